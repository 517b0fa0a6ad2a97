package pseudopython.formatters;

import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import pseudopython.model.python.PythonBinop;
import pseudopython.model.python.PythonComparison;
import pseudopython.model.python.PythonExpression;
import pseudopython.model.python.PythonModule;
import pseudopython.model.python.PythonNode;
import pseudopython.model.python.PythonUnary;
import pseudopython.parser.ParsingError;
import pseudopython.parser.PythonParser;

import static pseudopython.model.python.PythonBuilder.*;

@RunWith(Parameterized.class)
public class PythonNodePrintEquivalenceTest {

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
			{ module(assign(name("x"), num(1))) },
			{ module(
					def("Search", params(param("G"), param("v_0", raw("int"), num(0))), raw("path"),
							assign(name("d"), num(0)),
							forLoop(name("i"), call("range", num(1), name("n")),
									ifElse(compare(name("d"), PythonComparison.Operation.GT, name("i")),
											body(brk()),
											elifs(elif(name("b"), cont())),
											body(augAssign(name("d"), PythonBinop.Operation.PLUS, num(1))))),
							ret(name("d"))),
					expr(raw("!hide")),
					ifThen(compare(name("__name__"), PythonComparison.Operation.EQ, raw("__main__")),
							expr(call(attribute(name("pseudopython"), "main")))))
			},
			{ module(whileLoop(and(name("a"), or(name("b"), name("c"))), pass())) },
			{ module(annAssign(subscript(name("A"), name("i")), raw("int"), null)) },
			{ module(assign(Arrays.asList(name("a"), name("b")), tuple(num(1), num(2)))) },
			{ binop(PythonBinop.Operation.MINUS, name("a"),
					binop(PythonBinop.Operation.MINUS, name("b"), name("c"))) },
			{ binop(PythonBinop.Operation.TIMES,
					binop(PythonBinop.Operation.PLUS, name("a"), name("b")), name("c")) },
			{ binop(PythonBinop.Operation.POWER, unary(PythonUnary.Operation.NEG, name("a")), num(2)) },
			{ binop(PythonBinop.Operation.POWER, binop(PythonBinop.Operation.POWER, name("a"), name("b")), name("c")) },
			{ unary(PythonUnary.Operation.NOT, compare(name("x"), PythonComparison.Operation.IN, name("S"))) },
			{ compare(compare(name("a"), PythonComparison.Operation.EQ, name("b")),
					PythonComparison.Operation.EQ, name("c")) },
			{ call(raw("$\\arg\\min_i$"), subscript(name("A"), name("i"))) },
			{ call(name("f"), Arrays.asList(name("x")), Arrays.asList(keyword("k", num(1)))) },
			{ subscript(name("M"), tuple(name("i"), name("j"))) },
			{ tuple(name("x")) },
			{ tuple() },
			{ list(num(1), num(2)) },
			{ set(name("v")) },
			{ setComp(call(name("f"), name("x")), name("x"), binop(PythonBinop.Operation.BOR, name("A"), name("B")),
					compare(name("x"), PythonComparison.Operation.GT, num(0)), name("p")) },
			{ raw("it's a \\backslash") },
			{ raw("\\textbf{x}\\\\") },
			{ raw("both ' and \"") },
			{ raw("line\nbreak") },
			{ none() },
			{ bool(false) },
		});
	}

	PythonNode ast;
	public PythonNodePrintEquivalenceTest(PythonNode ast) {
		this.ast = ast;
	}

	@Test
	public void test() throws ParsingError {
		String str = ast.toString();
		PythonNode actual;
		if(ast instanceof PythonExpression) {
			actual = PythonParser.readExpression(Paths.get("TEST"), str);
		} else if(ast instanceof PythonModule) {
			actual = PythonParser.readModule(Paths.get("TEST"), str);
		} else {
			throw new RuntimeException("you can only directly write tests for modules and expressions");
		}

		assertThat(actual, is(ast));
	}

}
