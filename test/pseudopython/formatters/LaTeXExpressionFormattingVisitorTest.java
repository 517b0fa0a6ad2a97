package pseudopython.formatters;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import pseudopython.model.python.PythonExpression;
import pseudopython.parser.ParsingError;
import pseudopython.parser.PythonParser;

@RunWith(Parameterized.class)
public class LaTeXExpressionFormattingVisitorTest {

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
				// names
				{"x", "$x$"},
				{"x_0", "$x_{0}$"},
				{"N_iter", "$N_{\\mathit{iter}}$"},
				{"v_i_j", "$v_{i_{j}}$"},
				{"alpha", "$\\mathit{alpha}$"},
				{"Sym_alpha", "$\\alpha$"},
				{"MC_G", "$\\mathcal{G}$"},
				{"BB_R", "$\\mathbb{R}$"},
				{"_tmp", "$\\mathit{\\_tmp}$"},
				{"a__b", "$\\mathit{a\\_\\_b}$"},
				{"Sym_", "$\\mathit{Sym\\_}$"},

				// literals
				{"1_000", "$1000$"},
				{"0xff", "$255$"},
				{"0o17", "$15$"},
				{"0b101", "$5$"},
				{"3.14", "$3.14$"},
				{"True", "$\\textsc{True}$"},
				{"None", "$\\textsc{None}$"},
				{"'hello'", "hello"},

				// operators
				{"a + b * c", "$a + b \\cdot c$"},
				{"(a + b) * c", "$(a + b) \\cdot c$"},
				{"a - b - c", "$a - b - c$"},
				{"a - (b - c)", "$a - (b - c)$"},
				{"a / b % c", "$a / b \\bmod c$"},
				{"A | B & C", "$A \\cup B \\cap C$"},
				{"a ** 2", "${a}^{2}$"},
				{"(a + b) ** 2", "${(a + b)}^{2}$"},
				{"a ** (b + c)", "${a}^{b + c}$"},
				{"a // b", "$\\left\\lfloor a / b \\right\\rfloor$"},
				{"x @ y_1", "$xy_{1}$"},
				{"-x", "$-x$"},
				{"-(a + b)", "$-(a + b)$"},
				{"2 * -x", "$2 \\cdot -x$"},
				{"~a", "$\\sim a$"},
				{"not a", "$\\lnot a$"},
				{"not (a and b)", "$\\lnot (a \\land b)$"},
				{"not x in S", "$\\lnot (x \\in S)$"},
				{"a and b or c", "$a \\land b \\lor c$"},
				{"a and (b or c)", "$a \\land (b \\lor c)$"},
				{"x <= y", "$x \\leq y$"},
				{"x != y", "$x \\neq y$"},
				{"a < b < c", "$a < b < c$"},
				{"x not in S", "$x \\notin S$"},
				{"x is None", "$x \\equiv \\textsc{None}$"},
				{"x is not None", "$x \\not\\equiv \\textsc{None}$"},
				{"a + b == c", "$a + b = c$"},
				{"(a == b) == c", "$(a = b) = c$"},

				// calls
				{"f(x, y)", "$f(x, y)$"},
				{"dist(u, v)", "$\\mathit{dist}(u, v)$"},
				{"f(x, k=1)", "$f(x, k = 1)$"},
				{"_(a + b) * c", "$(a + b) \\cdot c$"},
				{"r'$\\sqrt{#1}$'(x + 1)", "$\\sqrt{x + 1}$"},
				{"r'\\textbf{#1}'(x)", "\\textbf{$x$}"},
				{"r'$\\arg\\min_i$'(A[i])", "$\\arg\\min_i${}$(A_{i})$"},
				{"'$\\arg\\min_i$'(A[i])", "$\\arg\\min_i${}$(A_{i})$"},
				{"'\\textbf{#1}'(x)", "\\textbf{$x$}"},
				{"'\\textbf{x}'", "\\textbf{x}"},
				{"r'\\textsc{Pick}'(U)", "\\textsc{Pick}$(U)$"},
				{"r'\\arg\\min'[v](d[v])", "$\\arg\\min_{v}(d_{v})$"},

				// subscripts and attributes
				{"A[i]", "$A_{i}$"},
				{"A[i][j]", "$A_{i, j}$"},
				{"M[i, j][k]", "$M_{i, j, k}$"},
				{"U[p[i]]", "$U_{p_{i}}$"},
				{"v_0[i]", "${v_{0}}_{i}$"},
				{"(a + b)[i]", "${(a + b)}_{i}$"},
				{"A[r'\\ast']", "$A_{\\ast}$"},
				{"A[r'$\\ast$']", "$A_{\\text{$\\ast$}}$"},
				{"p.x", "$p.x$"},
				{"node.parent", "$\\mathit{node}.\\mathit{parent}$"},

				// displays
				{"(a, b)", "$(a, b)$"},
				{"(a,)", "$(a,)$"},
				{"()", "$()$"},
				{"[1, 2]", "$[1, 2]$"},
				{"{x}", "$\\{x\\}$"},
				{"{v for v in V}", "$\\{v \\in V\\}$"},
				{"{v for v in V if d[v] > 0}", "$\\{v \\in V : d_{v} > 0\\}$"},
				{"{x for _ in A | B if x < 1 or x > 2}", "$\\{x \\in A \\cup B : x < 1 \\lor x > 2\\}$"},
				{"{f(x) for x in S if x > 0}", "$\\{f(x) : x \\in S, x > 0\\}$"},
		});
	}

	private String source;
	private String expected;

	public LaTeXExpressionFormattingVisitorTest(String source, String expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() throws ParsingError {
		PythonExpression expression = PythonParser.readExpression(Paths.get("TEST"), source);
		assertThat(LaTeXExpressionFormattingVisitor.render(expression, LaTeXRenderingContext.defaults()),
				is(expected));
	}
}
