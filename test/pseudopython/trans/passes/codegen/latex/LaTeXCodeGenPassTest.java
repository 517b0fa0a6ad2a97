package pseudopython.trans.passes.codegen.latex;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import pseudopython.trans.PseudoPythonTranslator;

@RunWith(Parameterized.class)
public class LaTeXCodeGenPassTest {

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
				{"x = 1\n", "\\State $x \\gets 1$\n"},
				{"if x > 0:\n"
						+ "    y = 1\n"
						+ "else:\n"
						+ "    y = -1\n",
					"\\If{$x > 0$}\n"
						+ "  \\State $y \\gets 1$\n"
						+ "\\Else\n"
						+ "  \\State $y \\gets -1$\n"
						+ "\\EndIf\n"},
				{"r'$\\arg\\min_i$'(A[i])\n", "\\State $\\arg\\min_i${}$(A_{i})$\n"},
				{"'$\\arg\\min_i$'(A[i])\n", "\\State $\\arg\\min_i${}$(A_{i})$\n"},
				{"B = {v for v in V if d[v] > 0}\n", "\\State $B \\gets \\{v \\in V : d_{v} > 0\\}$\n"},
				{"'\\textbf{Init}'\n", "\\State \\textbf{Init}\n"},
				{"'$\\alpha \\neq \\beta$'\n", "\\State $\\alpha \\neq \\beta$\n"},
				{"\"$\\xi \\gets \\Nu$\"\n", "\\State $\\xi \\gets \\Nu$\n"},
				{"'!hide'\n"
						+ "if __name__ == \"__main__\":\n"
						+ "    pseudopython.main()\n",
					""},
				{"for i in range(10):\n    pass\n", "\\For{$i \\gets 0$ \\textbf{to} $9$}\n\\EndFor\n"},

				// ranges
				{"for i in range(1, n):\n    pass\n", "\\For{$i \\gets 1$ \\textbf{to} $n - 1$}\n\\EndFor\n"},
				{"for i in range(n, 0, -1):\n    pass\n",
					"\\For{$i \\gets n$ \\textbf{to} $1$ \\textbf{step} $-1$}\n\\EndFor\n"},
				{"for i in range(0, n, 2):\n    pass\n",
					"\\For{$i \\gets 0$ \\textbf{to} $n - 1$ \\textbf{step} $2$}\n\\EndFor\n"},
				{"for i in range(0, 10, 1):\n    pass\n", "\\For{$i \\gets 0$ \\textbf{to} $9$}\n\\EndFor\n"},
				{"for i in range(0):\n    pass\n", "\\For{$i \\gets 0$ \\textbf{to} $-1$}\n\\EndFor\n"},
				{"for i in range(0x10):\n    pass\n", "\\For{$i \\gets 0$ \\textbf{to} $15$}\n\\EndFor\n"},

				// other loops
				{"for v in V:\n    visit(v)\n", "\\ForAll{$v \\in V$}\n  \\State $\\mathit{visit}(v)$\n\\EndFor\n"},
				{"for u, v in E:\n    pass\n", "\\ForAll{$u, v \\in E$}\n\\EndFor\n"},
				{"while i < n:\n    i += 1\n", "\\While{$i < n$}\n  \\State $i \\gets i + 1$\n\\EndWhile\n"},
				{"while True:\n"
						+ "    if done:\n"
						+ "        break\n"
						+ "    continue\n",
					"\\While{$\\textsc{True}$}\n"
						+ "  \\If{$\\mathit{done}$}\n"
						+ "    \\State \\Break\n"
						+ "  \\EndIf\n"
						+ "  \\State \\Continue\n"
						+ "\\EndWhile\n"},
				{"if a:\n"
						+ "    x = 1\n"
						+ "elif b:\n"
						+ "    x = 2\n"
						+ "else:\n"
						+ "    pass\n",
					"\\If{$a$}\n"
						+ "  \\State $x \\gets 1$\n"
						+ "\\ElsIf{$b$}\n"
						+ "  \\State $x \\gets 2$\n"
						+ "\\Else\n"
						+ "\\EndIf\n"},

				// procedures and functions
				{"def Search(G, v_0):\n"
						+ "    d = 0\n"
						+ "    return d\n",
					"\\Procedure{Search}{$G, v_{0}$}\n"
						+ "  \\State $d \\gets 0$\n"
						+ "  \\State \\Return{} $d$\n"
						+ "\\EndProcedure\n"},
				{"def f(n: 'int') -> 'int':\n    return n * 2\n",
					"\\Function{f}{$n$: \\texttt{int}} $\\rightarrow$ \\texttt{int}\n"
						+ "  \\State \\Return{} $n \\cdot 2$\n"
						+ "\\EndFunction\n"},
				{"def f():\n    return\n", "\\Procedure{f}{}\n  \\State \\Return\n\\EndProcedure\n"},
				{"def f(a, b=1):\n    pass\n", "\\Procedure{f}{$a, b = 1$}\n\\EndProcedure\n"},
				{"def Visit(v):\n"
						+ "    pass\n"
						+ "Visit(root)\n",
					"\\Procedure{Visit}{$v$}\n"
						+ "\\EndProcedure\n"
						+ "\\State \\Call{Visit}{$\\mathit{root}$}\n"},
				{"def Outer():\n"
						+ "    def helper_step(x):\n"
						+ "        return x\n"
						+ "    y = helper_step(1)\n",
					"\\Procedure{Outer}{}\n"
						+ "  \\Procedure{helper\\_step}{$x$}\n"
						+ "    \\State \\Return{} $x$\n"
						+ "  \\EndProcedure\n"
						+ "  \\State $y \\gets $\\Call{helper\\_step}{$1$}\n"
						+ "\\EndProcedure\n"},

				// assignments
				{"a, b = b, a\n", "\\State $a, b \\gets (b, a)$\n"},
				{"a = b = 0\n", "\\State $a, b \\gets 0$\n"},
				{"x *= a + b\n", "\\State $x \\gets x \\cdot (a + b)$\n"},
				{"x: 'int' = 0\n", "\\State $x$: \\texttt{int} $\\gets 0$\n"},
				{"x: 'int'\n", "\\State $x$: \\texttt{int}\n"},
				{"S_0 = MC_S | {v}\n", "\\State $S_{0} \\gets \\mathcal{S} \\cup \\{v\\}$\n"},

				// raw statements pass through
				{"r'\\Comment{hello}'\n", "\\State \\Comment{hello}\n"},
				{"x = 1\n'!hide'\nclass A:\n    pass\n", "\\State $x \\gets 1$\n"},
		});
	}

	private String source;
	private String expected;

	public LaTeXCodeGenPassTest(String source, String expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() {
		String actual = new PseudoPythonTranslator().translateToString(Paths.get("TEST"), source);
		assertThat(actual, is(expected));
	}
}
