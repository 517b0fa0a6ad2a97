package pseudopython.formatters;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class LaTeXWriterTest {

	@Test
	public void testMathRunsAreMerged() {
		LaTeXWriter w = new LaTeXWriter();
		w.math("x");
		w.math(" + ");
		w.math("y");
		assertThat(w.toString(), is("$x + y$"));
	}

	@Test
	public void testTextClosesMath() {
		LaTeXWriter w = new LaTeXWriter();
		w.text("a ");
		w.math("x");
		w.text(" b");
		assertThat(w.toString(), is("a $x$ b"));
	}

	@Test
	public void testAdjacentDollarsAreSeparated() {
		LaTeXWriter w = new LaTeXWriter();
		w.text("$a$");
		w.math("x");
		assertThat(w.toString(), is("$a${}$x$"));

		w = new LaTeXWriter();
		w.math("x");
		w.text("$y$");
		assertThat(w.toString(), is("$x${}$y$"));
	}

	@Test
	public void testEscapedDollarIsNotADelimiter() {
		LaTeXWriter w = new LaTeXWriter();
		w.text("costs \\$");
		w.math("5");
		assertThat(w.toString(), is("costs \\$$5$"));
	}

	@Test
	public void testTextInsideGroup() {
		LaTeXWriter w = new LaTeXWriter();
		w.math("A");
		try (LaTeXWriter.Group ignored = w.group("_{", "}")) {
			w.text("hi");
		}
		assertThat(w.toString(), is("$A_{\\text{hi}}$"));
	}

	@Test
	public void testMathOnly() {
		LaTeXWriter w = new LaTeXWriter(true);
		assertTrue(w.isMathOnly());
		w.math("x");
		w.text("y");
		assertThat(w.toString(), is("x\\text{y}"));
	}

	@Test
	public void testEmptyWritesAreIgnored() {
		LaTeXWriter w = new LaTeXWriter();
		w.math("");
		w.text("");
		assertThat(w.toString(), is(""));
	}

	@Test
	public void testEscapeText() {
		assertThat(LaTeXWriter.escapeText("a_b#c"), is("a\\_b\\#c"));
		assertThat(LaTeXWriter.escapeText("50%"), is("50\\%"));
		assertThat(LaTeXWriter.escapeText("\\"), is("\\textbackslash{}"));
		assertThat(LaTeXWriter.escapeText("~^"), is("\\textasciitilde{}\\textasciicircum{}"));
	}
}
