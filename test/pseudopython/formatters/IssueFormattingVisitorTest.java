package pseudopython.formatters;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.file.Paths;

import org.junit.Test;

import pseudopython.errors.Issue;
import pseudopython.errors.TopLevelIssueContext;
import pseudopython.trans.IOErrorIssue;
import pseudopython.trans.PseudoPythonTranslator;
import pseudopython.trans.passes.option.OptionParserIssue;
import pseudopython.trans.passes.parse.PythonParsingPass;
import pseudopython.trans.passes.preview.PreviewBuildIssue;

public class IssueFormattingVisitorTest {

	private static Issue translationIssue(String source) {
		try {
			new PseudoPythonTranslator().translate(Paths.get("test.py"), source);
		} catch (Issue issue) {
			return issue;
		}
		fail("expected the translation to fail");
		return null;
	}

	@Test
	public void testParsingIssue() {
		try {
			PythonParsingPass.perform(Paths.get("test.py"), "x = (");
			fail("expected a parsing issue");
		} catch (Issue issue) {
			assertThat(issue.getMessage(), is("error parsing Python: '(' was never closed at 1:5 in file test.py"));
		}
	}

	@Test
	public void testUnsupportedStatement() {
		assertThat(translationIssue("class A:\n    pass\n").getMessage(),
				is("unsupported statement class definition at 1:1-2:8 in file test.py"));
	}

	@Test
	public void testUnsupportedExpression() {
		assertThat(translationIssue("x = lambda: 0\n").getMessage(),
				is("unsupported expression lambda at 1:5-13 in file test.py"));
	}

	@Test
	public void testPreviewBuildIssue() {
		assertThat(new PreviewBuildIssue("pdflatex pseudopython.tex", 1, "a\nb\n").getMessage(),
				is("unable to build preview: pdflatex pseudopython.tex exited with status 1\n    a\n    b"));
		assertThat(new PreviewBuildIssue("pdftoppm", new IOException("not found")).getMessage(),
				is("unable to build preview: pdftoppm could not be run\n    not found"));
	}

	@Test
	public void testTopLevelContext() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertFalse(ctx.hasErrors());
		ctx.error(new OptionParserIssue("bad"));
		ctx.error(new IOErrorIssue(new IOException("boom")));
		assertTrue(ctx.hasErrors());
		assertThat(ctx.format(), is("Detected 2 issue(s):\n"
				+ "unable to parse options: bad\n"
				+ "IO Error: java.io.IOException: boom"));
	}
}
