package pseudopython;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class PseudoPythonMainTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private ByteArrayOutputStream out;
	private ByteArrayOutputStream err;

	@Before
	public void setUp() {
		out = new ByteArrayOutputStream();
		err = new ByteArrayOutputStream();
	}

	private boolean run(String... args) throws IOException {
		try (PrintStream o = new PrintStream(out, true, "UTF-8"); PrintStream e = new PrintStream(err, true, "UTF-8")) {
			return new PseudoPythonMain(args).run(o, e);
		}
	}

	private String out() {
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	private String err() {
		return new String(err.toByteArray(), StandardCharsets.UTF_8);
	}

	private File script(String source) throws IOException {
		File f = folder.newFile("script.py");
		FileUtils.writeStringToFile(f, source, StandardCharsets.UTF_8);
		return f;
	}

	@Test
	public void testTranslateToStandardOutput() throws IOException {
		assertTrue(run("-q", "examples/tree_search.py"));
		String expected = FileUtils.readFileToString(new File("examples/expected/tree_search.tex"), StandardCharsets.UTF_8);
		assertThat(out(), is(expected));
	}

	@Test
	public void testVersion() throws IOException {
		assertTrue(run("--version"));
		assertThat(out(), startsWith("pseudopython version " + PseudoPythonOptions.VERSION));
	}

	@Test
	public void testNoScript() throws IOException {
		assertFalse(run());
		assertThat(err(), containsString("Expected exactly one script, got 0"));
		assertThat(out(), is(""));
	}

	@Test
	public void testMissingScript() throws IOException {
		assertFalse(run("-q", new File(folder.getRoot(), "missing.py").getPath()));
		assertThat(err(), containsString("IO Error"));
	}

	@Test
	public void testOutputFile() throws IOException {
		File output = new File(folder.getRoot(), "out.tex");
		assertTrue(run("-q", "-o", output.getPath(), script("x = 1\n").getPath()));
		assertThat(out(), is(""));
		assertThat(FileUtils.readFileToString(output, StandardCharsets.UTF_8), is("\\State $x \\gets 1$\n"));
	}

	@Test
	public void testByteOrderMarkIsSkipped() throws IOException {
		assertTrue(run("-q", script("\uFEFFx = '\\textbf{y}'\n").getPath()));
		assertThat(out(), is("\\State $x \\gets $\\textbf{y}\n"));
	}

	@Test
	public void testStandalone() throws IOException {
		assertTrue(run("-q", "--standalone", script("x = 1\n").getPath()));
		assertThat(out(), startsWith("\\documentclass"));
		assertThat(out(), containsString("\\State $x \\gets 1$"));
		assertThat(out(), containsString("\\end{document}"));
	}

	@Test
	public void testConfiguredIndent() throws IOException {
		assertTrue(run("-q", "-c", "examples/configs/wide.json", script("while x:\n    y = 1\n").getPath()));
		assertThat(out(), is("\\While{$x$}\n    \\State $y \\gets 1$\n\\EndWhile\n"));
	}

	@Test
	public void testUnsupportedConstruct() throws IOException {
		assertFalse(run("-q", script("class A:\n    pass\n").getPath()));
		assertThat(err(), containsString("Detected 1 issue(s):"));
		assertThat(err(), containsString("unsupported statement class definition"));
		assertThat(out(), is(""));
	}

	@Test
	public void testParseError() throws IOException {
		assertFalse(run("-q", script("x = (1\n").getPath()));
		assertThat(err(), containsString("error parsing Python: '(' was never closed at 1:5"));
	}
}
