package pseudopython;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

import pseudopython.trans.passes.preview.PreviewOptions;

public class PseudoPythonOptionsTest {

	private static PseudoPythonOptions parse(String... args) throws PseudoPythonOptionException {
		PseudoPythonOptions options = new PseudoPythonOptions(args);
		options.parse();
		return options;
	}

	private static String parseError(String... args) {
		try {
			parse(args);
		} catch (PseudoPythonOptionException e) {
			return e.getMessage();
		}
		fail("expected the options to be rejected");
		return null;
	}

	@Test
	public void testDefaults() throws PseudoPythonOptionException {
		PseudoPythonOptions options = parse("examples/tree_search.py");
		assertThat(options.inputFilePath, is("examples/tree_search.py"));
		assertFalse(options.standalone);
		assertNull(options.output);
		assertNull(options.pdf);
		assertNull(options.png);
		assertThat(options.codegen.getIndent(), is(2));
		assertThat(options.preview.getWidth(), is(PreviewOptions.DEFAULT_WIDTH));
	}

	@Test
	public void testFlags() throws PseudoPythonOptionException {
		PseudoPythonOptions options = parse("--standalone", "-o", "out.tex", "--png", "algo.png", "-v",
				"examples/tree_search.py");
		assertTrue(options.standalone);
		assertTrue(options.verbose);
		assertThat(options.output, is("out.tex"));
		assertThat(options.png, is("algo.png"));
	}

	@Test
	public void testConfigurationFile() throws PseudoPythonOptionException {
		PseudoPythonOptions options = parse("-c", "examples/configs/wide.json", "examples/tree_search.py");
		assertThat(options.codegen.getIndent(), is(4));
		assertThat(options.codegen.getSymbolPrefixes().get("Op_"), is("\\operatorname{%s}"));
		assertThat(options.preview.getWidth(), is("16cm"));
	}

	@Test
	public void testHelpNeedsNoScript() throws PseudoPythonOptionException {
		assertTrue(parse("--help").help);
		assertTrue(parse("--version").version);
	}

	@Test
	public void testScriptCount() {
		assertThat(parseError(), is("Expected exactly one script, got 0"));
		assertThat(parseError("a.py", "b.py"), is("Expected exactly one script, got 2"));
	}

	@Test
	public void testQuietAndVerbose() {
		assertThat(parseError("-q", "-v", "a.py"), is("-q and -v cannot be used together"));
	}

	@Test
	public void testMissingConfigurationFile() {
		assertThat(parseError("-c", "examples/configs/missing.json", "a.py"),
				startsWith("Error reading configuration file: "));
	}

	@Test
	public void testMalformedConfigurationFile() {
		assertThat(parseError("-c", "examples/configs/malformed.json", "a.py"),
				startsWith("examples/configs/malformed.json: parsing error: "));
	}

	@Test
	public void testInvalidConfigurationFile() {
		assertThat(parseError("-c", "examples/configs/invalid.json", "a.py"),
				startsWith("Configuration is invalid: "));
	}

	@Test
	public void testUnknownOption() {
		assertNotNull(parseError("--no-such-option", "a.py"));
	}
}
