package pseudopython.trans.passes.codegen.latex;

import static org.junit.Assert.*;

import org.apache.commons.io.IOUtils;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;

import pseudopython.PseudoPythonOptionException;
import pseudopython.formatters.LaTeXRenderingContext;

import java.io.FileInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;

public class LaTeXCodeGenOptionsTest {

	// parsed JSON object for the configuration file used in the tests
	private JSONObject config;

	@Before
	public void setup() throws IOException {
		try (FileInputStream configIs = new FileInputStream("./examples/configs/wide.json")) {
			config = new JSONObject(IOUtils.toString(configIs, StandardCharsets.UTF_8));
		}
	}

	private LaTeXCodeGenOptions options() throws PseudoPythonOptionException {
		return new LaTeXCodeGenOptions(config);
	}

	private JSONObject getCodegen() {
		return config.getJSONObject(LaTeXCodeGenOptions.CODEGEN_FIELD);
	}

	// everything is defaulted if the configuration has no codegen object
	@Test
	public void testNoCodegen() throws PseudoPythonOptionException {
		config.remove(LaTeXCodeGenOptions.CODEGEN_FIELD);
		assertEquals(LaTeXCodeGenOptions.DEFAULT_INDENT, options().getIndent());
		assertEquals(LaTeXRenderingContext.DEFAULT_SYMBOL_PREFIXES, options().getSymbolPrefixes());
	}

	@Test
	public void testIndent() throws PseudoPythonOptionException {
		assertEquals(4, options().getIndent());
	}

	@Test
	public void testDefaultIndent() throws PseudoPythonOptionException {
		getCodegen().remove(LaTeXCodeGenOptions.INDENT_FIELD);
		assertEquals(LaTeXCodeGenOptions.DEFAULT_INDENT, options().getIndent());
	}

	// longer prefixes are tried first, ties in alphabetical order
	@Test
	public void testSymbolPrefixOrder() throws PseudoPythonOptionException {
		assertEquals(Arrays.asList("Opt_", "Sym_", "Op_"), new ArrayList<>(options().getSymbolPrefixes().keySet()));
		assertEquals("\\operatorname{%s}", options().getSymbolPrefixes().get("Op_"));
	}

	@Test
	public void testDefaultSymbolPrefixes() throws PseudoPythonOptionException {
		getCodegen().remove(LaTeXCodeGenOptions.SYMBOL_PREFIXES_FIELD);
		assertEquals(LaTeXRenderingContext.DEFAULT_SYMBOL_PREFIXES, options().getSymbolPrefixes());
	}

	@Test(expected = PseudoPythonOptionException.class)
	public void testIndentNotANumber() throws PseudoPythonOptionException {
		getCodegen().put(LaTeXCodeGenOptions.INDENT_FIELD, "four");
		options();
	}

	@Test(expected = PseudoPythonOptionException.class)
	public void testNegativeIndent() throws PseudoPythonOptionException {
		getCodegen().put(LaTeXCodeGenOptions.INDENT_FIELD, -1);
		options();
	}

	@Test(expected = PseudoPythonOptionException.class)
	public void testPrefixTemplateNotAString() throws PseudoPythonOptionException {
		getCodegen().getJSONObject(LaTeXCodeGenOptions.SYMBOL_PREFIXES_FIELD).put("Op_", new JSONObject());
		options();
	}

	@Test(expected = PseudoPythonOptionException.class)
	public void testCodegenNotAnObject() throws PseudoPythonOptionException {
		config.put(LaTeXCodeGenOptions.CODEGEN_FIELD, 3);
		options();
	}
}
