package pseudopython.trans;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import pseudopython.trans.passes.codegen.latex.LaTeXCodeGenOptions;

// translates each example script and compares with the checked-in pseudocode
@RunWith(Parameterized.class)
public class PseudoPythonTranslatorTest {

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
				{"tree_search.py", "tree_search.tex"},
		});
	}

	private String script;
	private String expected;

	public PseudoPythonTranslatorTest(String script, String expected) {
		this.script = script;
		this.expected = expected;
	}

	@Test
	public void test() throws IOException {
		Path scriptPath = Paths.get("examples", script);
		String source = FileUtils.readFileToString(scriptPath.toFile(), StandardCharsets.UTF_8);
		String expectedOutput = FileUtils.readFileToString(
				new File("examples" + File.separator + "expected" + File.separator + expected),
				StandardCharsets.UTF_8);

		PseudoPythonTranslator translator = new PseudoPythonTranslator(new LaTeXCodeGenOptions());
		assertThat(translator.translateToString(scriptPath, source), is(expectedOutput));
	}
}
