package pseudopython.trans.passes.preview;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import pseudopython.errors.Issue;
import pseudopython.trans.passes.codegen.latex.PseudocodeLine;

public class PreviewBuildPassTest {

	private static final List<PseudocodeLine> LINES =
			Collections.singletonList(new PseudocodeLine("\\State $x \\gets 1$", 0));

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testBuildDirectory() throws IOException {
		Path script = folder.newFile("algo.py").toPath();
		assertThat(PreviewBuildPass.buildDirectory(script),
				is(folder.getRoot().toPath().toAbsolutePath().resolve(".pseudopython").resolve("algo.py")));
	}

	@Test
	public void testNothingRequested() throws IOException {
		Path script = folder.newFile("algo.py").toPath();
		PreviewBuildPass.perform(new PreviewOptions(), script, LINES, 2, null, null);
		assertFalse(PreviewBuildPass.buildDirectory(script).toFile().exists());
	}

	@Test
	public void testMissingToolchain() throws IOException {
		Path script = folder.newFile("algo.py").toPath();
		PreviewOptions options = new PreviewOptions(
				"pseudopython-missing-pdflatex", "pdftoppm", "13cm", PreviewOptions.DEFAULT_PACKAGES);
		File pdf = new File(folder.getRoot(), "algo.pdf");
		try {
			PreviewBuildPass.perform(options, script, LINES, 2, pdf.toPath(), null);
			fail("expected the preview build to fail");
		} catch (Issue issue) {
			assertThat(issue, instanceOf(PreviewBuildIssue.class));
			PreviewBuildIssue buildIssue = (PreviewBuildIssue) issue;
			assertThat(buildIssue.getExitStatus(), is(-1));
			assertThat(buildIssue.getCommand(),
					is("pseudopython-missing-pdflatex -halt-on-error -interaction=nonstopmode pseudopython.tex"));
		}
		assertFalse(pdf.exists());

		// the document is written before the toolchain runs
		File tex = PreviewBuildPass.buildDirectory(script).resolve("pseudopython.tex").toFile();
		assertThat(FileUtils.readFileToString(tex, StandardCharsets.UTF_8),
				is(StandaloneDocument.format(options, LINES, 2)));
	}

	@Test
	public void testTail() {
		List<String> lines = new ArrayList<>();
		for (int i = 1; i <= 25; ++i) {
			lines.add("line " + i);
		}
		String tail = PreviewBuildPass.tail(String.join("\n", lines));
		assertThat(tail, is(String.join("\n", lines.subList(5, 25))));
		assertThat(PreviewBuildPass.tail("short\r\noutput"), is("short\noutput"));
	}
}
