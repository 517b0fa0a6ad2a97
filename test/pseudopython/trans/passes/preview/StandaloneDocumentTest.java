package pseudopython.trans.passes.preview;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import pseudopython.trans.passes.codegen.latex.PseudocodeLine;

public class StandaloneDocumentTest {

	private static final List<PseudocodeLine> LINES = Arrays.asList(
			new PseudocodeLine("\\While{$a$}", 0),
			new PseudocodeLine("\\State $x \\gets 1$", 1),
			new PseudocodeLine("\\EndWhile", 0));

	@Test
	public void testDefaultDocument() {
		assertThat(StandaloneDocument.format(new PreviewOptions(), LINES, 2), is(
				"\\documentclass[border=0.5cm, 12pt]{standalone}\n"
				+ "\n"
				+ "\\usepackage[utf8]{inputenc}\n"
				+ "\\usepackage{amsmath,amsfonts}\n"
				+ "\\usepackage{algorithm}\n"
				+ "\\usepackage{algorithmicx}\n"
				+ "\\usepackage{algpseudocode}\n"
				+ "\\algnewcommand\\Break{\\textbf{break}}\n"
				+ "\\algnewcommand\\Continue{\\textbf{continue}}\n"
				+ "\n"
				+ "\\begin{document}\n"
				+ "\\begin{minipage}{13cm}\n"
				+ "    \\begin{algorithmic}[1]\n"
				+ "        \\While{$a$}\n"
				+ "          \\State $x \\gets 1$\n"
				+ "        \\EndWhile\n"
				+ "    \\end{algorithmic}\n"
				+ "\\end{minipage}\n"
				+ "\\end{document}\n"));
	}

	@Test
	public void testConfiguredDocument() {
		PreviewOptions options = new PreviewOptions("pdflatex", "pdftoppm", "16cm", Collections.emptyList());
		String document = StandaloneDocument.format(options, LINES, 4);
		assertThat(document, containsString("\\begin{minipage}{16cm}\n"));
		assertThat(document, not(containsString("amsmath")));
		assertThat(document, containsString("\n            \\State $x \\gets 1$\n"));
	}

	@Test
	public void testEmptyPseudocode() {
		String document = StandaloneDocument.format(new PreviewOptions(), Collections.emptyList(), 2);
		assertThat(document, containsString("    \\begin{algorithmic}[1]\n    \\end{algorithmic}\n"));
	}
}
