package pseudopython.trans.passes.preview;

import pseudopython.Unreachable;
import pseudopython.formatters.IndentingWriter;
import pseudopython.formatters.PseudocodeFormatter;
import pseudopython.trans.passes.codegen.latex.PseudocodeLine;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

/**
 * A complete LaTeX document that typesets pseudocode on its own, cropped to the algorithm.
 */
public class StandaloneDocument {
	private StandaloneDocument() {}

	public static void write(IndentingWriter out, PreviewOptions options, List<PseudocodeLine> lines, int indent)
			throws IOException {
		out.write("\\documentclass[border=0.5cm, 12pt]{standalone}");
		out.newLine();
		out.newLine();
		out.write("\\usepackage[utf8]{inputenc}");
		out.newLine();
		if (!options.getPackages().isEmpty()) {
			out.write("\\usepackage{" + String.join(",", options.getPackages()) + "}");
			out.newLine();
		}
		out.write("\\usepackage{algorithm}");
		out.newLine();
		out.write("\\usepackage{algorithmicx}");
		out.newLine();
		out.write("\\usepackage{algpseudocode}");
		out.newLine();
		// algpseudocode has no loop exits of its own
		out.write("\\algnewcommand\\Break{\\textbf{break}}");
		out.newLine();
		out.write("\\algnewcommand\\Continue{\\textbf{continue}}");
		out.newLine();
		out.newLine();
		out.write("\\begin{document}");
		out.newLine();
		out.write("\\begin{minipage}{" + options.getWidth() + "}");
		out.newLine();
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.write("\\begin{algorithmic}[1]");
			out.newLine();
			try (IndentingWriter.Indent ignored1 = out.indent()) {
				new PseudocodeFormatter(out, indent).format(lines);
			}
			out.write("\\end{algorithmic}");
			out.newLine();
		}
		out.write("\\end{minipage}");
		out.newLine();
		out.write("\\end{document}");
		out.newLine();
	}

	public static String format(PreviewOptions options, List<PseudocodeLine> lines, int indent) {
		StringWriter w = new StringWriter();
		try {
			write(new IndentingWriter(w), options, lines, indent);
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return w.toString();
	}
}
