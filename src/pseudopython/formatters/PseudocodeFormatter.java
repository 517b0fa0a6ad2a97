package pseudopython.formatters;

import pseudopython.Unreachable;
import pseudopython.trans.passes.codegen.latex.PseudocodeLine;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

/**
 * Writes pseudocode commands one per line, each indented by its depth.
 */
public class PseudocodeFormatter implements FormattingTools.Formatter<PseudocodeLine> {
	private final IndentingWriter out;
	private final int indent;

	public PseudocodeFormatter(IndentingWriter out, int indent) {
		this.out = out;
		this.indent = indent;
	}

	@Override
	public void format(PseudocodeLine line) throws IOException {
		try (IndentingWriter.Indent ignored = out.indent(line.getDepth() * indent)) {
			out.write(line.getCommand());
			out.newLine();
		}
	}

	public void format(List<PseudocodeLine> lines) throws IOException {
		for (PseudocodeLine line : lines) {
			format(line);
		}
	}

	public static String format(List<PseudocodeLine> lines, int indent) {
		StringWriter w = new StringWriter();
		try {
			new PseudocodeFormatter(new IndentingWriter(w), indent).format(lines);
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return w.toString();
	}
}
