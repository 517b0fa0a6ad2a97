package pseudopython.errors;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import pseudopython.Unreachable;
import pseudopython.formatters.IndentingWriter;
import pseudopython.formatters.IssueFormattingVisitor;

/**
 * Collects every issue of a run so the driver can report them together.
 */
public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> issues = new ArrayList<>();

	@Override
	public void error(Issue err) {
		issues.add(err);
	}

	@Override
	public boolean hasErrors() {
		return !issues.isEmpty();
	}

	public void format(IndentingWriter out) throws IOException {
		out.write("Detected " + issues.size() + " issue(s):");
		IssueFormattingVisitor formatter = new IssueFormattingVisitor(out);
		for (Issue issue : issues) {
			out.newLine();
			issue.accept(formatter);
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		try {
			format(new IndentingWriter(w));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}
}
