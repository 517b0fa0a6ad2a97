package pseudopython.formatters;

import pseudopython.errors.IssueVisitor;
import pseudopython.trans.IOErrorIssue;
import pseudopython.trans.passes.codegen.latex.UnsupportedExpressionIssue;
import pseudopython.trans.passes.codegen.latex.UnsupportedStatementIssue;
import pseudopython.trans.passes.option.OptionParserIssue;
import pseudopython.trans.passes.parse.ParsingIssue;
import pseudopython.trans.passes.preview.PreviewBuildIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getDescription());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		out.write("error parsing "+parsingIssue.getLanguage()+": ");
		out.write(parsingIssue.getError().getMessage());
		return null;
	}

	@Override
	public Void visit(UnsupportedStatementIssue unsupportedStatementIssue) throws IOException {
		out.write("unsupported statement ");
		out.write(unsupportedStatementIssue.getKind());
		out.write(" ");
		unsupportedStatementIssue.getStatement().getLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(UnsupportedExpressionIssue unsupportedExpressionIssue) throws IOException {
		out.write("unsupported expression ");
		out.write(unsupportedExpressionIssue.getExpression().getKind());
		out.write(" ");
		unsupportedExpressionIssue.getExpression().getLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(PreviewBuildIssue previewBuildIssue) throws IOException {
		out.write("unable to build preview: ");
		out.write(previewBuildIssue.getCommand());
		if(previewBuildIssue.getExitStatus() == -1) {
			out.write(" could not be run");
		} else {
			out.write(" exited with status " + previewBuildIssue.getExitStatus());
		}
		String output = previewBuildIssue.getOutput();
		if(output != null && !output.trim().isEmpty()) {
			try (IndentingWriter.Indent ignored = out.indent()) {
				for(String line : output.trim().split("\r?\n")) {
					out.newLine();
					out.write(line);
				}
			}
		}
		return null;
	}
}
