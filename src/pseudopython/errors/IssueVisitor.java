package pseudopython.errors;

import pseudopython.trans.IOErrorIssue;
import pseudopython.trans.passes.codegen.latex.UnsupportedExpressionIssue;
import pseudopython.trans.passes.codegen.latex.UnsupportedStatementIssue;
import pseudopython.trans.passes.option.OptionParserIssue;
import pseudopython.trans.passes.parse.ParsingIssue;
import pseudopython.trans.passes.preview.PreviewBuildIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(ParsingIssue parsingIssue) throws E;
	public abstract T visit(UnsupportedStatementIssue unsupportedStatementIssue) throws E;
	public abstract T visit(UnsupportedExpressionIssue unsupportedExpressionIssue) throws E;
	public abstract T visit(PreviewBuildIssue previewBuildIssue) throws E;
}
