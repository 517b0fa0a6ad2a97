package pseudopython.trans.passes.codegen.latex;

import pseudopython.errors.Issue;
import pseudopython.errors.IssueVisitor;
import pseudopython.model.python.PythonStatement;

/**
 * A statement that has no pseudocode rendering, e.g. a class definition or a loop with an else clause.
 */
public class UnsupportedStatementIssue extends Issue {
	private final PythonStatement statement;
	private final String kind;

	public UnsupportedStatementIssue(PythonStatement statement, String kind) {
		this.statement = statement;
		this.kind = kind;
	}

	public PythonStatement getStatement() {
		return statement;
	}

	public String getKind() {
		return kind;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
