package pseudopython.trans.passes.codegen.latex;

import pseudopython.errors.Issue;
import pseudopython.errors.IssueVisitor;
import pseudopython.model.python.PythonUnsupportedExpression;

public class UnsupportedExpressionIssue extends Issue {
	private final PythonUnsupportedExpression expression;

	public UnsupportedExpressionIssue(PythonUnsupportedExpression expression) {
		this.expression = expression;
	}

	public PythonUnsupportedExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
