package pseudopython.trans.passes.option;

import pseudopython.errors.Issue;
import pseudopython.errors.IssueVisitor;

public class OptionParserIssue extends Issue {
	private final String message;

	public OptionParserIssue(String message) {
		this.message = message;
	}

	/**
	 * @return the problem with the command line or configuration, without any prefix
	 */
	public String getDescription() {
		return message;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
