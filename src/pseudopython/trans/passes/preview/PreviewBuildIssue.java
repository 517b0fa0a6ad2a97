package pseudopython.trans.passes.preview;

import pseudopython.errors.Issue;
import pseudopython.errors.IssueVisitor;

/**
 * The external TeX toolchain could not be started or did not succeed.
 */
public class PreviewBuildIssue extends Issue {
	private final String command;
	private final int exitStatus;
	private final String output;

	public PreviewBuildIssue(String command, int exitStatus, String output) {
		this.command = command;
		this.exitStatus = exitStatus;
		this.output = output;
	}

	public PreviewBuildIssue(String command, Exception cause) {
		this(command, -1, cause.getMessage());
		initCause(cause);
	}

	public String getCommand() {
		return command;
	}

	/**
	 * @return the exit status, or -1 if the process could not be run at all
	 */
	public int getExitStatus() {
		return exitStatus;
	}

	public String getOutput() {
		return output;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
