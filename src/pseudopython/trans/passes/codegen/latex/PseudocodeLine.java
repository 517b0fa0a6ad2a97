package pseudopython.trans.passes.codegen.latex;

import java.util.Objects;

/**
 * One pseudocode command and the nesting depth it is written at.
 */
public class PseudocodeLine {
	private final String command;
	private final int depth;

	public PseudocodeLine(String command, int depth) {
		this.command = command;
		this.depth = depth;
	}

	public String getCommand() {
		return command;
	}

	public int getDepth() {
		return depth;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PseudocodeLine that = (PseudocodeLine) o;
		return depth == that.depth && Objects.equals(command, that.command);
	}

	@Override
	public int hashCode() {
		return Objects.hash(command, depth);
	}

	@Override
	public String toString() {
		return depth + ":" + command;
	}
}
