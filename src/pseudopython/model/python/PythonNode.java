package pseudopython.model.python;

import pseudopython.Unreachable;
import pseudopython.formatters.IndentingWriter;
import pseudopython.formatters.PythonNodeFormattingVisitor;
import pseudopython.util.SourceLocatable;
import pseudopython.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Base of the script syntax tree. Nodes are immutable; equality is structural
 * and ignores source locations.
 */
public abstract class PythonNode extends SourceLocatable {

	private final SourceLocation location;

	public PythonNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	public abstract <T, E extends Throwable> T accept(PythonNodeVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new PythonNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
