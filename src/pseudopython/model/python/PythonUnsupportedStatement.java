package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.Objects;

/**
 * A syntactically valid statement with no pseudocode counterpart (import, class, with, try, ...).
 * The parser keeps its kind so that it can be reported where it appears, and dropped silently
 * when it is hidden.
 */
public class PythonUnsupportedStatement extends PythonStatement {
	private final String kind;

	public PythonUnsupportedStatement(SourceLocation location, String kind) {
		super(location);
		this.kind = kind;
	}

	public String getKind() {
		return kind;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonUnsupportedStatement that = (PythonUnsupportedStatement) o;
		return Objects.equals(kind, that.kind);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind);
	}
}
