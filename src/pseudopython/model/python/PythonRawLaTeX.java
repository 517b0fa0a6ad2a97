package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.Objects;

/**
 * A string literal. Its content is LaTeX that is copied into the output verbatim; when called
 * like a function it is a template whose {@code #1}..{@code #9} placeholders receive the
 * rendered arguments.
 */
public class PythonRawLaTeX extends PythonExpression {
	private final String value;

	public PythonRawLaTeX(SourceLocation location, String value) {
		super(location);
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonRawLaTeX that = (PythonRawLaTeX) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
