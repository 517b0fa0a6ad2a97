package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.Objects;

/**
 * A numeric literal, kept as it was written in the script.
 */
public class PythonNumber extends PythonExpression {
	private final String value;

	public PythonNumber(SourceLocation location, String value) {
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
		PythonNumber that = (PythonNumber) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
