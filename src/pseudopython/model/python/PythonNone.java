package pseudopython.model.python;

import pseudopython.util.SourceLocation;

public class PythonNone extends PythonExpression {
	public PythonNone(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return this == o || (o != null && getClass() == o.getClass());
	}

	@Override
	public int hashCode() {
		return PythonNone.class.hashCode();
	}
}
