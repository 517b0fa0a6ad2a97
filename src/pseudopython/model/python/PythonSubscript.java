package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.Objects;

public class PythonSubscript extends PythonExpression {
	private final PythonExpression target;
	private final PythonExpression index;

	public PythonSubscript(SourceLocation location, PythonExpression target, PythonExpression index) {
		super(location);
		this.target = target;
		this.index = index;
	}

	public PythonExpression getTarget() {
		return target;
	}

	public PythonExpression getIndex() {
		return index;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonSubscript that = (PythonSubscript) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(index, that.index);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, index);
	}
}
