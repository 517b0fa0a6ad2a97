package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.Objects;

public class PythonAttribute extends PythonExpression {
	private final PythonExpression target;
	private final String name;

	public PythonAttribute(SourceLocation location, PythonExpression target, String name) {
		super(location);
		this.target = target;
		this.name = name;
	}

	public PythonExpression getTarget() {
		return target;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonAttribute that = (PythonAttribute) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(name, that.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, name);
	}
}
