package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * {element for target in iterable if condition ...}, with a single for clause.
 */
public class PythonSetComprehension extends PythonExpression {
	private final PythonExpression element;
	private final PythonExpression target;
	private final PythonExpression iterable;
	private final List<PythonExpression> conditions;

	public PythonSetComprehension(SourceLocation location, PythonExpression element, PythonExpression target,
	                              PythonExpression iterable, List<PythonExpression> conditions) {
		super(location);
		this.element = element;
		this.target = target;
		this.iterable = iterable;
		this.conditions = conditions;
	}

	public PythonExpression getElement() {
		return element;
	}

	public PythonExpression getTarget() {
		return target;
	}

	public PythonExpression getIterable() {
		return iterable;
	}

	public List<PythonExpression> getConditions() {
		return conditions;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonSetComprehension that = (PythonSetComprehension) o;
		return Objects.equals(element, that.element) && Objects.equals(target, that.target) &&
				Objects.equals(iterable, that.iterable) && Objects.equals(conditions, that.conditions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), element, target, iterable, conditions);
	}
}
