package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * {@code t1 = t2 = value}; a chained assignment has one target per {@code =}.
 */
public class PythonAssignment extends PythonStatement {
	private final List<PythonExpression> targets;
	private final PythonExpression value;

	public PythonAssignment(SourceLocation location, List<PythonExpression> targets, PythonExpression value) {
		super(location);
		this.targets = targets;
		this.value = value;
	}

	public List<PythonExpression> getTargets() {
		return targets;
	}

	public PythonExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonAssignment that = (PythonAssignment) o;
		return Objects.equals(targets, that.targets) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(targets, value);
	}
}
