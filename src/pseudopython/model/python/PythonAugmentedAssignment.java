package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.Objects;

public class PythonAugmentedAssignment extends PythonStatement {
	private final PythonExpression target;
	private final PythonBinop.Operation operation;
	private final PythonExpression value;

	public PythonAugmentedAssignment(SourceLocation location, PythonExpression target,
	                                 PythonBinop.Operation operation, PythonExpression value) {
		super(location);
		this.target = target;
		this.operation = operation;
		this.value = value;
	}

	public PythonExpression getTarget() {
		return target;
	}

	public PythonBinop.Operation getOperation() {
		return operation;
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
		PythonAugmentedAssignment that = (PythonAugmentedAssignment) o;
		return Objects.equals(target, that.target) &&
				operation == that.operation &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, operation, value);
	}
}
