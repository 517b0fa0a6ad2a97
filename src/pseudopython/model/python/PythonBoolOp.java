package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonBoolOp extends PythonExpression {

	public enum Operation {
		OR("or"),
		AND("and");

		private final String token;

		Operation(String token) {
			this.token = token;
		}

		public String getToken() {
			return token;
		}
	}

	private final Operation operation;
	private final List<PythonExpression> operands;

	public PythonBoolOp(SourceLocation location, Operation operation, List<PythonExpression> operands) {
		super(location);
		this.operation = operation;
		this.operands = operands;
	}

	public Operation getOperation() {
		return operation;
	}

	public List<PythonExpression> getOperands() {
		return operands;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonBoolOp boolOp = (PythonBoolOp) o;
		return operation == boolOp.operation &&
				Objects.equals(operands, boolOp.operands);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operation, operands);
	}
}
