package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.Objects;

public class PythonUnary extends PythonExpression {

	public enum Operation {
		NOT("not "),
		NEG("-"),
		POS("+"),
		INVERT("~");

		private final String token;

		Operation(String token) {
			this.token = token;
		}

		public String getToken() {
			return token;
		}
	}

	private final Operation operation;
	private final PythonExpression operand;

	public PythonUnary(SourceLocation location, Operation operation, PythonExpression operand) {
		super(location);
		this.operation = operation;
		this.operand = operand;
	}

	public Operation getOperation() {
		return operation;
	}

	public PythonExpression getOperand() {
		return operand;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonUnary unary = (PythonUnary) o;
		return operation == unary.operation &&
				Objects.equals(operand, unary.operand);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operation, operand);
	}
}
