package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.Objects;

public class PythonBinop extends PythonExpression {

	public enum Operation {
		BOR("|"),
		BXOR("^"),
		BAND("&"),
		LSHIFT("<<"),
		RSHIFT(">>"),
		PLUS("+"),
		MINUS("-"),
		TIMES("*"),
		DIVIDE("/"),
		FLOOR_DIVIDE("//"),
		MOD("%"),
		MATMUL("@"),
		POWER("**");

		private final String token;

		Operation(String token) {
			this.token = token;
		}

		public String getToken() {
			return token;
		}
	}

	private final Operation operation;
	private final PythonExpression lhs;
	private final PythonExpression rhs;

	public PythonBinop(SourceLocation location, Operation operation, PythonExpression lhs, PythonExpression rhs) {
		super(location);
		this.operation = operation;
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public Operation getOperation() {
		return operation;
	}

	public PythonExpression getLHS() {
		return lhs;
	}

	public PythonExpression getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonBinop binop = (PythonBinop) o;
		return operation == binop.operation &&
				Objects.equals(lhs, binop.lhs) &&
				Objects.equals(rhs, binop.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operation, lhs, rhs);
	}
}
