package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * {@code left op1 c1 op2 c2 ...}; a plain comparison has exactly one operation and one comparator.
 */
public class PythonComparison extends PythonExpression {

	public enum Operation {
		EQ("=="),
		NEQ("!="),
		LT("<"),
		LEQ("<="),
		GT(">"),
		GEQ(">="),
		IN("in"),
		NOT_IN("not in"),
		IS("is"),
		IS_NOT("is not");

		private final String token;

		Operation(String token) {
			this.token = token;
		}

		public String getToken() {
			return token;
		}
	}

	private final PythonExpression left;
	private final List<Operation> operations;
	private final List<PythonExpression> comparators;

	public PythonComparison(SourceLocation location, PythonExpression left, List<Operation> operations,
	                        List<PythonExpression> comparators) {
		super(location);
		if (operations.isEmpty() || operations.size() != comparators.size()) {
			throw new IllegalArgumentException("comparison needs one comparator per operation");
		}
		this.left = left;
		this.operations = operations;
		this.comparators = comparators;
	}

	public PythonExpression getLeft() {
		return left;
	}

	public List<Operation> getOperations() {
		return operations;
	}

	public List<PythonExpression> getComparators() {
		return comparators;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonComparison that = (PythonComparison) o;
		return Objects.equals(left, that.left) &&
				Objects.equals(operations, that.operations) &&
				Objects.equals(comparators, that.comparators);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, operations, comparators);
	}
}
