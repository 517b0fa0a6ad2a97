package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.Objects;

public class PythonExpressionStatement extends PythonStatement {
	private final PythonExpression value;

	public PythonExpressionStatement(SourceLocation location, PythonExpression value) {
		super(location);
		this.value = value;
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
		PythonExpressionStatement that = (PythonExpressionStatement) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
