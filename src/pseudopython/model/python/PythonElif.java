package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * One {@code elif} clause of an if statement.
 */
public class PythonElif extends PythonNode {
	private final PythonExpression condition;
	private final List<PythonStatement> body;

	public PythonElif(SourceLocation location, PythonExpression condition, List<PythonStatement> body) {
		super(location);
		this.condition = condition;
		this.body = body;
	}

	public PythonExpression getCondition() {
		return condition;
	}

	public List<PythonStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonElif that = (PythonElif) o;
		return Objects.equals(condition, that.condition) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, body);
	}
}
