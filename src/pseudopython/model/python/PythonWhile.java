package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonWhile extends PythonStatement {
	private final PythonExpression condition;
	private final List<PythonStatement> body;
	private final List<PythonStatement> elseBody;

	public PythonWhile(SourceLocation location, PythonExpression condition, List<PythonStatement> body,
	                   List<PythonStatement> elseBody) {
		super(location);
		this.condition = condition;
		this.body = body;
		this.elseBody = elseBody;
	}

	public PythonExpression getCondition() {
		return condition;
	}

	public List<PythonStatement> getBody() {
		return body;
	}

	public List<PythonStatement> getElseBody() {
		return elseBody;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonWhile that = (PythonWhile) o;
		return Objects.equals(condition, that.condition) &&
				Objects.equals(body, that.body) &&
				Objects.equals(elseBody, that.elseBody);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, body, elseBody);
	}
}
