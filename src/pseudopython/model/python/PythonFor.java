package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonFor extends PythonStatement {
	private final PythonExpression target;
	private final PythonExpression iterable;
	private final List<PythonStatement> body;
	private final List<PythonStatement> elseBody;

	public PythonFor(SourceLocation location, PythonExpression target, PythonExpression iterable,
	                 List<PythonStatement> body, List<PythonStatement> elseBody) {
		super(location);
		this.target = target;
		this.iterable = iterable;
		this.body = body;
		this.elseBody = elseBody;
	}

	public PythonExpression getTarget() {
		return target;
	}

	public PythonExpression getIterable() {
		return iterable;
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
		PythonFor pythonFor = (PythonFor) o;
		return Objects.equals(target, pythonFor.target) &&
				Objects.equals(iterable, pythonFor.iterable) &&
				Objects.equals(body, pythonFor.body) &&
				Objects.equals(elseBody, pythonFor.elseBody);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, iterable, body, elseBody);
	}
}
