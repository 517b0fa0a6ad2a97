package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * An if statement together with its elif chain and optional else body (empty when absent).
 */
public class PythonIf extends PythonStatement {
	private final PythonExpression condition;
	private final List<PythonStatement> thenBody;
	private final List<PythonElif> elifs;
	private final List<PythonStatement> elseBody;

	public PythonIf(SourceLocation location, PythonExpression condition, List<PythonStatement> thenBody,
	                List<PythonElif> elifs, List<PythonStatement> elseBody) {
		super(location);
		this.condition = condition;
		this.thenBody = thenBody;
		this.elifs = elifs;
		this.elseBody = elseBody;
	}

	public PythonExpression getCondition() {
		return condition;
	}

	public List<PythonStatement> getThenBody() {
		return thenBody;
	}

	public List<PythonElif> getElifs() {
		return elifs;
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
		PythonIf pythonIf = (PythonIf) o;
		return Objects.equals(condition, pythonIf.condition) &&
				Objects.equals(thenBody, pythonIf.thenBody) &&
				Objects.equals(elifs, pythonIf.elifs) &&
				Objects.equals(elseBody, pythonIf.elseBody);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, thenBody, elifs, elseBody);
	}
}
