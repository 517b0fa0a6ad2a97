package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonFunctionDefinition extends PythonStatement {
	private final String name;
	private final List<PythonParameter> parameters;
	// nullable
	private final PythonExpression returnAnnotation;
	private final List<PythonStatement> body;

	public PythonFunctionDefinition(SourceLocation location, String name, List<PythonParameter> parameters,
	                                PythonExpression returnAnnotation, List<PythonStatement> body) {
		super(location);
		this.name = name;
		this.parameters = parameters;
		this.returnAnnotation = returnAnnotation;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<PythonParameter> getParameters() {
		return parameters;
	}

	public PythonExpression getReturnAnnotation() {
		return returnAnnotation;
	}

	public List<PythonStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonFunctionDefinition that = (PythonFunctionDefinition) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(parameters, that.parameters) &&
				Objects.equals(returnAnnotation, that.returnAnnotation) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, parameters, returnAnnotation, body);
	}
}
