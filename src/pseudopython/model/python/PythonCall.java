package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonCall extends PythonExpression {
	private final PythonExpression callee;
	private final List<PythonExpression> arguments;
	private final List<PythonKeyword> keywords;

	public PythonCall(SourceLocation location, PythonExpression callee, List<PythonExpression> arguments,
	                  List<PythonKeyword> keywords) {
		super(location);
		this.callee = callee;
		this.arguments = arguments;
		this.keywords = keywords;
	}

	public PythonExpression getCallee() {
		return callee;
	}

	public List<PythonExpression> getArguments() {
		return arguments;
	}

	public List<PythonKeyword> getKeywords() {
		return keywords;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonCall call = (PythonCall) o;
		return Objects.equals(callee, call.callee) &&
				Objects.equals(arguments, call.arguments) &&
				Objects.equals(keywords, call.keywords);
	}

	@Override
	public int hashCode() {
		return Objects.hash(callee, arguments, keywords);
	}
}
