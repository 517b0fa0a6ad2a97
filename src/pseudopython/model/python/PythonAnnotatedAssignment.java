package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.Objects;

public class PythonAnnotatedAssignment extends PythonStatement {
	private final PythonExpression target;
	private final PythonExpression annotation;
	// nullable
	private final PythonExpression value;

	public PythonAnnotatedAssignment(SourceLocation location, PythonExpression target, PythonExpression annotation,
	                                 PythonExpression value) {
		super(location);
		this.target = target;
		this.annotation = annotation;
		this.value = value;
	}

	public PythonExpression getTarget() {
		return target;
	}

	public PythonExpression getAnnotation() {
		return annotation;
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
		PythonAnnotatedAssignment that = (PythonAnnotatedAssignment) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(annotation, that.annotation) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, annotation, value);
	}
}
