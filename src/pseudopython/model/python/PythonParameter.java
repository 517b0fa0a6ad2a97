package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.Objects;

public class PythonParameter extends PythonNode {
	private final String name;
	// nullable
	private final PythonExpression annotation;
	// nullable
	private final PythonExpression defaultValue;

	public PythonParameter(SourceLocation location, String name, PythonExpression annotation,
	                       PythonExpression defaultValue) {
		super(location);
		this.name = name;
		this.annotation = annotation;
		this.defaultValue = defaultValue;
	}

	public String getName() {
		return name;
	}

	public PythonExpression getAnnotation() {
		return annotation;
	}

	public PythonExpression getDefaultValue() {
		return defaultValue;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonParameter that = (PythonParameter) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(annotation, that.annotation) &&
				Objects.equals(defaultValue, that.defaultValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, annotation, defaultValue);
	}
}
