package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class PythonSet extends PythonExpression {
	private final List<PythonExpression> elements;

	public PythonSet(SourceLocation location, List<PythonExpression> elements) {
		super(location);
		this.elements = elements;
	}

	public List<PythonExpression> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonSet that = (PythonSet) o;
		return Objects.equals(elements, that.elements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), elements);
	}
}
