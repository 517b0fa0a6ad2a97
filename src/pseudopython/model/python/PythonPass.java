package pseudopython.model.python;

import pseudopython.util.SourceLocation;

public class PythonPass extends PythonStatement {
	public PythonPass(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return this == o || (o != null && getClass() == o.getClass());
	}

	@Override
	public int hashCode() {
		return PythonPass.class.hashCode();
	}
}
