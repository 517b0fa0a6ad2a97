package pseudopython.model.python;

import pseudopython.util.SourceLocation;

public abstract class PythonStatement extends PythonNode {
	public PythonStatement(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(PythonNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(PythonStatementVisitor<T, E> v) throws E;
}
