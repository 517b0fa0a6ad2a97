package pseudopython.model.python;

public abstract class PythonNodeVisitor<T, E extends Throwable> {
	public abstract T visit(PythonModule module) throws E;
	public abstract T visit(PythonStatement statement) throws E;
	public abstract T visit(PythonExpression expression) throws E;
	public abstract T visit(PythonParameter parameter) throws E;
	public abstract T visit(PythonElif elif) throws E;
	public abstract T visit(PythonKeyword keyword) throws E;
}
