package pseudopython.model.python;

public abstract class PythonStatementVisitor<T, E extends Throwable> {
	public abstract T visit(PythonFunctionDefinition functionDefinition) throws E;
	public abstract T visit(PythonIf pythonIf) throws E;
	public abstract T visit(PythonFor pythonFor) throws E;
	public abstract T visit(PythonWhile pythonWhile) throws E;
	public abstract T visit(PythonAssignment assignment) throws E;
	public abstract T visit(PythonAugmentedAssignment augmentedAssignment) throws E;
	public abstract T visit(PythonAnnotatedAssignment annotatedAssignment) throws E;
	public abstract T visit(PythonReturn pythonReturn) throws E;
	public abstract T visit(PythonExpressionStatement expressionStatement) throws E;
	public abstract T visit(PythonPass pass) throws E;
	public abstract T visit(PythonBreak pythonBreak) throws E;
	public abstract T visit(PythonContinue pythonContinue) throws E;
	public abstract T visit(PythonUnsupportedStatement unsupportedStatement) throws E;
}
