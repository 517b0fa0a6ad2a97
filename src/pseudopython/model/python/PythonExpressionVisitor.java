package pseudopython.model.python;

public abstract class PythonExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(PythonName name) throws E;
	public abstract T visit(PythonNumber number) throws E;
	public abstract T visit(PythonBool bool) throws E;
	public abstract T visit(PythonNone none) throws E;
	public abstract T visit(PythonRawLaTeX rawLaTeX) throws E;
	public abstract T visit(PythonBinop binop) throws E;
	public abstract T visit(PythonUnary unary) throws E;
	public abstract T visit(PythonComparison comparison) throws E;
	public abstract T visit(PythonBoolOp boolOp) throws E;
	public abstract T visit(PythonCall call) throws E;
	public abstract T visit(PythonSubscript subscript) throws E;
	public abstract T visit(PythonAttribute attribute) throws E;
	public abstract T visit(PythonTuple tuple) throws E;
	public abstract T visit(PythonList list) throws E;
	public abstract T visit(PythonSet set) throws E;
	public abstract T visit(PythonSetComprehension setComprehension) throws E;
	public abstract T visit(PythonUnsupportedExpression unsupportedExpression) throws E;
}
