package pseudopython.trans.passes.codegen.latex;

import pseudopython.model.python.*;

import java.util.Set;

/**
 * Collects the names of all functions defined in a statement tree, at any depth.
 */
public class ProcedureNameCollectorVisitor extends PythonStatementVisitor<Void, RuntimeException> {
	private final Set<String> names;

	ProcedureNameCollectorVisitor(Set<String> names) {
		this.names = names;
	}

	@Override
	public Void visit(PythonFunctionDefinition functionDefinition) throws RuntimeException {
		names.add(functionDefinition.getName());
		functionDefinition.getBody().forEach(s -> s.accept(this));
		return null;
	}

	@Override
	public Void visit(PythonIf pythonIf) throws RuntimeException {
		pythonIf.getThenBody().forEach(s -> s.accept(this));
		for (PythonElif elif : pythonIf.getElifs()) {
			elif.getBody().forEach(s -> s.accept(this));
		}
		pythonIf.getElseBody().forEach(s -> s.accept(this));
		return null;
	}

	@Override
	public Void visit(PythonFor pythonFor) throws RuntimeException {
		pythonFor.getBody().forEach(s -> s.accept(this));
		pythonFor.getElseBody().forEach(s -> s.accept(this));
		return null;
	}

	@Override
	public Void visit(PythonWhile pythonWhile) throws RuntimeException {
		pythonWhile.getBody().forEach(s -> s.accept(this));
		pythonWhile.getElseBody().forEach(s -> s.accept(this));
		return null;
	}

	@Override
	public Void visit(PythonAssignment assignment) throws RuntimeException {
		// nothing to do
		return null;
	}

	@Override
	public Void visit(PythonAugmentedAssignment augmentedAssignment) throws RuntimeException {
		// nothing to do
		return null;
	}

	@Override
	public Void visit(PythonAnnotatedAssignment annotatedAssignment) throws RuntimeException {
		// nothing to do
		return null;
	}

	@Override
	public Void visit(PythonReturn pythonReturn) throws RuntimeException {
		// nothing to do
		return null;
	}

	@Override
	public Void visit(PythonExpressionStatement expressionStatement) throws RuntimeException {
		// nothing to do
		return null;
	}

	@Override
	public Void visit(PythonPass pass) throws RuntimeException {
		// nothing to do
		return null;
	}

	@Override
	public Void visit(PythonBreak pythonBreak) throws RuntimeException {
		// nothing to do
		return null;
	}

	@Override
	public Void visit(PythonContinue pythonContinue) throws RuntimeException {
		// nothing to do
		return null;
	}

	@Override
	public Void visit(PythonUnsupportedStatement unsupportedStatement) throws RuntimeException {
		// nothing to do
		return null;
	}
}
