package pseudopython.formatters;

import pseudopython.model.python.*;

import java.io.IOException;
import java.util.List;

public class PythonStatementFormattingVisitor extends PythonStatementVisitor<Void, IOException> {
	private final IndentingWriter out;

	public PythonStatementFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeBody(List<PythonStatement> body) throws IOException {
		out.write(":");
		try (IndentingWriter.Indent ignored = out.indent()) {
			if(body.isEmpty()) {
				out.newLine();
				out.write("pass");
			}
			for(PythonStatement statement : body) {
				out.newLine();
				statement.accept(this);
			}
		}
	}

	private void writeElse(List<PythonStatement> elseBody) throws IOException {
		if(!elseBody.isEmpty()) {
			out.newLine();
			out.write("else");
			writeBody(elseBody);
		}
	}

	private void writeTargets(PythonExpression target) throws IOException {
		if(target instanceof PythonTuple && !((PythonTuple) target).getElements().isEmpty()) {
			FormattingTools.writeCommaSeparated(out, ((PythonTuple) target).getElements(),
					e -> e.accept(new PythonExpressionFormattingVisitor(out)));
		} else {
			target.accept(new PythonExpressionFormattingVisitor(out));
		}
	}

	@Override
	public Void visit(PythonFunctionDefinition functionDefinition) throws IOException {
		out.write("def ");
		out.write(functionDefinition.getName());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, functionDefinition.getParameters(),
				p -> p.accept(new PythonNodeFormattingVisitor(out)));
		out.write(")");
		if(functionDefinition.getReturnAnnotation() != null) {
			out.write(" -> ");
			functionDefinition.getReturnAnnotation().accept(new PythonExpressionFormattingVisitor(out));
		}
		writeBody(functionDefinition.getBody());
		return null;
	}

	@Override
	public Void visit(PythonIf pythonIf) throws IOException {
		out.write("if ");
		pythonIf.getCondition().accept(new PythonExpressionFormattingVisitor(out));
		writeBody(pythonIf.getThenBody());
		for(PythonElif elif : pythonIf.getElifs()) {
			out.newLine();
			out.write("elif ");
			elif.getCondition().accept(new PythonExpressionFormattingVisitor(out));
			writeBody(elif.getBody());
		}
		writeElse(pythonIf.getElseBody());
		return null;
	}

	@Override
	public Void visit(PythonFor pythonFor) throws IOException {
		out.write("for ");
		writeTargets(pythonFor.getTarget());
		out.write(" in ");
		pythonFor.getIterable().accept(new PythonExpressionFormattingVisitor(out));
		writeBody(pythonFor.getBody());
		writeElse(pythonFor.getElseBody());
		return null;
	}

	@Override
	public Void visit(PythonWhile pythonWhile) throws IOException {
		out.write("while ");
		pythonWhile.getCondition().accept(new PythonExpressionFormattingVisitor(out));
		writeBody(pythonWhile.getBody());
		writeElse(pythonWhile.getElseBody());
		return null;
	}

	@Override
	public Void visit(PythonAssignment assignment) throws IOException {
		for(PythonExpression target : assignment.getTargets()) {
			writeTargets(target);
			out.write(" = ");
		}
		assignment.getValue().accept(new PythonExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(PythonAugmentedAssignment augmentedAssignment) throws IOException {
		augmentedAssignment.getTarget().accept(new PythonExpressionFormattingVisitor(out));
		out.write(" ");
		out.write(augmentedAssignment.getOperation().getToken());
		out.write("= ");
		augmentedAssignment.getValue().accept(new PythonExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(PythonAnnotatedAssignment annotatedAssignment) throws IOException {
		annotatedAssignment.getTarget().accept(new PythonExpressionFormattingVisitor(out));
		out.write(": ");
		annotatedAssignment.getAnnotation().accept(new PythonExpressionFormattingVisitor(out));
		if(annotatedAssignment.getValue() != null) {
			out.write(" = ");
			annotatedAssignment.getValue().accept(new PythonExpressionFormattingVisitor(out));
		}
		return null;
	}

	@Override
	public Void visit(PythonReturn pythonReturn) throws IOException {
		out.write("return");
		if(pythonReturn.getValue() != null) {
			out.write(" ");
			pythonReturn.getValue().accept(new PythonExpressionFormattingVisitor(out));
		}
		return null;
	}

	@Override
	public Void visit(PythonExpressionStatement expressionStatement) throws IOException {
		expressionStatement.getValue().accept(new PythonExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(PythonPass pass) throws IOException {
		out.write("pass");
		return null;
	}

	@Override
	public Void visit(PythonBreak pythonBreak) throws IOException {
		out.write("break");
		return null;
	}

	@Override
	public Void visit(PythonContinue pythonContinue) throws IOException {
		out.write("continue");
		return null;
	}

	@Override
	public Void visit(PythonUnsupportedStatement unsupportedStatement) throws IOException {
		out.write("<");
		out.write(unsupportedStatement.getKind());
		out.write(">");
		return null;
	}
}
