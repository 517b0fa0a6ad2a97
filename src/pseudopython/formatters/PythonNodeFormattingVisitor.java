package pseudopython.formatters;

import pseudopython.model.python.*;

import java.io.IOException;

public class PythonNodeFormattingVisitor extends PythonNodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public PythonNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(PythonModule module) throws IOException {
		boolean first = true;
		for(PythonStatement statement : module.getBody()) {
			if(!first) {
				out.newLine();
			}
			first = false;
			statement.accept(new PythonStatementFormattingVisitor(out));
		}
		return null;
	}

	@Override
	public Void visit(PythonStatement statement) throws IOException {
		statement.accept(new PythonStatementFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(PythonExpression expression) throws IOException {
		expression.accept(new PythonExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(PythonParameter parameter) throws IOException {
		out.write(parameter.getName());
		if(parameter.getAnnotation() != null) {
			out.write(": ");
			parameter.getAnnotation().accept(new PythonExpressionFormattingVisitor(out));
		}
		if(parameter.getDefaultValue() != null) {
			out.write(parameter.getAnnotation() != null ? " = " : "=");
			parameter.getDefaultValue().accept(new PythonExpressionFormattingVisitor(out));
		}
		return null;
	}

	@Override
	public Void visit(PythonElif elif) throws IOException {
		out.write("elif ");
		elif.getCondition().accept(new PythonExpressionFormattingVisitor(out));
		out.write(":");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for(PythonStatement statement : elif.getBody()) {
				out.newLine();
				statement.accept(new PythonStatementFormattingVisitor(out));
			}
		}
		return null;
	}

	@Override
	public Void visit(PythonKeyword keyword) throws IOException {
		out.write(keyword.getName());
		out.write("=");
		keyword.getValue().accept(new PythonExpressionFormattingVisitor(out));
		return null;
	}
}
