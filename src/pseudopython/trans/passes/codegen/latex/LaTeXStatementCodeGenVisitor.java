package pseudopython.trans.passes.codegen.latex;

import pseudopython.formatters.LaTeXExpressionFormattingVisitor;
import pseudopython.formatters.LaTeXRenderingContext;
import pseudopython.formatters.LaTeXWriter;
import pseudopython.model.python.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Writes the algpseudocode commands for one statement, and those of the statements nested in it.
 */
public class LaTeXStatementCodeGenVisitor extends PythonStatementVisitor<Void, RuntimeException> {
	private final LayoutTracker layout;
	private final LaTeXRenderingContext context;

	public LaTeXStatementCodeGenVisitor(LayoutTracker layout, LaTeXRenderingContext context) {
		this.layout = layout;
		this.context = context;
	}

	private void body(List<PythonStatement> statements) {
		statements.forEach(s -> s.accept(this));
	}

	private String render(PythonExpression expression) {
		return LaTeXExpressionFormattingVisitor.render(expression, context);
	}

	private LaTeXExpressionFormattingVisitor into(LaTeXWriter out) {
		return new LaTeXExpressionFormattingVisitor(out, context);
	}

	// annotations are usually type names given as strings
	private void writeAnnotation(LaTeXWriter out, PythonExpression annotation) {
		if (annotation instanceof PythonRawLaTeX && !((PythonRawLaTeX) annotation).getValue().contains("$")) {
			out.text("\\texttt{" + ((PythonRawLaTeX) annotation).getValue() + "}");
		} else {
			annotation.accept(into(out));
		}
	}

	private static boolean isIntegerLiteral(PythonExpression expression) {
		return expression instanceof PythonNumber
				&& LaTeXExpressionFormattingVisitor.formatNumber(((PythonNumber) expression).getValue()).matches("[0-9]+");
	}

	private static boolean isNegativeIntegerLiteral(PythonExpression expression) {
		return expression instanceof PythonUnary
				&& ((PythonUnary) expression).getOperation() == PythonUnary.Operation.NEG
				&& isIntegerLiteral(((PythonUnary) expression).getOperand());
	}

	private static boolean isRangeCall(PythonExpression iterable) {
		if (!(iterable instanceof PythonCall)) {
			return false;
		}
		PythonCall call = (PythonCall) iterable;
		return call.getCallee() instanceof PythonName
				&& ((PythonName) call.getCallee()).getName().equals("range")
				&& call.getKeywords().isEmpty()
				&& call.getArguments().size() >= 1 && call.getArguments().size() <= 3;
	}

	// the last value a range actually takes, one step short of its exclusive stop
	private static PythonExpression inclusiveEnd(PythonExpression stop, boolean descending) {
		if (isIntegerLiteral(stop)) {
			BigInteger value = new BigInteger(LaTeXExpressionFormattingVisitor.formatNumber(((PythonNumber) stop).getValue()));
			value = descending ? value.add(BigInteger.ONE) : value.subtract(BigInteger.ONE);
			if (value.signum() < 0) {
				return new PythonUnary(stop.getLocation(), PythonUnary.Operation.NEG,
						new PythonNumber(stop.getLocation(), value.negate().toString()));
			}
			return new PythonNumber(stop.getLocation(), value.toString());
		}
		if (isNegativeIntegerLiteral(stop)) {
			PythonExpression magnitude = ((PythonUnary) stop).getOperand();
			BigInteger value = new BigInteger(LaTeXExpressionFormattingVisitor.formatNumber(((PythonNumber) magnitude).getValue()))
					.negate();
			value = descending ? value.add(BigInteger.ONE) : value.subtract(BigInteger.ONE);
			if (value.signum() < 0) {
				return new PythonUnary(stop.getLocation(), PythonUnary.Operation.NEG,
						new PythonNumber(stop.getLocation(), value.negate().toString()));
			}
			return new PythonNumber(stop.getLocation(), value.toString());
		}
		return new PythonBinop(stop.getLocation(),
				descending ? PythonBinop.Operation.PLUS : PythonBinop.Operation.MINUS,
				stop, new PythonNumber(stop.getLocation(), "1"));
	}

	private String rangeHeader(PythonExpression target, PythonCall range) {
		List<PythonExpression> arguments = range.getArguments();
		PythonExpression start = arguments.size() == 1 ? new PythonNumber(range.getLocation(), "0") : arguments.get(0);
		PythonExpression stop = arguments.size() == 1 ? arguments.get(0) : arguments.get(1);
		PythonExpression step = arguments.size() == 3 ? arguments.get(2) : null;

		LaTeXWriter out = new LaTeXWriter();
		target.accept(into(out));
		out.math(" \\gets ");
		start.accept(into(out));
		out.text(" \\textbf{to} ");
		inclusiveEnd(stop, step != null && isNegativeIntegerLiteral(step)).accept(into(out));
		if (step != null && !(isIntegerLiteral(step)
				&& LaTeXExpressionFormattingVisitor.formatNumber(((PythonNumber) step).getValue()).equals("1"))) {
			out.text(" \\textbf{step} ");
			step.accept(into(out));
		}
		return out.toString();
	}

	private static void checkNoElse(PythonStatement loop, List<PythonStatement> elseBody, String kind) {
		if (!elseBody.isEmpty()) {
			throw new UnsupportedStatementIssue(loop, kind + " with else clause");
		}
	}

	// the left-hand sides of a chained or unpacking assignment, flattened into one list
	private static List<PythonExpression> flattenTargets(List<PythonExpression> targets) {
		List<PythonExpression> flat = new ArrayList<>();
		for (PythonExpression target : targets) {
			if (target instanceof PythonTuple) {
				flat.addAll(((PythonTuple) target).getElements());
			} else if (target instanceof PythonList) {
				flat.addAll(((PythonList) target).getElements());
			} else {
				flat.add(target);
			}
		}
		return flat;
	}

	private void writeParameters(LaTeXWriter out, List<PythonParameter> parameters) {
		boolean first = true;
		for (PythonParameter parameter : parameters) {
			if (!first) {
				out.math(", ");
			}
			first = false;
			new PythonName(parameter.getLocation(), parameter.getName()).accept(into(out));
			if (parameter.getAnnotation() != null) {
				out.text(": ");
				writeAnnotation(out, parameter.getAnnotation());
			}
			if (parameter.getDefaultValue() != null) {
				out.math(" = ");
				parameter.getDefaultValue().accept(into(out));
			}
		}
	}

	@Override
	public Void visit(PythonFunctionDefinition functionDefinition) throws RuntimeException {
		String name = LaTeXWriter.escapeText(functionDefinition.getName());
		LaTeXWriter parameters = new LaTeXWriter();
		writeParameters(parameters, functionDefinition.getParameters());

		LayoutTracker.Block block;
		if (functionDefinition.getReturnAnnotation() != null) {
			LaTeXWriter header = new LaTeXWriter();
			header.text("\\Function{" + name + "}{" + parameters + "} ");
			header.math("\\rightarrow");
			header.text(" ");
			writeAnnotation(header, functionDefinition.getReturnAnnotation());
			block = layout.open(header.toString(), "\\EndFunction");
		} else {
			block = layout.open("\\Procedure{" + name + "}{" + parameters + "}", "\\EndProcedure");
		}
		try (LayoutTracker.Block ignored = block) {
			body(functionDefinition.getBody());
		}
		return null;
	}

	@Override
	public Void visit(PythonIf pythonIf) throws RuntimeException {
		try (LayoutTracker.Block block = layout.open("\\If{" + render(pythonIf.getCondition()) + "}", "\\EndIf")) {
			body(pythonIf.getThenBody());
			for (PythonElif elif : pythonIf.getElifs()) {
				block.divide("\\ElsIf{" + render(elif.getCondition()) + "}");
				body(elif.getBody());
			}
			if (!pythonIf.getElseBody().isEmpty()) {
				block.divide("\\Else");
				body(pythonIf.getElseBody());
			}
		}
		return null;
	}

	@Override
	public Void visit(PythonFor pythonFor) throws RuntimeException {
		checkNoElse(pythonFor, pythonFor.getElseBody(), "for loop");
		String header;
		if (isRangeCall(pythonFor.getIterable())) {
			header = "\\For{" + rangeHeader(pythonFor.getTarget(), (PythonCall) pythonFor.getIterable()) + "}";
		} else {
			LaTeXWriter out = new LaTeXWriter();
			flattenLoopTarget(out, pythonFor.getTarget());
			out.math(" \\in ");
			pythonFor.getIterable().accept(into(out));
			header = "\\ForAll{" + out + "}";
		}
		try (LayoutTracker.Block ignored = layout.open(header, "\\EndFor")) {
			body(pythonFor.getBody());
		}
		return null;
	}

	private void flattenLoopTarget(LaTeXWriter out, PythonExpression target) {
		boolean first = true;
		for (PythonExpression element : flattenTargets(Collections.singletonList(target))) {
			if (!first) {
				out.math(", ");
			}
			first = false;
			element.accept(into(out));
		}
	}

	@Override
	public Void visit(PythonWhile pythonWhile) throws RuntimeException {
		checkNoElse(pythonWhile, pythonWhile.getElseBody(), "while loop");
		try (LayoutTracker.Block ignored = layout.open("\\While{" + render(pythonWhile.getCondition()) + "}",
				"\\EndWhile")) {
			body(pythonWhile.getBody());
		}
		return null;
	}

	@Override
	public Void visit(PythonAssignment assignment) throws RuntimeException {
		LaTeXWriter out = new LaTeXWriter();
		boolean first = true;
		for (PythonExpression target : flattenTargets(assignment.getTargets())) {
			if (!first) {
				out.math(", ");
			}
			first = false;
			target.accept(into(out));
		}
		out.math(" \\gets ");
		assignment.getValue().accept(into(out));
		layout.line("\\State " + out);
		return null;
	}

	@Override
	public Void visit(PythonAugmentedAssignment augmentedAssignment) throws RuntimeException {
		LaTeXWriter out = new LaTeXWriter();
		augmentedAssignment.getTarget().accept(into(out));
		out.math(" \\gets ");
		new PythonBinop(augmentedAssignment.getLocation(), augmentedAssignment.getOperation(),
				augmentedAssignment.getTarget(), augmentedAssignment.getValue()).accept(into(out));
		layout.line("\\State " + out);
		return null;
	}

	@Override
	public Void visit(PythonAnnotatedAssignment annotatedAssignment) throws RuntimeException {
		LaTeXWriter out = new LaTeXWriter();
		annotatedAssignment.getTarget().accept(into(out));
		out.text(": ");
		writeAnnotation(out, annotatedAssignment.getAnnotation());
		if (annotatedAssignment.getValue() != null) {
			out.text(" ");
			out.math("\\gets ");
			annotatedAssignment.getValue().accept(into(out));
		}
		layout.line("\\State " + out);
		return null;
	}

	@Override
	public Void visit(PythonReturn pythonReturn) throws RuntimeException {
		if (pythonReturn.getValue() == null) {
			layout.line("\\State \\Return");
		} else {
			layout.line("\\State \\Return{} " + render(pythonReturn.getValue()));
		}
		return null;
	}

	@Override
	public Void visit(PythonExpressionStatement expressionStatement) throws RuntimeException {
		layout.line("\\State " + render(expressionStatement.getValue()));
		return null;
	}

	@Override
	public Void visit(PythonPass pass) throws RuntimeException {
		// nothing to do
		return null;
	}

	@Override
	public Void visit(PythonBreak pythonBreak) throws RuntimeException {
		layout.line("\\State \\Break");
		return null;
	}

	@Override
	public Void visit(PythonContinue pythonContinue) throws RuntimeException {
		layout.line("\\State \\Continue");
		return null;
	}

	@Override
	public Void visit(PythonUnsupportedStatement unsupportedStatement) throws RuntimeException {
		throw new UnsupportedStatementIssue(unsupportedStatement, unsupportedStatement.getKind());
	}
}
