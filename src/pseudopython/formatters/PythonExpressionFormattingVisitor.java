package pseudopython.formatters;

import pseudopython.model.python.*;

import java.io.IOException;
import java.util.List;

/**
 * Prints an expression back in script syntax, with normalized spacing and quoting and only the
 * parentheses that precedence requires.
 */
public class PythonExpressionFormattingVisitor extends PythonExpressionVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final int precedence;

	public PythonExpressionFormattingVisitor(IndentingWriter out) {
		this(out, PythonPrecedenceVisitor.LOWEST);
	}

	public PythonExpressionFormattingVisitor(IndentingWriter out, int precedence) {
		this.out = out;
		this.precedence = precedence;
	}

	private void writeOperand(PythonExpression operand, int minimumPrecedence) throws IOException {
		operand.accept(new PythonExpressionFormattingVisitor(out, minimumPrecedence));
	}

	private void writeElements(List<PythonExpression> elements) throws IOException {
		FormattingTools.writeCommaSeparated(out, elements, e -> e.accept(new PythonExpressionFormattingVisitor(out)));
	}

	private boolean open(int ownPrecedence) throws IOException {
		if(ownPrecedence < precedence) {
			out.write("(");
			return true;
		}
		return false;
	}

	private void close(boolean parenthesized) throws IOException {
		if(parenthesized) {
			out.write(")");
		}
	}

	@Override
	public Void visit(PythonName name) throws IOException {
		out.write(name.getName());
		return null;
	}

	@Override
	public Void visit(PythonNumber number) throws IOException {
		out.write(number.getValue());
		return null;
	}

	@Override
	public Void visit(PythonBool bool) throws IOException {
		out.write(bool.getValue() ? "True" : "False");
		return null;
	}

	@Override
	public Void visit(PythonNone none) throws IOException {
		out.write("None");
		return null;
	}

	private static final String[] QUOTES = {"'", "\"", "'''", "\"\"\""};

	// whether the lexer would read body back unchanged between a pair of quotes
	static boolean fitsBetween(String body, String quote) {
		int i = 0;
		while(i < body.length()) {
			char c = body.charAt(i);
			if(c == '\\') {
				if(i + 1 == body.length()) {
					return false;
				}
				i += 2;
				continue;
			}
			if(body.startsWith(quote, i)) {
				return false;
			}
			if(quote.length() == 1 && (c == '\n' || c == '\r')) {
				return false;
			}
			++i;
		}
		// a quote character at the very end would run into a triple-quoted delimiter
		return quote.length() == 1 || !body.endsWith(quote.substring(0, 1));
	}

	@Override
	public Void visit(PythonRawLaTeX rawLaTeX) throws IOException {
		String body = rawLaTeX.getValue();
		String quote = QUOTES[0];
		for(String candidate : QUOTES) {
			if(fitsBetween(body, candidate)) {
				quote = candidate;
				break;
			}
		}
		out.write(quote + body + quote);
		return null;
	}

	@Override
	public Void visit(PythonBinop binop) throws IOException {
		int own = PythonPrecedenceVisitor.of(binop.getOperation());
		boolean parenthesized = open(own);
		if(binop.getOperation() == PythonBinop.Operation.POWER) {
			// right associative, and binds tighter than a unary operator on its left
			writeOperand(binop.getLHS(), PythonPrecedenceVisitor.ATOM);
			out.write(" ** ");
			writeOperand(binop.getRHS(), PythonPrecedenceVisitor.UNARY);
		} else {
			writeOperand(binop.getLHS(), own);
			out.write(" ");
			out.write(binop.getOperation().getToken());
			out.write(" ");
			writeOperand(binop.getRHS(), own + 1);
		}
		close(parenthesized);
		return null;
	}

	@Override
	public Void visit(PythonUnary unary) throws IOException {
		int own = PythonPrecedenceVisitor.of(unary);
		boolean parenthesized = open(own);
		out.write(unary.getOperation().getToken());
		writeOperand(unary.getOperand(), own);
		close(parenthesized);
		return null;
	}

	@Override
	public Void visit(PythonComparison comparison) throws IOException {
		boolean parenthesized = open(PythonPrecedenceVisitor.COMPARISON);
		writeOperand(comparison.getLeft(), PythonPrecedenceVisitor.COMPARISON + 1);
		for(int i = 0; i < comparison.getOperations().size(); ++i) {
			out.write(" ");
			out.write(comparison.getOperations().get(i).getToken());
			out.write(" ");
			writeOperand(comparison.getComparators().get(i), PythonPrecedenceVisitor.COMPARISON + 1);
		}
		close(parenthesized);
		return null;
	}

	@Override
	public Void visit(PythonBoolOp boolOp) throws IOException {
		int own = PythonPrecedenceVisitor.of(boolOp);
		boolean parenthesized = open(own);
		FormattingTools.writeSeparated(out, " " + boolOp.getOperation().getToken() + " ", boolOp.getOperands(),
				e -> writeOperand(e, own + 1));
		close(parenthesized);
		return null;
	}

	@Override
	public Void visit(PythonCall call) throws IOException {
		writeOperand(call.getCallee(), PythonPrecedenceVisitor.ATOM);
		out.write("(");
		writeElements(call.getArguments());
		for(int i = 0; i < call.getKeywords().size(); ++i) {
			if(i > 0 || !call.getArguments().isEmpty()) {
				out.write(", ");
			}
			call.getKeywords().get(i).accept(new PythonNodeFormattingVisitor(out));
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(PythonSubscript subscript) throws IOException {
		writeOperand(subscript.getTarget(), PythonPrecedenceVisitor.ATOM);
		out.write("[");
		if(subscript.getIndex() instanceof PythonTuple && !((PythonTuple) subscript.getIndex()).getElements().isEmpty()) {
			List<PythonExpression> indices = ((PythonTuple) subscript.getIndex()).getElements();
			writeElements(indices);
			if(indices.size() == 1) {
				out.write(",");
			}
		} else {
			subscript.getIndex().accept(new PythonExpressionFormattingVisitor(out));
		}
		out.write("]");
		return null;
	}

	@Override
	public Void visit(PythonAttribute attribute) throws IOException {
		writeOperand(attribute.getTarget(), PythonPrecedenceVisitor.ATOM);
		out.write(".");
		out.write(attribute.getName());
		return null;
	}

	@Override
	public Void visit(PythonTuple tuple) throws IOException {
		out.write("(");
		writeElements(tuple.getElements());
		if(tuple.getElements().size() == 1) {
			out.write(",");
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(PythonList list) throws IOException {
		out.write("[");
		writeElements(list.getElements());
		out.write("]");
		return null;
	}

	@Override
	public Void visit(PythonSet set) throws IOException {
		out.write("{");
		writeElements(set.getElements());
		out.write("}");
		return null;
	}

	@Override
	public Void visit(PythonSetComprehension setComprehension) throws IOException {
		out.write("{");
		writeOperand(setComprehension.getElement(), PythonPrecedenceVisitor.LOWEST);
		out.write(" for ");
		writeOperand(setComprehension.getTarget(), PythonPrecedenceVisitor.LOWEST);
		out.write(" in ");
		writeOperand(setComprehension.getIterable(), PythonPrecedenceVisitor.OR);
		for(PythonExpression condition : setComprehension.getConditions()) {
			out.write(" if ");
			writeOperand(condition, PythonPrecedenceVisitor.OR);
		}
		out.write("}");
		return null;
	}

	@Override
	public Void visit(PythonUnsupportedExpression unsupportedExpression) throws IOException {
		out.write("<");
		out.write(unsupportedExpression.getKind());
		out.write(">");
		return null;
	}
}
