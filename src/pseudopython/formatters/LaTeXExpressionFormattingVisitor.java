package pseudopython.formatters;

import pseudopython.model.python.*;
import pseudopython.trans.passes.codegen.latex.UnsupportedExpressionIssue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders an expression as LaTeX into a {@link LaTeXWriter}.
 *
 * Operators become math glyphs and only the parentheses that precedence requires are written.
 * String literals are raw LaTeX: they are copied verbatim, and when called they act as templates
 * whose #1..#9 placeholders receive the rendered arguments.
 */
public class LaTeXExpressionFormattingVisitor extends PythonExpressionVisitor<Void, RuntimeException> {

	private static final Pattern PLACEHOLDER = Pattern.compile("#[1-9]");

	private static final Map<PythonBinop.Operation, String> BINOP_GLYPHS = new EnumMap<>(PythonBinop.Operation.class);
	private static final Map<PythonComparison.Operation, String> COMPARISON_GLYPHS =
			new EnumMap<>(PythonComparison.Operation.class);
	private static final Map<PythonUnary.Operation, String> UNARY_GLYPHS = new EnumMap<>(PythonUnary.Operation.class);
	static {
		BINOP_GLYPHS.put(PythonBinop.Operation.PLUS, "+");
		BINOP_GLYPHS.put(PythonBinop.Operation.MINUS, "-");
		BINOP_GLYPHS.put(PythonBinop.Operation.TIMES, "\\cdot");
		BINOP_GLYPHS.put(PythonBinop.Operation.DIVIDE, "/");
		BINOP_GLYPHS.put(PythonBinop.Operation.MOD, "\\bmod");
		BINOP_GLYPHS.put(PythonBinop.Operation.BOR, "\\cup");
		BINOP_GLYPHS.put(PythonBinop.Operation.BAND, "\\cap");
		BINOP_GLYPHS.put(PythonBinop.Operation.BXOR, "\\oplus");
		BINOP_GLYPHS.put(PythonBinop.Operation.LSHIFT, "\\ll");
		BINOP_GLYPHS.put(PythonBinop.Operation.RSHIFT, "\\gg");

		COMPARISON_GLYPHS.put(PythonComparison.Operation.EQ, "=");
		COMPARISON_GLYPHS.put(PythonComparison.Operation.NEQ, "\\neq");
		COMPARISON_GLYPHS.put(PythonComparison.Operation.LT, "<");
		COMPARISON_GLYPHS.put(PythonComparison.Operation.LEQ, "\\leq");
		COMPARISON_GLYPHS.put(PythonComparison.Operation.GT, ">");
		COMPARISON_GLYPHS.put(PythonComparison.Operation.GEQ, "\\geq");
		COMPARISON_GLYPHS.put(PythonComparison.Operation.IN, "\\in");
		COMPARISON_GLYPHS.put(PythonComparison.Operation.NOT_IN, "\\notin");
		COMPARISON_GLYPHS.put(PythonComparison.Operation.IS, "\\equiv");
		COMPARISON_GLYPHS.put(PythonComparison.Operation.IS_NOT, "\\not\\equiv");

		UNARY_GLYPHS.put(PythonUnary.Operation.NOT, "\\lnot ");
		UNARY_GLYPHS.put(PythonUnary.Operation.NEG, "-");
		UNARY_GLYPHS.put(PythonUnary.Operation.POS, "+");
		UNARY_GLYPHS.put(PythonUnary.Operation.INVERT, "\\sim ");
	}

	private final LaTeXWriter out;
	private final LaTeXRenderingContext context;
	private final int precedence;

	public LaTeXExpressionFormattingVisitor(LaTeXWriter out, LaTeXRenderingContext context) {
		this(out, context, PythonPrecedenceVisitor.LOWEST);
	}

	public LaTeXExpressionFormattingVisitor(LaTeXWriter out, LaTeXRenderingContext context, int precedence) {
		this.out = out;
		this.context = context;
		this.precedence = precedence;
	}

	/**
	 * Renders an expression on its own, as text-mode LaTeX.
	 */
	public static String render(PythonExpression expression, LaTeXRenderingContext context) {
		LaTeXWriter w = new LaTeXWriter();
		expression.accept(new LaTeXExpressionFormattingVisitor(w, context));
		return w.toString();
	}

	/**
	 * Renders an expression as math content, without the surrounding dollar signs.
	 */
	public static String renderMath(PythonExpression expression, LaTeXRenderingContext context) {
		LaTeXWriter w = new LaTeXWriter(true);
		expression.accept(new LaTeXExpressionFormattingVisitor(w, context));
		return w.toString();
	}

	public String formatName(String name) {
		for(Map.Entry<String, String> prefix : context.getSymbolPrefixes().entrySet()) {
			if(name.startsWith(prefix.getKey()) && name.length() > prefix.getKey().length()) {
				return prefix.getValue().replace("%s", name.substring(prefix.getKey().length()));
			}
		}
		if(name.startsWith("_") || name.endsWith("_") || name.contains("__")) {
			return "\\mathit{" + name.replace("_", "\\_") + "}";
		}
		int split = name.indexOf('_');
		if(split == -1) {
			return formatNameBase(name);
		}
		return formatNameBase(name.substring(0, split)) + "_{" + formatName(name.substring(split + 1)) + "}";
	}

	private static String formatNameBase(String base) {
		if(base.codePointCount(0, base.length()) == 1 || base.chars().allMatch(Character::isDigit)) {
			return base;
		}
		return "\\mathit{" + base + "}";
	}

	public static String formatNumber(String literal) {
		String digits = literal.replace("_", "");
		String lower = digits.toLowerCase();
		if(lower.startsWith("0x")) {
			return new BigInteger(digits.substring(2), 16).toString();
		} else if(lower.startsWith("0o")) {
			return new BigInteger(digits.substring(2), 8).toString();
		} else if(lower.startsWith("0b")) {
			return new BigInteger(digits.substring(2), 2).toString();
		}
		return digits;
	}

	private void writeOperand(PythonExpression operand, int minimumPrecedence) {
		operand.accept(new LaTeXExpressionFormattingVisitor(out, context, minimumPrecedence));
	}

	private void writeSeparated(List<PythonExpression> expressions, String separator) {
		boolean first = true;
		for(PythonExpression expression : expressions) {
			if(!first) {
				out.math(separator);
			}
			first = false;
			writeOperand(expression, PythonPrecedenceVisitor.LOWEST);
		}
	}

	private void writeArguments(List<PythonExpression> arguments, List<PythonKeyword> keywords) {
		writeSeparated(arguments, ", ");
		for(int i = 0; i < keywords.size(); ++i) {
			if(i > 0 || !arguments.isEmpty()) {
				out.math(", ");
			}
			out.math(formatName(keywords.get(i).getName()) + " = ");
			writeOperand(keywords.get(i).getValue(), PythonPrecedenceVisitor.LOWEST);
		}
	}

	private void writeRaw(String value) {
		if(out.isMathOnly() && !value.contains("$")) {
			out.math(value);
		} else {
			out.text(value);
		}
	}

	private boolean open(int ownPrecedence) {
		if(ownPrecedence < precedence) {
			out.math("(");
			return true;
		}
		return false;
	}

	private void close(boolean parenthesized) {
		if(parenthesized) {
			out.math(")");
		}
	}

	@Override
	public Void visit(PythonName name) {
		out.math(formatName(name.getName()));
		return null;
	}

	@Override
	public Void visit(PythonNumber number) {
		out.math(formatNumber(number.getValue()));
		return null;
	}

	@Override
	public Void visit(PythonBool bool) {
		out.math(bool.getValue() ? "\\textsc{True}" : "\\textsc{False}");
		return null;
	}

	@Override
	public Void visit(PythonNone none) {
		out.math("\\textsc{None}");
		return null;
	}

	@Override
	public Void visit(PythonRawLaTeX rawLaTeX) {
		writeRaw(rawLaTeX.getValue());
		return null;
	}

	@Override
	public Void visit(PythonBinop binop) {
		switch(binop.getOperation()) {
			case POWER: {
				boolean parenthesized = open(PythonPrecedenceVisitor.POWER);
				try (LaTeXWriter.Group ignored = out.group("{", "}")) {
					writeOperand(binop.getLHS(), PythonPrecedenceVisitor.ATOM);
				}
				try (LaTeXWriter.Group ignored = out.group("^{", "}")) {
					writeOperand(binop.getRHS(), PythonPrecedenceVisitor.LOWEST);
				}
				close(parenthesized);
				return null;
			}
			case FLOOR_DIVIDE: {
				try (LaTeXWriter.Group ignored = out.group("\\left\\lfloor ", " \\right\\rfloor")) {
					writeOperand(binop.getLHS(), PythonPrecedenceVisitor.MULTIPLICATIVE);
					out.math(" / ");
					writeOperand(binop.getRHS(), PythonPrecedenceVisitor.MULTIPLICATIVE + 1);
				}
				return null;
			}
			case MATMUL: {
				// concatenation: the operands are set side by side
				boolean parenthesized = open(PythonPrecedenceVisitor.MULTIPLICATIVE);
				writeOperand(binop.getLHS(), PythonPrecedenceVisitor.MULTIPLICATIVE);
				writeOperand(binop.getRHS(), PythonPrecedenceVisitor.MULTIPLICATIVE + 1);
				close(parenthesized);
				return null;
			}
			default: {
				int own = PythonPrecedenceVisitor.of(binop.getOperation());
				boolean parenthesized = open(own);
				writeOperand(binop.getLHS(), own);
				out.math(" " + BINOP_GLYPHS.get(binop.getOperation()) + " ");
				writeOperand(binop.getRHS(), own + 1);
				close(parenthesized);
				return null;
			}
		}
	}

	@Override
	public Void visit(PythonUnary unary) {
		boolean parenthesized = open(PythonPrecedenceVisitor.UNARY);
		out.math(UNARY_GLYPHS.get(unary.getOperation()));
		writeOperand(unary.getOperand(), PythonPrecedenceVisitor.UNARY);
		close(parenthesized);
		return null;
	}

	@Override
	public Void visit(PythonComparison comparison) {
		boolean parenthesized = open(PythonPrecedenceVisitor.COMPARISON);
		writeOperand(comparison.getLeft(), PythonPrecedenceVisitor.BOR);
		for(int i = 0; i < comparison.getOperations().size(); ++i) {
			out.math(" " + COMPARISON_GLYPHS.get(comparison.getOperations().get(i)) + " ");
			writeOperand(comparison.getComparators().get(i), PythonPrecedenceVisitor.BOR);
		}
		close(parenthesized);
		return null;
	}

	@Override
	public Void visit(PythonBoolOp boolOp) {
		int own = PythonPrecedenceVisitor.of(boolOp);
		String glyph = boolOp.getOperation() == PythonBoolOp.Operation.AND ? " \\land " : " \\lor ";
		boolean parenthesized = open(own);
		boolean first = true;
		for(PythonExpression operand : boolOp.getOperands()) {
			if(!first) {
				out.math(glyph);
			}
			first = false;
			writeOperand(operand, own + 1);
		}
		close(parenthesized);
		return null;
	}

	@Override
	public Void visit(PythonCall call) {
		PythonExpression callee = call.getCallee();
		if(callee instanceof PythonRawLaTeX) {
			applyTemplate(((PythonRawLaTeX) callee).getValue(), call);
			return null;
		}
		if(callee instanceof PythonName) {
			String name = ((PythonName) callee).getName();
			if(name.equals("_") && call.getArguments().size() == 1 && call.getKeywords().isEmpty()) {
				// explicit parentheses
				out.math("(");
				writeOperand(call.getArguments().get(0), PythonPrecedenceVisitor.LOWEST);
				out.math(")");
				return null;
			}
			if(context.isProcedure(name)) {
				LaTeXWriter arguments = new LaTeXWriter();
				new LaTeXExpressionFormattingVisitor(arguments, context)
						.writeArguments(call.getArguments(), call.getKeywords());
				out.text("\\Call{" + LaTeXWriter.escapeText(name) + "}{" + arguments + "}");
				return null;
			}
		}
		writeOperand(callee, PythonPrecedenceVisitor.ATOM);
		out.math("(");
		writeArguments(call.getArguments(), call.getKeywords());
		out.math(")");
		return null;
	}

	private void applyTemplate(String template, PythonCall call) {
		List<PythonExpression> arguments = call.getArguments();
		if(!PLACEHOLDER.matcher(template).find()) {
			// without placeholders the arguments follow the template in parentheses
			writeRaw(template);
			out.math("(");
			writeArguments(arguments, call.getKeywords());
			out.math(")");
			return;
		}
		StringBuilder b = new StringBuilder();
		// a template without dollar signs is math content when it is used inside math
		boolean inMath = out.isMathOnly() && !template.contains("$");
		for(int i = 0; i < template.length(); ++i) {
			char c = template.charAt(i);
			if(c == '\\' && i + 1 < template.length()) {
				b.append(c).append(template.charAt(i + 1));
				++i;
				continue;
			}
			if(c == '$') {
				inMath = !inMath;
			} else if(c == '#' && i + 1 < template.length() && template.charAt(i + 1) >= '1'
					&& template.charAt(i + 1) <= '9') {
				int n = template.charAt(i + 1) - '1';
				if(n < arguments.size()) {
					b.append(inMath ? renderMath(arguments.get(n), context) : render(arguments.get(n), context));
					++i;
					continue;
				}
			}
			b.append(c);
		}
		writeRaw(b.toString());
	}

	@Override
	public Void visit(PythonSubscript subscript) {
		List<PythonExpression> indices = new ArrayList<>();
		PythonExpression target = subscript;
		while(target instanceof PythonSubscript) {
			PythonExpression index = ((PythonSubscript) target).getIndex();
			if(index instanceof PythonTuple && !((PythonTuple) index).getElements().isEmpty()) {
				indices.addAll(0, ((PythonTuple) index).getElements());
			} else {
				indices.add(0, index);
			}
			target = ((PythonSubscript) target).getTarget();
		}

		if(target instanceof PythonRawLaTeX && !((PythonRawLaTeX) target).getValue().contains("$")) {
			// typeset as an operator, e.g. \arg\min
			out.math(((PythonRawLaTeX) target).getValue());
		} else if(target instanceof PythonName) {
			String name = formatName(((PythonName) target).getName());
			// a name that already carries a subscript is braced to take another one
			out.math(name.contains("_") || name.contains("^") ? "{" + name + "}" : name);
		} else {
			try (LaTeXWriter.Group ignored = out.group("{", "}")) {
				writeOperand(target, PythonPrecedenceVisitor.ATOM);
			}
		}
		try (LaTeXWriter.Group ignored = out.group("_{", "}")) {
			writeSeparated(indices, ", ");
		}
		return null;
	}

	@Override
	public Void visit(PythonAttribute attribute) {
		writeOperand(attribute.getTarget(), PythonPrecedenceVisitor.ATOM);
		out.math("." + formatName(attribute.getName()));
		return null;
	}

	@Override
	public Void visit(PythonTuple tuple) {
		out.math("(");
		writeSeparated(tuple.getElements(), ", ");
		if(tuple.getElements().size() == 1) {
			out.math(",");
		}
		out.math(")");
		return null;
	}

	@Override
	public Void visit(PythonList list) {
		out.math("[");
		writeSeparated(list.getElements(), ", ");
		out.math("]");
		return null;
	}

	@Override
	public Void visit(PythonSet set) {
		out.math("\\{");
		writeSeparated(set.getElements(), ", ");
		out.math("\\}");
		return null;
	}

	/**
	 * Set-builder notation. When the element is the loop variable, or the variable is _, the
	 * conditions follow the colon: \{v \in V : c\}. Otherwise the element comes first:
	 * \{e : v \in V, c\}.
	 */
	@Override
	public Void visit(PythonSetComprehension setComprehension) {
		PythonExpression element = setComprehension.getElement();
		PythonExpression target = setComprehension.getTarget();
		boolean filterOnly = target.equals(element)
				|| (target instanceof PythonName && ((PythonName) target).getName().equals("_"));
		out.math("\\{");
		if(filterOnly) {
			writeMembership(element, setComprehension.getIterable());
			if(!setComprehension.getConditions().isEmpty()) {
				out.math(" : ");
				writeSeparated(setComprehension.getConditions(), ", ");
			}
		} else {
			writeOperand(element, PythonPrecedenceVisitor.LOWEST);
			out.math(" : ");
			writeMembership(target, setComprehension.getIterable());
			for(PythonExpression condition : setComprehension.getConditions()) {
				out.math(", ");
				writeOperand(condition, PythonPrecedenceVisitor.LOWEST);
			}
		}
		out.math("\\}");
		return null;
	}

	private void writeMembership(PythonExpression member, PythonExpression collection) {
		writeOperand(member, PythonPrecedenceVisitor.BOR);
		out.math(" \\in ");
		writeOperand(collection, PythonPrecedenceVisitor.BOR);
	}

	@Override
	public Void visit(PythonUnsupportedExpression unsupportedExpression) {
		throw new UnsupportedExpressionIssue(unsupportedExpression);
	}
}
