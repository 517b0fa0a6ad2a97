package pseudopython.formatters;

import pseudopython.model.python.*;

import java.util.HashMap;
import java.util.Map;

/**
 * Binding strength of an expression in script syntax: an operand must be parenthesized when its
 * precedence is lower than the one its position requires.
 */
public class PythonPrecedenceVisitor extends PythonExpressionVisitor<Integer, RuntimeException> {

	public static final int LOWEST = 0;
	public static final int OR = 1;
	public static final int AND = 2;
	public static final int NOT = 3;
	public static final int COMPARISON = 4;
	public static final int BOR = 5;
	public static final int BXOR = 6;
	public static final int BAND = 7;
	public static final int SHIFT = 8;
	public static final int ADDITIVE = 9;
	public static final int MULTIPLICATIVE = 10;
	public static final int UNARY = 11;
	public static final int POWER = 12;
	public static final int ATOM = 13;

	private static final Map<PythonBinop.Operation, Integer> operatorPrecedence = new HashMap<>();
	static {
		operatorPrecedence.put(PythonBinop.Operation.BOR, BOR);
		operatorPrecedence.put(PythonBinop.Operation.BXOR, BXOR);
		operatorPrecedence.put(PythonBinop.Operation.BAND, BAND);
		operatorPrecedence.put(PythonBinop.Operation.LSHIFT, SHIFT);
		operatorPrecedence.put(PythonBinop.Operation.RSHIFT, SHIFT);
		operatorPrecedence.put(PythonBinop.Operation.PLUS, ADDITIVE);
		operatorPrecedence.put(PythonBinop.Operation.MINUS, ADDITIVE);
		// *  @  /  //  %
		operatorPrecedence.put(PythonBinop.Operation.TIMES, MULTIPLICATIVE);
		operatorPrecedence.put(PythonBinop.Operation.MATMUL, MULTIPLICATIVE);
		operatorPrecedence.put(PythonBinop.Operation.DIVIDE, MULTIPLICATIVE);
		operatorPrecedence.put(PythonBinop.Operation.FLOOR_DIVIDE, MULTIPLICATIVE);
		operatorPrecedence.put(PythonBinop.Operation.MOD, MULTIPLICATIVE);
		operatorPrecedence.put(PythonBinop.Operation.POWER, POWER);
	}

	public static int of(PythonBinop.Operation operation) {
		return operatorPrecedence.get(operation);
	}

	public static int of(PythonExpression expression) {
		return expression.accept(new PythonPrecedenceVisitor());
	}

	@Override
	public Integer visit(PythonName name) {
		return ATOM;
	}

	@Override
	public Integer visit(PythonNumber number) {
		return ATOM;
	}

	@Override
	public Integer visit(PythonBool bool) {
		return ATOM;
	}

	@Override
	public Integer visit(PythonNone none) {
		return ATOM;
	}

	@Override
	public Integer visit(PythonRawLaTeX rawLaTeX) {
		return ATOM;
	}

	@Override
	public Integer visit(PythonBinop binop) {
		return of(binop.getOperation());
	}

	@Override
	public Integer visit(PythonUnary unary) {
		return unary.getOperation() == PythonUnary.Operation.NOT ? NOT : UNARY;
	}

	@Override
	public Integer visit(PythonComparison comparison) {
		return COMPARISON;
	}

	@Override
	public Integer visit(PythonBoolOp boolOp) {
		return boolOp.getOperation() == PythonBoolOp.Operation.AND ? AND : OR;
	}

	@Override
	public Integer visit(PythonCall call) {
		return ATOM;
	}

	@Override
	public Integer visit(PythonSubscript subscript) {
		return ATOM;
	}

	@Override
	public Integer visit(PythonAttribute attribute) {
		return ATOM;
	}

	@Override
	public Integer visit(PythonTuple tuple) {
		return ATOM;
	}

	@Override
	public Integer visit(PythonList list) {
		return ATOM;
	}

	@Override
	public Integer visit(PythonSet set) {
		return ATOM;
	}

	@Override
	public Integer visit(PythonSetComprehension setComprehension) {
		return ATOM;
	}

	@Override
	public Integer visit(PythonUnsupportedExpression unsupportedExpression) {
		return ATOM;
	}
}
