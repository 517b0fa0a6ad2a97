package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Shorthands for building syntax trees by hand; every node gets an unknown location.
 */
public class PythonBuilder {
	private PythonBuilder() {}

	public static PythonModule module(PythonStatement... body) {
		return new PythonModule(SourceLocation.unknown(), Arrays.asList(body));
	}

	public static List<PythonStatement> body(PythonStatement... statements) {
		return Arrays.asList(statements);
	}

	// statements

	public static PythonFunctionDefinition def(String name, List<PythonParameter> params, PythonStatement... body) {
		return new PythonFunctionDefinition(SourceLocation.unknown(), name, params, null, Arrays.asList(body));
	}

	public static PythonFunctionDefinition def(String name, List<PythonParameter> params, PythonExpression returns,
	                                           PythonStatement... body) {
		return new PythonFunctionDefinition(SourceLocation.unknown(), name, params, returns, Arrays.asList(body));
	}

	public static List<PythonParameter> params(PythonParameter... params) {
		return Arrays.asList(params);
	}

	public static PythonParameter param(String name) {
		return new PythonParameter(SourceLocation.unknown(), name, null, null);
	}

	public static PythonParameter param(String name, PythonExpression annotation, PythonExpression defaultValue) {
		return new PythonParameter(SourceLocation.unknown(), name, annotation, defaultValue);
	}

	public static PythonIf ifThen(PythonExpression condition, PythonStatement... body) {
		return new PythonIf(SourceLocation.unknown(), condition, Arrays.asList(body), Collections.emptyList(),
				Collections.emptyList());
	}

	public static PythonIf ifElse(PythonExpression condition, List<PythonStatement> thenBody,
	                              List<PythonElif> elifs, List<PythonStatement> elseBody) {
		return new PythonIf(SourceLocation.unknown(), condition, thenBody, elifs, elseBody);
	}

	public static List<PythonElif> elifs(PythonElif... elifs) {
		return Arrays.asList(elifs);
	}

	public static PythonElif elif(PythonExpression condition, PythonStatement... body) {
		return new PythonElif(SourceLocation.unknown(), condition, Arrays.asList(body));
	}

	public static PythonFor forLoop(PythonExpression target, PythonExpression iterable, PythonStatement... body) {
		return new PythonFor(SourceLocation.unknown(), target, iterable, Arrays.asList(body), Collections.emptyList());
	}

	public static PythonWhile whileLoop(PythonExpression condition, PythonStatement... body) {
		return new PythonWhile(SourceLocation.unknown(), condition, Arrays.asList(body), Collections.emptyList());
	}

	public static PythonAssignment assign(PythonExpression target, PythonExpression value) {
		return new PythonAssignment(SourceLocation.unknown(), Collections.singletonList(target), value);
	}

	public static PythonAssignment assign(List<PythonExpression> targets, PythonExpression value) {
		return new PythonAssignment(SourceLocation.unknown(), targets, value);
	}

	public static PythonAugmentedAssignment augAssign(PythonExpression target, PythonBinop.Operation operation,
	                                                  PythonExpression value) {
		return new PythonAugmentedAssignment(SourceLocation.unknown(), target, operation, value);
	}

	public static PythonAnnotatedAssignment annAssign(PythonExpression target, PythonExpression annotation,
	                                                  PythonExpression value) {
		return new PythonAnnotatedAssignment(SourceLocation.unknown(), target, annotation, value);
	}

	public static PythonReturn ret(PythonExpression value) {
		return new PythonReturn(SourceLocation.unknown(), value);
	}

	public static PythonReturn ret() {
		return ret(null);
	}

	public static PythonExpressionStatement expr(PythonExpression value) {
		return new PythonExpressionStatement(SourceLocation.unknown(), value);
	}

	public static PythonPass pass() {
		return new PythonPass(SourceLocation.unknown());
	}

	public static PythonBreak brk() {
		return new PythonBreak(SourceLocation.unknown());
	}

	public static PythonContinue cont() {
		return new PythonContinue(SourceLocation.unknown());
	}

	public static PythonUnsupportedStatement unsupported(String kind) {
		return new PythonUnsupportedStatement(SourceLocation.unknown(), kind);
	}

	// expressions

	public static PythonName name(String name) {
		return new PythonName(SourceLocation.unknown(), name);
	}

	public static PythonNumber num(String value) {
		return new PythonNumber(SourceLocation.unknown(), value);
	}

	public static PythonNumber num(int value) {
		return num(Integer.toString(value));
	}

	public static PythonBool bool(boolean value) {
		return new PythonBool(SourceLocation.unknown(), value);
	}

	public static PythonNone none() {
		return new PythonNone(SourceLocation.unknown());
	}

	public static PythonRawLaTeX raw(String value) {
		return new PythonRawLaTeX(SourceLocation.unknown(), value);
	}

	public static PythonBinop binop(PythonBinop.Operation operation, PythonExpression lhs, PythonExpression rhs) {
		return new PythonBinop(SourceLocation.unknown(), operation, lhs, rhs);
	}

	public static PythonUnary unary(PythonUnary.Operation operation, PythonExpression operand) {
		return new PythonUnary(SourceLocation.unknown(), operation, operand);
	}

	public static PythonComparison compare(PythonExpression lhs, PythonComparison.Operation operation,
	                                       PythonExpression rhs) {
		return new PythonComparison(SourceLocation.unknown(), lhs, Collections.singletonList(operation),
				Collections.singletonList(rhs));
	}

	public static PythonComparison compare(PythonExpression left, List<PythonComparison.Operation> operations,
	                                       List<PythonExpression> comparators) {
		return new PythonComparison(SourceLocation.unknown(), left, operations, comparators);
	}

	public static PythonBoolOp and(PythonExpression... operands) {
		return new PythonBoolOp(SourceLocation.unknown(), PythonBoolOp.Operation.AND, Arrays.asList(operands));
	}

	public static PythonBoolOp or(PythonExpression... operands) {
		return new PythonBoolOp(SourceLocation.unknown(), PythonBoolOp.Operation.OR, Arrays.asList(operands));
	}

	public static PythonCall call(PythonExpression callee, PythonExpression... args) {
		return new PythonCall(SourceLocation.unknown(), callee, Arrays.asList(args), Collections.emptyList());
	}

	public static PythonCall call(String callee, PythonExpression... args) {
		return call(name(callee), args);
	}

	public static PythonCall call(PythonExpression callee, List<PythonExpression> args, List<PythonKeyword> keywords) {
		return new PythonCall(SourceLocation.unknown(), callee, args, keywords);
	}

	public static PythonKeyword keyword(String name, PythonExpression value) {
		return new PythonKeyword(SourceLocation.unknown(), name, value);
	}

	public static PythonSubscript subscript(PythonExpression target, PythonExpression index) {
		return new PythonSubscript(SourceLocation.unknown(), target, index);
	}

	public static PythonAttribute attribute(PythonExpression target, String name) {
		return new PythonAttribute(SourceLocation.unknown(), target, name);
	}

	public static PythonTuple tuple(PythonExpression... elements) {
		return new PythonTuple(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static PythonList list(PythonExpression... elements) {
		return new PythonList(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static PythonSet set(PythonExpression... elements) {
		return new PythonSet(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static PythonSetComprehension setComp(PythonExpression element, PythonExpression target,
	                                             PythonExpression iterable, PythonExpression... conditions) {
		return new PythonSetComprehension(
				SourceLocation.unknown(), element, target, iterable, Arrays.asList(conditions));
	}

	public static PythonUnsupportedExpression unsupportedExpression(String kind) {
		return new PythonUnsupportedExpression(SourceLocation.unknown(), kind);
	}
}
