package pseudopython.parser;

import pseudopython.lexer.PythonLexer;
import pseudopython.lexer.PythonToken;
import pseudopython.lexer.PythonTokenType;
import pseudopython.model.python.*;
import pseudopython.util.SourceLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A recursive descent parser for the script language.
 *
 * The accepted grammar is Python's: anything that is valid Python parses. Constructs that have no
 * pseudocode counterpart (imports, classes, with, try, lambdas, comprehensions, dict displays,
 * slices, ...) are read and discarded, leaving an opaque {@link PythonUnsupportedStatement} or
 * {@link PythonUnsupportedExpression} in the tree.
 */
public final class PythonParser {

	// binary operator precedence levels, loosest first
	private static final List<List<PythonBinop.Operation>> BINARY_LEVELS = Arrays.asList(
			Collections.singletonList(PythonBinop.Operation.BOR),
			Collections.singletonList(PythonBinop.Operation.BXOR),
			Collections.singletonList(PythonBinop.Operation.BAND),
			Arrays.asList(PythonBinop.Operation.LSHIFT, PythonBinop.Operation.RSHIFT),
			Arrays.asList(PythonBinop.Operation.PLUS, PythonBinop.Operation.MINUS),
			Arrays.asList(PythonBinop.Operation.TIMES, PythonBinop.Operation.MATMUL, PythonBinop.Operation.DIVIDE,
					PythonBinop.Operation.FLOOR_DIVIDE, PythonBinop.Operation.MOD));

	private static final Map<String, PythonBinop.Operation> AUGMENTED_ASSIGNMENTS = new HashMap<>();
	private static final Map<String, PythonComparison.Operation> COMPARISONS = new HashMap<>();
	static {
		for(PythonBinop.Operation operation : PythonBinop.Operation.values()) {
			AUGMENTED_ASSIGNMENTS.put(operation.getToken() + "=", operation);
		}
		// in, not in, is and is not are keywords, matched separately
		for(PythonComparison.Operation operation : PythonComparison.Operation.values()) {
			if(!Character.isLetter(operation.getToken().charAt(0))) {
				COMPARISONS.put(operation.getToken(), operation);
			}
		}
	}

	private final List<PythonToken> tokens;
	private int index = 0;

	private PythonParser(List<PythonToken> tokens) {
		this.tokens = tokens;
	}

	public static PythonModule readModule(Path filename, CharSequence text) throws ParsingError {
		PythonParser parser = new PythonParser(new PythonLexer(filename, text).readTokens());
		return parser.module();
	}

	/**
	 * Reads a single expression (an unparenthesized tuple is allowed), such as the contents of one line.
	 */
	public static PythonExpression readExpression(Path filename, CharSequence text) throws ParsingError {
		PythonParser parser = new PythonParser(new PythonLexer(filename, text).readTokens());
		PythonExpression result = parser.testListStarExpr();
		parser.acceptType(PythonTokenType.NEWLINE);
		parser.expect(PythonTokenType.END_OF_INPUT, "end of input");
		return result;
	}

	// token stream

	private PythonToken peek() {
		return tokens.get(index);
	}

	private PythonToken peek(int ahead) {
		return tokens.get(Math.min(index + ahead, tokens.size() - 1));
	}

	private PythonToken next() {
		PythonToken t = tokens.get(index);
		if(t.getType() != PythonTokenType.END_OF_INPUT) {
			++index;
		}
		return t;
	}

	/**
	 * @return the last consumed token that is not a layout token
	 */
	private PythonToken previous() {
		for(int i = index - 1; i >= 0; --i) {
			PythonTokenType type = tokens.get(i).getType();
			if(type != PythonTokenType.NEWLINE && type != PythonTokenType.INDENT && type != PythonTokenType.DEDENT) {
				return tokens.get(i);
			}
		}
		return tokens.get(0);
	}

	private SourceLocation span(PythonToken first) {
		return first.getLocation().combine(previous().getLocation());
	}

	private boolean at(PythonTokenType type) {
		return peek().getType() == type;
	}

	private boolean atOperator(String value) {
		return peek().isOperator(value);
	}

	private boolean atKeyword(String value) {
		return peek().isKeyword(value);
	}

	private boolean acceptType(PythonTokenType type) {
		if(at(type)) {
			next();
			return true;
		}
		return false;
	}

	private boolean acceptOperator(String value) {
		if(atOperator(value)) {
			next();
			return true;
		}
		return false;
	}

	private boolean acceptKeyword(String value) {
		if(atKeyword(value)) {
			next();
			return true;
		}
		return false;
	}

	private PythonToken expect(PythonTokenType type, String description) throws ParsingError {
		if(!at(type)) {
			throw unexpected(description);
		}
		return next();
	}

	private PythonToken expectOperator(String value) throws ParsingError {
		if(!atOperator(value)) {
			throw unexpected("'" + value + "'");
		}
		return next();
	}

	private PythonToken expectKeyword(String value) throws ParsingError {
		if(!atKeyword(value)) {
			throw unexpected("'" + value + "'");
		}
		return next();
	}

	private ParsingError unexpected(String expected) {
		PythonToken t = peek();
		String found;
		switch(t.getType()) {
			case NEWLINE:
				found = "end of line";
				break;
			case INDENT:
				found = "indent";
				break;
			case DEDENT:
				found = "dedent";
				break;
			case END_OF_INPUT:
				found = "end of input";
				break;
			case STRING:
			case FORMATTED_STRING:
				found = "string literal";
				break;
			default:
				found = "'" + t.getValue() + "'";
		}
		return new ParsingError(t.getLocation(), "expected " + expected + ", found " + found);
	}

	private boolean startsExpression() {
		PythonToken t = peek();
		switch(t.getType()) {
			case NAME:
			case NUMBER:
			case STRING:
			case FORMATTED_STRING:
				return true;
			case KEYWORD:
				switch(t.getValue()) {
					case "not":
					case "lambda":
					case "None":
					case "True":
					case "False":
					case "await":
					case "yield":
						return true;
					default:
						return false;
				}
			case OPERATOR:
				switch(t.getValue()) {
					case "(":
					case "[":
					case "{":
					case "-":
					case "+":
					case "~":
					case "*":
					case "...":
						return true;
					default:
						return false;
				}
			default:
				return false;
		}
	}

	// statements

	private PythonModule module() throws ParsingError {
		PythonToken first = peek();
		List<PythonStatement> body = new ArrayList<>();
		while(!at(PythonTokenType.END_OF_INPUT)) {
			statement(body);
		}
		return new PythonModule(first.getLocation().combine(peek().getLocation()), body);
	}

	private void statement(List<PythonStatement> into) throws ParsingError {
		PythonToken t = peek();
		if(t.getType() == PythonTokenType.INDENT) {
			throw new ParsingError(t.getLocation(), "unexpected indent");
		}
		if(t.getType() == PythonTokenType.KEYWORD) {
			switch(t.getValue()) {
				case "if":
					into.add(ifStatement());
					return;
				case "while":
					into.add(whileStatement());
					return;
				case "for":
					into.add(forStatement());
					return;
				case "def":
					into.add(functionDefinition());
					return;
				case "class":
					into.add(skipCompound("class definition"));
					return;
				case "with":
					into.add(skipCompound("with statement"));
					return;
				case "try":
					into.add(skipCompound("try statement"));
					return;
				case "async":
					into.add(skipCompound("async statement"));
					return;
				default:
					break;
			}
		}
		if(t.isOperator("@")) {
			into.add(decoratedDefinition());
			return;
		}
		simpleStatements(into);
	}

	private void simpleStatements(List<PythonStatement> into) throws ParsingError {
		into.add(simpleStatement());
		while(acceptOperator(";")) {
			if(at(PythonTokenType.NEWLINE) || at(PythonTokenType.END_OF_INPUT)) {
				break;
			}
			into.add(simpleStatement());
		}
		if(!acceptType(PythonTokenType.NEWLINE) && !at(PythonTokenType.END_OF_INPUT)) {
			throw unexpected("end of line");
		}
	}

	private boolean atSimpleStatementEnd() {
		return at(PythonTokenType.NEWLINE) || at(PythonTokenType.END_OF_INPUT) || atOperator(";");
	}

	private PythonStatement simpleStatement() throws ParsingError {
		PythonToken t = peek();
		if(t.getType() == PythonTokenType.KEYWORD) {
			switch(t.getValue()) {
				case "pass":
					next();
					return new PythonPass(t.getLocation());
				case "break":
					next();
					return new PythonBreak(t.getLocation());
				case "continue":
					next();
					return new PythonContinue(t.getLocation());
				case "return":
					next();
					PythonExpression value = null;
					if(!atSimpleStatementEnd()) {
						value = testListStarExpr();
					}
					return new PythonReturn(span(t), value);
				case "import":
				case "from":
					return skipSimple("import statement");
				case "global":
				case "nonlocal":
					return skipSimple("name declaration");
				case "del":
					return skipSimple("del statement");
				case "assert":
					return skipSimple("assert statement");
				case "raise":
					return skipSimple("raise statement");
				default:
					break;
			}
		}
		return expressionOrAssignment();
	}

	private PythonStatement expressionOrAssignment() throws ParsingError {
		PythonToken first = peek();
		PythonExpression e = testListStarExpr();
		if(acceptOperator(":")) {
			if(!(e instanceof PythonName || e instanceof PythonAttribute || e instanceof PythonSubscript)) {
				throw new ParsingError(e.getLocation(), "only a single target can be annotated");
			}
			PythonExpression annotation = test();
			PythonExpression value = null;
			if(acceptOperator("=")) {
				value = testListStarExpr();
			}
			return new PythonAnnotatedAssignment(span(first), e, annotation, value);
		}
		if(at(PythonTokenType.OPERATOR) && AUGMENTED_ASSIGNMENTS.containsKey(peek().getValue())) {
			PythonBinop.Operation operation = AUGMENTED_ASSIGNMENTS.get(next().getValue());
			if(!(e instanceof PythonName || e instanceof PythonAttribute || e instanceof PythonSubscript)) {
				throw new ParsingError(e.getLocation(), "illegal target for augmented assignment");
			}
			PythonExpression value = testListStarExpr();
			return new PythonAugmentedAssignment(span(first), e, operation, value);
		}
		if(atOperator("=")) {
			List<PythonExpression> targets = new ArrayList<>();
			PythonExpression value = e;
			while(acceptOperator("=")) {
				checkTarget(value);
				targets.add(value);
				value = testListStarExpr();
			}
			return new PythonAssignment(span(first), targets, value);
		}
		return new PythonExpressionStatement(span(first), e);
	}

	private void checkTarget(PythonExpression target) throws ParsingError {
		if(target instanceof PythonName || target instanceof PythonAttribute || target instanceof PythonSubscript) {
			return;
		}
		if(target instanceof PythonUnsupportedExpression
				&& ((PythonUnsupportedExpression) target).getKind().equals("starred expression")) {
			return;
		}
		if(target instanceof PythonTuple || target instanceof PythonList) {
			List<PythonExpression> elements = target instanceof PythonTuple
					? ((PythonTuple) target).getElements()
					: ((PythonList) target).getElements();
			for(PythonExpression element : elements) {
				checkTarget(element);
			}
			return;
		}
		String what;
		if(target instanceof PythonCall) {
			what = "function call";
		} else if(target instanceof PythonNumber || target instanceof PythonBool || target instanceof PythonNone
				|| target instanceof PythonRawLaTeX) {
			what = "literal";
		} else {
			what = "expression";
		}
		throw new ParsingError(target.getLocation(), "cannot assign to " + what);
	}

	private PythonStatement skipSimple(String kind) {
		PythonToken first = peek();
		while(!atSimpleStatementEnd()) {
			next();
		}
		return new PythonUnsupportedStatement(span(first), kind);
	}

	private void skipLogicalLine() {
		while(!at(PythonTokenType.NEWLINE) && !at(PythonTokenType.END_OF_INPUT)) {
			next();
		}
		acceptType(PythonTokenType.NEWLINE);
	}

	private void skipBlock() throws ParsingError {
		expect(PythonTokenType.INDENT, "an indented block");
		int depth = 1;
		while(depth > 0) {
			PythonToken t = next();
			if(t.getType() == PythonTokenType.INDENT) {
				++depth;
			} else if(t.getType() == PythonTokenType.DEDENT) {
				--depth;
			} else if(t.getType() == PythonTokenType.END_OF_INPUT) {
				throw new ParsingError(t.getLocation(), "unexpected end of input inside a block");
			}
		}
	}

	private PythonStatement skipCompound(String kind) throws ParsingError {
		PythonToken first = peek();
		boolean isTry = first.isKeyword("try");
		skipLogicalLine();
		if(at(PythonTokenType.INDENT)) {
			skipBlock();
		}
		while(isTry && (atKeyword("except") || atKeyword("else") || atKeyword("finally"))) {
			skipLogicalLine();
			if(at(PythonTokenType.INDENT)) {
				skipBlock();
			}
		}
		return new PythonUnsupportedStatement(span(first), kind);
	}

	private PythonStatement decoratedDefinition() throws ParsingError {
		PythonToken first = peek();
		while(atOperator("@")) {
			skipLogicalLine();
		}
		if(!atKeyword("def") && !atKeyword("class") && !atKeyword("async")) {
			throw unexpected("a function or class definition after decorator");
		}
		statement(new ArrayList<>());
		return new PythonUnsupportedStatement(span(first), "decorated definition");
	}

	private List<PythonStatement> suite() throws ParsingError {
		List<PythonStatement> body = new ArrayList<>();
		if(acceptType(PythonTokenType.NEWLINE)) {
			expect(PythonTokenType.INDENT, "an indented block");
			while(!acceptType(PythonTokenType.DEDENT)) {
				if(at(PythonTokenType.END_OF_INPUT)) {
					throw unexpected("dedent");
				}
				statement(body);
			}
		} else {
			simpleStatements(body);
		}
		return body;
	}

	private List<PythonStatement> elseClause() throws ParsingError {
		if(acceptKeyword("else")) {
			expectOperator(":");
			return suite();
		}
		return Collections.emptyList();
	}

	private PythonStatement ifStatement() throws ParsingError {
		PythonToken first = expectKeyword("if");
		PythonExpression condition = namedExprTest();
		expectOperator(":");
		List<PythonStatement> thenBody = suite();
		List<PythonElif> elifs = new ArrayList<>();
		while(atKeyword("elif")) {
			PythonToken elif = next();
			PythonExpression elifCondition = namedExprTest();
			expectOperator(":");
			List<PythonStatement> elifBody = suite();
			elifs.add(new PythonElif(span(elif), elifCondition, elifBody));
		}
		List<PythonStatement> elseBody = elseClause();
		return new PythonIf(span(first), condition, thenBody, elifs, elseBody);
	}

	private PythonStatement whileStatement() throws ParsingError {
		PythonToken first = expectKeyword("while");
		PythonExpression condition = namedExprTest();
		expectOperator(":");
		List<PythonStatement> body = suite();
		List<PythonStatement> elseBody = elseClause();
		return new PythonWhile(span(first), condition, body, elseBody);
	}

	private PythonStatement forStatement() throws ParsingError {
		PythonToken first = expectKeyword("for");
		PythonExpression target = exprList();
		checkTarget(target);
		expectKeyword("in");
		PythonExpression iterable = testListStarExpr();
		expectOperator(":");
		List<PythonStatement> body = suite();
		List<PythonStatement> elseBody = elseClause();
		return new PythonFor(span(first), target, iterable, body, elseBody);
	}

	private PythonStatement functionDefinition() throws ParsingError {
		PythonToken first = expectKeyword("def");
		PythonToken name = expect(PythonTokenType.NAME, "a function name");
		expectOperator("(");
		List<PythonParameter> parameters = new ArrayList<>();
		boolean variadic = false;
		while(!atOperator(")")) {
			if(acceptOperator("*") || acceptOperator("**")) {
				// a bare * only separates keyword-only parameters
				if(at(PythonTokenType.NAME)) {
					parameter();
					variadic = true;
				}
			} else if(!acceptOperator("/")) {
				parameters.add(parameter());
			}
			if(!acceptOperator(",")) {
				break;
			}
		}
		expectOperator(")");
		PythonExpression returnAnnotation = null;
		if(acceptOperator("->")) {
			returnAnnotation = test();
		}
		expectOperator(":");
		List<PythonStatement> body = suite();
		if(variadic) {
			return new PythonUnsupportedStatement(span(first), "function definition with variadic parameters");
		}
		return new PythonFunctionDefinition(span(first), name.getValue(), parameters, returnAnnotation, body);
	}

	private PythonParameter parameter() throws ParsingError {
		PythonToken name = expect(PythonTokenType.NAME, "a parameter name");
		PythonExpression annotation = null;
		PythonExpression defaultValue = null;
		if(acceptOperator(":")) {
			annotation = test();
		}
		if(acceptOperator("=")) {
			defaultValue = test();
		}
		return new PythonParameter(span(name), name.getValue(), annotation, defaultValue);
	}

	// expressions

	private PythonExpression testListStarExpr() throws ParsingError {
		PythonToken first = peek();
		PythonExpression e = testOrStar();
		if(!atOperator(",")) {
			return e;
		}
		List<PythonExpression> elements = new ArrayList<>();
		elements.add(e);
		while(acceptOperator(",")) {
			if(!startsExpression()) {
				break;
			}
			elements.add(testOrStar());
		}
		return new PythonTuple(span(first), elements);
	}

	private PythonExpression exprList() throws ParsingError {
		PythonToken first = peek();
		PythonExpression e = exprOrStar();
		if(!atOperator(",")) {
			return e;
		}
		List<PythonExpression> elements = new ArrayList<>();
		elements.add(e);
		while(acceptOperator(",")) {
			if(!startsExpression()) {
				break;
			}
			elements.add(exprOrStar());
		}
		return new PythonTuple(span(first), elements);
	}

	private PythonExpression starred() throws ParsingError {
		PythonToken star = expectOperator("*");
		expr();
		return new PythonUnsupportedExpression(span(star), "starred expression");
	}

	private PythonExpression testOrStar() throws ParsingError {
		return atOperator("*") ? starred() : test();
	}

	private PythonExpression namedExprOrStar() throws ParsingError {
		return atOperator("*") ? starred() : namedExprTest();
	}

	private PythonExpression exprOrStar() throws ParsingError {
		return atOperator("*") ? starred() : expr();
	}

	private PythonExpression namedExprTest() throws ParsingError {
		PythonToken first = peek();
		PythonExpression e = test();
		if(acceptOperator(":=")) {
			test();
			return new PythonUnsupportedExpression(span(first), "assignment expression");
		}
		return e;
	}

	private PythonExpression test() throws ParsingError {
		if(atKeyword("lambda")) {
			return lambda();
		}
		PythonToken first = peek();
		PythonExpression e = orTest();
		if(acceptKeyword("if")) {
			orTest();
			expectKeyword("else");
			test();
			return new PythonUnsupportedExpression(span(first), "conditional expression");
		}
		return e;
	}

	private PythonExpression lambda() throws ParsingError {
		PythonToken first = expectKeyword("lambda");
		while(!atOperator(":")) {
			if(acceptType(PythonTokenType.NAME)) {
				if(acceptOperator("=")) {
					test();
				}
			} else if(!acceptOperator("*") && !acceptOperator("**") && !acceptOperator("/")) {
				throw unexpected("a lambda parameter");
			}
			if(!acceptOperator(",")) {
				break;
			}
		}
		expectOperator(":");
		test();
		return new PythonUnsupportedExpression(span(first), "lambda");
	}

	private PythonExpression orTest() throws ParsingError {
		PythonToken first = peek();
		List<PythonExpression> operands = new ArrayList<>();
		operands.add(andTest());
		while(acceptKeyword("or")) {
			operands.add(andTest());
		}
		if(operands.size() == 1) {
			return operands.get(0);
		}
		return new PythonBoolOp(span(first), PythonBoolOp.Operation.OR, operands);
	}

	private PythonExpression andTest() throws ParsingError {
		PythonToken first = peek();
		List<PythonExpression> operands = new ArrayList<>();
		operands.add(notTest());
		while(acceptKeyword("and")) {
			operands.add(notTest());
		}
		if(operands.size() == 1) {
			return operands.get(0);
		}
		return new PythonBoolOp(span(first), PythonBoolOp.Operation.AND, operands);
	}

	private PythonExpression notTest() throws ParsingError {
		if(atKeyword("not")) {
			PythonToken first = next();
			PythonExpression operand = notTest();
			return new PythonUnary(span(first), PythonUnary.Operation.NOT, operand);
		}
		return comparison();
	}

	private PythonComparison.Operation comparisonOperator() {
		PythonToken t = peek();
		if(t.getType() == PythonTokenType.OPERATOR && COMPARISONS.containsKey(t.getValue())) {
			next();
			return COMPARISONS.get(t.getValue());
		}
		if(t.isKeyword("in")) {
			next();
			return PythonComparison.Operation.IN;
		}
		if(t.isKeyword("not") && peek(1).isKeyword("in")) {
			next();
			next();
			return PythonComparison.Operation.NOT_IN;
		}
		if(t.isKeyword("is")) {
			next();
			if(acceptKeyword("not")) {
				return PythonComparison.Operation.IS_NOT;
			}
			return PythonComparison.Operation.IS;
		}
		return null;
	}

	private PythonExpression comparison() throws ParsingError {
		PythonToken first = peek();
		PythonExpression left = expr();
		List<PythonComparison.Operation> operations = new ArrayList<>();
		List<PythonExpression> comparators = new ArrayList<>();
		PythonComparison.Operation operation;
		while((operation = comparisonOperator()) != null) {
			operations.add(operation);
			comparators.add(expr());
		}
		if(operations.isEmpty()) {
			return left;
		}
		return new PythonComparison(span(first), left, operations, comparators);
	}

	private PythonExpression expr() throws ParsingError {
		return binary(0);
	}

	private PythonExpression binary(int level) throws ParsingError {
		if(level == BINARY_LEVELS.size()) {
			return factor();
		}
		PythonToken first = peek();
		PythonExpression lhs = binary(level + 1);
		while(true) {
			PythonBinop.Operation operation = null;
			for(PythonBinop.Operation candidate : BINARY_LEVELS.get(level)) {
				if(atOperator(candidate.getToken())) {
					operation = candidate;
				}
			}
			if(operation == null) {
				return lhs;
			}
			next();
			PythonExpression rhs = binary(level + 1);
			lhs = new PythonBinop(span(first), operation, lhs, rhs);
		}
	}

	private PythonExpression factor() throws ParsingError {
		PythonToken first = peek();
		PythonUnary.Operation operation = null;
		if(first.isOperator("-")) {
			operation = PythonUnary.Operation.NEG;
		} else if(first.isOperator("+")) {
			operation = PythonUnary.Operation.POS;
		} else if(first.isOperator("~")) {
			operation = PythonUnary.Operation.INVERT;
		}
		if(operation != null) {
			next();
			PythonExpression operand = factor();
			return new PythonUnary(span(first), operation, operand);
		}
		return power();
	}

	private PythonExpression power() throws ParsingError {
		PythonToken first = peek();
		PythonExpression base;
		if(acceptKeyword("await")) {
			primary();
			base = new PythonUnsupportedExpression(span(first), "await expression");
		} else {
			base = primary();
		}
		if(acceptOperator("**")) {
			PythonExpression exponent = factor();
			return new PythonBinop(span(first), PythonBinop.Operation.POWER, base, exponent);
		}
		return base;
	}

	private PythonExpression primary() throws ParsingError {
		PythonToken first = peek();
		PythonExpression e = atom();
		while(true) {
			if(acceptOperator("(")) {
				e = callTrailer(first, e);
			} else if(acceptOperator("[")) {
				e = subscriptTrailer(first, e);
			} else if(acceptOperator(".")) {
				PythonToken name = expect(PythonTokenType.NAME, "an attribute name");
				e = new PythonAttribute(span(first), e, name.getValue());
			} else {
				return e;
			}
		}
	}

	private PythonExpression callTrailer(PythonToken first, PythonExpression callee) throws ParsingError {
		List<PythonExpression> arguments = new ArrayList<>();
		List<PythonKeyword> keywords = new ArrayList<>();
		while(!atOperator(")")) {
			PythonToken argumentStart = peek();
			if(acceptOperator("*") || acceptOperator("**")) {
				test();
				arguments.add(new PythonUnsupportedExpression(span(argumentStart), "unpacked argument"));
			} else {
				PythonExpression argument = test();
				if(argument instanceof PythonName && acceptOperator("=")) {
					PythonExpression value = test();
					keywords.add(new PythonKeyword(
							span(argumentStart), ((PythonName) argument).getName(), value));
				} else if(acceptOperator(":=")) {
					test();
					arguments.add(new PythonUnsupportedExpression(span(argumentStart), "assignment expression"));
				} else if(atKeyword("for") || atKeyword("async")) {
					comprehension();
					arguments.add(new PythonUnsupportedExpression(span(argumentStart), "generator expression"));
				} else {
					if(!keywords.isEmpty()) {
						throw new ParsingError(argument.getLocation(), "positional argument follows keyword argument");
					}
					arguments.add(argument);
				}
			}
			if(!acceptOperator(",")) {
				break;
			}
		}
		expectOperator(")");
		return new PythonCall(span(first), callee, arguments, keywords);
	}

	private PythonExpression subscriptTrailer(PythonToken first, PythonExpression target) throws ParsingError {
		PythonToken indexStart = peek();
		List<PythonExpression> indices = new ArrayList<>();
		boolean isTuple = false;
		indices.add(subscriptItem());
		while(acceptOperator(",")) {
			isTuple = true;
			if(atOperator("]")) {
				break;
			}
			indices.add(subscriptItem());
		}
		PythonExpression index = isTuple ? new PythonTuple(span(indexStart), indices) : indices.get(0);
		expectOperator("]");
		return new PythonSubscript(span(first), target, index);
	}

	private PythonExpression subscriptItem() throws ParsingError {
		PythonToken first = peek();
		PythonExpression lower = null;
		if(!atOperator(":")) {
			lower = namedExprOrStar();
		}
		if(!acceptOperator(":")) {
			return lower;
		}
		if(startsExpression()) {
			test();
		}
		if(acceptOperator(":") && startsExpression()) {
			test();
		}
		return new PythonUnsupportedExpression(span(first), "slice");
	}

	private void comprehension() throws ParsingError {
		while(atKeyword("for") || atKeyword("async")) {
			acceptKeyword("async");
			expectKeyword("for");
			exprList();
			expectKeyword("in");
			orTest();
			while(acceptKeyword("if")) {
				if(atKeyword("lambda")) {
					lambda();
				} else {
					orTest();
				}
			}
		}
	}

	private PythonExpression atom() throws ParsingError {
		PythonToken t = peek();
		switch(t.getType()) {
			case NAME:
				next();
				return new PythonName(t.getLocation(), t.getValue());
			case NUMBER:
				next();
				return new PythonNumber(t.getLocation(), t.getValue());
			case STRING:
			case FORMATTED_STRING:
				return strings();
			case KEYWORD:
				switch(t.getValue()) {
					case "True":
						next();
						return new PythonBool(t.getLocation(), true);
					case "False":
						next();
						return new PythonBool(t.getLocation(), false);
					case "None":
						next();
						return new PythonNone(t.getLocation());
					case "yield":
						next();
						acceptKeyword("from");
						if(startsExpression()) {
							testListStarExpr();
						}
						return new PythonUnsupportedExpression(span(t), "yield expression");
					default:
						break;
				}
				break;
			case OPERATOR:
				switch(t.getValue()) {
					case "(":
						return parenthesized();
					case "[":
						return listDisplay();
					case "{":
						return braceDisplay();
					case "...":
						next();
						return new PythonUnsupportedExpression(t.getLocation(), "Ellipsis");
					default:
						break;
				}
				break;
			default:
				break;
		}
		throw unexpected("an expression");
	}

	private PythonExpression strings() {
		PythonToken first = peek();
		StringBuilder value = new StringBuilder();
		boolean formatted = false;
		while(at(PythonTokenType.STRING) || at(PythonTokenType.FORMATTED_STRING)) {
			PythonToken t = next();
			if(t.getType() == PythonTokenType.FORMATTED_STRING) {
				formatted = true;
			} else {
				value.append(t.getValue());
			}
		}
		if(formatted) {
			return new PythonUnsupportedExpression(span(first), "f-string");
		}
		return new PythonRawLaTeX(span(first), value.toString());
	}

	private PythonExpression parenthesized() throws ParsingError {
		PythonToken open = expectOperator("(");
		if(acceptOperator(")")) {
			return new PythonTuple(span(open), Collections.emptyList());
		}
		if(atKeyword("yield")) {
			PythonExpression yield = atom();
			expectOperator(")");
			return yield;
		}
		PythonExpression first = namedExprOrStar();
		if(atKeyword("for") || atKeyword("async")) {
			comprehension();
			expectOperator(")");
			return new PythonUnsupportedExpression(span(open), "generator expression");
		}
		if(!atOperator(",")) {
			expectOperator(")");
			return first;
		}
		List<PythonExpression> elements = new ArrayList<>();
		elements.add(first);
		while(acceptOperator(",")) {
			if(atOperator(")")) {
				break;
			}
			elements.add(namedExprOrStar());
		}
		expectOperator(")");
		return new PythonTuple(span(open), elements);
	}

	private PythonExpression listDisplay() throws ParsingError {
		PythonToken open = expectOperator("[");
		List<PythonExpression> elements = new ArrayList<>();
		if(acceptOperator("]")) {
			return new PythonList(span(open), elements);
		}
		elements.add(namedExprOrStar());
		if(atKeyword("for") || atKeyword("async")) {
			comprehension();
			expectOperator("]");
			return new PythonUnsupportedExpression(span(open), "list comprehension");
		}
		while(acceptOperator(",")) {
			if(atOperator("]")) {
				break;
			}
			elements.add(namedExprOrStar());
		}
		expectOperator("]");
		return new PythonList(span(open), elements);
	}

	/**
	 * @return true if the item read was a dict entry
	 */
	private boolean braceItem(List<PythonExpression> elements) throws ParsingError {
		if(acceptOperator("**")) {
			expr();
			return true;
		}
		PythonExpression e = namedExprOrStar();
		if(acceptOperator(":")) {
			test();
			return true;
		}
		elements.add(e);
		return false;
	}

	// only a single synchronous for clause has a set-builder form
	private PythonExpression setComprehension(PythonToken open, PythonExpression element) throws ParsingError {
		expectKeyword("for");
		PythonExpression target = exprList();
		expectKeyword("in");
		PythonExpression iterable = orTest();
		List<PythonExpression> conditions = new ArrayList<>();
		while(acceptKeyword("if")) {
			conditions.add(atKeyword("lambda") ? lambda() : orTest());
		}
		if(atKeyword("for") || atKeyword("async")) {
			comprehension();
			expectOperator("}");
			return new PythonUnsupportedExpression(span(open), "set comprehension");
		}
		expectOperator("}");
		return new PythonSetComprehension(span(open), element, target, iterable, conditions);
	}

	private PythonExpression braceDisplay() throws ParsingError {
		PythonToken open = expectOperator("{");
		if(acceptOperator("}")) {
			return new PythonUnsupportedExpression(span(open), "dict display");
		}
		List<PythonExpression> elements = new ArrayList<>();
		boolean isDict = braceItem(elements);
		if(!isDict && atKeyword("for")) {
			return setComprehension(open, elements.get(0));
		}
		if(atKeyword("for") || atKeyword("async")) {
			comprehension();
			expectOperator("}");
			return new PythonUnsupportedExpression(span(open), isDict ? "dict comprehension" : "set comprehension");
		}
		while(acceptOperator(",")) {
			if(atOperator("}")) {
				break;
			}
			isDict |= braceItem(elements);
		}
		expectOperator("}");
		if(isDict) {
			return new PythonUnsupportedExpression(span(open), "dict display");
		}
		return new PythonSet(span(open), elements);
	}
}
