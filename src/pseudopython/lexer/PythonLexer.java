package pseudopython.lexer;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import pseudopython.util.SourceLocation;

/**
 * A lexer for the script language that follows Python's lexical rules closely enough
 * that any valid script can be tokenized.
 *
 * Besides the ordinary tokens it produces the layout tokens of an indentation-sensitive
 * grammar: NEWLINE at the end of each logical line, INDENT and DEDENT when the indentation
 * changes. Newlines inside brackets and after a backslash are joined, and blank or
 * comment-only lines produce no tokens at all.
 *
 * String tokens hold the contents of the literal exactly as written; adjacent literals are left
 * for the parser to concatenate.
 */
public class PythonLexer {

	static final Pattern INDENTATION = Pattern.compile("[ \\t\\f]*");
	static final Pattern WHITESPACE = Pattern.compile("[ \\t\\f]+");
	static final Pattern COMMENT = Pattern.compile("#[^\\r\\n]*");
	static final Pattern NEWLINE = Pattern.compile("\\r\\n|\\r|\\n");
	static final Pattern CONTINUATION = Pattern.compile("\\\\(?:\\r\\n|\\r|\\n)");

	static final Pattern IDENT = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

	static final Pattern STRING_START = Pattern.compile("([rRuUbBfF]{0,2})('''|\"\"\"|'|\")");

	static final Set<String> STRING_PREFIXES = new HashSet<>(Arrays.asList(
			"", "r", "u", "b", "f", "br", "rb", "fr", "rf"));

	static final Pattern[] NUMBER = {
		Pattern.compile("0[xX](?:_?[0-9a-fA-F])+"),
		Pattern.compile("0[oO](?:_?[0-7])+"),
		Pattern.compile("0[bB](?:_?[01])+"),
		Pattern.compile("[0-9](?:_?[0-9])*(?:\\.(?:[0-9](?:_?[0-9])*)?)?(?:[eE][+-]?[0-9](?:_?[0-9])*)?[jJ]?"),
		Pattern.compile("\\.[0-9](?:_?[0-9])*(?:[eE][+-]?[0-9](?:_?[0-9])*)?[jJ]?"),
	};

	static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
			"False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
			"def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
			"is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with",
			"yield"));

	static final String[] OPERATORS = {
		// brackets
		"(", ")", "[", "]", "{", "}",
		// delimiters
		",", ":", ".", ";", "=", "->", ":=", "...",
		// arithmetic and bitwise
		"+", "-", "*", "/", "//", "%", "**", "@", "&", "|", "^", "~", "<<", ">>",
		// comparison
		"<", ">", "<=", ">=", "==", "!=",
		// augmented assignment
		"+=", "-=", "*=", "/=", "//=", "%=", "**=", "@=", "&=", "|=", "^=", "<<=", ">>=",
	};

	static final String BYTE_ORDER_MARK = "\uFEFF";

	static final String OPENING_BRACKETS = "([{";
	static final String CLOSING_BRACKETS = ")]}";

	private final Path filename;
	private final String text;

	private List<PythonToken> tokens;
	private Deque<Integer> indents;
	private Deque<PythonToken> openBrackets;
	private int pos;
	private int line;
	private int lineStart;

	public PythonLexer(Path filename, CharSequence text) {
		this.filename = filename;
		this.text = text.toString();
	}

	/**
	 * @return the tokens of the whole input, always terminated by an END_OF_INPUT token
	 * @throws PythonLexerException if part of the input is not a valid token, or the indentation is inconsistent
	 */
	public List<PythonToken> readTokens() throws PythonLexerException {
		tokens = new ArrayList<>();
		indents = new ArrayDeque<>();
		indents.push(0);
		openBrackets = new ArrayDeque<>();
		pos = 0;
		line = 0;
		lineStart = 0;
		// a byte order mark is not part of the first line
		if(text.startsWith(BYTE_ORDER_MARK)) {
			pos = BYTE_ORDER_MARK.length();
			lineStart = pos;
		}

		boolean atLineStart = true;
		while(pos < text.length()) {
			if(atLineStart) {
				atLineStart = false;
				if(openBrackets.isEmpty()) {
					readIndentation();
					continue;
				}
			}

			Matcher m = matcher(NEWLINE);
			if(m.lookingAt()) {
				pos = m.end();
				if(openBrackets.isEmpty() && !tokens.isEmpty() && lastType() != PythonTokenType.NEWLINE) {
					tokens.add(new PythonToken(m.group(), PythonTokenType.NEWLINE, location(m.start())));
				}
				nextLine();
				atLineStart = true;
				continue;
			}

			m = matcher(CONTINUATION);
			if(m.lookingAt()) {
				pos = m.end();
				nextLine();
				continue;
			}

			m = matcher(WHITESPACE);
			if(m.lookingAt()) {
				pos = m.end();
				continue;
			}

			m = matcher(COMMENT);
			if(m.lookingAt()) {
				pos = m.end();
				continue;
			}

			m = matcher(STRING_START);
			if(m.lookingAt() && STRING_PREFIXES.contains(m.group(1).toLowerCase())) {
				readString(m);
				continue;
			}

			m = matcher(IDENT);
			if(m.lookingAt()) {
				String ident = m.group();
				readToken(ident, KEYWORDS.contains(ident) ? PythonTokenType.KEYWORD : PythonTokenType.NAME);
				continue;
			}

			// try to match the biggest number we can
			String possibleNumber = null;
			for(Pattern numberPattern : NUMBER) {
				m = matcher(numberPattern);
				if(m.lookingAt() && (possibleNumber == null || m.group().length() > possibleNumber.length())) {
					possibleNumber = m.group();
				}
			}
			if(possibleNumber != null) {
				readToken(possibleNumber, PythonTokenType.NUMBER);
				continue;
			}

			// match the longest operator we can
			String possibleOperator = null;
			for(String operator : OPERATORS) {
				if(possibleOperator != null && operator.length() <= possibleOperator.length()) {
					continue;
				}
				if(text.startsWith(operator, pos)) {
					possibleOperator = operator;
				}
			}
			if(possibleOperator != null) {
				PythonToken token = readToken(possibleOperator, PythonTokenType.OPERATOR);
				trackBrackets(token);
				continue;
			}

			throw new PythonLexerException(
					location(pos, pos + 1), "unexpected character '" + text.charAt(pos) + "'");
		}

		if(!openBrackets.isEmpty()) {
			PythonToken open = openBrackets.peek();
			throw new PythonLexerException(open.getLocation(), "'" + open.getValue() + "' was never closed");
		}
		if(!tokens.isEmpty() && lastType() != PythonTokenType.NEWLINE) {
			tokens.add(new PythonToken("", PythonTokenType.NEWLINE, location(pos)));
		}
		while(indents.peek() > 0) {
			indents.pop();
			tokens.add(new PythonToken("", PythonTokenType.DEDENT, location(pos)));
		}
		tokens.add(new PythonToken("", PythonTokenType.END_OF_INPUT, location(pos)));
		return tokens;
	}

	private Matcher matcher(Pattern pattern) {
		Matcher m = pattern.matcher(text);
		m.region(pos, text.length());
		return m;
	}

	private PythonTokenType lastType() {
		return tokens.get(tokens.size() - 1).getType();
	}

	private void nextLine() {
		++line;
		lineStart = pos;
	}

	private SourceLocation location(int start) {
		return location(start, pos);
	}

	private SourceLocation location(int start, int end) {
		return new SourceLocation(filename, start, end, line, line, start - lineStart, end - lineStart);
	}

	private PythonToken readToken(String value, PythonTokenType type) {
		int start = pos;
		pos += value.length();
		PythonToken token = new PythonToken(value, type, location(start));
		tokens.add(token);
		return token;
	}

	private void trackBrackets(PythonToken token) throws PythonLexerException {
		String value = token.getValue();
		if(OPENING_BRACKETS.contains(value)) {
			openBrackets.push(token);
		} else if(CLOSING_BRACKETS.contains(value)) {
			if(openBrackets.isEmpty()) {
				throw new PythonLexerException(token.getLocation(), "unmatched '" + value + "'");
			}
			PythonToken open = openBrackets.pop();
			if(OPENING_BRACKETS.indexOf(open.getValue()) != CLOSING_BRACKETS.indexOf(value)) {
				throw new PythonLexerException(token.getLocation(),
						"closing bracket '" + value + "' does not match opening bracket '" + open.getValue() + "'");
			}
		}
	}

	private void readIndentation() throws PythonLexerException {
		Matcher m = matcher(INDENTATION);
		m.lookingAt();
		int end = m.end();
		if(end == text.length() || text.charAt(end) == '\n' || text.charAt(end) == '\r' || text.charAt(end) == '#') {
			// blank lines and comment-only lines do not affect indentation
			pos = end;
			return;
		}
		int width = 0;
		for(char c : m.group().toCharArray()) {
			if(c == '\t') {
				width = (width / 8 + 1) * 8;
			} else if(c == '\f') {
				width = 0;
			} else {
				++width;
			}
		}
		int start = pos;
		pos = end;
		if(width > indents.peek()) {
			indents.push(width);
			tokens.add(new PythonToken("", PythonTokenType.INDENT, location(start)));
			return;
		}
		while(width < indents.peek()) {
			indents.pop();
			tokens.add(new PythonToken("", PythonTokenType.DEDENT, location(start)));
		}
		if(width != indents.peek()) {
			throw new PythonLexerException(location(start), "unindent does not match any outer indentation level");
		}
	}

	/**
	 * @return true if a line break was skipped at the current position
	 */
	private boolean skipLineBreak() {
		if(text.startsWith("\r\n", pos)) {
			pos += 2;
		} else if(text.charAt(pos) == '\n' || text.charAt(pos) == '\r') {
			pos += 1;
		} else {
			return false;
		}
		nextLine();
		return true;
	}

	private void readString(Matcher m) throws PythonLexerException {
		String prefix = m.group(1).toLowerCase();
		String quote = m.group(2);
		int start = pos;
		int startLine = line;
		int startColumn = pos - lineStart;
		pos = m.end();
		int bodyStart = pos;
		int bodyEnd;
		while(true) {
			if(pos >= text.length()) {
				throw new PythonLexerException(
						new SourceLocation(filename, start, pos, startLine, line, startColumn, pos - lineStart),
						"unterminated string literal");
			}
			char c = text.charAt(pos);
			if(c == '\\' && pos + 1 < text.length()) {
				++pos;
				if(!skipLineBreak()) {
					++pos;
				}
				continue;
			}
			if(text.startsWith(quote, pos)) {
				bodyEnd = pos;
				pos += quote.length();
				break;
			}
			if(c == '\n' || c == '\r') {
				if(quote.length() == 1) {
					throw new PythonLexerException(location(start), "unterminated string literal");
				}
				skipLineBreak();
				continue;
			}
			++pos;
		}

		SourceLocation location = new SourceLocation(
				filename, start, pos, startLine, line, startColumn, pos - lineStart);
		String body = text.substring(bodyStart, bodyEnd);
		if(prefix.contains("f")) {
			tokens.add(new PythonToken(text.substring(start, pos), PythonTokenType.FORMATTED_STRING, location));
		} else {
			// string literals carry LaTeX, so backslashes are kept as written whatever the prefix
			tokens.add(new PythonToken(body, PythonTokenType.STRING, location));
		}
	}
}
