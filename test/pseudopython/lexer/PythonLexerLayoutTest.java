package pseudopython.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import static pseudopython.lexer.PythonTokenType.*;

public class PythonLexerLayoutTest {

	static Path testFile = Paths.get("TEST");

	private static List<PythonTokenType> types(String input) throws PythonLexerException {
		List<PythonTokenType> result = new ArrayList<>();
		for(PythonToken token : new PythonLexer(testFile, input).readTokens()) {
			result.add(token.getType());
		}
		return result;
	}

	private static String lexerError(String input) {
		try {
			new PythonLexer(testFile, input).readTokens();
		} catch (PythonLexerException e) {
			return e.getDescription();
		}
		fail("expected a lexer error for " + input);
		return null;
	}

	@Test
	public void testIndentation() throws PythonLexerException {
		assertThat(types("if x:\n    y = 1\nz = 2\n"), is(Arrays.asList(
				KEYWORD, NAME, OPERATOR, NEWLINE,
				INDENT, NAME, OPERATOR, NUMBER, NEWLINE,
				DEDENT, NAME, OPERATOR, NUMBER, NEWLINE,
				END_OF_INPUT)));
	}

	@Test
	public void testDedentAtEndOfInput() throws PythonLexerException {
		assertThat(types("def f():\n    if a:\n        pass\n"), is(Arrays.asList(
				KEYWORD, NAME, OPERATOR, OPERATOR, OPERATOR, NEWLINE,
				INDENT, KEYWORD, NAME, OPERATOR, NEWLINE,
				INDENT, KEYWORD, NEWLINE,
				DEDENT, DEDENT, END_OF_INPUT)));
	}

	@Test
	public void testNewlinesInsideBracketsAreJoined() throws PythonLexerException {
		assertThat(types("f(a,\n  b)\n"), is(Arrays.asList(
				NAME, OPERATOR, NAME, OPERATOR, NAME, OPERATOR, NEWLINE, END_OF_INPUT)));
	}

	@Test
	public void testLineContinuation() throws PythonLexerException {
		assertThat(types("x = 1 + \\\n    2\n"), is(Arrays.asList(
				NAME, OPERATOR, NUMBER, OPERATOR, NUMBER, NEWLINE, END_OF_INPUT)));
	}

	@Test
	public void testBlankAndCommentLinesProduceNothing() throws PythonLexerException {
		assertThat(types("# c\nx = 1  # trailing\n\n    # indented comment\n"), is(Arrays.asList(
				NAME, OPERATOR, NUMBER, NEWLINE, END_OF_INPUT)));
	}

	@Test
	public void testInconsistentDedent() {
		assertThat(lexerError("if a:\n    x\n  y\n"), is("unindent does not match any outer indentation level"));
	}

	@Test
	public void testBracketErrors() {
		assertThat(lexerError("f(a"), is("'(' was never closed"));
		assertThat(lexerError("x)"), is("unmatched ')'"));
		assertThat(lexerError("(]"), is("closing bracket ']' does not match opening bracket '('"));
	}

	@Test
	public void testUnterminatedString() {
		assertThat(lexerError("'abc"), is("unterminated string literal"));
		assertThat(lexerError("'abc\nd'"), is("unterminated string literal"));
	}

	@Test
	public void testUnexpectedCharacter() {
		assertThat(lexerError("x = $"), is("unexpected character '$'"));
	}

	@Test
	public void testErrorMessageCarriesPosition() {
		try {
			new PythonLexer(Paths.get("test.py"), "x = (").readTokens();
			fail("expected a lexer error");
		} catch (PythonLexerException e) {
			assertThat(e.getMessage(), is("'(' was never closed at 1:5 in file test.py"));
		}
	}

	private static PythonToken first(String input) throws PythonLexerException {
		return new PythonLexer(testFile, input).readTokens().get(0);
	}

	@Test
	public void testStringsKeepBackslashes() throws PythonLexerException {
		assertThat(first("'\\textbf{x}'").getValue(), is("\\textbf{x}"));
		assertThat(first("'$\\xi + \\Nu$'").getValue(), is("$\\xi + \\Nu$"));
		assertThat(first("u'\\alpha \\neq \\beta'").getValue(), is("\\alpha \\neq \\beta"));
		// an escaped quote does not end the literal
		assertThat(first("'it\\'s'").getValue(), is("it\\'s"));
		assertThat(first("'\\\\'").getValue(), is("\\\\"));
		assertThat(first("\"\"\"a\nb\"\"\"").getValue(), is("a\nb"));
	}

	@Test
	public void testByteOrderMark() throws PythonLexerException {
		List<PythonToken> tokens = new PythonLexer(testFile, "\uFEFFx = 1\n").readTokens();
		assertThat(tokens.get(0).getValue(), is("x"));
		assertThat(tokens.get(0).getLocation().getStartColumn(), is(0));
		assertThat(tokens.get(0).getLocation().getStartOffset(), is(1));
		assertThat(types("\uFEFFif a:\n    pass\n"), is(Arrays.asList(
				KEYWORD, NAME, OPERATOR, NEWLINE, INDENT, KEYWORD, NEWLINE, DEDENT, END_OF_INPUT)));
	}
}
