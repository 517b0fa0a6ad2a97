package pseudopython.lexer;

public enum PythonTokenType {
	NAME,
	KEYWORD,
	NUMBER,
	// value is the decoded contents, without prefix and quotes
	STRING,
	// f-strings are kept as written; they have no rendering
	FORMATTED_STRING,
	OPERATOR,
	// layout tokens of the indentation-sensitive grammar
	NEWLINE,
	INDENT,
	DEDENT,
	END_OF_INPUT,
}
