package pseudopython.lexer;

import pseudopython.parser.ParsingError;
import pseudopython.util.SourceLocation;

public class PythonLexerException extends ParsingError {

	private static final long serialVersionUID = -2046188263015781163L;

	public PythonLexerException(SourceLocation location, String description) {
		super(location, description);
	}

}
