package pseudopython.trans.passes.parse;

import pseudopython.errors.Issue;
import pseudopython.model.python.PythonModule;
import pseudopython.parser.ParsingError;
import pseudopython.parser.PythonParser;

import java.nio.file.Path;
import java.util.logging.Logger;

public class PythonParsingPass {
	private static final Logger logger = Logger.getLogger("PseudoPython Parser");

	private PythonParsingPass() {}

	public static PythonModule perform(Path inputFileName, CharSequence inputFileContents) throws Issue {
		try {
			PythonModule module = PythonParser.readModule(inputFileName, inputFileContents);
			logger.fine("parsed " + module.getBody().size() + " top-level statement(s) from " + inputFileName);
			return module;
		} catch (ParsingError e) {
			throw new ParsingIssue("Python", e);
		}
	}
}
