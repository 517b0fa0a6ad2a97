package pseudopython.trans;

import pseudopython.errors.Issue;
import pseudopython.formatters.PseudocodeFormatter;
import pseudopython.model.python.PythonModule;
import pseudopython.model.python.PythonStatement;
import pseudopython.trans.passes.codegen.latex.LaTeXCodeGenOptions;
import pseudopython.trans.passes.codegen.latex.LaTeXCodeGenPass;
import pseudopython.trans.passes.codegen.latex.PseudocodeLine;
import pseudopython.trans.passes.parse.PythonParsingPass;
import pseudopython.trans.passes.visibility.VisibilityFilterPass;

import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Translates one script into pseudocode: parse, keep the visible statements, generate commands.
 *
 * Holds no state between calls; a failing translation produces an issue and no output.
 */
public class PseudoPythonTranslator {
	private static final Logger logger = Logger.getLogger("PseudoPython Translator");

	private final LaTeXCodeGenOptions options;

	public PseudoPythonTranslator() {
		this(new LaTeXCodeGenOptions());
	}

	public PseudoPythonTranslator(LaTeXCodeGenOptions options) {
		this.options = options;
	}

	public List<PseudocodeLine> translate(Path inputFileName, CharSequence inputFileContents) throws Issue {
		logger.fine("parsing " + inputFileName);
		PythonModule module = PythonParsingPass.perform(inputFileName, inputFileContents);
		List<PythonStatement> visible = VisibilityFilterPass.perform(module);
		logger.fine(visible.size() + " of " + module.getBody().size() + " top-level statement(s) visible");
		return LaTeXCodeGenPass.perform(options, visible);
	}

	public String translateToString(Path inputFileName, CharSequence inputFileContents) throws Issue {
		return PseudocodeFormatter.format(translate(inputFileName, inputFileContents), options.getIndent());
	}
}
