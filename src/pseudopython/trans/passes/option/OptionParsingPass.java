package pseudopython.trans.passes.option;

import pseudopython.PseudoPythonOptionException;
import pseudopython.PseudoPythonOptions;
import pseudopython.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static PseudoPythonOptions perform(IssueContext ctx, Logger logger, String[] args) {
		PseudoPythonOptions opts = new PseudoPythonOptions(args);
		try {
			opts.parse();
		} catch (PseudoPythonOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		// set the logger's log level based on command line arguments
		Level level;
		if (opts.quiet) {
			level = Level.WARNING;
		} else if (opts.verbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		// the console handler filters on its own level as well
		for (Handler handler : logger.getHandlers()) {
			handler.setLevel(level);
		}
		return opts;
	}
}
