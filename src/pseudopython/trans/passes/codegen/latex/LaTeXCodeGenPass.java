package pseudopython.trans.passes.codegen.latex;

import pseudopython.errors.Issue;
import pseudopython.formatters.LaTeXRenderingContext;
import pseudopython.model.python.PythonStatement;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

public class LaTeXCodeGenPass {
	private static final Logger logger = Logger.getLogger("PseudoPython CodeGen");

	private LaTeXCodeGenPass() {}

	/**
	 * Translates the visible statements of a script into pseudocode commands, in order.
	 *
	 * @throws Issue if a statement or expression has no pseudocode rendering; no commands are
	 *               produced in that case
	 */
	public static List<PseudocodeLine> perform(LaTeXCodeGenOptions options, List<PythonStatement> statements)
			throws Issue {
		// calls to functions defined in the script are typeset with \Call
		Set<String> procedures = new LinkedHashSet<>();
		ProcedureNameCollectorVisitor nameCollector = new ProcedureNameCollectorVisitor(procedures);
		statements.forEach(s -> s.accept(nameCollector));
		logger.fine("procedures defined: " + procedures);

		LaTeXRenderingContext context = new LaTeXRenderingContext(options.getSymbolPrefixes(), procedures);
		LayoutTracker layout = new LayoutTracker();
		LaTeXStatementCodeGenVisitor visitor = new LaTeXStatementCodeGenVisitor(layout, context);
		for (PythonStatement statement : statements) {
			statement.accept(visitor);
		}
		List<PseudocodeLine> lines = layout.getLines();
		logger.fine("generated " + lines.size() + " pseudocode command(s)");
		return lines;
	}
}
