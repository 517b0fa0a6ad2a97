package pseudopython.trans.passes.visibility;

import pseudopython.model.python.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Decides which top-level statements of a script make it into the pseudocode.
 *
 * Output ends at the first top-level '!hide' statement, and the script-entry guard
 * (if __name__ == '__main__': ...) is dropped wherever it appears before that. Nested bodies
 * are left alone: a '!hide' inside a function is an ordinary string statement.
 */
public class VisibilityFilterPass {
	private static final Logger logger = Logger.getLogger("PseudoPython Visibility");

	public static final String HIDE_MARKER = "!hide";

	private static final List<String> ENTRY_GUARDS = Collections.unmodifiableList(Arrays.asList(
			"__name__ == '__main__'",
			"'__main__' == __name__"));

	private VisibilityFilterPass() {}

	public static boolean isHideMarker(PythonStatement statement) {
		if(!(statement instanceof PythonExpressionStatement)) {
			return false;
		}
		PythonExpression value = ((PythonExpressionStatement) statement).getValue();
		return value instanceof PythonRawLaTeX && ((PythonRawLaTeX) value).getValue().equals(HIDE_MARKER);
	}

	public static boolean isScriptEntryGuard(PythonStatement statement) {
		if(!(statement instanceof PythonIf)) {
			return false;
		}
		// compared as printed source so quoting and spacing do not matter
		return ENTRY_GUARDS.contains(((PythonIf) statement).getCondition().toString());
	}

	public static List<PythonStatement> perform(PythonModule module) {
		List<PythonStatement> visible = new ArrayList<>();
		for(PythonStatement statement : module.getBody()) {
			if(isHideMarker(statement)) {
				logger.fine("output truncated " + statement.getLocation().prettyString());
				break;
			}
			if(isScriptEntryGuard(statement)) {
				logger.fine("dropped script entry guard " + statement.getLocation().prettyString());
				continue;
			}
			visible.add(statement);
		}
		return visible;
	}
}
