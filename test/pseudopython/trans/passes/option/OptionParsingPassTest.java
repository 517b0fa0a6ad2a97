package pseudopython.trans.passes.option;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.junit.Test;

import pseudopython.PseudoPythonOptions;
import pseudopython.errors.TopLevelIssueContext;

public class OptionParsingPassTest {

	private final Logger logger = Logger.getLogger("PseudoPython Option Test");

	@Test
	public void testLogLevels() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		OptionParsingPass.perform(ctx, logger, new String[] {"a.py"});
		assertThat(logger.getLevel(), is(Level.INFO));
		OptionParsingPass.perform(ctx, logger, new String[] {"-v", "a.py"});
		assertThat(logger.getLevel(), is(Level.FINE));
		OptionParsingPass.perform(ctx, logger, new String[] {"-q", "a.py"});
		assertThat(logger.getLevel(), is(Level.WARNING));
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void testErrorsAreReported() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PseudoPythonOptions options = OptionParsingPass.perform(ctx, logger, new String[] {});
		assertNotNull(options);
		assertTrue(ctx.hasErrors());
		assertThat(ctx.format(), is("Detected 1 issue(s):\n"
				+ "unable to parse options: Expected exactly one script, got 0"));
	}
}
