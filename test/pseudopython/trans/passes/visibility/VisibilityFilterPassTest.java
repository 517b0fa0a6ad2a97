package pseudopython.trans.passes.visibility;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import pseudopython.model.python.PythonComparison;
import pseudopython.model.python.PythonModule;
import pseudopython.model.python.PythonStatement;
import pseudopython.parser.ParsingError;
import pseudopython.parser.PythonParser;

import static pseudopython.model.python.PythonBuilder.*;

public class VisibilityFilterPassTest {

	private static List<PythonStatement> filter(String source) throws ParsingError {
		return VisibilityFilterPass.perform(PythonParser.readModule(Paths.get("TEST"), source));
	}

	@Test
	public void testEverythingVisibleWithoutMarker() {
		PythonModule module = module(assign(name("x"), num(1)), assign(name("y"), num(2)));
		assertThat(VisibilityFilterPass.perform(module), is(module.getBody()));
	}

	@Test
	public void testMarkerTruncates() {
		PythonModule module = module(
				assign(name("x"), num(1)),
				expr(raw("!hide")),
				assign(name("y"), num(2)),
				expr(raw("!hide")),
				assign(name("z"), num(3)));
		assertThat(VisibilityFilterPass.perform(module),
				is(Collections.<PythonStatement>singletonList(assign(name("x"), num(1)))));
	}

	@Test
	public void testMarkerFirst() throws ParsingError {
		assertThat(filter("'!hide'\nx = 1\n"), is(Collections.<PythonStatement>emptyList()));
	}

	@Test
	public void testOnlyExactMarker() throws ParsingError {
		assertThat(filter("'!hide '\n'!HIDE'\n").size(), is(2));
		// any quoting of the same value counts
		assertThat(filter("r\"!hide\"\nx = 1\n"), is(Collections.<PythonStatement>emptyList()));
	}

	@Test
	public void testNestedMarkerIsOrdinary() throws ParsingError {
		List<PythonStatement> visible = filter("def f():\n    '!hide'\n    x = 1\ny = 2\n");
		assertThat(visible, is(Arrays.<PythonStatement>asList(
				def("f", params(), expr(raw("!hide")), assign(name("x"), num(1))),
				assign(name("y"), num(2)))));
	}

	@Test
	public void testEntryGuardDropped() throws ParsingError {
		assertThat(filter("x = 1\nif __name__ == \"__main__\":\n    main()\ny = 2\n"), is(Arrays.<PythonStatement>asList(
				assign(name("x"), num(1)),
				assign(name("y"), num(2)))));
	}

	@Test
	public void testReversedEntryGuardDropped() throws ParsingError {
		assertThat(filter("if '__main__' == __name__:\n    main()\nelse:\n    pass\n"),
				is(Collections.<PythonStatement>emptyList()));
	}

	@Test
	public void testOtherConditionsKept() throws ParsingError {
		assertThat(filter("if __name__ == 'tests':\n    main()\n").size(), is(1));
		assertFalse(VisibilityFilterPass.isScriptEntryGuard(
				ifThen(compare(name("__name__"), PythonComparison.Operation.NEQ, raw("__main__")), pass())));
	}

	@Test
	public void testHiddenStatementsAreNotInspected() throws ParsingError {
		assertThat(filter("x = 1\n'!hide'\nclass A:\n    pass\n"),
				is(Collections.<PythonStatement>singletonList(assign(name("x"), num(1)))));
	}
}
