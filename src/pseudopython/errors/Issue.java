package pseudopython.errors;

import pseudopython.Unreachable;
import pseudopython.formatters.IndentingWriter;
import pseudopython.formatters.IssueFormattingVisitor;
import pseudopython.trans.PseudoPythonTransException;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends PseudoPythonTransException {
	public Issue() {
		super("");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}
	
	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;
	
}
