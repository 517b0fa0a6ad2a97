package pseudopython.model.python;

import pseudopython.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * The syntax tree of one script: its top-level statements in source order.
 */
public class PythonModule extends PythonNode {
	private final List<PythonStatement> body;

	public PythonModule(SourceLocation location, List<PythonStatement> body) {
		super(location);
		this.body = body;
	}

	public List<PythonStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(PythonNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonModule that = (PythonModule) o;
		return Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(body);
	}
}
