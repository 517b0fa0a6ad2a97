package pseudopython.parser;

import pseudopython.util.SourceLocation;

/**
 * Raised when a script does not conform to the grammar. The message always carries the
 * line and column of the offending text.
 */
public class ParsingError extends Exception {

	private static final long serialVersionUID = 8163226357416427716L;

	private final SourceLocation location;
	private final String description;

	public ParsingError(SourceLocation location, String description) {
		super(description + " " + location.prettyString());
		this.location = location;
		this.description = description;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getDescription() {
		return description;
	}
}
