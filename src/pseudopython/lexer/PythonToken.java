package pseudopython.lexer;

import pseudopython.util.SourceLocatable;
import pseudopython.util.SourceLocation;

import java.util.Objects;

public class PythonToken extends SourceLocatable {

	private final String value;
	private final PythonTokenType type;
	private final SourceLocation location;

	public PythonToken(String value, PythonTokenType type, SourceLocation location) {
		this.value = value;
		this.type = type;
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getValue() {
		return value;
	}

	public PythonTokenType getType() {
		return type;
	}

	public boolean is(PythonTokenType type, String value) {
		return this.type == type && this.value.equals(value);
	}

	public boolean isOperator(String value) {
		return is(PythonTokenType.OPERATOR, value);
	}

	public boolean isKeyword(String value) {
		return is(PythonTokenType.KEYWORD, value);
	}

	@Override
	public String toString() {
		return "PythonToken [value=" + value + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PythonToken that = (PythonToken) o;
		return Objects.equals(value, that.value) &&
				type == that.type &&
				Objects.equals(location, that.location);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, type, location);
	}
}
