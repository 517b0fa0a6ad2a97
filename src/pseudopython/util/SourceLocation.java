package pseudopython.util;

import pseudopython.Unreachable;
import pseudopython.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A span of a script. Lines and columns are 0-based; the end offset and end column are exclusive.
 *
 * A location without a file is unknown, as for nodes built in memory.
 */
public final class SourceLocation {
	private static final SourceLocation UNKNOWN = new SourceLocation(null, -1, -1, -1, -1, -1, -1);

	private final Path file;
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public static SourceLocation unknown() {
		return UNKNOWN;
	}

	public boolean isUnknown() {
		return file == null;
	}

	/**
	 * Renders the location for diagnostics, 1-based: "at 3:5", "at 3:5-9" or "at 3:5-4:2",
	 * followed by the file.
	 */
	public String prettyString() {
		StringWriter w = new StringWriter();
		writePretty(new IndentingWriter(w));
		return w.toString();
	}

	public void writePretty(IndentingWriter out) {
		try {
			if (isUnknown()) {
				out.write("at unknown source location");
				return;
			}
			StringBuilder range = new StringBuilder("at ");
			range.append(startLine + 1).append(':').append(startColumn + 1);
			if (startLine != endLine) {
				range.append('-').append(endLine + 1).append(':').append(endColumn);
			} else if (startColumn + 1 < endColumn) {
				range.append('-').append(endColumn);
			}
			out.write(range.toString());
			out.write(" in file " + file);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
	}

	/**
	 * The smallest location covering both this one and the other; unknown locations are ignored.
	 */
	public SourceLocation combine(SourceLocation other) {
		if (isUnknown()) {
			return other;
		}
		if (other.isUnknown()) {
			return this;
		}
		if (!file.equals(other.file)) {
			throw new IllegalArgumentException("cannot combine locations in " + file + " and " + other.file);
		}
		SourceLocation first = startOffset <= other.startOffset ? this : other;
		SourceLocation last = endOffset >= other.endOffset ? this : other;
		return new SourceLocation(file, first.startOffset, last.endOffset,
				first.startLine, last.endLine, first.startColumn, last.endColumn);
	}

	public Path getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		SourceLocation that = (SourceLocation) o;
		return startOffset == that.startOffset && endOffset == that.endOffset &&
				startLine == that.startLine && endLine == that.endLine &&
				startColumn == that.startColumn && endColumn == that.endColumn &&
				Objects.equals(file, that.file);
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startOffset, endOffset, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation[unknown]";
		}
		return "SourceLocation[" + file + " " + startOffset + "-" + endOffset + ", lines " + startLine + "-" +
				endLine + ", columns " + startColumn + "-" + endColumn + "]";
	}
}
