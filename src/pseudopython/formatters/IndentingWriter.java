package pseudopython.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that prefixes every non-empty line with the current number of spaces.
 *
 * Indentation is scoped: {@link #indent(int)} returns a handle that restores the previous level
 * when closed, so nested output reads naturally inside try-with-resources.
 */
public class IndentingWriter extends Writer {

	static final char LINE_SEPARATOR = '\n';
	static final int DEFAULT_INDENT = 4;

	private final Writer out;
	private int level = 0;
	private boolean atLineStart = true;

	public class Indent implements AutoCloseable {
		private final int spaces;

		private Indent(int spaces) {
			this.spaces = spaces;
		}

		@Override
		public void close() {
			level -= spaces;
		}
	}

	public IndentingWriter(Writer out) {
		this.out = out;
	}

	public Indent indent(int spaces) {
		if (spaces < 0) {
			throw new IllegalArgumentException("negative indentation " + spaces);
		}
		level += spaces;
		return new Indent(spaces);
	}

	public Indent indent() {
		return indent(DEFAULT_INDENT);
	}

	public void newLine() throws IOException {
		write(LINE_SEPARATOR);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		int lineStart = offset;
		int end = offset + len;
		for (int i = offset; i < end; ++i) {
			if (chars[i] != LINE_SEPARATOR) {
				continue;
			}
			writeLinePart(chars, lineStart, i);
			out.write(LINE_SEPARATOR);
			atLineStart = true;
			lineStart = i + 1;
		}
		writeLinePart(chars, lineStart, end);
	}

	// empty lines stay empty
	private void writeLinePart(char[] chars, int from, int to) throws IOException {
		if (from == to) {
			return;
		}
		if (atLineStart) {
			for (int i = 0; i < level; ++i) {
				out.write(' ');
			}
			atLineStart = false;
		}
		out.write(chars, from, to - from);
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}
}
