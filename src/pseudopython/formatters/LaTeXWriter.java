package pseudopython.formatters;

/**
 * Accumulates a piece of text-mode LaTeX that interleaves math and text.
 *
 * Consecutive math writes are merged into a single $...$ run. Where a run of math would start
 * right after text ending in a dollar sign (or text starting with one would follow math), an
 * empty group separates them so TeX never sees $$.
 *
 * Inside a group (a subscript, a superscript, a bracket pair) everything is math: text is
 * wrapped in \text{...} instead of leaving math mode.
 */
public class LaTeXWriter {

	private final StringBuilder out = new StringBuilder();
	private int groupDepth;
	private boolean inMath = false;

	public class Group implements AutoCloseable {
		private final String close;

		private Group(String close) {
			this.close = close;
		}

		@Override
		public void close() {
			--groupDepth;
			math(close);
		}
	}

	public LaTeXWriter() {
		this(false);
	}

	/**
	 * @param mathOnly whether everything written is math content, in which case the result is not
	 *                 delimited by dollar signs
	 */
	public LaTeXWriter(boolean mathOnly) {
		this.groupDepth = mathOnly ? 1 : 0;
	}

	public boolean isMathOnly() {
		return groupDepth > 0;
	}

	private boolean endsWithDollar() {
		int length = out.length();
		return length > 0 && out.charAt(length - 1) == '$' && (length < 2 || out.charAt(length - 2) != '\\');
	}

	public void math(String s) {
		if(s.isEmpty()) {
			return;
		}
		if(groupDepth == 0 && !inMath) {
			if(endsWithDollar()) {
				out.append("{}");
			}
			out.append('$');
			inMath = true;
		}
		out.append(s);
	}

	public void text(String s) {
		if(s.isEmpty()) {
			return;
		}
		if(groupDepth > 0) {
			out.append("\\text{").append(s).append('}');
			return;
		}
		if(inMath) {
			out.append('$');
			inMath = false;
		}
		if(s.charAt(0) == '$' && endsWithDollar()) {
			out.append("{}");
		}
		out.append(s);
	}

	/**
	 * Opens a math construct; the returned group writes the closing delimiter when closed.
	 */
	public Group group(String open, String close) {
		math(open);
		++groupDepth;
		return new Group(close);
	}

	/**
	 * Escapes the characters that are special in text mode.
	 */
	public static String escapeText(String s) {
		StringBuilder b = new StringBuilder();
		for(char c : s.toCharArray()) {
			switch(c) {
				case '\\':
					b.append("\\textbackslash{}");
					break;
				case '~':
					b.append("\\textasciitilde{}");
					break;
				case '^':
					b.append("\\textasciicircum{}");
					break;
				case '_':
				case '{':
				case '}':
				case '$':
				case '&':
				case '#':
				case '%':
					b.append('\\').append(c);
					break;
				default:
					b.append(c);
			}
		}
		return b.toString();
	}

	@Override
	public String toString() {
		return inMath ? out + "$" : out.toString();
	}
}
