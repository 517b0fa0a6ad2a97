package pseudopython.trans.passes.codegen.latex;

import pseudopython.InternalTranslatorError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects pseudocode commands together with their nesting depth.
 *
 * Every block opened with {@link #open(String, String)} writes its end command when it is
 * closed, so a try-with-resources around each block body keeps begin and end commands matched.
 */
public class LayoutTracker {
	private final List<PseudocodeLine> lines = new ArrayList<>();
	private int depth = 0;

	public class Block implements AutoCloseable {
		private final String end;
		private final int blockDepth;
		private boolean closed = false;

		private Block(String end, int blockDepth) {
			this.end = end;
			this.blockDepth = blockDepth;
		}

		/**
		 * Writes a command that splits the block, like \Else, level with the begin command.
		 */
		public void divide(String command) {
			if(closed || depth != blockDepth + 1) {
				throw new InternalTranslatorError("block divided while a nested block is open");
			}
			lines.add(new PseudocodeLine(command, blockDepth));
		}

		@Override
		public void close() {
			if(closed) {
				return;
			}
			if(depth != blockDepth + 1) {
				throw new InternalTranslatorError("blocks closed out of order");
			}
			closed = true;
			--depth;
			lines.add(new PseudocodeLine(end, depth));
		}
	}

	public void line(String command) {
		lines.add(new PseudocodeLine(command, depth));
	}

	public Block open(String begin, String end) {
		lines.add(new PseudocodeLine(begin, depth));
		Block block = new Block(end, depth);
		++depth;
		return block;
	}

	public int getDepth() {
		return depth;
	}

	public List<PseudocodeLine> getLines() {
		if(depth != 0) {
			throw new InternalTranslatorError("pseudocode requested with " + depth + " block(s) still open");
		}
		return Collections.unmodifiableList(lines);
	}
}
