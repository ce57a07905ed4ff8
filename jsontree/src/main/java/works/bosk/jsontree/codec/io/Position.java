package works.bosk.jsontree.codec.io;

/**
 * Line and column bookkeeping shared by the {@link CharCursor} implementations.
 */
final class Position {
	private long offset = 0;
	private int line = 0;
	private int column = 0;

	void advancePast(int c) {
		offset++;
		if (c == '\n') {
			line++;
			column = 0;
		} else {
			column++;
		}
	}

	long offset() {
		return offset;
	}

	int line() {
		return line + 1;
	}

	int column() {
		return column + 1;
	}
}
