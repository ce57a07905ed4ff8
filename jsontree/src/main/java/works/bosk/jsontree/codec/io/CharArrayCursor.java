package works.bosk.jsontree.codec.io;

import static java.lang.Math.min;

/**
 * A {@link CharCursor} over a char array.
 * Useful for JSON text that has already been fully loaded into memory,
 * like a String.
 */
public final class CharArrayCursor implements CharCursor {
	final char[] chars;
	int pos = 0;
	private final Position position = new Position();

	public CharArrayCursor(char[] chars) {
		this.chars = chars;
	}

	@Override
	public int peek() {
		if (pos >= chars.length) {
			return EOF;
		} else {
			return chars[pos];
		}
	}

	@Override
	public int next() {
		if (pos >= chars.length) {
			return EOF;
		}
		char c = chars[pos++];
		position.advancePast(c);
		return c;
	}

	@Override
	public int line() {
		return position.line();
	}

	@Override
	public int column() {
		return position.column();
	}

	@Override
	public long offset() {
		return pos;
	}

	@Override
	public String preview(int requestedLength) {
		int actualLength = min(requestedLength, chars.length - pos);
		return new String(chars, pos, actualLength);
	}

	@Override
	public void close() {

	}
}
