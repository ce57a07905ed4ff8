package works.bosk.jsontree.codec.io;

import java.io.Reader;

/**
 * A forward-only sequence of UTF-16 chars with one char of lookahead.
 * <p>
 * The position reported by {@link #line()} and {@link #column()}
 * is that of the char {@link #peek()} would return, both counting from 1.
 * A newline ends a line; carriage returns are counted as ordinary characters.
 */
public sealed interface CharCursor extends AutoCloseable permits CharArrayCursor, ReaderCursor {
	int EOF = -1;

	/**
	 * @return the next char without consuming it, or {@link #EOF}
	 */
	int peek();

	/**
	 * Consumes one char.
	 * At the end of input, does nothing and returns {@link #EOF}.
	 *
	 * @return the char consumed, or {@link #EOF}
	 */
	int next();

	/**
	 * Consumes the next char if it is {@code expected}.
	 *
	 * @return true if consumed
	 */
	default boolean accept(int expected) {
		if (expected != EOF && peek() == expected) {
			next();
			return true;
		} else {
			return false;
		}
	}

	int line();

	int column();

	/**
	 * @return the number of chars consumed so far
	 */
	long offset();

	/**
	 * @return up to {@code requestedLength} upcoming chars, for diagnostics.
	 * Implementations may return fewer.
	 */
	String preview(int requestedLength);

	@Override
	void close();

	static CharCursor of(String text) {
		return new CharArrayCursor(text.toCharArray());
	}

	static CharCursor of(char[] chars) {
		return new CharArrayCursor(chars);
	}

	static CharCursor of(Reader reader) {
		return new ReaderCursor(reader);
	}
}
