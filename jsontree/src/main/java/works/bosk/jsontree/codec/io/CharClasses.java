package works.bosk.jsontree.codec.io;

import java.util.stream.LongStream;

public final class CharClasses {
	private static final long WHITESPACE_CHARS = LongStream
		.of(0x20, 0x0A, 0x0D, 0x09)
		.map(n -> 1L << n)
		.sum();

	private CharClasses() { }

	/**
	 * Accepts {@link CharCursor#EOF} and any char, returning false for both
	 * unless the char is JSON whitespace.
	 */
	public static boolean isWhitespace(int c) {
		// Shifts are mod 64, so exclude anything outside [0,63] first
		return c >= 0 && c < 64 && (WHITESPACE_CHARS & (1L << c)) != 0;
	}

	public static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}

	/**
	 * @return the value of a hexadecimal digit, or -1 if {@code c} isn't one
	 */
	public static int hexValue(int c) {
		if (c >= '0' && c <= '9') {
			return c - '0';
		} else if (c >= 'a' && c <= 'f') {
			return c - 'a' + 10;
		} else if (c >= 'A' && c <= 'F') {
			return c - 'A' + 10;
		} else {
			return -1;
		}
	}
}
