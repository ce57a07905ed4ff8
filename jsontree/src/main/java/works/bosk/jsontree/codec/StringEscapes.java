package works.bosk.jsontree.codec;

/**
 * Escape sequences for string output, indexed by char value.
 * Chars at or above {@link #TABLE_SIZE}, and chars whose entry is null, are written verbatim.
 */
final class StringEscapes {
	static final int TABLE_SIZE = 256;
	private static final String[] ESCAPES = new String[TABLE_SIZE];

	static {
		for (int c = 0; c < 0x20; c++) {
			ESCAPES[c] = unicodeEscape(c);
		}
		ESCAPES['\b'] = "\\b";
		ESCAPES['\t'] = "\\t";
		ESCAPES['\n'] = "\\n";
		ESCAPES['\f'] = "\\f";
		ESCAPES['\r'] = "\\r";
		ESCAPES['"'] = "\\\"";
		ESCAPES['\\'] = "\\\\";
		ESCAPES['/'] = "\\/";
		ESCAPES[0x7F] = unicodeEscape(0x7F);
		ESCAPES[0xFF] = unicodeEscape(0xFF);
	}

	private StringEscapes() { }

	/**
	 * @return the escape sequence for {@code c}, or null if it needs none
	 */
	static String escapeFor(char c) {
		return (c < TABLE_SIZE) ? ESCAPES[c] : null;
	}

	static void appendQuoted(StringBuilder sb, CharSequence s) {
		sb.append('"');
		int verbatimStart = 0;
		for (int i = 0; i < s.length(); i++) {
			String escape = escapeFor(s.charAt(i));
			if (escape != null) {
				sb.append(s, verbatimStart, i).append(escape);
				verbatimStart = i + 1;
			}
		}
		sb.append(s, verbatimStart, s.length()).append('"');
	}

	private static String unicodeEscape(int c) {
		return String.format("\\u%04X", c);
	}
}
