package works.bosk.jsontree.exceptions;

/**
 * The input text is not valid under the parser's settings.
 * <p>
 * Carries the position of the offending character so that a caller can
 * report it, and so that tests can check we blame the right place.
 */
public sealed class JsonFormatException extends JsonException permits JsonNestingException {
	/**
	 * Value of {@link #encountered()} when the failure is not about any particular character.
	 */
	public static final int NOTHING = -2;

	/**
	 * Value of {@link #encountered()} when the failure happened at end of input.
	 */
	public static final int EOF = -1;

	private final String reason;
	private final int encountered;
	private final int line;
	private final int column;

	public JsonFormatException(String reason, int encountered, int line, int column) {
		super(describe(reason, encountered, line, column));
		this.reason = reason;
		this.encountered = encountered;
		this.line = line;
		this.column = column;
	}

	public String reason() {
		return reason;
	}

	/**
	 * @return the UTF-16 code unit the parser was looking at,
	 * or {@link #EOF}, or {@link #NOTHING}
	 */
	public int encountered() {
		return encountered;
	}

	/**
	 * @return 1-based
	 */
	public int line() {
		return line;
	}

	/**
	 * @return 1-based
	 */
	public int column() {
		return column;
	}

	static String describe(String reason, int encountered, int line, int column) {
		StringBuilder sb = new StringBuilder(reason);
		if (encountered != NOTHING) {
			sb.append(" but encountered ");
			if (encountered == EOF) {
				sb.append("EOF");
			} else if (encountered >= 0x20 && encountered < 0x7F) {
				sb.append('\'').append((char) encountered).append('\'');
			} else {
				sb.append("(char)").append(String.format("%02x", encountered));
			}
		}
		return sb
			.append(" at line ").append(line)
			.append(" column ").append(column)
			.append('.')
			.toString();
	}
}
