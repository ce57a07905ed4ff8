package works.bosk.jsontree.codec;

/**
 * Individual relaxations of strict JSON syntax.
 * Each one is independent of the others.
 *
 * @see ParserSettings
 */
public enum ParseOption {
	/**
	 * A U+FEFF character at the very start of the text is skipped.
	 */
	BYTE_ORDER_MARK,

	/**
	 * A bare {@code /} may appear inside a string.
	 * Standard JSON permits this; it's an option only so it can be turned off.
	 */
	UNESCAPED_SLASH,

	/**
	 * {@code /* ... *}{@code /} and {@code // ...} comments count as whitespace.
	 * An unterminated block comment runs to the end of the input.
	 */
	COMMENTS,

	/**
	 * A single comma may follow the last element of an array or member of an object.
	 */
	TRAILING_COMMAS,

	/**
	 * An object key may be written without quotes. It then runs up to,
	 * but not including, the first {@code :}, whitespace, or control character.
	 */
	UNQUOTED_KEYS,

	/**
	 * A number may begin with {@code +}.
	 */
	PLUS_SIGN,
}
