package works.bosk.jsontree.codec;

import works.bosk.jsontree.codec.io.CharCursor;

import static works.bosk.jsontree.codec.io.CharClasses.isWhitespace;

/**
 * A syntactically significant element of JSON text,
 * identified by its first character.
 */
public enum Token {
	END_TEXT,
	NULL,
	FALSE,
	TRUE,

	/**
	 * Includes a leading {@code +}, which only some settings accept.
	 */
	NUMBER,
	START_OBJECT,
	END_OBJECT,
	START_ARRAY,
	END_ARRAY,

	/**
	 * Can be a member name or a string value.
	 * We don't distinguish at the token level.
	 */
	STRING,
	COMMA,
	COLON,
	WHITESPACE,

	/**
	 * Only valid when comments are allowed.
	 */
	COMMENT,

	/**
	 * U+FEFF. Only valid at the very start of the text, and only when allowed.
	 */
	BYTE_ORDER_MARK,

	ERROR;

	public static final int BYTE_ORDER_MARK_CHAR = 0xFEFF;

	public static Token startingWith(int c) {
		return switch (c) {
			case CharCursor.EOF -> END_TEXT;
			case 'n' -> NULL;
			case 'f' -> FALSE;
			case 't' -> TRUE;
			case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', '-', '+' -> NUMBER;
			case '{' -> START_OBJECT;
			case '}' -> END_OBJECT;
			case '[' -> START_ARRAY;
			case ']' -> END_ARRAY;
			case '"' -> STRING;
			case ',' -> COMMA;
			case ':' -> COLON;
			case '/' -> COMMENT;
			case BYTE_ORDER_MARK_CHAR -> BYTE_ORDER_MARK;
			default -> isWhitespace(c) ? WHITESPACE : ERROR;
		};
	}

	public String fixedRepresentation() {
		return switch (this) {
			case END_TEXT -> "";
			case NULL -> "null";
			case FALSE -> "false";
			case TRUE -> "true";
			case START_OBJECT -> "{";
			case END_OBJECT -> "}";
			case START_ARRAY -> "[";
			case END_ARRAY -> "]";
			case COMMA -> ",";
			case COLON -> ":";
			default ->
				throw new IllegalArgumentException("Token has no fixed representation: " + this);
		};
	}
}
