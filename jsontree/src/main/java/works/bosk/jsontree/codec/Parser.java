package works.bosk.jsontree.codec;

import works.bosk.jsontree.codec.io.CharCursor;
import works.bosk.jsontree.value.JsonValue;

/**
 * Creates {@link JsonValue} trees corresponding to JSON text.
 */
public interface Parser {
	/**
	 * Reads exactly one value, after an optional byte order mark and any insignificant text,
	 * leaving whatever follows it unread.
	 */
	JsonValue parse(CharCursor input);

	/**
	 * Like {@link #parse} but also requires that nothing but insignificant text follows the value.
	 */
	JsonValue parseDocument(CharCursor input);
}
