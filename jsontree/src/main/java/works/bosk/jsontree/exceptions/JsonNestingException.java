package works.bosk.jsontree.exceptions;

/**
 * Arrays and objects in the input are nested more deeply than
 * {@link works.bosk.jsontree.codec.ParserSettings#maxDepth() maxDepth} allows.
 */
public final class JsonNestingException extends JsonFormatException {
	public JsonNestingException(int maxDepth, int encountered, int line, int column) {
		super("nesting depth exceeds " + maxDepth, encountered, line, column);
	}
}
