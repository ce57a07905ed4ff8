package works.bosk.jsontree.exceptions;

/**
 * A tree contains something that can't be written as JSON text:
 * an undefined node, or a NaN.
 */
public final class JsonValueException extends JsonException {
	public JsonValueException(String message) {
		super(message);
	}
}
