package works.bosk.jsontree.exceptions;

/**
 * Base of every failure raised by the tree model and its codec.
 * All are fail-fast: nothing is retried or partially recovered internally.
 */
public sealed abstract class JsonException extends RuntimeException permits
	JsonFormatException,
	JsonValueException,
	JsonAccessException
{
	protected JsonException(String message) {
		super(message);
	}

	protected JsonException(String message, Throwable cause) {
		super(message, cause);
	}
}
