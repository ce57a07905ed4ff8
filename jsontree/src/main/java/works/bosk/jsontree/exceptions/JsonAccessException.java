package works.bosk.jsontree.exceptions;

/**
 * A node was required to hold a particular type and didn't,
 * or a write went through a reference that has nowhere to put the value.
 * <p>
 * Reads that merely <em>probe</em> a node never throw this;
 * see the {@code get...Or} and {@code as...} accessors.
 */
public final class JsonAccessException extends JsonException {
	public JsonAccessException(String message) {
		super(message);
	}
}
