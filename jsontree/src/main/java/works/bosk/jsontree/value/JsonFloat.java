package works.bosk.jsontree.value;

/**
 * A binary floating-point number.
 * May hold infinities and NaN; the generator writes infinities with a sentinel
 * exponent and rejects NaN.
 * <p>
 * Equality follows {@link Double#compare}, so {@code 0.0} and {@code -0.0} differ
 * and NaN equals itself.
 */
public record JsonFloat(double value) implements JsonValue {
	@Override
	public JsonType type() {
		return JsonType.FLOAT;
	}

	@Override
	public JsonValue copy() {
		return this;
	}

	@Override
	public String toString() {
		return Double.toString(value);
	}
}
