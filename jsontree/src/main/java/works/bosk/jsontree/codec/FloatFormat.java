package works.bosk.jsontree.codec;

/**
 * How {@link TreeGenerator} renders finite floating-point numbers.
 * <p>
 * {@link Notation#FIXED} and {@link Notation#SCIENTIFIC} only apply to magnitudes strictly between
 * 10<sup>-precision</sup> and 10<sup>precision</sup>; anything else falls back to
 * {@link Notation#GENERAL} so that tiny and huge numbers don't lose all their digits
 * or balloon in length.
 * <p>
 * Whatever the notation, the text always contains a {@code .} or an exponent,
 * so it reads back as a float rather than an integer.
 *
 * @param precision clamped to [0, 64]
 */
public record FloatFormat(Notation notation, int precision) {
	public static final int MAX_PRECISION = 64;

	public enum Notation {
		/**
		 * Like C's {@code %g}: {@code precision} significant digits,
		 * trailing zeros removed, scientific only for very small or large exponents.
		 */
		GENERAL,

		/**
		 * Like C's {@code %f}: {@code precision} digits after the decimal point.
		 */
		FIXED,

		/**
		 * Like C's {@code %e}: one digit before the point and {@code precision} after.
		 */
		SCIENTIFIC,

		/**
		 * The fewest digits that read back as the identical double.
		 * {@code precision} is ignored.
		 */
		SHORTEST,
	}

	public static final FloatFormat DEFAULT = new FloatFormat(Notation.GENERAL, 7);
	public static final FloatFormat ROUND_TRIP = new FloatFormat(Notation.SHORTEST, 0);

	public FloatFormat {
		if (notation == null) {
			throw new NullPointerException("notation");
		}
		precision = Math.max(0, Math.min(MAX_PRECISION, precision));
	}

	public static FloatFormat general(int precision) {
		return new FloatFormat(Notation.GENERAL, precision);
	}

	public static FloatFormat fixed(int precision) {
		return new FloatFormat(Notation.FIXED, precision);
	}

	public static FloatFormat scientific(int precision) {
		return new FloatFormat(Notation.SCIENTIFIC, precision);
	}
}
