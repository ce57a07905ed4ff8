package works.bosk.jsontree.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

import static works.bosk.jsontree.codec.FloatFormat.Notation.GENERAL;

/**
 * Renders finite doubles according to a {@link FloatFormat}.
 * Exact decimal expansion goes through {@link BigDecimal}, so the digits
 * match what C's {@code printf} would produce under round-half-even.
 */
final class FloatFormatter {
	private FloatFormatter() { }

	static String format(double value, FloatFormat format) {
		assert Double.isFinite(value);
		int precision = format.precision();
		String text = switch (effectiveNotation(value, format)) {
			case SHORTEST -> Double.toString(value);
			case GENERAL -> general(value, precision);
			case FIXED -> fixed(value, precision);
			case SCIENTIFIC -> scientific(value, precision);
		};
		return withFloatSyntax(text);
	}

	private static FloatFormat.Notation effectiveNotation(double value, FloatFormat format) {
		return switch (format.notation()) {
			case FIXED, SCIENTIFIC -> {
				double magnitude = Math.abs(value);
				int p = format.precision();
				if (magnitude < Math.pow(10, p) && magnitude > Math.pow(10, -p)) {
					yield format.notation();
				} else {
					yield GENERAL;
				}
			}
			default -> format.notation();
		};
	}

	static String general(double value, int precision) {
		int p = Math.max(1, precision);
		if (value == 0) {
			return isNegative(value) ? "-0" : "0";
		}
		BigDecimal rounded = new BigDecimal(value).round(new MathContext(p, RoundingMode.HALF_EVEN)).stripTrailingZeros();
		int exponent = decimalExponent(rounded);
		if (exponent < -4 || exponent >= p) {
			String digits = rounded.unscaledValue().abs().toString();
			return sign(rounded) + mantissa(digits) + exponentSuffix(exponent);
		} else {
			return rounded.toPlainString();
		}
	}

	static String fixed(double value, int precision) {
		String text = new BigDecimal(value).setScale(precision, RoundingMode.HALF_EVEN).toPlainString();
		if (isNegative(value) && !text.startsWith("-")) {
			return "-" + text;
		}
		return text;
	}

	static String scientific(double value, int precision) {
		if (value == 0) {
			return (isNegative(value) ? "-" : "") + mantissa("0".repeat(precision + 1)) + exponentSuffix(0);
		}
		BigDecimal rounded = new BigDecimal(value).round(new MathContext(precision + 1, RoundingMode.HALF_EVEN));
		int exponent = decimalExponent(rounded);
		StringBuilder digits = new StringBuilder(stripZeros(rounded.unscaledValue().abs()));
		while (digits.length() < precision + 1) {
			digits.append('0');
		}
		return sign(rounded) + mantissa(digits.toString()) + exponentSuffix(exponent);
	}

	/**
	 * Ensures the text reads back as a float rather than an integer.
	 */
	static String withFloatSyntax(String text) {
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '.' || c == 'e' || c == 'E') {
				return text;
			}
		}
		return text + ".0";
	}

	/**
	 * @return the power of ten of the most significant digit
	 */
	private static int decimalExponent(BigDecimal d) {
		return d.precision() - d.scale() - 1;
	}

	private static String stripZeros(BigInteger unscaled) {
		String s = unscaled.toString();
		int end = s.length();
		while (end > 1 && s.charAt(end - 1) == '0') {
			end--;
		}
		return s.substring(0, end);
	}

	private static String mantissa(String digits) {
		if (digits.length() == 1) {
			return digits;
		} else {
			return digits.charAt(0) + "." + digits.substring(1);
		}
	}

	private static String exponentSuffix(int exponent) {
		String magnitude = Integer.toString(Math.abs(exponent));
		return (exponent < 0 ? "e-" : "e+") + (magnitude.length() < 2 ? "0" + magnitude : magnitude);
	}

	private static String sign(BigDecimal d) {
		return d.signum() < 0 ? "-" : "";
	}

	private static boolean isNegative(double value) {
		return Double.doubleToRawLongBits(value) < 0;
	}
}
