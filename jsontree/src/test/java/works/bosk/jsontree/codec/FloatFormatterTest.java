package works.bosk.jsontree.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.bosk.jsontree.codec.FloatFormatter.format;

class FloatFormatterTest {

	@Test
	void generalMatchesPrintf() {
		FloatFormat g = FloatFormat.DEFAULT;
		assertEquals("3.14", format(3.14, g));
		assertEquals("0.1", format(0.1, g));
		assertEquals("0.3", format(0.1 + 0.2, g));
		assertEquals("1e-05", format(1e-5, g));
		assertEquals("0.0001", format(1e-4, g));
		assertEquals("1.234568e+08", format(123456789.0, g));
		assertEquals("1234567.0", format(1234567.0, g));
		assertEquals("1.234568e+07", format(12345678.0, g));
		assertEquals("-2.5", format(-2.5, g));
		assertEquals("1e+100", format(1e100, g));
		assertEquals("1.797693e+308", format(Double.MAX_VALUE, g));
		assertEquals("4.940656e-324", format(Double.MIN_VALUE, g));
	}

	@Test
	void generalWithZeroPrecisionActsLikeOne() {
		assertEquals("0.5", format(0.5, FloatFormat.general(0)));
		assertEquals("2e+01", format(15.0, FloatFormat.general(0)));
	}

	@Test
	void fixedWithinRange() {
		assertEquals("3.14", format(3.14159, FloatFormat.fixed(2)));
		assertEquals("0.125", format(0.125, FloatFormat.fixed(3)));
		assertEquals("2.50", format(2.5, FloatFormat.fixed(2)));
	}

	@Test
	void fixedOutOfRangeFallsBackToGeneral() {
		assertEquals("1.2e+03", format(1234.5, FloatFormat.fixed(2)));
		assertEquals("0.0001", format(0.0001, FloatFormat.fixed(3)));
		assertEquals("0.0", format(0.0, FloatFormat.fixed(3)));
	}

	@Test
	void scientificWithinRange() {
		assertEquals("1.234e+01", format(12.34375, FloatFormat.scientific(3)));
		// 12.345 is slightly above its decimal spelling as a double
		assertEquals("1.235e+01", format(12.345, FloatFormat.scientific(3)));
		assertEquals("2.00e+00", format(2.0, FloatFormat.scientific(2)));
		assertEquals("-5.0e-01", format(-0.5, FloatFormat.scientific(1)));
	}

	@Test
	void scientificOutOfRangeFallsBackToGeneral() {
		assertEquals("1e+05", format(1e5, FloatFormat.scientific(3)));
	}

	@Test
	void shortest() {
		assertEquals("0.1", format(0.1, FloatFormat.ROUND_TRIP));
		assertEquals("0.30000000000000004", format(0.1 + 0.2, FloatFormat.ROUND_TRIP));
		assertEquals("1.0E-7", format(1e-7, FloatFormat.ROUND_TRIP));
		assertEquals("100.0", format(100.0, FloatFormat.ROUND_TRIP));
	}

	@Test
	void precisionIsClamped() {
		assertEquals(FloatFormat.MAX_PRECISION, FloatFormat.fixed(1000).precision());
		assertEquals(0, FloatFormat.fixed(-3).precision());
	}
}
