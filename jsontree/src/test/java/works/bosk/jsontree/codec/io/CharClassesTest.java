package works.bosk.jsontree.codec.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CharClassesTest {

	@ParameterizedTest
	@ValueSource(chars = { ' ', '\t', '\n', '\r' })
	void whitespace(char c) {
		assertTrue(CharClasses.isWhitespace(c));
	}

	@ParameterizedTest
	@ValueSource(ints = { -1, 0, '\f', 0x0B, 'a', 0x20 + 64, 0xA0, 0xFEFF })
	void notWhitespace(int c) {
		assertFalse(CharClasses.isWhitespace(c));
	}

	@Test
	void hexValues() {
		assertEquals(0, CharClasses.hexValue('0'));
		assertEquals(10, CharClasses.hexValue('a'));
		assertEquals(15, CharClasses.hexValue('F'));
		assertEquals(-1, CharClasses.hexValue('g'));
		assertEquals(-1, CharClasses.hexValue(-1));
	}
}
