package works.bosk.jsontree.codec;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TokenTest {

	@ParameterizedTest
	@EnumSource(value = Token.class, names = { "NULL", "FALSE", "TRUE", "START_OBJECT", "END_OBJECT", "START_ARRAY", "END_ARRAY", "COMMA", "COLON" })
	void fixedRepresentationStartsWithItsOwnToken(Token token) {
		assertEquals(token, Token.startingWith(token.fixedRepresentation().charAt(0)));
	}

	@ParameterizedTest
	@EnumSource(value = Token.class, names = { "NUMBER", "STRING", "WHITESPACE", "COMMENT", "BYTE_ORDER_MARK", "ERROR" })
	void variableTokensHaveNoFixedRepresentation(Token token) {
		assertThrows(IllegalArgumentException.class, token::fixedRepresentation);
	}

	@Test
	void leadingCharacters() {
		assertEquals(Token.END_TEXT, Token.startingWith(-1));
		assertEquals(Token.NUMBER, Token.startingWith('+'));
		assertEquals(Token.NUMBER, Token.startingWith('-'));
		assertEquals(Token.COMMENT, Token.startingWith('/'));
		assertEquals(Token.BYTE_ORDER_MARK, Token.startingWith(0xFEFF));
		assertEquals(Token.ERROR, Token.startingWith('\''));
		assertEquals(Token.ERROR, Token.startingWith(0x0B));
		for (char c : new char[] { ' ', '\t', '\n', '\r' }) {
			assertEquals(Token.WHITESPACE, Token.startingWith(c));
		}
	}
}
