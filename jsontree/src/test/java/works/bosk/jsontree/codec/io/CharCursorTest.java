package works.bosk.jsontree.codec.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.bosk.jsontree.codec.io.CharCursor.EOF;

@ParameterizedClass
@MethodSource("cursorSuppliers")
class CharCursorTest extends AbstractCharCursorTest {

	@Test
	void emptyInput() {
		try (CharCursor cursor = cursorFor("")) {
			assertEquals(EOF, cursor.peek());
			assertEquals(EOF, cursor.next());
			assertEquals(EOF, cursor.next(), "EOF is sticky");
			assertEquals(0, cursor.offset());
		}
	}

	@Test
	void peekDoesNotConsume() {
		try (CharCursor cursor = cursorFor("ab")) {
			assertEquals('a', cursor.peek());
			assertEquals('a', cursor.peek());
			assertEquals('a', cursor.next());
			assertEquals('b', cursor.next());
			assertEquals(EOF, cursor.peek());
			assertEquals(2, cursor.offset());
		}
	}

	@Test
	void acceptOnlyConsumesMatch() {
		try (CharCursor cursor = cursorFor("xy")) {
			assertFalse(cursor.accept('y'));
			assertTrue(cursor.accept('x'));
			assertTrue(cursor.accept('y'));
			assertFalse(cursor.accept(EOF), "EOF can't be accepted");
		}
	}

	@Test
	void lineAndColumnDescribeLookahead() {
		try (CharCursor cursor = cursorFor("ab\ncd")) {
			assertEquals(1, cursor.line());
			assertEquals(1, cursor.column());
			cursor.next();
			cursor.next();
			assertEquals(1, cursor.line());
			assertEquals(3, cursor.column());
			cursor.next(); // newline
			assertEquals(2, cursor.line());
			assertEquals(1, cursor.column());
			cursor.next();
			assertEquals(2, cursor.column());
		}
	}

	@Test
	void carriageReturnIsAnOrdinaryColumn() {
		try (CharCursor cursor = cursorFor("\r\nx")) {
			cursor.next();
			assertEquals(1, cursor.line());
			assertEquals(2, cursor.column());
			cursor.next();
			assertEquals(2, cursor.line());
			assertEquals(1, cursor.column());
		}
	}

	@Test
	void previewStartsAtLookahead() {
		try (CharCursor cursor = cursorFor("hello")) {
			cursor.next();
			assertTrue(cursor.preview(3).startsWith("e"));
			assertEquals('e', cursor.peek(), "Preview doesn't consume");
		}
	}
}
