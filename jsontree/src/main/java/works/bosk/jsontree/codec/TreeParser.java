package works.bosk.jsontree.codec;

import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.jsontree.codec.io.CharCursor;
import works.bosk.jsontree.exceptions.JsonFormatException;
import works.bosk.jsontree.exceptions.JsonNestingException;
import works.bosk.jsontree.value.JsonArray;
import works.bosk.jsontree.value.JsonObject;
import works.bosk.jsontree.value.JsonValue;

import static works.bosk.jsontree.codec.io.CharCursor.EOF;
import static works.bosk.jsontree.codec.io.CharClasses.hexValue;
import static works.bosk.jsontree.codec.io.CharClasses.isDigit;

/**
 * A recursive-descent parser producing {@link JsonValue} trees.
 * <p>
 * Numbers without a fraction or exponent become integers if they fit in a {@code long},
 * and floats otherwise. Floats whose exponent is out of range saturate to
 * infinity or zero rather than failing.
 * Duplicate object keys are allowed; the last value wins, in the position of the first.
 * <p>
 * Every syntax error is a {@link JsonFormatException} carrying the line and column of
 * the offending character.
 */
public class TreeParser implements Parser {
	/**
	 * Integer digits beyond this many are dropped, and accounted for in the exponent.
	 */
	static final int INTEGER_DIGIT_LIMIT = 48;

	/**
	 * Total significant characters kept; fraction digits beyond this are dropped.
	 */
	static final int FRACTION_DIGIT_LIMIT = 64;

	static final int NUMBER_BUFFER_SIZE = 128;

	private final ParserSettings settings;

	public TreeParser(ParserSettings settings) {
		this.settings = settings;
	}

	public ParserSettings settings() {
		return settings;
	}

	@Override
	public JsonValue parse(CharCursor input) {
		LOGGER.debug("Parsing one value using {}", settings);
		return new Session(input, settings).parseValue();
	}

	@Override
	public JsonValue parseDocument(CharCursor input) {
		LOGGER.debug("Parsing document using {}", settings);
		Session session = new Session(input, settings);
		JsonValue result = session.parseValue();
		session.skipInsignificant();
		if (input.peek() != EOF) {
			throw session.error("invalid json format: unexpected text after the value", input.peek());
		}
		return result;
	}

	static final class Session {
		final CharCursor input;
		final ParserSettings settings;
		final StringBuilder stringBuffer = new StringBuilder();
		final char[] numberBuffer = new char[NUMBER_BUFFER_SIZE];
		int depth = 0;

		Session(CharCursor input, ParserSettings settings) {
			this.input = input;
			this.settings = settings;
		}

		JsonValue parseValue() {
			if (Token.startingWith(input.peek()) == Token.BYTE_ORDER_MARK) {
				if (!settings.allowByteOrderMark()) {
					throw error("invalid json format: expected an element. (byte order mark not allowed)", input.peek());
				}
				input.next();
			}
			skipInsignificant();
			return parseElement();
		}

		JsonValue parseElement() {
			Token token = nextToken();
			return switch (token) {
				case NULL -> {
					consumeLiteral(Token.NULL);
					yield JsonValue.NULL;
				}
				case FALSE -> {
					consumeLiteral(Token.FALSE);
					yield JsonValue.FALSE;
				}
				case TRUE -> {
					consumeLiteral(Token.TRUE);
					yield JsonValue.TRUE;
				}
				case NUMBER -> parseNumber();
				case STRING -> JsonValue.of(parseString());
				case START_ARRAY -> parseArray(new JsonArray());
				case START_OBJECT -> parseObject(new JsonObject());
				default -> throw error("invalid json format: expected an element", input.peek());
			};
		}

		/**
		 * Containers are created in place, so the parent never has to copy them.
		 */
		private void parseElementInto(JsonArray array) {
			switch (Token.startingWith(input.peek())) {
				case START_ARRAY -> parseArray(array.addArray());
				case START_OBJECT -> parseObject(array.addObject());
				default -> array.add(parseElement());
			}
		}

		private void parseMemberInto(JsonObject object, String key) {
			switch (Token.startingWith(input.peek())) {
				case START_ARRAY -> parseArray(object.putArray(key));
				case START_OBJECT -> parseObject(object.putObject(key));
				default -> object.put(key, parseElement());
			}
		}

		private Token nextToken() {
			Token token = Token.startingWith(input.peek());
			if (LOGGER.isTraceEnabled()) {
				LOGGER.trace("parseElement {} at {}:{} |{}|", token, input.line(), input.column(), input.preview(20));
			}
			return token;
		}

		private void consumeLiteral(Token token) {
			String expected = token.fixedRepresentation();
			for (int i = 0; i < expected.length(); i++) {
				char c = expected.charAt(i);
				if (!input.accept(c)) {
					throw error("invalid '" + expected + "' literal: expected '" + c + "'", input.peek());
				}
			}
		}

		//
		// Numbers
		//

		/**
		 * Copies at most {@link #NUMBER_BUFFER_SIZE} significant characters of the number,
		 * tracking dropped digits in a separate decimal exponent adjustment,
		 * so arbitrarily long input never needs an arbitrarily large buffer.
		 */
		private JsonValue parseNumber() {
			char[] buf = numberBuffer;
			int length = 0;
			long exponentOffset = 0;
			boolean integral = true;

			if (input.accept('-')) {
				buf[length++] = '-';
			} else if (settings.allowPlusSign()) {
				input.accept('+');
			}

			if (input.accept('0')) {
				buf[length++] = '0';
			} else if (isDigit(input.peek())) {
				while (isDigit(input.peek())) {
					if (length < INTEGER_DIGIT_LIMIT) {
						buf[length++] = (char) input.next();
					} else {
						input.next();
						exponentOffset++;
					}
				}
			} else {
				throw error("invalid number format: expected a digit", input.peek());
			}

			if (input.accept('.')) {
				integral = false;
				buf[length++] = '.';
				if (!isDigit(input.peek())) {
					throw error("invalid number format: expected a digit", input.peek());
				}
				if (isZeroIntegerPart(buf, length)) {
					// Leading fraction zeros aren't significant
					while (input.peek() == '0') {
						input.next();
						exponentOffset--;
					}
				}
				while (isDigit(input.peek())) {
					if (length < FRACTION_DIGIT_LIMIT) {
						buf[length++] = (char) input.next();
					} else {
						input.next();
					}
				}
			}

			if (input.peek() == 'e' || input.peek() == 'E') {
				input.next();
				integral = false;
				boolean negative = input.accept('-');
				if (!negative) {
					input.accept('+');
				}
				if (!isDigit(input.peek())) {
					throw error("invalid number format: expected a digit", input.peek());
				}
				long exponent = 0;
				boolean overflow = false;
				while (isDigit(input.peek())) {
					int digit = input.next() - '0';
					if (!overflow) {
						if (exponent > (Long.MAX_VALUE - digit) / 10) {
							overflow = true;
						} else {
							exponent = exponent * 10 + digit;
						}
					}
				}
				if (overflow) {
					exponentOffset = negative ? Long.MIN_VALUE : Long.MAX_VALUE;
				} else {
					exponentOffset = saturatedAdd(exponentOffset, negative ? -exponent : exponent);
				}
			}

			if (exponentOffset != 0) {
				integral = false;
			}

			if (integral) {
				OptionalLong exact = exactLong(buf, length);
				if (exact.isPresent()) {
					return JsonValue.of(exact.getAsLong());
				}
			}

			String text = new String(buf, 0, length);
			if (exponentOffset != 0) {
				text = text + "e" + exponentOffset;
			}
			// Out-of-range exponents yield infinity or zero, with the right sign
			return JsonValue.of(Double.parseDouble(text));
		}

		private static boolean isZeroIntegerPart(char[] buf, int length) {
			return (length == 2 && buf[0] == '0')
				|| (length == 3 && buf[0] == '-' && buf[1] == '0');
		}

		//
		// Strings
		//

		/**
		 * Expects the input to be at the opening quote.
		 */
		String parseString() {
			input.next();
			StringBuilder sb = stringBuffer;
			sb.setLength(0);
			while (true) {
				int c = input.peek();
				if (c == '"') {
					input.next();
					return sb.toString();
				} else if (c == '\\') {
					input.next();
					parseEscape(sb);
				} else if (c == EOF) {
					throw error("invalid string format: unexpected eof", c);
				} else if (c < 0x20 || c == 0x7F) {
					throw error("invalid string format: control character is not allowed", c);
				} else if (c == '/' && !settings.allowUnescapedSlash()) {
					throw error("invalid string format: unescaped '/' is not allowed", c);
				} else {
					sb.append((char) input.next());
				}
			}
		}

		private void parseEscape(StringBuilder sb) {
			int c = input.peek();
			switch (c) {
				case '"', '\\', '/' -> sb.append((char) c);
				case 'b' -> sb.append('\b');
				case 'f' -> sb.append('\f');
				case 'n' -> sb.append('\n');
				case 'r' -> sb.append('\r');
				case 't' -> sb.append('\t');
				case 'u' -> {
					input.next();
					parseUnicodeEscape(sb);
					return;
				}
				default -> throw error("invalid string format: invalid escape sequence", c);
			}
			input.next();
		}

		/**
		 * Expects the input to be just past the <code>&#92;u</code>.
		 * A surrogate must be immediately followed by another <code>&#92;u</code> escape
		 * holding its partner. A low surrogate followed by a high one is accepted as a swapped pair.
		 */
		private void parseUnicodeEscape(StringBuilder sb) {
			char first = parseHex4();
			if (!Character.isSurrogate(first)) {
				sb.append(first);
				return;
			}
			if (!input.accept('\\') || !input.accept('u')) {
				throw error("invalid string format: expected surrogate pair", input.peek());
			}
			char second = parseHex4();
			if (Character.isSurrogatePair(first, second)) {
				sb.append(first).append(second);
			} else if (Character.isSurrogatePair(second, first)) {
				sb.append(second).append(first);
			} else {
				throw error("invalid string format: invalid surrogate pair sequence", JsonFormatException.NOTHING);
			}
		}

		private char parseHex4() {
			int result = 0;
			for (int i = 0; i < 4; i++) {
				int digit = hexValue(input.peek());
				if (digit < 0) {
					throw error("invalid string format: expected hexadecimal digit for \\u????", input.peek());
				}
				input.next();
				result = (result << 4) | digit;
			}
			return (char) result;
		}

		//
		// Containers
		//

		private JsonArray parseArray(JsonArray result) {
			enter();
			input.next();
			skipInsignificant();
			if (input.accept(']')) {
				depth--;
				return result;
			}
			while (true) {
				parseElementInto(result);
				skipInsignificant();
				if (input.accept(',')) {
					skipInsignificant();
					if (input.peek() == ']') {
						if (!settings.allowTrailingCommas()) {
							throw error("invalid array format: expected an element (trailing comma not allowed)", input.peek());
						}
						input.next();
						break;
					}
				} else if (input.accept(']')) {
					break;
				} else {
					throw error("invalid array format: ',' or ']' expected", input.peek());
				}
			}
			depth--;
			return result;
		}

		private JsonObject parseObject(JsonObject result) {
			enter();
			input.next();
			skipInsignificant();
			if (input.accept('}')) {
				depth--;
				return result;
			}
			while (true) {
				String key = parseKey();
				skipInsignificant();
				if (!input.accept(':')) {
					throw error("invalid object format: expected a ':'", input.peek());
				}
				skipInsignificant();
				parseMemberInto(result, key);
				skipInsignificant();
				if (input.accept(',')) {
					skipInsignificant();
					if (input.peek() == '}') {
						if (!settings.allowTrailingCommas()) {
							throw error("invalid object format: expected object key (trailing comma not allowed)", input.peek());
						}
						input.next();
						break;
					}
				} else if (input.accept('}')) {
					break;
				} else {
					throw error("invalid object format: expected ',' or '}'", input.peek());
				}
			}
			depth--;
			return result;
		}

		private String parseKey() {
			if (input.peek() == '"') {
				return parseString();
			} else if (settings.allowUnquotedKeys()) {
				StringBuilder sb = stringBuffer;
				sb.setLength(0);
				int c;
				while ((c = input.peek()) != EOF && c > ' ' && c != ':') {
					sb.append((char) input.next());
				}
				return sb.toString();
			} else {
				throw error("invalid object format: expected object key", input.peek());
			}
		}

		private void enter() {
			if (++depth > settings.maxDepth()) {
				throw new JsonNestingException(settings.maxDepth(), input.peek(), input.line(), input.column());
			}
		}

		//
		// Whitespace and comments
		//

		void skipInsignificant() {
			while (true) {
				Token token = Token.startingWith(input.peek());
				if (token == Token.WHITESPACE) {
					input.next();
				} else if (token == Token.COMMENT && settings.allowComments()) {
					skipComment();
				} else {
					return;
				}
			}
		}

		private void skipComment() {
			input.next();
			if (input.accept('*')) {
				// An unterminated block comment ends at EOF
				while (input.peek() != EOF) {
					if (input.next() == '*' && input.accept('/')) {
						return;
					}
				}
			} else if (input.accept('/')) {
				while (input.peek() != EOF) {
					if (input.next() == '\n') {
						return;
					}
				}
			} else {
				throw error("invalid comment: expected '*' or '/'", input.peek());
			}
		}

		JsonFormatException error(String reason, int encountered) {
			return new JsonFormatException(reason, encountered, input.line(), input.column());
		}
	}

	static long saturatedAdd(long a, long b) {
		long sum = a + b;
		// Overflow iff both operands have the same sign and the sum's sign differs
		if (((a ^ sum) & (b ^ sum)) < 0) {
			return (a < 0) ? Long.MIN_VALUE : Long.MAX_VALUE;
		}
		return sum;
	}

	/**
	 * Parses optionally-signed decimal digits, or returns empty if they don't fit in a long.
	 * Accumulates negatively so that {@link Long#MIN_VALUE} is representable.
	 */
	static OptionalLong exactLong(char[] buf, int length) {
		boolean negative = buf[0] == '-';
		int i = negative ? 1 : 0;
		long limit = negative ? Long.MIN_VALUE : -Long.MAX_VALUE;
		long multiplyLimit = limit / 10;
		long result = 0;
		for (; i < length; i++) {
			int digit = buf[i] - '0';
			if (result < multiplyLimit) {
				return OptionalLong.empty();
			}
			result *= 10;
			if (result < limit + digit) {
				return OptionalLong.empty();
			}
			result -= digit;
		}
		return OptionalLong.of(negative ? result : -result);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeParser.class);
}
