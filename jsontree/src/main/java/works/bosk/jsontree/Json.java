package works.bosk.jsontree;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import works.bosk.jsontree.codec.FloatFormat;
import works.bosk.jsontree.codec.GeneratorSettings;
import works.bosk.jsontree.codec.ParserSettings;
import works.bosk.jsontree.codec.TreeGenerator;
import works.bosk.jsontree.codec.TreeParser;
import works.bosk.jsontree.codec.io.CharCursor;
import works.bosk.jsontree.exceptions.JsonValueException;
import works.bosk.jsontree.value.JsonValue;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Entry points for converting between JSON text and {@link JsonValue} trees.
 * <p>
 * The {@code parse} methods require the text to hold exactly one value,
 * optionally surrounded by whitespace (and comments, if allowed).
 * The {@code read} methods consume one value from a stream and stop,
 * so a stream holding several concatenated values can be read with repeated calls;
 * pass a {@link java.io.PushbackReader} to avoid losing the lookahead character between calls.
 */
public final class Json {
	private Json() { }

	public static JsonValue parse(String text) {
		return parse(text, ParserSettings.DEFAULT);
	}

	public static JsonValue parse(String text, ParserSettings settings) {
		try (CharCursor cursor = CharCursor.of(text)) {
			return new TreeParser(settings).parseDocument(cursor);
		}
	}

	public static JsonValue parse(char[] text, ParserSettings settings) {
		try (CharCursor cursor = CharCursor.of(text)) {
			return new TreeParser(settings).parseDocument(cursor);
		}
	}

	public static JsonValue read(Reader in) {
		return read(in, ParserSettings.DEFAULT);
	}

	public static JsonValue read(Reader in, ParserSettings settings) {
		try (CharCursor cursor = CharCursor.of(in)) {
			return new TreeParser(settings).parse(cursor);
		}
	}

	/**
	 * Decodes the stream as UTF-8. The stream is buffered, so its position
	 * after this call is unspecified.
	 */
	public static JsonValue read(InputStream in, ParserSettings settings) {
		return read(new BufferedReader(new InputStreamReader(in, UTF_8)), settings);
	}

	public static String serialize(JsonValue value) {
		return serialize(value, GeneratorSettings.COMPACT);
	}

	public static String serialize(JsonValue value, GeneratorSettings settings) {
		StringWriter out = new StringWriter();
		write(out, value, settings);
		return out.toString();
	}

	public static void write(Writer out, JsonValue value) {
		write(out, value, GeneratorSettings.COMPACT);
	}

	public static void write(Writer out, JsonValue value, GeneratorSettings settings) {
		new TreeGenerator(settings).generate(out, value);
	}

	/**
	 * Text for {@link Object#toString()}: compact JSON where possible,
	 * or a debug dump for trees that have no JSON form.
	 */
	public static String describe(JsonValue value) {
		GeneratorSettings settings = GeneratorSettings.COMPACT
			.withFloatFormat(FloatFormat.ROUND_TRIP)
			.withMaxDepth(Integer.MAX_VALUE);
		try {
			return serialize(value, settings);
		} catch (JsonValueException e) {
			return serialize(value, settings.withDebugDump(true));
		}
	}
}
