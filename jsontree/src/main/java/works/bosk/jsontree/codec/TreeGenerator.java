package works.bosk.jsontree.codec;

import java.io.PrintWriter;
import java.io.Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.jsontree.collections.LinearMap.Entry;
import works.bosk.jsontree.exceptions.JsonValueException;
import works.bosk.jsontree.value.JsonArray;
import works.bosk.jsontree.value.JsonBoolean;
import works.bosk.jsontree.value.JsonFloat;
import works.bosk.jsontree.value.JsonInteger;
import works.bosk.jsontree.value.JsonObject;
import works.bosk.jsontree.value.JsonString;
import works.bosk.jsontree.value.JsonValue;

import static works.bosk.jsontree.codec.Token.COLON;
import static works.bosk.jsontree.codec.Token.COMMA;
import static works.bosk.jsontree.codec.Token.END_ARRAY;
import static works.bosk.jsontree.codec.Token.END_OBJECT;
import static works.bosk.jsontree.codec.Token.FALSE;
import static works.bosk.jsontree.codec.Token.NULL;
import static works.bosk.jsontree.codec.Token.START_ARRAY;
import static works.bosk.jsontree.codec.Token.START_OBJECT;
import static works.bosk.jsontree.codec.Token.TRUE;

/**
 * Writes a {@link JsonValue} tree as JSON text.
 * <p>
 * Infinities are written as {@code 1.0e999999999} and {@code -1.0e999999999},
 * which any reader that saturates out-of-range exponents will read back as infinity.
 * NaN and undefined nodes have no JSON form, and are rejected with
 * {@link JsonValueException} unless {@link GeneratorSettings#debugDump()} is on.
 * <p>
 * Errors from the underlying {@link Writer} are reported as {@link IllegalStateException}.
 */
public class TreeGenerator implements Generator {
	static final String POSITIVE_INFINITY = "1.0e999999999";
	static final String NEGATIVE_INFINITY = "-1.0e999999999";
	static final String INDENT = "  ";

	private final GeneratorSettings settings;

	public TreeGenerator(GeneratorSettings settings) {
		this.settings = settings;
	}

	public GeneratorSettings settings() {
		return settings;
	}

	@Override
	public void generate(Writer out, JsonValue value) {
		LOGGER.debug("Generating JSON for {} using {}", value.type(), settings);
		PrintWriter printWriter;
		if (out instanceof PrintWriter pw) {
			printWriter = pw;
		} else {
			printWriter = new PrintWriter(out);
		}
		new Session(printWriter, settings).generateAny(value);
		if (printWriter.checkError()) {
			// checkError also flushes
			throw new IllegalStateException("Error writing JSON text");
		}
	}

	static final class Session {
		final PrintWriter out;
		final GeneratorSettings settings;
		final boolean indents;
		final StringBuilder scratch = new StringBuilder();
		String indentation = "";
		int depth = 0;

		Session(PrintWriter out, GeneratorSettings settings) {
			this.out = out;
			this.settings = settings;
			this.indents = settings.indents();
		}

		void generateAny(JsonValue value) {
			switch (value.type()) {
				case UNDEFINED -> generateUndefined();
				case NULL -> {
					annotate("NULL");
					out.print(NULL.fixedRepresentation());
				}
				case BOOLEAN -> {
					annotate("BOOLEAN");
					out.print(((JsonBoolean) value).value() ? TRUE.fixedRepresentation() : FALSE.fixedRepresentation());
				}
				case INTEGER -> {
					annotate("INTEGER");
					out.print(((JsonInteger) value).value());
				}
				case FLOAT -> {
					annotate("FLOATING");
					generateFloat(((JsonFloat) value).value());
				}
				case STRING -> {
					String s = ((JsonString) value).value();
					annotate("STRING[" + s.length() + "]");
					generateString(s);
				}
				case ARRAY -> generateArray((JsonArray) value);
				case OBJECT -> generateObject((JsonObject) value);
			}
		}

		private void generateUndefined() {
			if (settings.debugDump()) {
				annotate("UNDEFINED");
				out.print("undefined /* not allowed */");
			} else {
				throw new JsonValueException("Undefined node cannot be written as JSON");
			}
		}

		private void generateFloat(double value) {
			if (Double.isNaN(value)) {
				if (settings.debugDump()) {
					out.print("NaN /* not allowed */");
				} else {
					throw new JsonValueException("NaN cannot be written as JSON");
				}
			} else if (value == Double.POSITIVE_INFINITY) {
				out.print(POSITIVE_INFINITY);
			} else if (value == Double.NEGATIVE_INFINITY) {
				out.print(NEGATIVE_INFINITY);
			} else {
				out.print(FloatFormatter.format(value, settings.floatFormat()));
			}
		}

		private void generateString(String value) {
			scratch.setLength(0);
			StringEscapes.appendQuoted(scratch, value);
			out.append(scratch);
		}

		private void generateArray(JsonArray array) {
			annotate("ARRAY[" + array.size() + "]");
			enter();
			out.print(START_ARRAY.fixedRepresentation());
			if (!array.isEmpty()) {
				String outerIndentation = indentation;
				if (indents) {
					indentation += INDENT;
				}
				newline();
				String sep = "";
				for (JsonValue element : array) {
					out.print(sep);
					sep = separator();
					indent();
					generateAny(element);
				}
				indentation = outerIndentation;
				newline();
				indent();
			}
			out.print(END_ARRAY.fixedRepresentation());
			depth--;
		}

		private void generateObject(JsonObject object) {
			annotate("OBJECT[" + object.size() + "]");
			enter();
			out.print(START_OBJECT.fixedRepresentation());
			if (!object.isEmpty()) {
				String outerIndentation = indentation;
				if (indents) {
					indentation += INDENT;
				}
				newline();
				String sep = "";
				for (Entry<String, JsonValue> member : object) {
					out.print(sep);
					sep = separator();
					indent();
					generateString(member.key());
					out.print(COLON.fixedRepresentation());
					if (indents) {
						out.print(' ');
					}
					generateAny(member.value());
				}
				indentation = outerIndentation;
				newline();
				indent();
			}
			out.print(END_OBJECT.fixedRepresentation());
			depth--;
		}

		private void indent() {
			if (indents) {
				out.print(indentation);
			}
		}

		private void enter() {
			if (++depth > settings.maxDepth()) {
				throw new JsonValueException("Nesting depth exceeds " + settings.maxDepth());
			}
		}

		private String separator() {
			return indents ? COMMA.fixedRepresentation() + "\n" : COMMA.fixedRepresentation();
		}

		private void newline() {
			if (indents) {
				out.print('\n');
			}
		}

		private void annotate(String description) {
			if (settings.debugDump()) {
				out.print("/***  ");
				out.print(description);
				out.print("  ***/ ");
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeGenerator.class);
}
