package works.bosk.jsontree;

import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import works.bosk.jsontree.codec.FloatFormat;
import works.bosk.jsontree.codec.GeneratorSettings;
import works.bosk.jsontree.value.JsonValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.bosk.jsontree.JsonTestUtils.ONE_OF_EACH;
import static works.bosk.jsontree.JsonTestUtils.jacksonView;
import static works.bosk.jsontree.JsonTestUtils.plainView;
import static works.bosk.jsontree.JsonTestUtils.widened;

/**
 * Checks that we read standard JSON the same way Jackson does,
 * and that Jackson can read what we write.
 */
class JacksonConformanceTest {

	@SuppressWarnings("unused")
	static Stream<String> documents() {
		return Stream.of(
			ONE_OF_EACH,
			"[1, -2, 3.5, -4.25e3, 0.001, 1E10, 9223372036854775807]",
			"{\"nested\": {\"deeper\": {\"deepest\": [true, false, null]}}}",
			"\"escapes: \\\" \\\\ \\/ \\b \\f \\n \\r \\t \\u00e9 \\ud83d\\ude03\"",
			"{\"dup\": 1, \"other\": 2, \"dup\": 3}",
			"  [ ]  ",
			"{\"unicode key é\": \"value ☃\"}"
		);
	}

	@ParameterizedTest
	@MethodSource("documents")
	void parsesLikeJackson(String json) {
		assertEquals(widened(jacksonView(json)), plainView(Json.parse(json)));
	}

	@ParameterizedTest
	@MethodSource("documents")
	void jacksonReadsOurOutput(String json) {
		JsonValue tree = Json.parse(json);
		GeneratorSettings exact = GeneratorSettings.COMPACT.withFloatFormat(FloatFormat.ROUND_TRIP);
		for (GeneratorSettings settings : new GeneratorSettings[] { exact, exact.withPretty(true) }) {
			String text = Json.serialize(tree, settings);
			assertEquals(plainView(tree), widened(jacksonView(text)), text);
		}
	}
}
