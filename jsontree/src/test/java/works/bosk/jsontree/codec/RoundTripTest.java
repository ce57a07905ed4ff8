package works.bosk.jsontree.codec;

import java.util.Random;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import works.bosk.jsontree.Json;
import works.bosk.jsontree.value.JsonArray;
import works.bosk.jsontree.value.JsonObject;
import works.bosk.jsontree.value.JsonValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.bosk.jsontree.JsonTestUtils.ONE_OF_EACH;

class RoundTripTest {
	static final GeneratorSettings EXACT = GeneratorSettings.COMPACT.withFloatFormat(FloatFormat.ROUND_TRIP);

	@SuppressWarnings("unused")
	static Stream<String> documents() {
		return Stream.of(
			ONE_OF_EACH,
			"[]",
			"{}",
			"\"\"",
			"[[[[]]],{\"\":{}}]",
			"{\"z\":1,\"a\":2,\"m\":3}",
			"[0,-0,1e-300,-1.7976931348623157e308,4.9e-324,123456789012345678]",
			"\"\\u0000\\u001f\\\"\\\\ \\ud83d\\ude03 \\u00e9\""
		);
	}

	@ParameterizedTest
	@MethodSource("documents")
	void exactFormatPreservesTree(String json) {
		JsonValue original = Json.parse(json);
		for (GeneratorSettings settings : new GeneratorSettings[] { EXACT, EXACT.withPretty(true) }) {
			String text = Json.serialize(original, settings);
			assertEquals(original, Json.parse(text), text);
		}
	}

	@ParameterizedTest
	@MethodSource("documents")
	void reserializingIsIdempotent(String json) {
		String once = Json.serialize(Json.parse(json));
		String twice = Json.serialize(Json.parse(once));
		assertEquals(once, twice);
	}

	@Test
	void randomFloatsSurviveExactFormat() {
		Random r = new Random(123);
		JsonArray array = new JsonArray();
		for (int i = 0; i < 1000; i++) {
			array.add(JsonValue.of(Double.longBitsToDouble(r.nextLong())));
		}
		// NaN has no JSON form
		for (int i = 0; i < array.size(); i++) {
			if (Double.isNaN(array.get(i).getFloat())) {
				array.set(i, JsonValue.of(0.5));
			}
		}
		assertEquals(array, Json.parse(Json.serialize(array, EXACT)));
	}

	@Test
	void builtTreeRoundTrips() {
		JsonObject root = new JsonObject();
		root.at("name").set("widget");
		root.at("tags").at(1).set("blue");
		root.at("size").at("w").set(2.5);
		root.at("size").at("h").set(3L);
		String text = root.toJson();
		assertEquals("{\"name\":\"widget\",\"tags\":[null,\"blue\"],\"size\":{\"w\":2.5,\"h\":3}}", text);
		assertEquals(root, Json.parse(text));
	}
}
