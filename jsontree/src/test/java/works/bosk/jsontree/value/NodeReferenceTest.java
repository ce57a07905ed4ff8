package works.bosk.jsontree.value;

import org.junit.jupiter.api.Test;
import works.bosk.jsontree.Json;
import works.bosk.jsontree.exceptions.JsonAccessException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeReferenceTest {

	@Test
	void writingThroughPendingChainCreatesAncestors() {
		JsonObject root = new JsonObject();
		NodeReference ref = root.at("a").at(2);
		assertTrue(ref.isPending());
		assertTrue(ref.isUndefined());
		assertEquals("{}", root.toJson(), "Reading a pending reference changes nothing");

		ref.set(5L);
		assertEquals("{\"a\":[null,null,5]}", root.toJson());
		assertTrue(ref.isReal());
		assertEquals(5, ref.getInteger());
	}

	@Test
	void secondWriteReusesSlot() {
		JsonObject root = new JsonObject();
		NodeReference ref = root.at("x").at("y");
		ref.set("first");
		ref.set("second");
		assertEquals("{\"x\":{\"y\":\"second\"}}", root.toJson());
	}

	@Test
	void siblingPendingReferencesShareCreatedParent() {
		JsonObject root = new JsonObject();
		NodeReference parent = root.at("p");
		NodeReference left = parent.at("l");
		NodeReference right = parent.at("r");
		left.set(1L);
		right.set(2L);
		assertEquals("{\"p\":{\"l\":1,\"r\":2}}", root.toJson());
	}

	@Test
	void existingSlotsAreRealAndWritable() {
		JsonValue root = Json.parse("{\"list\":[10,20,30]}");
		NodeReference ref = root.at("list").at(1);
		assertTrue(ref.isReal());
		assertEquals(20, ref.getInteger());
		ref.set(JsonValue.of(true));
		assertEquals("{\"list\":[10,true,30]}", root.toJson());
	}

	@Test
	void writingPastEndGrowsArrayWithNulls() {
		JsonValue root = Json.parse("[1]");
		root.at(3).set("x");
		assertEquals("[1,null,null,\"x\"]", root.toJson());
	}

	@Test
	void storedValuesAreCopied() {
		JsonObject root = new JsonObject();
		JsonArray source = JsonArray.of(JsonValue.of(1L));
		root.at("copy").set(source);
		source.add(JsonValue.of(2L));
		assertEquals("{\"copy\":[1]}", root.toJson());
		assertNotSame(source, root.get("copy"));
	}

	@Test
	void indexingIntoScalarGoesNowhere() {
		JsonValue root = Json.parse("{\"s\":\"text\",\"n\":null}");
		NodeReference intoString = root.at("s").at("k");
		assertTrue(intoString.isNowhere());
		assertTrue(intoString.isUndefined());
		assertThrows(JsonAccessException.class, () -> intoString.set(1L));
		assertThrows(JsonAccessException.class, () -> root.at("n").at(0).set(1L));
		assertTrue(root.at("n").at(0).at("deeper").isNowhere());
		assertEquals("{\"s\":\"text\",\"n\":null}", root.toJson());
	}

	@Test
	void pendingMemberBesideScalar() {
		JsonValue root = Json.parse("{\"s\":\"text\"}");
		NodeReference ref = root.at("missing").at("s");
		ref.set(1L);
		assertEquals("{\"s\":\"text\",\"missing\":{\"s\":1}}", root.toJson());

		NodeReference wrongKind = root.at("s").at(0);
		assertTrue(wrongKind.isNowhere());
	}

	@Test
	void containerKindMismatchFailsOnWrite() {
		JsonObject root = new JsonObject();
		NodeReference asArray = root.at("c").at(0);
		NodeReference asObject = root.at("c").at("k");
		asArray.set(1L);
		assertThrows(JsonAccessException.class, () -> asObject.set(2L));
		assertEquals("{\"c\":[1]}", root.toJson());
	}

	@Test
	void negativeIndexGoesNowhere() {
		JsonValue root = Json.parse("[1,2]");
		assertTrue(root.at(-1).isNowhere());
		assertThrows(JsonAccessException.class, () -> root.at(-1).set(0L));
	}

	@Test
	void rootCannotBeReplaced() {
		JsonValue root = Json.parse("{}");
		NodeReference ref = NodeReference.to(root);
		assertTrue(ref.isReal());
		assertThrows(JsonAccessException.class, () -> ref.set(1L));
	}

	@Test
	void undefinedRootCannotGrowChildren() {
		NodeReference ref = JsonValue.UNDEFINED.at("a");
		assertTrue(ref.isNowhere());
		assertFalse(ref.isPending());
	}

	@Test
	void readAccessorsWorkThroughReference() {
		JsonValue root = Json.parse("{\"f\":1.5,\"i\":3}");
		assertEquals(1.5, root.at("f").getFloat());
		assertEquals(3.0, root.at("i").getNumber());
		assertEquals(-1, root.at("nope").getIntegerOr(-1));
		assertThrows(JsonAccessException.class, () -> root.at("nope").getString());
	}
}
