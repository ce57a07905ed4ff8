package works.bosk.jsontree.value;

import works.bosk.jsontree.Json;
import works.bosk.jsontree.codec.GeneratorSettings;

import static java.util.Objects.requireNonNull;

/**
 * A node in a JSON document tree.
 * <p>
 * Scalars are immutable; {@link JsonArray} and {@link JsonObject} are mutable containers
 * that exclusively own their children. Storing a value into a container,
 * directly or through a {@link NodeReference}, stores a {@link #copy() copy},
 * so no two containers ever share a child.
 * <p>
 * {@link #UNDEFINED} is not a JSON literal. It's what lookups return when they miss,
 * and it can't be serialized except as a debug dump.
 */
public sealed interface JsonValue extends JsonView permits
	JsonUndefined,
	JsonNull,
	JsonBoolean,
	JsonInteger,
	JsonFloat,
	JsonString,
	JsonArray,
	JsonObject
{
	JsonValue UNDEFINED = JsonUndefined.INSTANCE;
	JsonValue NULL = JsonNull.INSTANCE;
	JsonValue TRUE = new JsonBoolean(true);
	JsonValue FALSE = new JsonBoolean(false);

	@Override
	JsonType type();

	@Override
	default JsonValue resolve() {
		return this;
	}

	/**
	 * @return a deep copy. Immutable values may return themselves.
	 */
	JsonValue copy();

	/**
	 * Starts a reference chain at this node.
	 * Writing through the chain can create missing descendants; see {@link NodeReference}.
	 */
	default NodeReference at(int index) {
		return NodeReference.to(this).at(index);
	}

	default NodeReference at(String key) {
		return NodeReference.to(this).at(key);
	}

	default String toJson() {
		return Json.serialize(this);
	}

	default String toPrettyJson() {
		return Json.serialize(this, GeneratorSettings.PRETTY);
	}

	static JsonValue of(boolean value) {
		return value ? TRUE : FALSE;
	}

	static JsonValue of(long value) {
		return new JsonInteger(value);
	}

	static JsonValue of(double value) {
		return new JsonFloat(value);
	}

	static JsonValue of(String value) {
		return new JsonString(requireNonNull(value));
	}
}
