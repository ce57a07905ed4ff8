package works.bosk.jsontree.value;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import works.bosk.jsontree.exceptions.JsonAccessException;

/**
 * Read access to a node, shared by {@link JsonValue} itself and by {@link NodeReference},
 * which reads whatever node it currently points at.
 * <p>
 * There are two tiers of accessor:
 * <ul>
 *     <li>
 *         {@code getX()} <em>requires</em> the node to be of type X,
 *         and throws {@link JsonAccessException} otherwise;
 *     </li>
 *     <li>
 *         {@code getXOr(default)} and {@code asX()} merely <em>probe</em>,
 *         and never throw.
 *     </li>
 * </ul>
 * Child lookups via {@link #get(int)} and {@link #get(String)} never throw either:
 * a miss of any kind yields {@link JsonValue#UNDEFINED}, so lookups can be chained freely.
 */
public interface JsonView {
	/**
	 * @return the node this view currently represents; never null
	 */
	JsonValue resolve();

	default JsonType type() {
		return resolve().type();
	}

	default boolean isDefined() {
		return type() != JsonType.UNDEFINED;
	}

	default boolean isUndefined() {
		return type() == JsonType.UNDEFINED;
	}

	default boolean isNull() {
		return type() == JsonType.NULL;
	}

	default boolean isBoolean() {
		return type() == JsonType.BOOLEAN;
	}

	default boolean isInteger() {
		return type() == JsonType.INTEGER;
	}

	default boolean isFloat() {
		return type() == JsonType.FLOAT;
	}

	/**
	 * @return true for both {@link JsonType#INTEGER} and {@link JsonType#FLOAT}
	 */
	default boolean isNumber() {
		return type().isNumber();
	}

	default boolean isString() {
		return type() == JsonType.STRING;
	}

	default boolean isArray() {
		return type() == JsonType.ARRAY;
	}

	default boolean isObject() {
		return type() == JsonType.OBJECT;
	}

	//
	// Booleans
	//

	default boolean getBoolean() {
		if (resolve() instanceof JsonBoolean b) {
			return b.value();
		}
		throw mismatch(JsonType.BOOLEAN);
	}

	default boolean getBooleanOr(boolean defaultValue) {
		return (resolve() instanceof JsonBoolean b) ? b.value() : defaultValue;
	}

	default Optional<Boolean> asBoolean() {
		return (resolve() instanceof JsonBoolean b) ? Optional.of(b.value()) : Optional.empty();
	}

	//
	// Integers
	//

	default long getInteger() {
		if (resolve() instanceof JsonInteger i) {
			return i.value();
		}
		throw mismatch(JsonType.INTEGER);
	}

	default long getIntegerOr(long defaultValue) {
		return (resolve() instanceof JsonInteger i) ? i.value() : defaultValue;
	}

	default OptionalLong asInteger() {
		return (resolve() instanceof JsonInteger i) ? OptionalLong.of(i.value()) : OptionalLong.empty();
	}

	//
	// Floats
	//

	default double getFloat() {
		if (resolve() instanceof JsonFloat f) {
			return f.value();
		}
		throw mismatch(JsonType.FLOAT);
	}

	default double getFloatOr(double defaultValue) {
		return (resolve() instanceof JsonFloat f) ? f.value() : defaultValue;
	}

	default OptionalDouble asFloat() {
		return (resolve() instanceof JsonFloat f) ? OptionalDouble.of(f.value()) : OptionalDouble.empty();
	}

	//
	// Numbers: either of the above, read as a double
	//

	default double getNumber() {
		OptionalDouble result = asNumber();
		if (result.isPresent()) {
			return result.getAsDouble();
		}
		throw new JsonAccessException("Expected a number but node is " + type());
	}

	default double getNumberOr(double defaultValue) {
		return asNumber().orElse(defaultValue);
	}

	default OptionalDouble asNumber() {
		JsonValue value = resolve();
		if (value instanceof JsonInteger i) {
			return OptionalDouble.of(i.value());
		} else if (value instanceof JsonFloat f) {
			return OptionalDouble.of(f.value());
		} else {
			return OptionalDouble.empty();
		}
	}

	//
	// Strings
	//

	default String getString() {
		if (resolve() instanceof JsonString s) {
			return s.value();
		}
		throw mismatch(JsonType.STRING);
	}

	default String getStringOr(String defaultValue) {
		return (resolve() instanceof JsonString s) ? s.value() : defaultValue;
	}

	default Optional<String> asString() {
		return (resolve() instanceof JsonString s) ? Optional.of(s.value()) : Optional.empty();
	}

	//
	// Containers. These return the live container, not a copy.
	//

	default JsonArray getArray() {
		if (resolve() instanceof JsonArray a) {
			return a;
		}
		throw mismatch(JsonType.ARRAY);
	}

	default JsonArray getArrayOr(JsonArray defaultValue) {
		return (resolve() instanceof JsonArray a) ? a : defaultValue;
	}

	default Optional<JsonArray> asArray() {
		return (resolve() instanceof JsonArray a) ? Optional.of(a) : Optional.empty();
	}

	default JsonObject getObject() {
		if (resolve() instanceof JsonObject o) {
			return o;
		}
		throw mismatch(JsonType.OBJECT);
	}

	default JsonObject getObjectOr(JsonObject defaultValue) {
		return (resolve() instanceof JsonObject o) ? o : defaultValue;
	}

	default Optional<JsonObject> asObject() {
		return (resolve() instanceof JsonObject o) ? Optional.of(o) : Optional.empty();
	}

	//
	// Children
	//

	/**
	 * @return the number of elements or members of a container; zero for anything else
	 */
	default int size() {
		JsonValue value = resolve();
		if (value instanceof JsonArray a) {
			return a.elements().size();
		} else if (value instanceof JsonObject o) {
			return o.members().size();
		} else {
			return 0;
		}
	}

	/**
	 * @return the element at {@code index}, or {@link JsonValue#UNDEFINED}
	 * if this isn't an array or the index is out of range
	 */
	default JsonValue get(int index) {
		if (resolve() instanceof JsonArray a && index >= 0 && index < a.elements().size()) {
			return a.elements().get(index);
		}
		return JsonValue.UNDEFINED;
	}

	/**
	 * @return the member named {@code key}, or {@link JsonValue#UNDEFINED}
	 * if this isn't an object or has no such member
	 */
	default JsonValue get(String key) {
		if (resolve() instanceof JsonObject o) {
			JsonValue result = o.members().get(key);
			if (result != null) {
				return result;
			}
		}
		return JsonValue.UNDEFINED;
	}

	private JsonAccessException mismatch(JsonType expected) {
		return new JsonAccessException("Expected " + expected + " but node is " + type());
	}
}
