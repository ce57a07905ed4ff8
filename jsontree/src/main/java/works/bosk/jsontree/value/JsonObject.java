package works.bosk.jsontree.value;

import java.util.Iterator;
import java.util.List;
import works.bosk.jsontree.Json;
import works.bosk.jsontree.collections.LinearMap;
import works.bosk.jsontree.collections.LinearMap.Entry;
import works.bosk.jsontree.collections.LinearMap.KeyMatcher;

import static java.util.Objects.requireNonNull;

/**
 * An insertion-ordered, mutable collection of named {@link JsonValue}s with unique names.
 * <p>
 * Members are held in a {@link LinearMap} whose keys match any {@link CharSequence}
 * with the same characters, so lookups don't need a {@link String}.
 * Reassigning an existing member keeps its original position.
 * Values passed in are {@link JsonValue#copy() copied}, so the object owns all its members.
 */
public final class JsonObject implements JsonValue, Iterable<Entry<String, JsonValue>> {
	private static final KeyMatcher<String> KEY_MATCHER = (probe, key) ->
		probe instanceof CharSequence cs && key.contentEquals(cs);

	private final LinearMap<String, JsonValue> members = new LinearMap<>(KEY_MATCHER);

	public static JsonObject with(String key, JsonValue value) {
		return new JsonObject().put(key, value);
	}

	@Override
	public JsonType type() {
		return JsonType.OBJECT;
	}

	/**
	 * @return the live member container
	 */
	LinearMap<String, JsonValue> members() {
		return members;
	}

	@Override
	public int size() {
		return members.size();
	}

	public boolean isEmpty() {
		return members.isEmpty();
	}

	public List<String> keys() {
		return members.keys();
	}

	public boolean containsKey(CharSequence key) {
		return members.containsKey(key);
	}

	/**
	 * Adds the member at the end, or replaces the value of an existing member in place.
	 */
	public JsonObject put(String key, JsonValue value) {
		members.insertOrAssign(requireNonNull(key), value.copy());
		return this;
	}

	/**
	 * Like {@link #put}, with a new empty array as the value.
	 *
	 * @return the new array
	 */
	public JsonArray putArray(String key) {
		JsonArray result = new JsonArray();
		members.insertOrAssign(requireNonNull(key), result);
		return result;
	}

	/**
	 * Like {@link #put}, with a new empty object as the value.
	 *
	 * @return the new object
	 */
	public JsonObject putObject(String key) {
		JsonObject result = new JsonObject();
		members.insertOrAssign(requireNonNull(key), result);
		return result;
	}

	/**
	 * Adds the member at the end unless one with this name already exists.
	 *
	 * @return true if added
	 */
	public boolean insert(String key, JsonValue value) {
		return members.insert(requireNonNull(key), value.copy());
	}

	public boolean remove(CharSequence key) {
		return members.remove(key);
	}

	public void clear() {
		members.clear();
	}

	@Override
	public JsonObject copy() {
		JsonObject result = new JsonObject();
		for (Entry<String, JsonValue> e : members) {
			result.members.insert(e.key(), e.value().copy());
		}
		return result;
	}

	@Override
	public Iterator<Entry<String, JsonValue>> iterator() {
		return members.iterator();
	}

	/**
	 * Order-sensitive, like the underlying {@link LinearMap}.
	 */
	@Override
	public boolean equals(Object obj) {
		return obj instanceof JsonObject other && members.equals(other.members);
	}

	@Override
	public int hashCode() {
		return members.hashCode();
	}

	@Override
	public String toString() {
		return Json.describe(this);
	}
}
