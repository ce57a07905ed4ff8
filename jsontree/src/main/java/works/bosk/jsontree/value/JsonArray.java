package works.bosk.jsontree.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import works.bosk.jsontree.Json;

/**
 * An ordered, mutable sequence of {@link JsonValue}s.
 * The array owns its elements: values passed in are {@link JsonValue#copy() copied},
 * and {@link #copy()} and {@link #equals} are deep.
 */
public final class JsonArray implements JsonValue, Iterable<JsonValue> {
	private final ArrayList<JsonValue> elements;

	public JsonArray() {
		this.elements = new ArrayList<>();
	}

	public JsonArray(List<? extends JsonValue> elements) {
		this.elements = new ArrayList<>(elements.size());
		elements.forEach(this::add);
	}

	public static JsonArray of(JsonValue... elements) {
		return new JsonArray(List.of(elements));
	}

	@Override
	public JsonType type() {
		return JsonType.ARRAY;
	}

	/**
	 * @return an unmodifiable live view of the elements
	 */
	public List<JsonValue> elements() {
		return Collections.unmodifiableList(elements);
	}

	@Override
	public int size() {
		return elements.size();
	}

	public boolean isEmpty() {
		return elements.isEmpty();
	}

	public JsonArray add(JsonValue element) {
		elements.add(element.copy());
		return this;
	}

	/**
	 * Appends a new empty array.
	 *
	 * @return the appended array
	 */
	public JsonArray addArray() {
		JsonArray result = new JsonArray();
		elements.add(result);
		return result;
	}

	/**
	 * Appends a new empty object.
	 *
	 * @return the appended object
	 */
	public JsonObject addObject() {
		JsonObject result = new JsonObject();
		elements.add(result);
		return result;
	}

	/**
	 * @return the element previously at {@code index}
	 * @throws IndexOutOfBoundsException if {@code index} isn't an existing position
	 */
	public JsonValue set(int index, JsonValue element) {
		Objects.checkIndex(index, elements.size());
		return elements.set(index, element.copy());
	}

	public JsonValue remove(int index) {
		return elements.remove(index);
	}

	public void clear() {
		elements.clear();
	}

	/**
	 * Truncates, or pads with {@link JsonValue#NULL}, so that {@link #size()} becomes {@code newSize}.
	 */
	public void resize(int newSize) {
		if (newSize < 0) {
			throw new IllegalArgumentException("Negative size: " + newSize);
		}
		if (newSize < elements.size()) {
			elements.subList(newSize, elements.size()).clear();
		} else {
			elements.ensureCapacity(newSize);
			while (elements.size() < newSize) {
				elements.add(JsonValue.NULL);
			}
		}
	}

	@Override
	public JsonArray copy() {
		JsonArray result = new JsonArray();
		result.elements.ensureCapacity(elements.size());
		for (JsonValue e : elements) {
			result.elements.add(e.copy());
		}
		return result;
	}

	@Override
	public Iterator<JsonValue> iterator() {
		return elements().iterator();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof JsonArray other && elements.equals(other.elements);
	}

	@Override
	public int hashCode() {
		return elements.hashCode();
	}

	@Override
	public String toString() {
		return Json.describe(this);
	}
}
