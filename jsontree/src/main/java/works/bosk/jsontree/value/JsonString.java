package works.bosk.jsontree.value;

import works.bosk.jsontree.Json;

import static java.util.Objects.requireNonNull;

public record JsonString(String value) implements JsonValue {
	public JsonString {
		requireNonNull(value);
	}

	@Override
	public JsonType type() {
		return JsonType.STRING;
	}

	@Override
	public JsonValue copy() {
		return this;
	}

	@Override
	public String toString() {
		return Json.describe(this);
	}
}
