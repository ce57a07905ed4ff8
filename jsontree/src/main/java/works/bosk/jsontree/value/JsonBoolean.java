package works.bosk.jsontree.value;

public record JsonBoolean(boolean value) implements JsonValue {
	@Override
	public JsonType type() {
		return JsonType.BOOLEAN;
	}

	@Override
	public JsonValue copy() {
		return this;
	}

	@Override
	public String toString() {
		return Boolean.toString(value);
	}
}
