package works.bosk.jsontree.value;

public record JsonInteger(long value) implements JsonValue {
	@Override
	public JsonType type() {
		return JsonType.INTEGER;
	}

	@Override
	public JsonValue copy() {
		return this;
	}

	@Override
	public String toString() {
		return Long.toString(value);
	}
}
