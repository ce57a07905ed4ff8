package works.bosk.jsontree.value;

public enum JsonNull implements JsonValue {
	INSTANCE;

	@Override
	public JsonType type() {
		return JsonType.NULL;
	}

	@Override
	public JsonValue copy() {
		return this;
	}

	@Override
	public String toString() {
		return "null";
	}
}
