package works.bosk.jsontree.value;

public enum JsonUndefined implements JsonValue {
	INSTANCE;

	@Override
	public JsonType type() {
		return JsonType.UNDEFINED;
	}

	@Override
	public JsonValue copy() {
		return this;
	}

	@Override
	public String toString() {
		return "undefined";
	}
}
