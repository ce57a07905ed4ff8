package works.bosk.jsontree.value;

/**
 * The discriminant of {@link JsonValue}.
 * Exactly one of these is active for any node.
 */
public enum JsonType {
	/**
	 * "No such node". Produced by lookups that miss; not a JSON literal.
	 */
	UNDEFINED,
	NULL,
	BOOLEAN,
	INTEGER,
	FLOAT,
	STRING,
	ARRAY,
	OBJECT;

	public boolean isNumber() {
		return this == INTEGER || this == FLOAT;
	}
}
