package works.bosk.jsontree.value;

import works.bosk.jsontree.exceptions.JsonAccessException;

import static java.util.Objects.requireNonNull;

/**
 * A cursor onto a node, or onto a place where a node could be.
 * <p>
 * A reference is in one of three states:
 * <dl>
 *     <dt>Real</dt>
 *     <dd>
 *         It designates an existing slot: the root it was created from,
 *         an element of an array, or a member of an object.
 *     </dd>
 *     <dt>Pending</dt>
 *     <dd>
 *         It designates a slot that doesn't exist yet: an array index past the end,
 *         an absent object member, or any child of another pending slot.
 *         Reading it yields {@link JsonValue#UNDEFINED} until the slot exists.
 *         Writing it creates the slot, along with any missing ancestors,
 *         and the reference becomes real.
 *     </dd>
 *     <dt>Nowhere</dt>
 *     <dd>
 *         Indexing reached into a scalar or null, or used a negative index.
 *         Reading yields {@link JsonValue#UNDEFINED}; writing throws {@link JsonAccessException}.
 *     </dd>
 * </dl>
 * Missing ancestors are created as arrays when the next step is an index,
 * and as objects when it is a key. Arrays are padded with {@link JsonValue#NULL}.
 * <p>
 * A reference holds on to the container it designates, so it must not be used
 * after that container has been structurally modified by other means.
 */
public final class NodeReference implements JsonView {
	private Target target;

	private NodeReference(Target target) {
		this.target = target;
	}

	/**
	 * A read-only reference to {@code root} itself.
	 * Its children can be written; the root can't be replaced.
	 */
	public static NodeReference to(JsonValue root) {
		return new NodeReference(new Root(requireNonNull(root)));
	}

	private sealed interface Target { }
	private record Nowhere() implements Target { }
	private record Root(JsonValue value) implements Target { }
	private record Element(JsonArray array, int index) implements Target { }
	private record Member(JsonObject object, String key) implements Target { }
	private record PendingElement(NodeReference parent, int index) implements Target { }
	private record PendingMember(NodeReference parent, String key) implements Target { }

	private static final Nowhere NOWHERE = new Nowhere();

	public boolean isPending() {
		return target instanceof PendingElement || target instanceof PendingMember;
	}

	public boolean isNowhere() {
		return target instanceof Nowhere;
	}

	/**
	 * @return true if this designates an existing slot
	 */
	public boolean isReal() {
		return !isPending() && !isNowhere();
	}

	@Override
	public JsonValue resolve() {
		if (target instanceof Root r) {
			return r.value();
		} else if (target instanceof Element e) {
			return e.array().get(e.index());
		} else if (target instanceof Member m) {
			return m.object().get(m.key());
		} else if (target instanceof PendingElement p) {
			// The slot may since have been created through another reference
			return p.parent().resolve().get(p.index());
		} else if (target instanceof PendingMember p) {
			return p.parent().resolve().get(p.key());
		} else {
			return JsonValue.UNDEFINED;
		}
	}

	public NodeReference at(int index) {
		if (index < 0 || isNowhere()) {
			return nowhere();
		}
		if (isPending()) {
			return new NodeReference(new PendingElement(this, index));
		}
		JsonValue current = resolve();
		if (current instanceof JsonArray a) {
			if (index < a.size()) {
				return new NodeReference(new Element(a, index));
			} else {
				return new NodeReference(new PendingElement(this, index));
			}
		} else if (canMaterialize(current)) {
			return new NodeReference(new PendingElement(this, index));
		} else {
			return nowhere();
		}
	}

	public NodeReference at(String key) {
		requireNonNull(key);
		if (isNowhere()) {
			return nowhere();
		}
		if (isPending()) {
			return new NodeReference(new PendingMember(this, key));
		}
		JsonValue current = resolve();
		if (current instanceof JsonObject o) {
			if (o.containsKey(key)) {
				return new NodeReference(new Member(o, key));
			} else {
				return new NodeReference(new PendingMember(this, key));
			}
		} else if (canMaterialize(current)) {
			return new NodeReference(new PendingMember(this, key));
		} else {
			return nowhere();
		}
	}

	/**
	 * Stores a deep copy of {@code value} in the designated slot,
	 * creating the slot and its missing ancestors if this reference is pending.
	 *
	 * @return this reference, which is now real
	 * @throws JsonAccessException if this reference is nowhere or designates a root,
	 * or if a missing ancestor would have to be created inside a non-container
	 */
	public NodeReference set(JsonValue value) {
		store(requireNonNull(value));
		return this;
	}

	public NodeReference set(boolean value) {
		return set(JsonValue.of(value));
	}

	public NodeReference set(long value) {
		return set(JsonValue.of(value));
	}

	public NodeReference set(double value) {
		return set(JsonValue.of(value));
	}

	public NodeReference set(String value) {
		return set(JsonValue.of(value));
	}

	public NodeReference setNull() {
		return set(JsonValue.NULL);
	}

	private void store(JsonValue value) {
		if (target instanceof Element e) {
			storeElement(e.array(), e.index(), value);
		} else if (target instanceof Member m) {
			m.object().put(m.key(), value);
		} else if (target instanceof PendingElement p) {
			JsonArray array = (JsonArray) p.parent().containerForWrite(JsonType.ARRAY);
			storeElement(array, p.index(), value);
			target = new Element(array, p.index());
		} else if (target instanceof PendingMember p) {
			JsonObject object = (JsonObject) p.parent().containerForWrite(JsonType.OBJECT);
			object.put(p.key(), value);
			target = new Member(object, p.key());
		} else if (target instanceof Root) {
			throw new JsonAccessException("Cannot replace the root node through a reference");
		} else {
			throw new JsonAccessException("Cannot write through a reference to nowhere");
		}
	}

	private static void storeElement(JsonArray array, int index, JsonValue value) {
		if (index >= array.size()) {
			array.resize(index + 1);
		}
		array.set(index, value);
	}

	/**
	 * @return the container of the given kind that this reference designates,
	 * first creating it if the slot is empty
	 */
	private JsonValue containerForWrite(JsonType kind) {
		JsonValue current = resolve();
		if (current.type() == kind) {
			return current;
		} else if (canMaterialize(current)) {
			store((kind == JsonType.ARRAY) ? new JsonArray() : new JsonObject());
			return resolve();
		} else {
			throw new JsonAccessException("Cannot create " + kind + " child inside " + current.type() + " node");
		}
	}

	/**
	 * An empty slot can take a new container; the root and nowhere can't.
	 */
	private boolean canMaterialize(JsonValue current) {
		return current.isUndefined() && !(target instanceof Root) && !isNowhere();
	}

	private static NodeReference nowhere() {
		return new NodeReference(NOWHERE);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + target.getClass().getSimpleName() + ")";
	}
}
