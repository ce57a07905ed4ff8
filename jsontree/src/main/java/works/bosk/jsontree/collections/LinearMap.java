package works.bosk.jsontree.collections;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * An insertion-ordered associative container backed by a plain list.
 * <p>
 * Every keyed operation is a linear scan using a {@link KeyMatcher},
 * which lets callers probe with a "view" of a key (say, a {@link CharSequence}
 * pointing into a buffer) without first materializing a real key object.
 * Keys are unique, and a key keeps the position of its first insertion
 * even when its value is later reassigned.
 * <p>
 * Lookups are O(n). JSON objects are usually small enough that this beats
 * hashing, and there's no secondary index to keep in sync.
 * Objects with thousands of members will be slow.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class LinearMap<K, V> implements Iterable<LinearMap.Entry<K, V>> {
	private final ArrayList<Entry<K, V>> entries;
	private final KeyMatcher<? super K> matcher;

	/**
	 * Decides whether a probe identifies a stored key.
	 * The probe need not be of the key type.
	 */
	@FunctionalInterface
	public interface KeyMatcher<K> {
		boolean matches(Object probe, K key);

		static <K> KeyMatcher<K> equality() {
			return (probe, key) -> Objects.equals(probe, key);
		}
	}

	/**
	 * A key-value pair stored in a {@link LinearMap}.
	 * Only the owning map can replace the value.
	 */
	public static final class Entry<K, V> {
		private final K key;
		private V value;

		Entry(K key, V value) {
			this.key = key;
			this.value = value;
		}

		public K key() {
			return key;
		}

		public V value() {
			return value;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Entry<?, ?> other
				&& Objects.equals(key, other.key)
				&& Objects.equals(value, other.value);
		}

		@Override
		public int hashCode() {
			return 31 * Objects.hashCode(key) + Objects.hashCode(value);
		}

		@Override
		public String toString() {
			return key + "=" + value;
		}
	}

	public LinearMap() {
		this(KeyMatcher.equality());
	}

	public LinearMap(KeyMatcher<? super K> matcher) {
		this.entries = new ArrayList<>();
		this.matcher = matcher;
	}

	/**
	 * @return a shallow copy: same keys and values, independent ordering
	 */
	public LinearMap<K, V> copy() {
		LinearMap<K, V> result = new LinearMap<>(matcher);
		result.entries.ensureCapacity(entries.size());
		for (Entry<K, V> e : entries) {
			result.entries.add(new Entry<>(e.key, e.value));
		}
		return result;
	}

	public KeyMatcher<? super K> matcher() {
		return matcher;
	}

	/**
	 * @return the position of the matching key, or -1 if absent
	 */
	public int find(Object probe) {
		for (int i = 0; i < entries.size(); i++) {
			if (matcher.matches(probe, entries.get(i).key)) {
				return i;
			}
		}
		return -1;
	}

	public boolean containsKey(Object probe) {
		return find(probe) >= 0;
	}

	/**
	 * @return 1 if present, else 0
	 */
	public int count(Object probe) {
		return containsKey(probe) ? 1 : 0;
	}

	/**
	 * @return the value for the matching key, or null if absent
	 */
	public V get(Object probe) {
		int i = find(probe);
		return (i < 0) ? null : entries.get(i).value;
	}

	/**
	 * @throws NoSuchElementException if absent
	 */
	public V at(Object probe) {
		int i = find(probe);
		if (i < 0) {
			throw new NoSuchElementException("No such key: " + probe);
		}
		return entries.get(i).value;
	}

	/**
	 * Adds the pair at the end unless the key is already present,
	 * in which case nothing changes.
	 *
	 * @return true if inserted
	 */
	public boolean insert(K key, V value) {
		if (containsKey(key)) {
			return false;
		}
		entries.add(new Entry<>(key, value));
		return true;
	}

	/**
	 * Adds the pair at the end, or if the key is already present,
	 * replaces its value without moving it.
	 *
	 * @return true if inserted, false if assigned
	 */
	public boolean insertOrAssign(K key, V value) {
		int i = find(key);
		if (i >= 0) {
			entries.get(i).value = value;
			return false;
		}
		entries.add(new Entry<>(key, value));
		return true;
	}

	/**
	 * Like {@link #insert} but only calls {@code valueSupplier} if the key is absent.
	 *
	 * @return the entry for {@code key}, whether new or existing
	 */
	public Entry<K, V> tryInsert(K key, Supplier<? extends V> valueSupplier) {
		int i = find(key);
		if (i >= 0) {
			return entries.get(i);
		}
		Entry<K, V> entry = new Entry<>(key, valueSupplier.get());
		entries.add(entry);
		return entry;
	}

	/**
	 * @return the existing value for {@code key}, or a default one that has just been appended
	 */
	public V getOrInsert(K key, Supplier<? extends V> defaultValue) {
		return tryInsert(key, defaultValue).value;
	}

	/**
	 * @return true if something was removed
	 */
	public boolean remove(Object probe) {
		int i = find(probe);
		if (i < 0) {
			return false;
		}
		entries.remove(i);
		return true;
	}

	public Entry<K, V> removeAt(int index) {
		return entries.remove(index);
	}

	public Entry<K, V> entryAt(int index) {
		return entries.get(index);
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public void clear() {
		entries.clear();
	}

	public List<K> keys() {
		return entries.stream().map(Entry::key).toList();
	}

	public List<V> values() {
		return entries.stream().map(Entry::value).toList();
	}

	public Stream<Entry<K, V>> stream() {
		return entries.stream();
	}

	@Override
	public Iterator<Entry<K, V>> iterator() {
		Iterator<Entry<K, V>> iter = entries.iterator();
		return new Iterator<>() {
			@Override
			public boolean hasNext() {
				return iter.hasNext();
			}

			@Override
			public Entry<K, V> next() {
				return iter.next();
			}
		};
	}

	/**
	 * Order-sensitive: two maps with the same pairs in a different order are not equal.
	 */
	@Override
	public boolean equals(Object obj) {
		return obj instanceof LinearMap<?, ?> other && entries.equals(other.entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return entries.toString();
	}
}
