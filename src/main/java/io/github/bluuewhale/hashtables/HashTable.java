package io.github.bluuewhale.hashtables;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

import org.jspecify.annotations.Nullable;

/**
 * Shared state of an array-backed hash table: capacity, element and tombstone counts, and the
 * load-factor driven resize that every collision strategy reuses.
 *
 * <p>Null keys are rejected, null values are allowed. {@link #lookup} and {@link #delete} report an
 * absent key with {@link KeyNotFoundException}; the plain {@link Map} methods {@link #get} and
 * {@link #remove} answer {@code null} instead, as the {@code Map} contract requires.
 */
public abstract class HashTable<K, V> extends AbstractMap<K, V> {

	protected static final int DEFAULT_GROWTH_FACTOR = 2;

	protected int capacity;
	protected int size;
	protected int tombstones;
	protected final double maxLoadFactor;
	protected final int growthFactor;

	protected HashTable(int initialCapacity, double maxLoadFactor, int growthFactor) {
		Utils.validateCapacity(initialCapacity);
		Utils.validateLoadFactor(maxLoadFactor);
		Utils.validateGrowthFactor(growthFactor);
		this.maxLoadFactor = maxLoadFactor;
		this.growthFactor = growthFactor;
		init(initialCapacity);
	}

	@Override
	public int size() {
		return size;
	}

	@Override
	public boolean isEmpty() {
		return size == 0;
	}

	public int capacity() {
		return capacity;
	}

	public int tombstones() {
		return tombstones;
	}

	public double maxLoadFactor() {
		return maxLoadFactor;
	}

	public int growthFactor() {
		return growthFactor;
	}

	/**
	 * Used slots over capacity. Tombstones count as used, so for chaining this is simply
	 * entries per bucket.
	 */
	public double loadFactor() {
		return (double) (size + tombstones) / capacity;
	}

	@Override
	public boolean containsKey(Object key) {
		return findEntry(key) != null;
	}

	@Override
	public @Nullable V get(Object key) {
		Entry<K, V> e = findEntry(key);
		return (e != null) ? e.getValue() : null;
	}

	/**
	 * Returns the value mapped to {@code key}.
	 *
	 * @throws KeyNotFoundException if the table holds no mapping for {@code key}
	 */
	public V lookup(Object key) {
		Entry<K, V> e = findEntry(key);
		if (e == null) throw new KeyNotFoundException(key);
		return e.getValue();
	}

	@Override
	public @Nullable V remove(Object key) {
		Entry<K, V> removed = removeEntry(key);
		return (removed != null) ? removed.getValue() : null;
	}

	/**
	 * Removes the mapping for {@code key} and returns its value.
	 *
	 * @throws KeyNotFoundException if the table holds no mapping for {@code key}
	 */
	public V delete(Object key) {
		Entry<K, V> removed = removeEntry(key);
		if (removed == null) throw new KeyNotFoundException(key);
		return removed.getValue();
	}

	@Override
	public void clear() {
		init(capacity);
	}

	@Override
	public Set<Entry<K, V>> entrySet() {
		return new EntrySet();
	}

	/* Hooks for subclasses */

	/** Allocates empty storage of the given capacity and resets all counters. */
	protected abstract void init(int capacity);

	protected abstract @Nullable Entry<K, V> findEntry(Object key);

	/** Removes the mapping for {@code key}, returning a detached copy of it, or null if absent. */
	protected abstract @Nullable Entry<K, V> removeEntry(Object key);

	/** Places a key known to be absent into storage that has no tombstones; never resizes. */
	protected abstract void insertFresh(K key, V value);

	/** Live entries in slot order. */
	protected abstract Iterator<Entry<K, V>> entryIterator();

	/* Resize */

	/** Runs after an insertion; the table may sit above its max load factor until this call. */
	protected final void maybeResize() {
		if (loadFactor() > maxLoadFactor) {
			resize();
		}
	}

	protected final void resize() {
		int newCapacity = Math.multiplyExact(capacity, growthFactor);
		Object[] live = new Object[size * 2];
		int n = 0;
		for (Iterator<Entry<K, V>> it = entryIterator(); it.hasNext(); ) {
			Entry<K, V> e = it.next();
			live[n++] = e.getKey();
			live[n++] = e.getValue();
		}

		// Tombstones are dropped here: only live pairs are carried over.
		init(newCapacity);
		for (int i = 0; i < n; i += 2) {
			insertFresh(castKey(live[i]), castValue(live[i + 1]));
		}
	}

	/* Common utilities */
	protected int hashNonNull(Object key) {
		if (key == null) throw new NullPointerException("Null keys not supported");
		return key.hashCode();
	}

	protected int homeIndex(Object key) {
		return Utils.homeIndex(hashNonNull(key), capacity);
	}

	@SuppressWarnings("unchecked")
	protected final K castKey(Object key) {
		return (K) key;
	}

	@SuppressWarnings("unchecked")
	protected final V castValue(Object value) {
		return (V) value;
	}

	private final class EntrySet extends AbstractSet<Entry<K, V>> {
		@Override
		public int size() {
			return HashTable.this.size;
		}

		@Override
		public void clear() {
			HashTable.this.clear();
		}

		@Override
		public Iterator<Entry<K, V>> iterator() {
			return entryIterator();
		}
	}
}
