package io.github.bluuewhale.hashtables;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.Iterator;
import java.util.Map.Entry;
import java.util.NoSuchElementException;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Open addressing over one slot per index. Collisions walk a {@link ProbeSequence} from the
 * key's home index; deletions leave tombstones so that later keys on the same walk stay reachable.
 * Tombstones count towards the load factor and are purged by the next resize.
 */
public abstract class OpenAddressingHashTable<K, V> extends HashTable<K, V> {

	/* Control byte values */
	private static final byte EMPTY = 0;      // fresh slot, ends a probe walk
	private static final byte TOMBSTONE = 1;  // deleted entry
	private static final byte FULL = 2;       // live entry

	/* Defaults */
	protected static final int DEFAULT_INITIAL_CAPACITY = 8;
	protected static final double DEFAULT_LOAD_FACTOR = 0.6d;

	private final ProbeSequence probes;

	/* Storage */
	private byte[] ctrl;
	private Object[] keys;
	private Object[] vals;

	protected OpenAddressingHashTable(ProbeSequence probes, int initialCapacity, double maxLoadFactor,
			int growthFactor) {
		super(initialCapacity, maxLoadFactor, growthFactor);
		this.probes = Objects.requireNonNull(probes, "probes");
	}

	public ProbeSequence probeSequence() {
		return probes;
	}

	@Override
	protected void init(int capacity) {
		this.capacity = capacity;
		this.ctrl = new byte[capacity];
		this.keys = new Object[capacity];
		this.vals = new Object[capacity];
		this.size = 0;
		this.tombstones = 0;
	}

	@Override
	public @Nullable V put(K key, V value) {
		int home = homeIndex(key);
		int firstTombstone = -1;
		int idx = home;
		for (int attempt = 0; attempt < capacity; ) {
			byte c = ctrl[idx];
			if (c == EMPTY) {
				// key is absent: prefer the earliest tombstone on the walk
				insertAt((firstTombstone >= 0) ? firstTombstone : idx, key, value);
				maybeResize();
				return null;
			}
			if (c == TOMBSTONE) {
				if (firstTombstone < 0) firstTombstone = idx;
			} else if (keys[idx].equals(key)) {
				V old = castValue(vals[idx]);
				vals[idx] = value;
				return old;
			}
			idx = probes.advance(idx, ++attempt, capacity);
		}
		// Every reachable slot was checked without a match.
		if (firstTombstone < 0) throw new TableFullException(capacity);
		insertAt(firstTombstone, key, value);
		maybeResize();
		return null;
	}

	@Override
	protected @Nullable Entry<K, V> findEntry(Object key) {
		int idx = findIndex(key);
		return (idx >= 0) ? new SlotRef(idx) : null;
	}

	@Override
	protected @Nullable Entry<K, V> removeEntry(Object key) {
		int idx = findIndex(key);
		if (idx < 0) return null;
		Entry<K, V> removed = new SimpleImmutableEntry<>(castKey(keys[idx]), castValue(vals[idx]));
		deleteAt(idx);
		return removed;
	}

	/* fresh-table insertion used only during resize */
	@Override
	protected void insertFresh(K key, V value) {
		int idx = homeIndex(key);
		for (int attempt = 0; attempt < capacity; ) {
			if (ctrl[idx] == EMPTY) {
				insertAt(idx, key, value);
				return;
			}
			idx = probes.advance(idx, ++attempt, capacity);
		}
		throw new TableFullException(capacity);
	}

	@Override
	protected Iterator<Entry<K, V>> entryIterator() {
		return new SlotIterator();
	}

	/* lookup utilities */
	private int findIndex(Object key) {
		int idx = homeIndex(key);
		for (int attempt = 0; attempt < capacity; ) {
			byte c = ctrl[idx];
			if (c == EMPTY) return -1;
			// tombstones never match; keep walking past them
			if (c == FULL && keys[idx].equals(key)) return idx;
			idx = probes.advance(idx, ++attempt, capacity);
		}
		return -1;
	}

	private void insertAt(int idx, K key, V value) {
		if (ctrl[idx] == TOMBSTONE) tombstones--;
		ctrl[idx] = FULL;
		keys[idx] = key;
		vals[idx] = value;
		size++;
	}

	private void deleteAt(int idx) {
		ctrl[idx] = TOMBSTONE;
		keys[idx] = null;
		vals[idx] = null;
		size--;
		tombstones++;
	}

	/* Slot inspection */
	SlotState stateAt(int idx) {
		switch (ctrl[idx]) {
			case EMPTY: return SlotState.EMPTY;
			case TOMBSTONE: return SlotState.TOMBSTONE;
			default: return SlotState.OCCUPIED;
		}
	}

	K keyAt(int idx) {
		return castKey(keys[idx]);
	}

	V valueAt(int idx) {
		return castValue(vals[idx]);
	}

	/* ------------ Iterator ------------ */

	private final class SlotIterator implements Iterator<Entry<K, V>> {
		private int cursor = 0;
		private int next = -1;
		private int last = -1;

		SlotIterator() {
			advance();
		}

		private void advance() {
			next = -1;
			while (cursor < capacity) {
				int idx = cursor++;
				if (ctrl[idx] == FULL) {
					next = idx;
					return;
				}
			}
		}

		@Override
		public boolean hasNext() {
			return next >= 0;
		}

		@Override
		public Entry<K, V> next() {
			if (next < 0) throw new NoSuchElementException();
			last = next;
			advance();
			return new SlotRef(last);
		}

		@Override
		public void remove() {
			if (last < 0) throw new IllegalStateException();
			if (ctrl[last] == FULL) deleteAt(last);
			last = -1;
		}
	}

	private final class SlotRef implements Entry<K, V> {
		private final int idx;

		SlotRef(int idx) {
			this.idx = idx;
		}

		@Override
		public K getKey() {
			return castKey(keys[idx]);
		}

		@Override
		public V getValue() {
			return castValue(vals[idx]);
		}

		@Override
		public V setValue(V value) {
			V old = castValue(vals[idx]);
			vals[idx] = value;
			return old;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Entry)) return false;
			Entry<?, ?> e = (Entry<?, ?>) o;
			return Objects.equals(getKey(), e.getKey()) && Objects.equals(getValue(), e.getValue());
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(getKey()) ^ Objects.hashCode(getValue());
		}

		@Override
		public String toString() {
			return getKey() + "=" + getValue();
		}
	}
}
