package io.github.bluuewhale.hashtables;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map.Entry;
import java.util.NoSuchElementException;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Separate chaining: each index holds a bucket of entries in append order. A bucket is only
 * allocated by its first insertion and is released again when its last entry is deleted, so no
 * tombstones are needed and the load factor may exceed 1.0.
 */
public class ChainingHashTable<K, V> extends HashTable<K, V> {

	/* Defaults */
	private static final int DEFAULT_INITIAL_CAPACITY = 8;
	private static final double DEFAULT_LOAD_FACTOR = 1.0d;

	/* Storage: null marks an empty bucket */
	private ArrayDeque<Node<K, V>>[] buckets;

	public ChainingHashTable() {
		this(DEFAULT_INITIAL_CAPACITY, DEFAULT_LOAD_FACTOR);
	}

	public ChainingHashTable(int initialCapacity) {
		this(initialCapacity, DEFAULT_LOAD_FACTOR);
	}

	public ChainingHashTable(int initialCapacity, double maxLoadFactor) {
		this(initialCapacity, maxLoadFactor, DEFAULT_GROWTH_FACTOR);
	}

	public ChainingHashTable(int initialCapacity, double maxLoadFactor, int growthFactor) {
		super(initialCapacity, maxLoadFactor, growthFactor);
	}

	@Override
	@SuppressWarnings("unchecked")
	protected void init(int capacity) {
		this.capacity = capacity;
		this.buckets = (ArrayDeque<Node<K, V>>[]) new ArrayDeque<?>[capacity];
		this.size = 0;
		this.tombstones = 0;
	}

	@Override
	public @Nullable V put(K key, V value) {
		int idx = homeIndex(key);
		ArrayDeque<Node<K, V>> bucket = buckets[idx];
		if (bucket == null) {
			bucket = new ArrayDeque<>();
			buckets[idx] = bucket;
		}
		Node<K, V> node = find(bucket, key);
		if (node != null) {
			return node.setValue(value);
		}
		bucket.addLast(new Node<>(key, value));
		size++;
		maybeResize();
		return null;
	}

	@Override
	protected @Nullable Entry<K, V> findEntry(Object key) {
		ArrayDeque<Node<K, V>> bucket = buckets[homeIndex(key)];
		return (bucket != null) ? find(bucket, key) : null;
	}

	@Override
	protected @Nullable Entry<K, V> removeEntry(Object key) {
		int idx = homeIndex(key);
		ArrayDeque<Node<K, V>> bucket = buckets[idx];
		if (bucket == null) return null;
		for (Iterator<Node<K, V>> it = bucket.iterator(); it.hasNext(); ) {
			Node<K, V> node = it.next();
			if (node.key.equals(key)) {
				it.remove();
				if (bucket.isEmpty()) buckets[idx] = null;
				size--;
				return node;
			}
		}
		return null;
	}

	/* fresh-table insertion used only during resize */
	@Override
	protected void insertFresh(K key, V value) {
		int idx = homeIndex(key);
		ArrayDeque<Node<K, V>> bucket = buckets[idx];
		if (bucket == null) {
			bucket = new ArrayDeque<>();
			buckets[idx] = bucket;
		}
		bucket.addLast(new Node<>(key, value));
		size++;
	}

	@Override
	protected Iterator<Entry<K, V>> entryIterator() {
		return new BucketIterator();
	}

	private static <K, V> @Nullable Node<K, V> find(ArrayDeque<Node<K, V>> bucket, Object key) {
		for (Node<K, V> node : bucket) {
			if (node.key.equals(key)) return node;
		}
		return null;
	}

	/* Bucket inspection: null for an empty bucket, else a snapshot in append order */
	@Nullable List<Entry<K, V>> bucketAt(int idx) {
		ArrayDeque<Node<K, V>> bucket = buckets[idx];
		return (bucket != null) ? new ArrayList<>(bucket) : null;
	}

	/* ------------ Iterator ------------ */

	private final class BucketIterator implements Iterator<Entry<K, V>> {
		private int bucketIdx = -1;
		private Iterator<Node<K, V>> current = Collections.emptyIterator();
		// hasNext() may move on to the next bucket, so remove() needs its own handle
		private @Nullable Iterator<Node<K, V>> lastIter;
		private int lastBucket = -1;

		@Override
		public boolean hasNext() {
			while (!current.hasNext()) {
				if (bucketIdx + 1 >= capacity) return false;
				ArrayDeque<Node<K, V>> bucket = buckets[++bucketIdx];
				if (bucket != null) current = bucket.iterator();
			}
			return true;
		}

		@Override
		public Entry<K, V> next() {
			if (!hasNext()) throw new NoSuchElementException();
			Node<K, V> node = current.next();
			lastIter = current;
			lastBucket = bucketIdx;
			return node;
		}

		@Override
		public void remove() {
			if (lastIter == null) throw new IllegalStateException();
			lastIter.remove();
			ArrayDeque<Node<K, V>> bucket = buckets[lastBucket];
			if (bucket != null && bucket.isEmpty()) buckets[lastBucket] = null;
			size--;
			lastIter = null;
		}
	}

	static final class Node<K, V> implements Entry<K, V> {
		final K key;
		V value;

		Node(K key, V value) {
			this.key = key;
			this.value = value;
		}

		@Override
		public K getKey() {
			return key;
		}

		@Override
		public V getValue() {
			return value;
		}

		@Override
		public V setValue(V value) {
			V old = this.value;
			this.value = value;
			return old;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Entry)) return false;
			Entry<?, ?> e = (Entry<?, ?>) o;
			return Objects.equals(key, e.getKey()) && Objects.equals(value, e.getValue());
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(key) ^ Objects.hashCode(value);
		}

		@Override
		public String toString() {
			return key + "=" + value;
		}
	}
}
