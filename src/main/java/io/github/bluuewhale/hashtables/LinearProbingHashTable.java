package io.github.bluuewhale.hashtables;

/**
 * Open addressing with stride 1: a colliding key takes the next slot along.
 */
public class LinearProbingHashTable<K, V> extends OpenAddressingHashTable<K, V> {

	public LinearProbingHashTable() {
		this(DEFAULT_INITIAL_CAPACITY, DEFAULT_LOAD_FACTOR);
	}

	public LinearProbingHashTable(int initialCapacity) {
		this(initialCapacity, DEFAULT_LOAD_FACTOR);
	}

	public LinearProbingHashTable(int initialCapacity, double maxLoadFactor) {
		this(initialCapacity, maxLoadFactor, DEFAULT_GROWTH_FACTOR);
	}

	public LinearProbingHashTable(int initialCapacity, double maxLoadFactor, int growthFactor) {
		super(ProbeSequence.LINEAR, initialCapacity, maxLoadFactor, growthFactor);
	}
}
