package io.github.bluuewhale.hashtables;

/**
 * Open addressing with triangular-number strides (1, 3, 6, 10, ... past the home index).
 *
 * <p>Only the first {@code capacity} probes are taken per operation. With a power-of-two capacity
 * they cover every slot; with other capacities some slots may be unreachable from a given home
 * index, and an insertion that finds none of its reachable slots free fails with
 * {@link TableFullException}.
 */
public class QuadraticProbingHashTable<K, V> extends OpenAddressingHashTable<K, V> {

	public QuadraticProbingHashTable() {
		this(DEFAULT_INITIAL_CAPACITY, DEFAULT_LOAD_FACTOR);
	}

	public QuadraticProbingHashTable(int initialCapacity) {
		this(initialCapacity, DEFAULT_LOAD_FACTOR);
	}

	public QuadraticProbingHashTable(int initialCapacity, double maxLoadFactor) {
		this(initialCapacity, maxLoadFactor, DEFAULT_GROWTH_FACTOR);
	}

	public QuadraticProbingHashTable(int initialCapacity, double maxLoadFactor, int growthFactor) {
		super(ProbeSequence.QUADRATIC, initialCapacity, maxLoadFactor, growthFactor);
	}
}
