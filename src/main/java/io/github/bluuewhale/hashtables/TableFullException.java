package io.github.bluuewhale.hashtables;

/**
 * Thrown when an insertion walks {@code capacity} probes without finding a free slot. A table whose
 * max load factor stays below 1.0 does not get here unless its probe sequence fails to reach the
 * free slots, as quadratic probing can for some capacities.
 */
public class TableFullException extends IllegalStateException {

	private final int capacity;

	public TableFullException(int capacity) {
		super("Probe sequence exhausted; no free slot in table of capacity " + capacity);
		this.capacity = capacity;
	}

	public int getCapacity() {
		return capacity;
	}
}
