package io.github.bluuewhale.hashtables;

import java.util.PrimitiveIterator;

/**
 * Candidate slot indices visited by open addressing, starting from a key's home index.
 * Both sequences are deterministic and infinite; tables consume the first {@code capacity} terms.
 */
public enum ProbeSequence {

	/** {@code (home + i) mod capacity} */
	LINEAR {
		@Override
		public int indexAt(int home, int attempt, int capacity) {
			return (int) ((home + (long) attempt) % capacity);
		}

		@Override
		public int advance(int index, int attempt, int capacity) {
			int next = index + 1;
			return (next == capacity) ? 0 : next;
		}
	},

	/**
	 * {@code (home + i(i+1)/2) mod capacity}. Triangular strides break up linear clusters but
	 * reach every slot within {@code capacity} attempts only for power-of-two capacities.
	 */
	QUADRATIC {
		@Override
		public int indexAt(int home, int attempt, int capacity) {
			long offset = (long) attempt * (attempt + 1L) / 2;
			return (int) ((home + offset) % capacity);
		}

		@Override
		public int advance(int index, int attempt, int capacity) {
			// T(i) = T(i-1) + i
			return (int) ((index + (long) (attempt % capacity)) % capacity);
		}
	};

	/** Index visited on the given attempt, 0 being the home index itself. */
	public abstract int indexAt(int home, int attempt, int capacity);

	/**
	 * Index visited on {@code attempt}, given {@code index} was visited on {@code attempt - 1}.
	 * Lets probe loops walk the sequence without recomputing it from the home index.
	 */
	public abstract int advance(int index, int attempt, int capacity);

	/**
	 * Lazy, unbounded sequence of indices starting at {@code home}. Each call starts over.
	 */
	public PrimitiveIterator.OfInt generate(int home, int capacity) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("capacity must be positive: " + capacity);
		}
		if (home < 0 || home >= capacity) {
			throw new IllegalArgumentException("home index out of range [0, " + capacity + "): " + home);
		}
		return new PrimitiveIterator.OfInt() {
			private int index = home;
			private int stride = 0; // attempt mod capacity

			@Override
			public boolean hasNext() {
				return true;
			}

			@Override
			public int nextInt() {
				int current = index;
				stride = (stride + 1 == capacity) ? 0 : stride + 1;
				index = advance(index, stride, capacity);
				return current;
			}
		};
	}
}
