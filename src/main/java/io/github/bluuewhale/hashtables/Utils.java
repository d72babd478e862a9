package io.github.bluuewhale.hashtables;

/**
 * Shared argument checks and index arithmetic.
 */
final class Utils {
	private Utils() {}

	static void validateCapacity(int capacity) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("initialCapacity must be positive: " + capacity);
		}
	}

	static void validateLoadFactor(double lf) {
		if (!(lf > 0.0d && lf < Double.POSITIVE_INFINITY)) {
			throw new IllegalArgumentException("maxLoadFactor must be positive and finite: " + lf);
		}
	}

	static void validateGrowthFactor(int growthFactor) {
		if (growthFactor < 2) {
			throw new IllegalArgumentException("growthFactor must be at least 2: " + growthFactor);
		}
	}

	/** Non-negative {@code hash mod capacity}, also for negative hash codes. */
	static int homeIndex(int hash, int capacity) {
		return Math.floorMod(hash, capacity);
	}
}
