package io.github.bluuewhale.hashtables.bench;

import java.util.HashMap;
import java.util.Map;
import java.util.function.DoubleFunction;

import io.github.bluuewhale.hashtables.ChainingHashTable;
import io.github.bluuewhale.hashtables.LinearProbingHashTable;
import io.github.bluuewhale.hashtables.QuadraticProbingHashTable;

/**
 * Table implementations the benchmark can drive. {@link #HASH_MAP} is the JDK baseline and ignores
 * the requested max load factor.
 */
public enum TableKind {
	CHAINING("ChainingHashTable", lf -> new ChainingHashTable<>(8, lf)),
	LINEAR_PROBING("LinearProbingHashTable", lf -> new LinearProbingHashTable<>(8, lf)),
	QUADRATIC_PROBING("QuadraticProbingHashTable", lf -> new QuadraticProbingHashTable<>(8, lf)),
	HASH_MAP("HashMap", lf -> new HashMap<>());

	private final String displayName;
	private final DoubleFunction<Map<String, Double>> factory;

	TableKind(String displayName, DoubleFunction<Map<String, Double>> factory) {
		this.displayName = displayName;
		this.factory = factory;
	}

	public Map<String, Double> newTable(double maxLoadFactor) {
		return factory.apply(maxLoadFactor);
	}

	public String displayName() {
		return displayName;
	}

	@Override
	public String toString() {
		return displayName;
	}
}
