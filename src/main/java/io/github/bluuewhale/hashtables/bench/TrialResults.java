package io.github.bluuewhale.hashtables.bench;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Samples collected over a trial, grouped by metric, table and max load factor.
 */
public final class TrialResults {

	private final Map<Metric, Map<TableKind, NavigableMap<Double, List<Double>>>> samples =
		new EnumMap<>(Metric.class);

	public TrialResults() {
		for (Metric m : Metric.values()) {
			samples.put(m, new EnumMap<>(TableKind.class));
		}
	}

	public void add(TableKind kind, double maxLoadFactor, BenchmarkResult result) {
		for (Metric m : Metric.values()) {
			samples.get(m)
				.computeIfAbsent(kind, k -> new TreeMap<>())
				.computeIfAbsent(maxLoadFactor, lf -> new ArrayList<>())
				.add(result.get(m));
		}
	}

	public Set<TableKind> kinds(Metric metric) {
		return Collections.unmodifiableSet(samples.get(metric).keySet());
	}

	/** Load factors recorded for the table, ascending. */
	public Set<Double> loadFactors(Metric metric, TableKind kind) {
		NavigableMap<Double, List<Double>> byLf = samples.get(metric).get(kind);
		return (byLf == null) ? Set.of() : Collections.unmodifiableSet(byLf.navigableKeySet());
	}

	public List<Double> samples(Metric metric, TableKind kind, double maxLoadFactor) {
		NavigableMap<Double, List<Double>> byLf = samples.get(metric).get(kind);
		List<Double> values = (byLf == null) ? null : byLf.get(maxLoadFactor);
		return (values == null) ? List.of() : Collections.unmodifiableList(values);
	}

	public double mean(Metric metric, TableKind kind, double maxLoadFactor) {
		return mean(samples(metric, kind, maxLoadFactor));
	}

	public double std(Metric metric, TableKind kind, double maxLoadFactor) {
		return std(samples(metric, kind, maxLoadFactor));
	}

	static double mean(List<Double> values) {
		if (values.isEmpty()) return Double.NaN;
		double sum = 0;
		for (double v : values) sum += v;
		return sum / values.size();
	}

	/** Population standard deviation. */
	static double std(List<Double> values) {
		if (values.isEmpty()) return Double.NaN;
		double mean = mean(values);
		double sq = 0;
		for (double v : values) sq += (v - mean) * (v - mean);
		return Math.sqrt(sq / values.size());
	}
}
