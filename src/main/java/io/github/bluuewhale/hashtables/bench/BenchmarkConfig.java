package io.github.bluuewhale.hashtables.bench;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;

/**
 * Parameters of one benchmark trial.
 *
 * @param trialName prefix of the plot-data files
 * @param keyCount number of keys inserted, at most {@link #MAX_KEY_COUNT}
 * @param repetitions runs per table and load factor
 * @param maxLoadFactors load factors to sweep per table; the {@link TableKind#HASH_MAP} baseline is
 *     added by the benchmark itself
 * @param duplicateKeys resample the keys with replacement, leaving roughly 63% of them distinct
 * @param plottedMetrics metrics that get a plot-data file
 * @param errorBars include the standard deviation next to each mean
 * @param verbose progress logging level, 0 for none
 * @param outputDirectory where plot-data files are written
 * @param seed seed for key order, resampling and values; null for a random seed
 */
public record BenchmarkConfig(
	String trialName,
	int keyCount,
	int repetitions,
	Map<TableKind, List<Double>> maxLoadFactors,
	boolean duplicateKeys,
	Set<Metric> plottedMetrics,
	boolean errorBars,
	int verbose,
	Path outputDirectory,
	@Nullable Long seed
) {

	/** Permutations of the ten-letter key alphabet. */
	public static final int MAX_KEY_COUNT = 3_628_800;

	public static final String DEFAULT_TRIAL_NAME = "example";
	public static final int DEFAULT_KEY_COUNT = 1_000_000;
	public static final Path DEFAULT_OUTPUT_DIRECTORY = Path.of("plots");
	public static final List<Double> CHAINING_LOAD_FACTORS = List.of(0.6, 0.7, 0.8, 0.9, 1.0, 1.1, 1.2);
	public static final List<Double> LINEAR_LOAD_FACTORS = List.of(0.6, 0.65, 0.7, 0.75, 0.8, 0.85);
	public static final List<Double> QUADRATIC_LOAD_FACTORS = List.of(0.6, 0.65, 0.7, 0.75, 0.8, 0.85);

	public BenchmarkConfig {
		Objects.requireNonNull(trialName, "trialName");
		Objects.requireNonNull(outputDirectory, "outputDirectory");
		if (keyCount <= 0 || keyCount > MAX_KEY_COUNT) {
			throw new IllegalArgumentException("keyCount must be in [1, " + MAX_KEY_COUNT + "]: " + keyCount);
		}
		if (repetitions <= 0) {
			throw new IllegalArgumentException("repetitions must be positive: " + repetitions);
		}
		if (maxLoadFactors.containsKey(TableKind.HASH_MAP)) {
			throw new IllegalArgumentException("the HashMap baseline is added automatically");
		}
		var copy = new EnumMap<TableKind, List<Double>>(TableKind.class);
		for (Map.Entry<TableKind, List<Double>> e : maxLoadFactors.entrySet()) {
			for (double lf : e.getValue()) {
				if (!(lf > 0.0d && lf < Double.POSITIVE_INFINITY)) {
					throw new IllegalArgumentException(e.getKey() + " load factor must be positive: " + lf);
				}
			}
			copy.put(e.getKey(), e.getValue().stream().sorted().distinct().toList());
		}
		maxLoadFactors = Collections.unmodifiableMap(copy);
		plottedMetrics = Collections.unmodifiableSet(
			plottedMetrics.isEmpty() ? EnumSet.noneOf(Metric.class) : EnumSet.copyOf(plottedMetrics));
	}

	public static BenchmarkConfig defaults() {
		var lfs = new EnumMap<TableKind, List<Double>>(TableKind.class);
		lfs.put(TableKind.CHAINING, CHAINING_LOAD_FACTORS);
		lfs.put(TableKind.LINEAR_PROBING, LINEAR_LOAD_FACTORS);
		lfs.put(TableKind.QUADRATIC_PROBING, QUADRATIC_LOAD_FACTORS);
		return new BenchmarkConfig(DEFAULT_TRIAL_NAME, DEFAULT_KEY_COUNT, 1, lfs, false,
			EnumSet.allOf(Metric.class), false, 0, DEFAULT_OUTPUT_DIRECTORY, null);
	}
}
