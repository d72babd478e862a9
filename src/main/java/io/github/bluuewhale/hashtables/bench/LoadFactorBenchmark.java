package io.github.bluuewhale.hashtables.bench;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sweeps each table over its max load factors and measures bulk insert, lookup, retained memory
 * and delete, against a {@link java.util.HashMap} baseline run at every load factor seen.
 *
 * <p>Keys are the first N permutations of {@value #KEY_ALPHABET} in lexicographic order, shuffled.
 */
public final class LoadFactorBenchmark {

	private static final Logger LOGGER = LoggerFactory.getLogger(LoadFactorBenchmark.class);

	static final String KEY_ALPHABET = "abcdefghij";

	private final BenchmarkConfig config;
	private final Random rnd;

	public LoadFactorBenchmark(BenchmarkConfig config) {
		this.config = Objects.requireNonNull(config, "config");
		this.rnd = (config.seed() != null) ? new Random(config.seed()) : new Random();
	}

	/**
	 * Benchmarks one table with the given keys and values.
	 *
	 * <p>After timing the insertions, every distinct key is looked up and checked against the value
	 * written last for it; earlier pairs of duplicated keys are looked up as well, unchecked, so that
	 * runs with and without duplicates do the same number of lookups.
	 *
	 * @throws IllegalStateException if the table returns a wrong value or misses a key
	 */
	public static BenchmarkResult benchmark(Map<String, Double> table, String description, List<String> keys,
			double[] values, List<String> deleteKeys, int verbose) {
		if (keys.size() != values.length) {
			throw new IllegalArgumentException("keys and values must have same length");
		}

		// Insert
		long start = System.nanoTime();
		for (int i = 0; i < values.length; i++) {
			table.put(keys.get(i), values[i]);
		}
		double insertSeconds = seconds(start);
		if (verbose > 2) LOGGER.info("{} completed insertion benchmark in {} s", description, fmt(insertSeconds));

		// Last write wins: walk backwards to find the expected value of every key.
		List<Integer> answers = new ArrayList<>();
		List<Integer> extras = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		for (int i = keys.size() - 1; i >= 0; i--) {
			if (seen.add(keys.get(i))) answers.add(i);
			else extras.add(i);
		}

		// Lookup
		start = System.nanoTime();
		for (int i : answers) {
			String key = keys.get(i);
			Double v = table.get(key);
			if (v == null || v != values[i]) {
				throw new IllegalStateException(
					"Value " + v + " for key " + key + " did not match expected value " + values[i]);
			}
		}
		for (int i : extras) {
			table.get(keys.get(i));
		}
		double lookupSeconds = seconds(start);
		if (verbose > 2) LOGGER.info("{} completed lookup benchmark in {} s", description, fmt(lookupSeconds));

		// Memory
		double memoryMegabytes = MemoryFootprint.megabytes(table);
		if (verbose > 2) LOGGER.info("{} used {} MB", description, fmt(memoryMegabytes));

		// Delete
		start = System.nanoTime();
		for (String key : deleteKeys) {
			if (table.remove(key) == null) {
				throw new IllegalStateException("Key " + key + " missing on delete");
			}
		}
		double deleteSeconds = seconds(start);
		if (verbose > 2) LOGGER.info("{} completed deletion benchmark in {} s", description, fmt(deleteSeconds));

		return new BenchmarkResult(insertSeconds, lookupSeconds, memoryMegabytes, deleteSeconds);
	}

	/**
	 * Runs the whole trial, prints a summary per metric and writes the plot-data files.
	 */
	public TrialResults run() throws IOException {
		Map<TableKind, List<Double>> sweep = new EnumMap<>(TableKind.class);
		sweep.putAll(config.maxLoadFactors());
		Set<Double> allLoadFactors = new TreeSet<>();
		sweep.values().forEach(allLoadFactors::addAll);
		sweep.put(TableKind.HASH_MAP, List.copyOf(allLoadFactors));

		System.out.printf("____Beginning trial \"%s\"____%n", config.trialName());

		List<String> keys = permutations(KEY_ALPHABET, config.keyCount());
		Collections.shuffle(keys, rnd);
		if (config.duplicateKeys()) {
			keys = resample(keys, rnd);
		}
		List<String> deleteKeys = new ArrayList<>(new LinkedHashSet<>(keys));
		Collections.shuffle(deleteKeys, rnd);
		double[] values = new double[keys.size()];
		for (int i = 0; i < values.length; i++) values[i] = rnd.nextDouble();

		TrialResults results = new TrialResults();
		for (Map.Entry<TableKind, List<Double>> e : sweep.entrySet()) {
			TableKind kind = e.getKey();
			if (config.verbose() == 1) LOGGER.info("Running benchmarks for {}", kind);
			for (double lf : e.getValue()) {
				if (config.verbose() > 1) LOGGER.info("Running benchmarks for {}", describe(kind, lf));
				for (int r = 0; r < config.repetitions(); r++) {
					Map<String, Double> table = kind.newTable(lf);
					results.add(kind, lf, benchmark(table, describe(kind, lf), keys, values, deleteKeys,
						config.verbose()));
				}
			}
		}

		for (Metric metric : Metric.values()) {
			printSummary(metric, results);
			if (config.plottedMetrics().contains(metric)) {
				Path out = writePlotData(metric, results);
				if (config.verbose() > 0) LOGGER.info("Wrote {}", out);
			}
		}
		return results;
	}

	/** First {@code n} permutations of {@code alphabet}, in lexicographic order of its sorted letters. */
	static List<String> permutations(String alphabet, int n) {
		char[] chars = alphabet.toCharArray();
		Arrays.sort(chars);
		List<String> out = new ArrayList<>(n);
		for (int i = 0; i < n; i++) {
			out.add(new String(chars));
			if (!nextPermutation(chars)) break;
		}
		return out;
	}

	private static boolean nextPermutation(char[] a) {
		int i = a.length - 2;
		while (i >= 0 && a[i] >= a[i + 1]) i--;
		if (i < 0) return false;
		int j = a.length - 1;
		while (a[j] <= a[i]) j--;
		char t = a[i]; a[i] = a[j]; a[j] = t;
		for (int lo = i + 1, hi = a.length - 1; lo < hi; lo++, hi--) {
			t = a[lo]; a[lo] = a[hi]; a[hi] = t;
		}
		return true;
	}

	/** Sampling with replacement; about 1 - 1/e of the keys survive as distinct. */
	static List<String> resample(List<String> keys, Random rnd) {
		List<String> out = new ArrayList<>(keys.size());
		for (int i = 0; i < keys.size(); i++) {
			out.add(keys.get(rnd.nextInt(keys.size())));
		}
		return out;
	}

	static String describe(TableKind kind, double maxLoadFactor) {
		if (kind == TableKind.HASH_MAP) return kind.displayName();
		return kind.displayName() + "(maxLoadFactor=" + maxLoadFactor + ")";
	}

	private void printSummary(Metric metric, TrialResults results) {
		String info = config.duplicateKeys() ? " with duplicates" : "";
		System.out.printf(Locale.ROOT, "%s%s (#keys = %,d, %d repetitions)%n",
			metric.title(), info, config.keyCount(), config.repetitions());
		for (TableKind kind : results.kinds(metric)) {
			for (double lf : results.loadFactors(metric, kind)) {
				if (config.errorBars()) {
					System.out.printf(Locale.ROOT, "  %-26s lf=%-5s %12.4f +/- %.4f%n",
						kind, lf, results.mean(metric, kind, lf), results.std(metric, kind, lf));
				} else {
					System.out.printf(Locale.ROOT, "  %-26s lf=%-5s %12.4f%n",
						kind, lf, results.mean(metric, kind, lf));
				}
			}
		}
	}

	/** One CSV per metric: a series per table, max load factor on the x axis. */
	Path writePlotData(Metric metric, TrialResults results) throws IOException {
		Files.createDirectories(config.outputDirectory());
		Path out = config.outputDirectory().resolve(config.trialName() + "_" + metric.fileSuffix() + ".csv");
		CSVFormat format = CSVFormat.DEFAULT.builder()
			.setCommentMarker('#')
			.setHeaderComments(metric.title() + (config.duplicateKeys() ? " with duplicates" : ""))
			.setHeader(config.errorBars()
				? new String[] {"table", "max_load_factor", "mean", "std"}
				: new String[] {"table", "max_load_factor", "mean"})
			.build();
		try (BufferedWriter w = Files.newBufferedWriter(out, StandardCharsets.UTF_8);
				CSVPrinter printer = format.print(w)) {
			for (TableKind kind : results.kinds(metric)) {
				for (double lf : results.loadFactors(metric, kind)) {
					String mean = fmt(results.mean(metric, kind, lf));
					if (config.errorBars()) {
						printer.printRecord(kind, lf, mean, fmt(results.std(metric, kind, lf)));
					} else {
						printer.printRecord(kind, lf, mean);
					}
				}
			}
		}
		return out;
	}

	private static double seconds(long startNanos) {
		return (System.nanoTime() - startNanos) / 1e9;
	}

	private static String fmt(double v) {
		return String.format(Locale.ROOT, "%.6f", v);
	}
}
