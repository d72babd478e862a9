package io.github.bluuewhale.hashtables.bench;

/**
 * Measurements of a single benchmark run.
 */
public record BenchmarkResult(
	double insertSeconds,
	double lookupSeconds,
	double memoryMegabytes,
	double deleteSeconds
) {
	double get(Metric metric) {
		return switch (metric) {
			case INSERT -> insertSeconds;
			case LOOKUP -> lookupSeconds;
			case MEMORY -> memoryMegabytes;
			case DELETE -> deleteSeconds;
		};
	}
}
