package io.github.bluuewhale.hashtables.bench;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

class TrialResultsTest {

	@Test
	void groupsSamplesByMetricTableAndLoadFactor() {
		var results = new TrialResults();
		results.add(TableKind.LINEAR_PROBING, 0.8, new BenchmarkResult(1, 2, 3, 4));
		results.add(TableKind.LINEAR_PROBING, 0.6, new BenchmarkResult(5, 6, 7, 8));
		results.add(TableKind.LINEAR_PROBING, 0.8, new BenchmarkResult(3, 2, 3, 4));

		assertEquals(Set.of(TableKind.LINEAR_PROBING), results.kinds(Metric.INSERT));
		assertEquals(List.of(0.6, 0.8), List.copyOf(results.loadFactors(Metric.INSERT, TableKind.LINEAR_PROBING)));
		assertEquals(List.of(1.0, 3.0), results.samples(Metric.INSERT, TableKind.LINEAR_PROBING, 0.8));
		assertEquals(List.of(7.0), results.samples(Metric.MEMORY, TableKind.LINEAR_PROBING, 0.6));
		assertEquals(2.0, results.mean(Metric.INSERT, TableKind.LINEAR_PROBING, 0.8));
		assertEquals(1.0, results.std(Metric.INSERT, TableKind.LINEAR_PROBING, 0.8));
		assertEquals(0.0, results.std(Metric.LOOKUP, TableKind.LINEAR_PROBING, 0.8));
	}

	@Test
	void missingSamplesAreEmpty() {
		var results = new TrialResults();

		assertTrue(results.kinds(Metric.DELETE).isEmpty());
		assertTrue(results.loadFactors(Metric.DELETE, TableKind.CHAINING).isEmpty());
		assertTrue(results.samples(Metric.DELETE, TableKind.CHAINING, 1.0).isEmpty());
		assertTrue(Double.isNaN(results.mean(Metric.DELETE, TableKind.CHAINING, 1.0)));
	}

	@Test
	void populationStandardDeviation() {
		assertEquals(2.5, TrialResults.mean(List.of(1.0, 2.0, 3.0, 4.0)));
		assertEquals(Math.sqrt(1.25), TrialResults.std(List.of(1.0, 2.0, 3.0, 4.0)), 1e-12);
	}
}
