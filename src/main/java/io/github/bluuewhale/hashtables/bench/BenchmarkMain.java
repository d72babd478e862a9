package io.github.bluuewhale.hashtables.bench;

import java.io.IOException;
import java.util.Optional;

import org.apache.commons.cli.ParseException;

/**
 * Main entry point of the load-factor benchmark.
 */
public final class BenchmarkMain {
	private BenchmarkMain() {}

	public static void main(String[] args) throws IOException {
		Optional<BenchmarkConfig> config;
		try {
			config = BenchmarkOptions.parse(args);
		} catch (ParseException e) {
			System.out.println(e.getMessage());
			BenchmarkOptions.printHelp();
			System.exit(1);
			return;
		}
		if (config.isEmpty()) {
			BenchmarkOptions.printHelp();
			return;
		}
		new LoadFactorBenchmark(config.get()).run();
	}
}
