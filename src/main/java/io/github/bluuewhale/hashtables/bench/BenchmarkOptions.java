package io.github.bluuewhale.hashtables.bench;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * Command line options of {@link BenchmarkMain}.
 */
public final class BenchmarkOptions {
	private BenchmarkOptions() {}

	private static final Option NAME = Option.builder()
		.longOpt("name")
		.hasArg(true)
		.desc("Name of the benchmark. Used as a prefix for the plot-data file names.")
		.build();

	private static final Option KEY_COUNT = Option.builder("N")
		.hasArg(true)
		.desc("Number of keys to benchmark with (at most " + BenchmarkConfig.MAX_KEY_COUNT + ")")
		.build();

	private static final Option REPETITIONS = Option.builder("r")
		.longOpt("repetitions")
		.hasArg(true)
		.desc("Number of times to repeat the experiment for lowering variance")
		.build();

	private static final Option CHAINING_LF = Option.builder()
		.longOpt("chainingLoadFactor")
		.hasArgs()
		.desc("Chaining hash table maximum load factors")
		.build();

	private static final Option LINEAR_LF = Option.builder()
		.longOpt("linearLoadFactor")
		.hasArgs()
		.desc("Linear probing hash table maximum load factors")
		.build();

	private static final Option QUADRATIC_LF = Option.builder()
		.longOpt("quadraticLoadFactor")
		.hasArgs()
		.desc("Quadratic probing hash table maximum load factors")
		.build();

	private static final Option DUPLICATES = Option.builder()
		.longOpt("duplicates")
		.desc("Resample keys with replacement so that some are duplicated")
		.build();

	private static final Option NO_PLOT_INSERT = Option.builder()
		.longOpt("noPlotInsert")
		.desc("Disable plot data for insert times")
		.build();

	private static final Option NO_PLOT_LOOKUP = Option.builder()
		.longOpt("noPlotLookup")
		.desc("Disable plot data for lookup times")
		.build();

	private static final Option NO_PLOT_MEMORY = Option.builder()
		.longOpt("noPlotMemory")
		.desc("Disable plot data for memory usage")
		.build();

	private static final Option NO_PLOT_DELETE = Option.builder()
		.longOpt("noPlotDelete")
		.desc("Disable plot data for delete times")
		.build();

	private static final Option ERROR_BARS = Option.builder()
		.longOpt("errorBars")
		.desc("Report the standard deviation around each data point")
		.build();

	private static final Option VERBOSE = Option.builder("v")
		.longOpt("verbose")
		.desc("Verbose mode. Repeat for more detail.")
		.build();

	private static final Option OUTPUT = Option.builder("o")
		.longOpt("output")
		.hasArg(true)
		.desc("Directory for plot-data files (default: " + BenchmarkConfig.DEFAULT_OUTPUT_DIRECTORY + ")")
		.build();

	private static final Option SEED = Option.builder()
		.longOpt("seed")
		.hasArg(true)
		.desc("Random seed for key order and values")
		.build();

	private static final Option HELP = Option.builder("h")
		.longOpt("help")
		.desc("Print this message")
		.build();

	/**
	 * Method which creates the configuration required for the CLI argument parser.
	 * @return A description of accepted CLI arguments.
	 */
	public static Options createOptionConfiguration() {
		Options options = new Options();
		options.addOption(NAME);
		options.addOption(KEY_COUNT);
		options.addOption(REPETITIONS);
		options.addOption(CHAINING_LF);
		options.addOption(LINEAR_LF);
		options.addOption(QUADRATIC_LF);
		options.addOption(DUPLICATES);
		options.addOption(NO_PLOT_INSERT);
		options.addOption(NO_PLOT_LOOKUP);
		options.addOption(NO_PLOT_MEMORY);
		options.addOption(NO_PLOT_DELETE);
		options.addOption(ERROR_BARS);
		options.addOption(VERBOSE);
		options.addOption(OUTPUT);
		options.addOption(SEED);
		options.addOption(HELP);
		return options;
	}

	/**
	 * Parses the arguments into a trial configuration.
	 *
	 * @return the configuration, or empty if help was requested
	 * @throws ParseException on an unknown option or a malformed value
	 */
	public static Optional<BenchmarkConfig> parse(String[] args) throws ParseException {
		CommandLineParser parser = new DefaultParser();
		CommandLine cmd = parser.parse(createOptionConfiguration(), args);
		if (cmd.hasOption(HELP)) return Optional.empty();

		BenchmarkConfig defaults = BenchmarkConfig.defaults();

		var lfs = new EnumMap<TableKind, List<Double>>(TableKind.class);
		lfs.put(TableKind.CHAINING, doubles(cmd, CHAINING_LF, BenchmarkConfig.CHAINING_LOAD_FACTORS));
		lfs.put(TableKind.LINEAR_PROBING, doubles(cmd, LINEAR_LF, BenchmarkConfig.LINEAR_LOAD_FACTORS));
		lfs.put(TableKind.QUADRATIC_PROBING, doubles(cmd, QUADRATIC_LF, BenchmarkConfig.QUADRATIC_LOAD_FACTORS));

		Set<Metric> plotted = EnumSet.allOf(Metric.class);
		if (cmd.hasOption(NO_PLOT_INSERT)) plotted.remove(Metric.INSERT);
		if (cmd.hasOption(NO_PLOT_LOOKUP)) plotted.remove(Metric.LOOKUP);
		if (cmd.hasOption(NO_PLOT_MEMORY)) plotted.remove(Metric.MEMORY);
		if (cmd.hasOption(NO_PLOT_DELETE)) plotted.remove(Metric.DELETE);

		int verbose = 0;
		for (Option o : cmd.getOptions()) {
			if (VERBOSE.getOpt().equals(o.getOpt())) verbose++;
		}

		String seed = cmd.getOptionValue(SEED);
		try {
			return Optional.of(new BenchmarkConfig(
				cmd.getOptionValue(NAME, defaults.trialName()),
				integer(cmd, KEY_COUNT, defaults.keyCount()),
				integer(cmd, REPETITIONS, defaults.repetitions()),
				lfs,
				cmd.hasOption(DUPLICATES),
				plotted,
				cmd.hasOption(ERROR_BARS),
				verbose,
				cmd.hasOption(OUTPUT) ? Path.of(cmd.getOptionValue(OUTPUT)) : defaults.outputDirectory(),
				(seed != null) ? parseLong(SEED, seed) : null
			));
		} catch (IllegalArgumentException e) {
			throw new ParseException(e.getMessage());
		}
	}

	public static void printHelp() {
		new HelpFormatter().printHelp("Usage:", createOptionConfiguration());
	}

	private static int integer(CommandLine cmd, Option option, int fallback) throws ParseException {
		String raw = cmd.getOptionValue(option);
		if (raw == null) return fallback;
		try {
			return Integer.parseInt(raw.trim());
		} catch (NumberFormatException e) {
			throw new ParseException("Option " + name(option) + " expects an integer: " + raw);
		}
	}

	private static long parseLong(Option option, String raw) throws ParseException {
		try {
			return Long.parseLong(raw.trim());
		} catch (NumberFormatException e) {
			throw new ParseException("Option " + name(option) + " expects an integer: " + raw);
		}
	}

	private static List<Double> doubles(CommandLine cmd, Option option, List<Double> fallback)
			throws ParseException {
		String[] raw = cmd.getOptionValues(option);
		if (raw == null) return fallback;
		List<Double> out = new ArrayList<>(raw.length);
		for (String s : raw) {
			try {
				out.add(Double.parseDouble(s.trim()));
			} catch (NumberFormatException e) {
				throw new ParseException("Option " + name(option) + " expects numbers: " + s);
			}
		}
		return out;
	}

	private static String name(Option option) {
		return (option.getLongOpt() != null) ? "--" + option.getLongOpt() : "-" + option.getOpt();
	}
}
