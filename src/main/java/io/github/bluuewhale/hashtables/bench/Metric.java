package io.github.bluuewhale.hashtables.bench;

/**
 * The four quantities a benchmark run reports.
 */
public enum Metric {
	INSERT("insert", "Insertion Time", "Time Elapsed (seconds)"),
	LOOKUP("lookup", "Lookup Time", "Time Elapsed (seconds)"),
	MEMORY("memory", "Memory Usage", "Memory Used (MB)"),
	DELETE("delete", "Delete Time", "Time Elapsed (seconds)");

	private final String fileSuffix;
	private final String title;
	private final String unitLabel;

	Metric(String fileSuffix, String title, String unitLabel) {
		this.fileSuffix = fileSuffix;
		this.title = title;
		this.unitLabel = unitLabel;
	}

	public String fileSuffix() {
		return fileSuffix;
	}

	public String title() {
		return title;
	}

	public String unitLabel() {
		return unitLabel;
	}
}
