package io.github.bluuewhale.hashtables.bench;

import org.openjdk.jol.info.GraphLayout;

/**
 * Retained heap size of an object graph. Every reachable object is counted once, so keys and
 * values shared between entries are not double counted.
 */
public final class MemoryFootprint {
	private MemoryFootprint() {}

	public static long deepSizeOf(Object root) {
		return GraphLayout.parseInstance(root).totalSize();
	}

	public static double megabytes(Object root) {
		return deepSizeOf(root) / 1e6;
	}
}
