package io.github.bluuewhale.hashtables;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.eclipse.collections.impl.map.mutable.UnifiedMap;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

@Fork(value = 1)
@Warmup(iterations = 5)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class HashTableBenchmark {

	private static String randomUuidString(Random rnd) {
		return new UUID(rnd.nextLong(), rnd.nextLong()).toString();
	}

	/**
	 * Generates UUID-string keys and miss-keys such that:
	 * - keys are unique
	 * - misses are unique
	 * - misses never overlap with keys
	 */
	private static void generateKeysAndMisses(Random rnd, String[] keys, String[] misses) {
		if (keys.length != misses.length) throw new IllegalArgumentException("keys and misses must have same length");
		int size = keys.length;
		Set<String> set = new HashSet<>(size * 2);
		for (int i = 0; i < size; i++) {
			String k;
			do { k = randomUuidString(rnd); } while (!set.add(k));
			keys[i] = k;
		}
		for (int i = 0; i < size; i++) {
			String miss;
			do { miss = randomUuidString(rnd); } while (!set.add(miss));
			misses[i] = miss;
		}
	}

	@State(Scope.Benchmark)
	public static class ReadState {
		@Param({ "12000", "48000", "196000" })
		int size;

		@Param({ "0.6", "0.75" })
		double maxLoadFactor;

		ChainingHashTable<String, Object> chaining;
		LinearProbingHashTable<String, Object> linear;
		QuadraticProbingHashTable<String, Object> quadratic;
		Object2ObjectOpenHashMap<String, Object> fastutil;
		UnifiedMap<String, Object> unified;
		HashMap<String, Object> jdk;
		String[] keys;
		String[] misses;
		int nextKeyIndex;
		int nextMissIndex;

		@Setup(Level.Trial)
		public void setup() {
			Random rnd = new Random(123);
			keys = new String[size];
			misses = new String[size];
			generateKeysAndMisses(rnd, keys, misses);
			nextKeyIndex = 0;
			nextMissIndex = 0;
			chaining = new ChainingHashTable<>(16, maxLoadFactor);
			linear = new LinearProbingHashTable<>(16, maxLoadFactor);
			quadratic = new QuadraticProbingHashTable<>(16, maxLoadFactor);
			fastutil = new Object2ObjectOpenHashMap<>(16, (float) maxLoadFactor);
			unified = new UnifiedMap<>(16, (float) maxLoadFactor);
			jdk = new HashMap<>(16, (float) maxLoadFactor);
			for (String k : keys) {
				chaining.put(k, "dummy");
				linear.put(k, "dummy");
				quadratic.put(k, "dummy");
				fastutil.put(k, "dummy");
				unified.put(k, "dummy");
				jdk.put(k, "dummy");
			}
		}

		String nextHitKey() {
			String k = keys[nextKeyIndex];
			nextKeyIndex = (nextKeyIndex + 1) % keys.length;
			return k;
		}

		String nextMissingKey() {
			String k = misses[nextMissIndex];
			nextMissIndex = (nextMissIndex + 1) % misses.length;
			return k;
		}
	}

	/**
	 * Keeps the entry count constant by removing one present key before each invocation
	 * (outside the measured region), then the benchmark inserts one absent key.
	 * Delete-heavy churn like this leaves tombstones behind in the open-addressing tables.
	 */
	@State(Scope.Thread)
	public static class PutMissState {
		@Param({ "12000", "48000", "196000" })
		int size;

		@Param({ "0.6", "0.75" })
		double maxLoadFactor;

		int idx;
		String[] keys;   // keys currently present in the tables
		String[] misses; // keys currently absent from the tables
		String nextKey;

		ChainingHashTable<String, Object> chaining;
		LinearProbingHashTable<String, Object> linear;
		QuadraticProbingHashTable<String, Object> quadratic;
		HashMap<String, Object> jdk;

		@Setup(Level.Trial)
		public void initKeys() {
			Random rnd = new Random(456);
			keys = new String[size];
			misses = new String[size];
			generateKeysAndMisses(rnd, keys, misses);
		}

		@Setup(Level.Iteration)
		public void resetTables() {
			idx = 0;
			chaining = new ChainingHashTable<>(16, maxLoadFactor);
			linear = new LinearProbingHashTable<>(16, maxLoadFactor);
			quadratic = new QuadraticProbingHashTable<>(16, maxLoadFactor);
			jdk = new HashMap<>(16, (float) maxLoadFactor);
			for (String k : keys) {
				chaining.put(k, "dummy");
				linear.put(k, "dummy");
				quadratic.put(k, "dummy");
				jdk.put(k, "dummy");
			}
		}

		@Setup(Level.Invocation)
		public void beforeInvocation() {
			String evictKey = keys[idx];
			chaining.delete(evictKey);
			linear.delete(evictKey);
			quadratic.delete(evictKey);
			jdk.remove(evictKey);

			nextKey = misses[idx];

			// swap so that nextKey becomes a "present" key and evict becomes an "absent" key
			keys[idx] = nextKey;
			misses[idx] = evictKey;

			idx = (idx + 1) % keys.length;
		}

		String nextMissKey() { return nextKey; }
	}

	// ------- get hit/miss -------
	@Benchmark
	public void chainingGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.chaining.lookup(s.nextHitKey()));
	}

	@Benchmark
	public void linearGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.linear.lookup(s.nextHitKey()));
	}

	@Benchmark
	public void quadraticGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.quadratic.lookup(s.nextHitKey()));
	}

	@Benchmark
	public void fastutilGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.fastutil.get(s.nextHitKey()));
	}

	@Benchmark
	public void unifiedGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.unified.get(s.nextHitKey()));
	}

	@Benchmark
	public void jdkGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.jdk.get(s.nextHitKey()));
	}

	@Benchmark
	public void chainingGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.chaining.get(s.nextMissingKey()));
	}

	@Benchmark
	public void linearGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.linear.get(s.nextMissingKey()));
	}

	@Benchmark
	public void quadraticGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.quadratic.get(s.nextMissingKey()));
	}

	@Benchmark
	public void jdkGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.jdk.get(s.nextMissingKey()));
	}

	// ------- mutating: put hit/miss -------
	@Benchmark
	public void chainingPutHit(ReadState s, Blackhole bh) {
		bh.consume(s.chaining.put(s.nextHitKey(), "dummy"));
	}

	@Benchmark
	public void linearPutHit(ReadState s, Blackhole bh) {
		bh.consume(s.linear.put(s.nextHitKey(), "dummy"));
	}

	@Benchmark
	public void quadraticPutHit(ReadState s, Blackhole bh) {
		bh.consume(s.quadratic.put(s.nextHitKey(), "dummy"));
	}

	@Benchmark
	public void jdkPutHit(ReadState s, Blackhole bh) {
		bh.consume(s.jdk.put(s.nextHitKey(), "dummy"));
	}

	@Benchmark
	public void chainingPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.chaining.put(s.nextMissKey(), "dummy"));
	}

	@Benchmark
	public void linearPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.linear.put(s.nextMissKey(), "dummy"));
	}

	@Benchmark
	public void quadraticPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.quadratic.put(s.nextMissKey(), "dummy"));
	}

	@Benchmark
	public void jdkPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.jdk.put(s.nextMissKey(), "dummy"));
	}

	@Benchmark
	public void linearIterate(ReadState s, Blackhole bh) {
		for (Map.Entry<String, Object> e : s.linear.entrySet()) {
			bh.consume(e.getKey());
			bh.consume(e.getValue());
		}
	}

	@Benchmark
	public void chainingIterate(ReadState s, Blackhole bh) {
		for (Map.Entry<String, Object> e : s.chaining.entrySet()) {
			bh.consume(e.getKey());
			bh.consume(e.getValue());
		}
	}
}
