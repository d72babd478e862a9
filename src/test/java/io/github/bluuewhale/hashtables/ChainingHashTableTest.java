package io.github.bluuewhale.hashtables;

import static io.github.bluuewhale.hashtables.TableLayouts.buckets;
import static java.util.Map.entry;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class ChainingHashTableTest {

	@Test
	void insertions() {
		var table = new ChainingHashTable<Integer, Integer>(4, 0.9);

		table.put(2, 100);
		assertEquals(Arrays.asList(null, null, List.of(entry(2, 100)), null), buckets(table));
		table.put(3, 101);
		assertEquals(Arrays.asList(null, null, List.of(entry(2, 100)), List.of(entry(3, 101))), buckets(table));

		// same bucket, appended
		table.put(6, 200);
		assertEquals(
			Arrays.asList(null, null, List.of(entry(2, 100), entry(6, 200)), List.of(entry(3, 101))),
			buckets(table));
		assertEquals(3, table.size());

		// overwrites keep the node's position
		table.put(2, 90);
		assertEquals(
			Arrays.asList(null, null, List.of(entry(2, 90), entry(6, 200)), List.of(entry(3, 101))),
			buckets(table));
		table.put(6, 115);
		assertEquals(
			Arrays.asList(null, null, List.of(entry(2, 90), entry(6, 115)), List.of(entry(3, 101))),
			buckets(table));
		assertEquals(3, table.size());

		// 4/4 > 0.9
		table.put(0, 25);
		assertEquals(8, table.capacity());
		assertEquals(
			Arrays.asList(
				List.of(entry(0, 25)), null, List.of(entry(2, 90)), List.of(entry(3, 101)),
				null, null, List.of(entry(6, 115)), null),
			buckets(table));
	}

	@Test
	void lookups() {
		var table = new ChainingHashTable<Integer, Integer>(4, 0.9);
		table.put(2, 100);
		table.put(3, 101);
		table.put(6, 200);

		assertEquals(100, table.lookup(2));
		assertEquals(101, table.lookup(3));
		assertEquals(200, table.lookup(6));
		assertThrows(KeyNotFoundException.class, () -> table.lookup(10));
		assertThrows(KeyNotFoundException.class, () -> table.lookup(0));
	}

	@Test
	void delete() {
		var table = new ChainingHashTable<Integer, Integer>(4, 0.9);
		table.put(2, 100);
		table.put(3, 101);
		table.put(6, 200);

		assertEquals(200, table.delete(6));
		assertEquals(Arrays.asList(null, null, List.of(entry(2, 100)), List.of(entry(3, 101))), buckets(table));
		assertEquals(2, table.size());

		// emptied bucket goes back to null
		table.delete(2);
		assertEquals(Arrays.asList(null, null, null, List.of(entry(3, 101))), buckets(table));
		assertEquals(1, table.size());
		assertEquals(0, table.tombstones());

		assertThrows(KeyNotFoundException.class, () -> table.delete(0));
		assertThrows(KeyNotFoundException.class, () -> table.delete(2));
	}

	@Test
	void iterationFollowsBucketThenAppendOrder() {
		var table = new ChainingHashTable<Integer, Integer>(4, 0.9);
		table.put(3, 101);
		table.put(6, 200);
		table.put(2, 100);

		assertEquals(List.of(6, 2, 3), new ArrayList<>(table.keySet()));
	}

	@Test
	void iteratorRemoveAcrossBuckets() {
		var table = new ChainingHashTable<Integer, Integer>(4, 0.9);
		table.put(2, 100);
		table.put(6, 200);
		table.put(3, 101);

		var it = table.entrySet().iterator();
		while (it.hasNext()) {
			var e = it.next();
			if (e.getKey() != 3) {
				it.remove();
			}
		}
		assertEquals(Arrays.asList(null, null, null, List.of(entry(3, 101))), buckets(table));
		assertEquals(1, table.size());
	}

	@Test
	void loadFactorCanExceedOne() {
		var table = new ChainingHashTable<Integer, Integer>(2, 2.0);
		for (int i = 0; i < 4; i++) {
			table.put(i, i);
		}
		assertEquals(2, table.capacity());
		assertEquals(2.0, table.loadFactor());

		table.put(4, 4);
		assertEquals(4, table.capacity());
		assertEquals(1.25, table.loadFactor());
	}

	@Test
	void defaults() {
		var table = new ChainingHashTable<String, String>();
		assertEquals(8, table.capacity());
		assertEquals(1.0, table.maxLoadFactor());
		assertEquals(2, table.growthFactor());
	}
}
