package io.github.bluuewhale.hashtables;

import static io.github.bluuewhale.hashtables.SlotState.EMPTY;
import static io.github.bluuewhale.hashtables.SlotState.TOMBSTONE;
import static io.github.bluuewhale.hashtables.TableLayouts.slots;
import static java.util.Map.entry;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class OpenAddressingHashTableTest {

	private static OpenAddressingHashTable<Integer, Integer> newTable(ProbeSequence probes, int capacity, double lf) {
		return (probes == ProbeSequence.LINEAR)
			? new LinearProbingHashTable<>(capacity, lf)
			: new QuadraticProbingHashTable<>(capacity, lf);
	}

	@ParameterizedTest
	@EnumSource(ProbeSequence.class)
	void deletedKeyDoesNotShadowLaterKeyOnItsWalk(ProbeSequence probes) {
		var t = newTable(probes, 16, 0.9);
		t.put(3, 1);
		t.put(19, 2); // same home, probes past 3
		t.delete(3);

		t.put(19, 20);

		assertEquals(1, t.size());
		assertEquals(20, t.lookup(19));
		assertEquals(1, t.tombstones());
		assertEquals(TOMBSTONE, t.stateAt(3));
	}

	@ParameterizedTest
	@EnumSource(ProbeSequence.class)
	void iteratorRemoveLeavesTombstone(ProbeSequence probes) {
		var t = newTable(probes, 8, 0.9);
		t.put(1, 10);
		t.put(2, 20);

		var it = t.entrySet().iterator();
		it.next();
		it.remove();

		assertEquals(List.of(EMPTY, TOMBSTONE, entry(2, 20), EMPTY, EMPTY, EMPTY, EMPTY, EMPTY), slots(t));
		assertEquals(1, t.tombstones());
	}

	@Test
	void linearTableFullWhenLoadFactorAllowsIt() {
		var t = new LinearProbingHashTable<Integer, Integer>(2, 1.0);
		t.put(0, 0);
		t.put(1, 1);

		var e = assertThrows(TableFullException.class, () -> t.put(2, 2));
		assertEquals(2, e.getCapacity());
		assertEquals(2, t.size());
	}

	@Test
	void quadraticTableFullWhenProbesMissFreeSlot() {
		// capacity 3: from home 0 the walk is 0, 1, 0 and never sees slot 2
		var t = new QuadraticProbingHashTable<Integer, Integer>(3, 0.99);
		t.put(0, 0);
		t.put(1, 1);
		assertEquals(List.of(entry(0, 0), entry(1, 1), EMPTY), slots(t));

		assertThrows(TableFullException.class, () -> t.put(3, 3));
		assertEquals(2, t.size());
		assertThrows(KeyNotFoundException.class, () -> t.lookup(3));
	}

	@Test
	void exhaustedWalkReusesRememberedTombstone() {
		var t = new QuadraticProbingHashTable<Integer, Integer>(3, 0.99);
		t.put(0, 0);
		t.put(1, 1);
		t.delete(0);

		t.put(3, 3);

		assertEquals(List.of(entry(3, 3), entry(1, 1), EMPTY), slots(t));
		assertEquals(2, t.size());
		assertEquals(0, t.tombstones());
	}

	@Test
	void defaults() {
		var linear = new LinearProbingHashTable<String, String>();
		assertEquals(8, linear.capacity());
		assertEquals(0.6, linear.maxLoadFactor());
		assertEquals(2, linear.growthFactor());

		var quadratic = new QuadraticProbingHashTable<String, String>(32);
		assertEquals(32, quadratic.capacity());
		assertEquals(0.6, quadratic.maxLoadFactor());
	}
}
