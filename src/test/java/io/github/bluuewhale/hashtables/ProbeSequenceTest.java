package io.github.bluuewhale.hashtables;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.PrimitiveIterator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ProbeSequenceTest {

	private static List<Integer> take(PrimitiveIterator.OfInt it, int n) {
		List<Integer> out = new ArrayList<>(n);
		for (int i = 0; i < n; i++) {
			out.add(it.nextInt());
		}
		return out;
	}

	@Test
	void linearWrapsAround() {
		assertEquals(List.of(6, 7, 0, 1, 2, 3, 4, 5, 6, 7), take(ProbeSequence.LINEAR.generate(6, 8), 10));
	}

	@Test
	void quadraticFollowsTriangularOffsets() {
		assertEquals(
			List.of(6, 7, 1, 4, 0, 5, 3, 2, 2, 3, 5, 0, 4, 1, 7),
			take(ProbeSequence.QUADRATIC.generate(6, 8), 15));
	}

	@Test
	void quadraticVisitsEverySlotForPowerOfTwo() {
		for (int home = 0; home < 16; home++) {
			var seen = new HashSet<>(take(ProbeSequence.QUADRATIC.generate(home, 16), 16));
			assertEquals(16, seen.size(), "home " + home);
		}
	}

	@Test
	void quadraticMissesSlotsForOtherCapacities() {
		// offsets 0, 1, 3 mod 3 never reach home + 2
		assertEquals(List.of(0, 1, 0), take(ProbeSequence.QUADRATIC.generate(0, 3), 3));
	}

	@ParameterizedTest
	@EnumSource(ProbeSequence.class)
	void generateMatchesIndexAt(ProbeSequence probes) {
		int capacity = 13;
		int home = 5;
		var it = probes.generate(home, capacity);
		for (int attempt = 0; attempt < 200; attempt++) {
			assertEquals(probes.indexAt(home, attempt, capacity), it.nextInt(), "attempt " + attempt);
		}
	}

	@ParameterizedTest
	@EnumSource(ProbeSequence.class)
	void eachCallStartsOver(ProbeSequence probes) {
		assertEquals(take(probes.generate(3, 8), 12), take(probes.generate(3, 8), 12));
	}

	@ParameterizedTest
	@EnumSource(ProbeSequence.class)
	void rejectsBadArguments(ProbeSequence probes) {
		assertThrows(IllegalArgumentException.class, () -> probes.generate(0, 0));
		assertThrows(IllegalArgumentException.class, () -> probes.generate(-1, 8));
		assertThrows(IllegalArgumentException.class, () -> probes.generate(8, 8));
	}

	@Test
	void indexAtDoesNotOverflow() {
		int capacity = Integer.MAX_VALUE;
		int idx = ProbeSequence.QUADRATIC.indexAt(capacity - 1, Integer.MAX_VALUE, capacity);
		assertTrue(idx >= 0 && idx < capacity);
		// MAX * (MAX + 1) / 2 is a multiple of MAX
		assertEquals(capacity - 1, idx);
		assertEquals(0, ProbeSequence.QUADRATIC.indexAt(0, Integer.MAX_VALUE, capacity));
		assertEquals(capacity - 2, ProbeSequence.LINEAR.indexAt(capacity - 1, capacity - 1, capacity));
	}
}
