package fla.util;

import java.util.*;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FixpointIterationTest {

	@Test
	public void testUntilStableCountsTheLastRound(){
		int[] value = {0};
		List<Integer> snapshots = new ArrayList<>();
		int rounds = FixpointIteration.untilStable(() -> {
			if (value[0] < 3){
				value[0]++;
				return true;
			}
			return false;
		}, () -> value[0], (round, snapshot) -> snapshots.add(snapshot));
		assertEquals(4, rounds);
		assertEquals(Arrays.asList(1, 2, 3, 3), snapshots);
	}

	@Test
	public void testReachableInBreadthFirstOrder(){
		Map<Integer, List<Integer>> successors = new HashMap<>();
		successors.put(1, Arrays.asList(3, 2));
		successors.put(2, Arrays.asList(4, 1));
		successors.put(3, Collections.singletonList(4));
		successors.put(5, Collections.singletonList(1));
		Set<Integer> reachable = FixpointIteration.reachable(Collections.singletonList(1),
				i -> successors.getOrDefault(i, Collections.emptyList()));
		assertEquals(Arrays.asList(1, 3, 2, 4), new ArrayList<>(reachable));
	}
}
