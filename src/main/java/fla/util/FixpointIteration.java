package fla.util;

import java.util.*;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Fix point and worklist iterations used by the automata and grammar algorithms.
 */
public class FixpointIteration {

	/**
	 * Repeats the passed round until it reports that nothing changed.
	 *
	 * @param round returns true if something changed
	 * @param snapshot creates the snapshot passed to the listener
	 * @param listener notified after every round
	 * @return number of rounds
	 */
	public static <T> int untilStable(BooleanSupplier round, Supplier<T> snapshot, FixpointListener<T> listener){
		int rounds = 0;
		boolean somethingChanged;
		do {
			somethingChanged = round.getAsBoolean();
			rounds++;
			listener.afterRound(rounds, snapshot.get());
		} while (somethingChanged);
		return rounds;
	}

	/**
	 * Collects everything reachable from the start elements, including them.
	 * <p/>
	 * Uses a worklist in breadth first order, the iteration order of the result is the visiting order
	 * and therefore deterministic if the successor function is.
	 *
	 * @param start start elements
	 * @param successors direct successors of an element
	 * @return reachable elements in visiting order
	 */
	public static <T> LinkedHashSet<T> reachable(Collection<T> start, Function<T, ? extends Collection<T>> successors){
		LinkedHashSet<T> alreadyVisited = new LinkedHashSet<>(start);
		Deque<T> toVisit = new ArrayDeque<>(start);
		while (!toVisit.isEmpty()){
			T current = toVisit.poll();
			for (T next : successors.apply(current)){
				if (alreadyVisited.add(next)){
					toVisit.add(next);
				}
			}
		}
		return alreadyVisited;
	}
}
