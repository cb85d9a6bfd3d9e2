package fla.util;

/**
 * Observes the rounds of a fix point iteration.
 *
 * @param <T> type of the snapshot of the current approximation
 */
@FunctionalInterface
public interface FixpointListener<T> {

	/**
	 * Called after every round with an unmodifiable snapshot of the current approximation.
	 *
	 * @param round number of the finished round, starting at 1
	 * @param snapshot current approximation
	 */
	void afterRound(int round, T snapshot);

	static <T> FixpointListener<T> ignore(){
		return (round, snapshot) -> {};
	}
}
