package fla.automata.pushdown;

/**
 * Result of a bounded acceptance search
 */
public enum Verdict {
	ACCEPT,
	REJECT,
	/**
	 * The step budget was exhausted before a decision was reached
	 */
	INCONCLUSIVE
}
