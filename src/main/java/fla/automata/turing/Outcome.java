package fla.automata.turing;

public enum Outcome {
	/**
	 * Reached the accept state
	 */
	ACCEPTED,
	/**
	 * Reached the reject state or halted because no transition was defined
	 */
	REJECTED,
	/**
	 * The step budget was exhausted before the machine halted
	 */
	EXCEEDED
}
