package fla.automata.pushdown;

public enum AcceptanceMode {
	/**
	 * Input consumed and in an accepting state, the stack contents don't matter
	 */
	FINAL_STATE,
	/**
	 * Input consumed and the stack is empty, the state doesn't matter
	 */
	EMPTY_STACK
}
