package fla.automata.turing;

import java.util.List;

import fla.alphabet.StateId;
import fla.alphabet.Symbol;

/**
 * Result of running a Turing machine
 */
public class Execution {

	public final Outcome outcome;

	/**
	 * Number of applied transitions
	 */
	public final int steps;

	public final StateId finalState;

	/**
	 * Tape contents without leading and trailing blanks
	 */
	public final List<Symbol> tape;

	public final int headPosition;

	Execution(Outcome outcome, int steps, StateId finalState, List<Symbol> tape, int headPosition) {
		this.outcome = outcome;
		this.steps = steps;
		this.finalState = finalState;
		this.tape = tape;
		this.headPosition = headPosition;
	}

	@Override
	public String toString() {
		return String.format("%s after %d steps in %s, tape %s", outcome, steps, finalState, Symbol.join(tape));
	}
}
