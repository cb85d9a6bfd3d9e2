package fla.automata.pushdown;

import java.util.*;

import fla.alphabet.StateId;
import fla.alphabet.Symbol;

/**
 * Instantaneous description of a pushdown automaton: current state, number of consumed input symbols
 * and the stack (top first).
 */
public final class Configuration {

	public final StateId state;

	public final int position;

	public final List<Symbol> stack;

	private final int hash;

	Configuration(StateId state, int position, List<Symbol> stack) {
		this.state = state;
		this.position = position;
		this.stack = Collections.unmodifiableList(stack);
		this.hash = Objects.hash(state, position, stack);
	}

	public Optional<Symbol> top(){
		return stack.isEmpty() ? Optional.empty() : Optional.of(stack.get(0));
	}

	/**
	 * Configuration after applying the transition
	 *
	 * @param consumed consumes the transition an input symbol?
	 */
	Configuration apply(PushdownTransition transition, boolean consumed){
		List<Symbol> newStack = new ArrayList<>(transition.push.size() + stack.size() - 1);
		newStack.addAll(transition.push);
		newStack.addAll(stack.subList(1, stack.size()));
		return new Configuration(transition.to, consumed ? position + 1 : position, newStack);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Configuration)){
			return false;
		}
		Configuration other = (Configuration) obj;
		return hash == other.hash && position == other.position && state.equals(other.state)
				&& stack.equals(other.stack);
	}

	@Override
	public int hashCode() {
		return hash;
	}

	@Override
	public String toString() {
		return "(" + state + ", " + position + ", " + (stack.isEmpty() ? "ε" : Symbol.join(stack)) + ")";
	}
}
