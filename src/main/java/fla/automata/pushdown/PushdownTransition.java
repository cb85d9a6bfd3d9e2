package fla.automata.pushdown;

import java.io.Serializable;
import java.util.*;

import fla.alphabet.StateId;
import fla.alphabet.Symbol;

/**
 * A transition <code>(from, input, pop) → (to, push)</code>.
 *
 * The popped top of stack is replaced by the push sequence, its first symbol becomes the new top.
 */
public final class PushdownTransition implements Serializable {

	public final StateId from;

	/**
	 * Consumed input symbol, <code>null</code> for epsilon transitions
	 */
	public final Symbol input;

	public final Symbol pop;

	public final StateId to;

	public final List<Symbol> push;

	public PushdownTransition(StateId from, Symbol input, Symbol pop, StateId to, List<Symbol> push) {
		this.from = Objects.requireNonNull(from);
		this.input = input;
		this.pop = Objects.requireNonNull(pop);
		this.to = Objects.requireNonNull(to);
		this.push = Collections.unmodifiableList(new ArrayList<>(push));
	}

	public boolean isEpsilonTransition(){
		return input == null;
	}

	/**
	 * Label of the form <code>input, pop / push</code>
	 */
	public String label(){
		return (input == null ? "ε" : input.name) + ", " + pop + " / " + (push.isEmpty() ? "ε" : Symbol.join(push));
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof PushdownTransition)){
			return false;
		}
		PushdownTransition other = (PushdownTransition) obj;
		return from.equals(other.from) && Objects.equals(input, other.input) && pop.equals(other.pop)
				&& to.equals(other.to) && push.equals(other.push);
	}

	@Override
	public int hashCode() {
		return Objects.hash(from, input, pop, to, push);
	}

	@Override
	public String toString() {
		return from + " --" + label() + "--> " + to;
	}
}
