package fla.automata.turing;

import java.io.Serializable;
import java.util.Objects;

import fla.alphabet.StateId;
import fla.alphabet.Symbol;

/**
 * Transition <code>(from, read) → (to, write, move)</code>
 */
public final class TuringTransition implements Serializable {

	public final StateId from;
	public final Symbol read;
	public final StateId to;
	public final Symbol write;
	public final Move move;

	public TuringTransition(StateId from, Symbol read, StateId to, Symbol write, Move move) {
		this.from = Objects.requireNonNull(from);
		this.read = Objects.requireNonNull(read);
		this.to = Objects.requireNonNull(to);
		this.write = Objects.requireNonNull(write);
		this.move = Objects.requireNonNull(move);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof TuringTransition)){
			return false;
		}
		TuringTransition other = (TuringTransition) obj;
		return from.equals(other.from) && read.equals(other.read) && to.equals(other.to)
				&& write.equals(other.write) && move == other.move;
	}

	@Override
	public int hashCode() {
		return Objects.hash(from, read, to, write, move);
	}

	@Override
	public String toString() {
		return from + " --" + read + " / " + write + ", " + (move == Move.LEFT ? "L" : "R") + "--> " + to;
	}
}
