package fla.alphabet;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identifier of an automaton state, compared by name.
 *
 * Ordering puts shorter names first, so that generated names like <code>q2</code> sort before <code>q10</code>.
 */
public final class StateId implements Serializable, Comparable<StateId> {

	public final String name;

	private StateId(String name) {
		this.name = name;
	}

	public static StateId of(String name){
		Objects.requireNonNull(name, "state name");
		if (name.isEmpty()){
			throw new IllegalArgumentException("State names must not be empty");
		}
		return new StateId(name);
	}

	/**
	 * State with the generated name <code>q&lt;number&gt;</code>, used by the automata transformations.
	 */
	public static StateId numbered(int number){
		return new StateId("q" + number);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof StateId && ((StateId) obj).name.equals(name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public int compareTo(StateId o) {
		if (name.length() != o.name.length()){
			return Integer.compare(name.length(), o.name.length());
		}
		return name.compareTo(o.name);
	}

	@Override
	public String toString() {
		return name;
	}
}
