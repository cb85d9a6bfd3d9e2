package fla.grammar;

import java.io.Serializable;

/**
 * Base class for terminal symbols, non terminal symbols and the empty word.
 *
 * Ordering: epsilon first, then terminals (end of input marker last) and non terminals, each sorted by name.
 */
public abstract class GrammarSymbol implements Serializable, Comparable<GrammarSymbol> {

	public abstract String getName();

	abstract int kindOrder();

	@Override
	public int compareTo(GrammarSymbol o) {
		if (kindOrder() != o.kindOrder()){
			return Integer.compare(kindOrder(), o.kindOrder());
		}
		return getName().compareTo(o.getName());
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == getClass() && ((GrammarSymbol) obj).getName().equals(getName());
	}

	@Override
	public int hashCode() {
		return getName().hashCode() * 31 + kindOrder();
	}

	@Override
	public String toString() {
		return getName();
	}
}
