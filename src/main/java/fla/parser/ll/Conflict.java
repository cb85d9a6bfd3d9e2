package fla.parser.ll;

import java.io.Serializable;
import java.util.Objects;

import fla.grammar.NonTerminal;
import fla.grammar.Production;
import fla.grammar.Terminal;

/**
 * A parser table cell that two different productions compete for.
 */
public final class Conflict implements Serializable {

	public final NonTerminal nonTerminal;
	public final Terminal lookahead;
	/**
	 * Production that was registered first
	 */
	public final Production first;
	public final Production second;

	public Conflict(NonTerminal nonTerminal, Terminal lookahead, Production first, Production second) {
		this.nonTerminal = nonTerminal;
		this.lookahead = lookahead;
		this.first = first;
		this.second = second;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Conflict)){
			return false;
		}
		Conflict other = (Conflict) obj;
		return nonTerminal.equals(other.nonTerminal) && lookahead.equals(other.lookahead)
				&& first.equals(other.first) && second.equals(other.second);
	}

	@Override
	public int hashCode() {
		return Objects.hash(nonTerminal, lookahead, first, second);
	}

	@Override
	public String toString() {
		return String.format("Conflict between %s and %s at lookahead token %s", first, second, lookahead);
	}
}
