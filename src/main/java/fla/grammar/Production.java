package fla.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A grammar production with a left and a right hand side.
 *
 * Two productions are equal if their sides are equal, the id is only the position in the grammar.
 */
public class Production implements Serializable {

	/**
	 * Id of the production, its index in the grammar
	 */
	public final int id;
	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production without epsilons, empty for epsilon productions.
	 */
	public final List<GrammarSymbol> right;

	/**
	 * Non terminals used in the right hand side
	 */
	public final List<NonTerminal> nonTerminals;

	/**
	 * Terminals used in the right hand side
	 */
	public final List<Terminal> terminals;

	public Production(int id, NonTerminal left, List<? extends GrammarSymbol> right) {
		this.id = id;
		this.left = left;
		List<GrammarSymbol> r = new ArrayList<>();
		List<NonTerminal> nonTerminals = new ArrayList<>();
		List<Terminal> terminals = new ArrayList<>();
		for (GrammarSymbol symbol : right){
			if (symbol instanceof Epsilon){
				continue;
			}
			r.add(symbol);
			if (symbol instanceof NonTerminal){
				nonTerminals.add((NonTerminal)symbol);
			} else {
				terminals.add((Terminal) symbol);
			}
		}
		this.right = Collections.unmodifiableList(r);
		this.nonTerminals = Collections.unmodifiableList(nonTerminals);
		this.terminals = Collections.unmodifiableList(terminals);
	}

	/**
	 * Copy with another id
	 */
	Production withId(int id){
		return new Production(id, left, right);
	}

	public String formatRightSide(){
		if (right.isEmpty()){
			return Epsilon.EPSILON.toString();
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return left.toString() + " → " + formatRightSide();
	}

	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Production && ((Production)obj).left.equals(left) && ((Production)obj).right.equals(right);
	}

	@Override
	public int hashCode() {
		return left.hashCode() * 31 + right.hashCode();
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return right.size();
	}
}
