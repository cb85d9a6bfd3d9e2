package fla.grammar;

import java.util.*;

import fla.StructuralError;

/**
 * Allows the simple creation of grammars.
 *
 * In this class all symbols are strings: a string is a non terminal if it appears on the left hand side
 * of a production or is declared via {@link #nonTerminals(String...)}, every other string is a terminal.
 * The empty string and "ε" stand for the empty word.
 */
public class GrammarBuilder {

	private final Set<String> declaredNonTerminals = new LinkedHashSet<>();
	private final Set<String> declaredTerminals = new LinkedHashSet<>();
	private boolean terminalsDeclared = false;
	private final List<String[]> productions = new ArrayList<>();

	public GrammarBuilder nonTerminals(String... names){
		declaredNonTerminals.addAll(Arrays.asList(names));
		return this;
	}

	/**
	 * Declares the terminals, using other symbols that aren't non terminals is an error afterwards
	 */
	public GrammarBuilder terminals(String... names){
		terminalsDeclared = true;
		declaredTerminals.addAll(Arrays.asList(names));
		return this;
	}

	/**
	 * Adds a new production.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production, no symbols or only "" produce an epsilon production
	 */
	public GrammarBuilder add(String left, String... right){
		if (left == null || left.isEmpty() || isEpsilon(left)){
			throw new StructuralError("Invalid left hand side '%s'", left);
		}
		String[] prod = new String[right.length + 1];
		prod[0] = left;
		System.arraycopy(right, 0, prod, 1, right.length);
		productions.add(prod);
		return this;
	}

	/**
	 * Adds a production whose right hand side is given as whitespace separated symbols
	 */
	public GrammarBuilder addWords(String left, String rightSide){
		String trimmed = rightSide.trim();
		return add(left, trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+"));
	}

	private static boolean isEpsilon(String symbol){
		return symbol.isEmpty() || symbol.equals(Epsilon.EPSILON.getName());
	}

	/**
	 * @param startNonTerminal name of the start non terminal
	 * @throws StructuralError if the start symbol isn't a non terminal or a symbol is used inconsistently
	 */
	public Grammar toGrammar(String startNonTerminal){
		Map<String, NonTerminal> nonTerminals = new LinkedHashMap<>();
		for (String name : declaredNonTerminals){
			nonTerminals.put(name, new NonTerminal(name));
		}
		for (String[] prod : productions){
			nonTerminals.computeIfAbsent(prod[0], NonTerminal::new);
		}
		for (String name : declaredTerminals){
			if (nonTerminals.containsKey(name)){
				throw new StructuralError("'%s' is used as terminal and as non terminal", name);
			}
		}
		Map<String, Terminal> terminals = new LinkedHashMap<>();
		for (String name : declaredTerminals){
			terminals.put(name, Terminal.of(name));
		}
		List<Production> result = new ArrayList<>();
		for (String[] prod : productions){
			List<GrammarSymbol> right = new ArrayList<>();
			for (int i = 1; i < prod.length; i++){
				String name = prod[i];
				if (isEpsilon(name)){
					right.add(Epsilon.EPSILON);
				} else if (nonTerminals.containsKey(name)){
					right.add(nonTerminals.get(name));
				} else if (terminals.containsKey(name)){
					right.add(terminals.get(name));
				} else if (terminalsDeclared){
					throw new StructuralError("Symbol '%s' in a production of %s is neither a declared terminal " +
							"nor a non terminal", name, prod[0]);
				} else {
					Terminal terminal = Terminal.of(name);
					terminals.put(name, terminal);
					right.add(terminal);
				}
			}
			result.add(new Production(result.size(), nonTerminals.get(prod[0]), right));
		}
		return new Grammar(nonTerminals.values(), terminals.values(), result,
				startNonTerminal == null ? null : nonTerminals.get(startNonTerminal));
	}
}
