package fla.grammar;

import java.util.*;

import fla.StructuralError;
import fla.alphabet.Symbol;

/**
 * Membership test for grammars in Chomsky normal form (Cocke–Younger–Kasami).
 * <p/>
 * table[length - 1][start] holds the non terminals (as bit indexes) that derive the sub word of the given
 * length beginning at start. The empty word is handled separately by checking whether the start symbol
 * is nullable.
 */
public class CYKRecognizer {

	private final Grammar grammar;
	private final Map<NonTerminal, Integer> indexes = new HashMap<>();
	private final Map<Terminal, BitSet> terminalProducers = new HashMap<>();
	/**
	 * Binary productions as (left, first, second) index triples
	 */
	private final List<int[]> binaryProductions = new ArrayList<>();
	private final boolean acceptsEmptyWord;

	/**
	 * @throws StructuralError if the grammar isn't in Chomsky normal form
	 */
	public CYKRecognizer(Grammar grammar) {
		if (!grammar.isInChomskyNormalForm()){
			throw new StructuralError("CYK requires a grammar in Chomsky normal form, got %s", grammar);
		}
		this.grammar = grammar;
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			indexes.put(nonTerminal, indexes.size());
		}
		for (Production production : grammar.getProductions()){
			int left = indexes.get(production.left);
			if (production.rightSize() == 1){
				terminalProducers.computeIfAbsent((Terminal) production.right.get(0), t -> new BitSet()).set(left);
			} else if (production.rightSize() == 2){
				binaryProductions.add(new int[]{left, indexes.get(production.nonTerminals.get(0)),
						indexes.get(production.nonTerminals.get(1))});
			}
		}
		this.acceptsEmptyWord = grammar.calculateEpsilonable().contains(grammar.getStart());
	}

	/**
	 * Is the word part of the grammar's language?
	 */
	public boolean member(List<Symbol> word){
		int n = word.size();
		if (n == 0){
			return acceptsEmptyWord;
		}
		BitSet[][] table = new BitSet[n][];
		table[0] = new BitSet[n];
		for (int i = 0; i < n; i++){
			BitSet producers = terminalProducers.get(new Terminal(word.get(i)));
			table[0][i] = producers == null ? new BitSet() : (BitSet) producers.clone();
		}
		for (int length = 2; length <= n; length++){
			table[length - 1] = new BitSet[n - length + 1];
			for (int start = 0; start <= n - length; start++){
				BitSet cell = new BitSet();
				for (int split = 1; split < length; split++){
					BitSet firstPart = table[split - 1][start];
					BitSet secondPart = table[length - split - 1][start + split];
					if (firstPart.isEmpty() || secondPart.isEmpty()){
						continue;
					}
					for (int[] production : binaryProductions){
						if (firstPart.get(production[1]) && secondPart.get(production[2])){
							cell.set(production[0]);
						}
					}
				}
				table[length - 1][start] = cell;
			}
		}
		boolean member = table[n - 1][0].get(indexes.get(grammar.getStart()));
		Grammar.LOG.finer(() -> String.format("CYK: %s %s", Symbol.join(word), member ? "accepted" : "rejected"));
		return member;
	}

	public boolean member(String word){
		return member(Symbol.chars(word));
	}

	public static boolean member(Grammar grammar, List<Symbol> word){
		return new CYKRecognizer(grammar).member(word);
	}
}
