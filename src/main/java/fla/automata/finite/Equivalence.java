package fla.automata.finite;

import java.util.*;

import fla.alphabet.StateId;
import fla.alphabet.Symbol;
import fla.util.Pair;

/**
 * Breadth first search over the product of two deterministic automata for a pair of states
 * where exactly one accepts. A <code>null</code> component stands for the implicit dead state.
 */
class Equivalence {

	static Optional<List<Symbol>> findDistinguishingWord(FiniteAutomaton first, FiniteAutomaton second){
		SortedSet<Symbol> alphabet = new TreeSet<>(first.getAlphabet());
		alphabet.addAll(second.getAlphabet());
		Pair<StateId, StateId> start = new Pair<>(first.getInitialState(), second.getInitialState());
		Map<Pair<StateId, StateId>, Pair<Pair<StateId, StateId>, Symbol>> parents = new HashMap<>();
		Set<Pair<StateId, StateId>> visited = new HashSet<>();
		Deque<Pair<StateId, StateId>> toVisit = new ArrayDeque<>();
		visited.add(start);
		toVisit.add(start);
		while (!toVisit.isEmpty()){
			Pair<StateId, StateId> current = toVisit.poll();
			boolean firstAccepts = current.first != null && first.isAccepting(current.first);
			boolean secondAccepts = current.second != null && second.isAccepting(current.second);
			if (firstAccepts != secondAccepts){
				LinkedList<Symbol> word = new LinkedList<>();
				Pair<StateId, StateId> pair = current;
				while (parents.containsKey(pair)){
					Pair<Pair<StateId, StateId>, Symbol> parent = parents.get(pair);
					word.addFirst(parent.second);
					pair = parent.first;
				}
				return Optional.of(Collections.unmodifiableList(word));
			}
			for (Symbol symbol : alphabet){
				Pair<StateId, StateId> next = new Pair<>(step(first, current.first, symbol),
						step(second, current.second, symbol));
				if (next.first == null && next.second == null){
					continue;
				}
				if (visited.add(next)){
					parents.put(next, new Pair<>(current, symbol));
					toVisit.add(next);
				}
			}
		}
		return Optional.empty();
	}

	private static StateId step(FiniteAutomaton dfa, StateId state, Symbol symbol){
		if (state == null){
			return null;
		}
		SortedSet<StateId> targets = dfa.targets(state, symbol);
		return targets.isEmpty() ? null : targets.first();
	}
}
