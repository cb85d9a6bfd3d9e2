package fla.automata.finite;

import java.util.*;

import fla.alphabet.StateId;
import fla.alphabet.Symbol;

import static fla.automata.finite.FiniteAutomaton.LOG;

/**
 * Subset construction: every state of the deterministic automaton stands for a non empty, epsilon closed
 * set of states of the non deterministic one.
 * <p/>
 * Subsets are discovered breadth first from the closure of the initial state, symbols are tried in
 * alphabet order. The n-th discovered subset becomes state <code>q&lt;n&gt;</code>.
 */
class PowersetConstruction {

	static FiniteAutomaton determinize(FiniteAutomaton nfa){
		Map<SortedSet<StateId>, StateId> setToId = new HashMap<>();
		List<SortedSet<StateId>> subsets = new ArrayList<>();
		Map<StateId, Map<Symbol, Set<StateId>>> transitions = new HashMap<>();
		List<StateId> accepting = new ArrayList<>();

		SortedSet<StateId> initialSet = nfa.epsilonClosure(Collections.singleton(nfa.getInitialState()));
		setToId.put(initialSet, StateId.numbered(0));
		subsets.add(initialSet);

		Deque<SortedSet<StateId>> toVisit = new ArrayDeque<>();
		toVisit.add(initialSet);
		while (!toVisit.isEmpty()){
			SortedSet<StateId> current = toVisit.poll();
			StateId currentId = setToId.get(current);
			for (StateId part : current){
				if (nfa.isAccepting(part)){
					accepting.add(currentId);
					break;
				}
			}
			Map<Symbol, Set<StateId>> row = new HashMap<>();
			for (Symbol symbol : nfa.getAlphabet()){
				SortedSet<StateId> next = nfa.epsilonClosure(nfa.move(current, symbol));
				if (next.isEmpty()){
					continue;
				}
				StateId nextId = setToId.get(next);
				if (nextId == null){
					nextId = StateId.numbered(subsets.size());
					setToId.put(next, nextId);
					subsets.add(next);
					toVisit.add(next);
				}
				row.put(symbol, Collections.singleton(nextId));
			}
			transitions.put(currentId, row);
		}
		List<StateId> states = new ArrayList<>();
		for (SortedSet<StateId> subset : subsets){
			states.add(setToId.get(subset));
		}
		LOG.fine(() -> String.format("Subset construction: %d NFA states → %d DFA states %s",
				nfa.getStates().size(), subsets.size(), subsets));
		return new FiniteAutomaton(states, nfa.getAlphabet(), transitions, Collections.emptyMap(),
				states.get(0), accepting);
	}
}
