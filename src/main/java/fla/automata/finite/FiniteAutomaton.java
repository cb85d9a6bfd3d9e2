package fla.automata.finite;

import java.io.Serializable;
import java.util.*;
import java.util.logging.Logger;

import fla.StructuralError;
import fla.alphabet.StateId;
import fla.alphabet.Symbol;
import fla.util.DotUtils;
import fla.util.FixpointIteration;
import guru.nidi.graphviz.model.MutableGraph;

/**
 * An immutable finite automaton, deterministic or not.
 *
 * A deterministic automaton may be partial: a missing transition rejects the word. Transformations
 * like {@link #toDeterministicVersion()} and {@link #toMinimalDeterministicVersion()} create new automata
 * and leave this one untouched.
 *
 * Use the {@link FiniteAutomatonBuilder} to create instances conveniently.
 */
public class FiniteAutomaton implements Serializable {

	public static final Logger LOG = Logger.getLogger("Automata");

	/**
	 * States in their numbering order
	 */
	private final List<StateId> states;

	private final Set<StateId> stateSet;

	private final SortedSet<Symbol> alphabet;

	/**
	 * Maps state and symbol to the target states, contains only non empty target sets.
	 */
	private final Map<StateId, SortedMap<Symbol, SortedSet<StateId>>> transitions;

	private final Map<StateId, SortedSet<StateId>> epsilonTransitions;

	private final StateId initialState;

	private final SortedSet<StateId> acceptingStates;

	/**
	 * No epsilon transitions and at most one target per state and symbol?
	 */
	public final boolean isDeterministic;

	/**
	 * Creates a new automaton and checks its structure.
	 *
	 * @param states states, their iteration order is the numbering order of the automaton
	 * @param alphabet input alphabet
	 * @param transitions state → symbol → target states
	 * @param epsilonTransitions state → targets of epsilon transitions
	 * @param initialState initial state
	 * @param acceptingStates accepting states
	 * @throws StructuralError if a used state or symbol isn't declared
	 */
	public FiniteAutomaton(Collection<StateId> states, Collection<Symbol> alphabet,
	                       Map<StateId, ? extends Map<Symbol, ? extends Collection<StateId>>> transitions,
	                       Map<StateId, ? extends Collection<StateId>> epsilonTransitions,
	                       StateId initialState, Collection<StateId> acceptingStates) {
		this.states = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(states)));
		this.alphabet = Collections.unmodifiableSortedSet(new TreeSet<>(alphabet));
		Set<StateId> stateSet = new HashSet<>(this.states);
		this.stateSet = Collections.unmodifiableSet(stateSet);
		if (initialState == null){
			throw new StructuralError("Automaton has no initial state");
		}
		if (!stateSet.contains(initialState)){
			throw new StructuralError("Initial state %s isn't a state of the automaton", initialState);
		}
		this.initialState = initialState;
		for (StateId accepting : acceptingStates){
			if (!stateSet.contains(accepting)){
				throw new StructuralError("Accepting state %s isn't a state of the automaton", accepting);
			}
		}
		this.acceptingStates = Collections.unmodifiableSortedSet(new TreeSet<>(acceptingStates));
		Map<StateId, SortedMap<Symbol, SortedSet<StateId>>> trans = new HashMap<>();
		boolean deterministic = true;
		for (Map.Entry<StateId, ? extends Map<Symbol, ? extends Collection<StateId>>> entry : transitions.entrySet()){
			StateId from = entry.getKey();
			if (!stateSet.contains(from)){
				throw new StructuralError("Transition from unknown state %s", from);
			}
			SortedMap<Symbol, SortedSet<StateId>> row = new TreeMap<>();
			for (Map.Entry<Symbol, ? extends Collection<StateId>> symbolEntry : entry.getValue().entrySet()){
				Symbol symbol = symbolEntry.getKey();
				if (!this.alphabet.contains(symbol)){
					throw new StructuralError("Symbol %s of transition from %s isn't part of the alphabet %s",
							symbol, from, this.alphabet);
				}
				SortedSet<StateId> targets = new TreeSet<>();
				for (StateId target : symbolEntry.getValue()){
					if (!stateSet.contains(target)){
						throw new StructuralError("Transition %s --%s--> %s points to an unknown state", from, symbol, target);
					}
					targets.add(target);
				}
				if (!targets.isEmpty()){
					deterministic &= targets.size() == 1;
					row.put(symbol, Collections.unmodifiableSortedSet(targets));
				}
			}
			if (!row.isEmpty()){
				trans.put(from, Collections.unmodifiableSortedMap(row));
			}
		}
		this.transitions = Collections.unmodifiableMap(trans);
		Map<StateId, SortedSet<StateId>> eps = new HashMap<>();
		for (Map.Entry<StateId, ? extends Collection<StateId>> entry : epsilonTransitions.entrySet()){
			if (!stateSet.contains(entry.getKey())){
				throw new StructuralError("Epsilon transition from unknown state %s", entry.getKey());
			}
			SortedSet<StateId> targets = new TreeSet<>();
			for (StateId target : entry.getValue()){
				if (!stateSet.contains(target)){
					throw new StructuralError("Epsilon transition %s --ε--> %s points to an unknown state",
							entry.getKey(), target);
				}
				targets.add(target);
			}
			if (!targets.isEmpty()){
				deterministic = false;
				eps.put(entry.getKey(), Collections.unmodifiableSortedSet(targets));
			}
		}
		this.epsilonTransitions = Collections.unmodifiableMap(eps);
		this.isDeterministic = deterministic;
	}

	public List<StateId> getStates() {
		return states;
	}

	public SortedSet<Symbol> getAlphabet() {
		return alphabet;
	}

	public StateId getInitialState() {
		return initialState;
	}

	public SortedSet<StateId> getAcceptingStates() {
		return acceptingStates;
	}

	public boolean isAccepting(StateId state){
		return acceptingStates.contains(state);
	}

	/**
	 * Targets of the transitions that consume the passed symbol, excluding epsilon closures.
	 *
	 * @return empty set if there is no such transition
	 */
	public SortedSet<StateId> targets(StateId state, Symbol symbol){
		SortedMap<Symbol, SortedSet<StateId>> row = transitions.get(state);
		if (row == null || !row.containsKey(symbol)){
			return Collections.emptySortedSet();
		}
		return row.get(symbol);
	}

	/**
	 * Transitions of the passed state as symbol → targets map (sorted by symbol)
	 */
	public SortedMap<Symbol, SortedSet<StateId>> transitionsOf(StateId state){
		return transitions.getOrDefault(state, Collections.emptySortedMap());
	}

	public SortedSet<StateId> epsilonTargets(StateId state){
		return epsilonTransitions.getOrDefault(state, Collections.emptySortedSet());
	}

	public int transitionCount(){
		int count = 0;
		for (SortedMap<Symbol, SortedSet<StateId>> row : transitions.values()){
			for (SortedSet<StateId> targets : row.values()){
				count += targets.size();
			}
		}
		for (SortedSet<StateId> targets : epsilonTransitions.values()){
			count += targets.size();
		}
		return count;
	}

	/**
	 * Smallest superset of the passed states that is closed under epsilon transitions.
	 * Terminates on cyclic epsilon transitions.
	 *
	 * @param states set of states of this automaton
	 * @return unmodifiable closed set
	 */
	public SortedSet<StateId> epsilonClosure(Set<StateId> states){
		for (StateId state : states){
			if (!stateSet.contains(state)){
				throw new IllegalArgumentException("Unknown state " + state);
			}
		}
		if (epsilonTransitions.isEmpty()){
			return Collections.unmodifiableSortedSet(new TreeSet<>(states));
		}
		return Collections.unmodifiableSortedSet(new TreeSet<>(
				FixpointIteration.reachable(new TreeSet<>(states), this::epsilonTargets)));
	}

	/**
	 * States reachable by consuming the passed symbol from one of the passed states (without closure).
	 */
	public SortedSet<StateId> move(Set<StateId> states, Symbol symbol){
		SortedSet<StateId> ret = new TreeSet<>();
		for (StateId state : states){
			ret.addAll(targets(state, symbol));
		}
		return ret;
	}

	/**
	 * Does this automaton accept the passed word?
	 *
	 * A missing transition or a symbol outside of the alphabet rejects the word.
	 */
	public boolean accepts(List<Symbol> word){
		Objects.requireNonNull(word, "word");
		if (isDeterministic){
			StateId current = initialState;
			for (Symbol symbol : word){
				SortedSet<StateId> next = targets(current, symbol);
				if (next.isEmpty()){
					return false;
				}
				current = next.first();
			}
			return isAccepting(current);
		}
		Set<StateId> current = epsilonClosure(Collections.singleton(initialState));
		for (Symbol symbol : word){
			current = epsilonClosure(move(current, symbol));
			if (current.isEmpty()){
				return false;
			}
		}
		for (StateId state : current){
			if (isAccepting(state)){
				return true;
			}
		}
		return false;
	}

	public boolean accepts(String word){
		return accepts(Symbol.chars(word));
	}

	/**
	 * States reachable from the initial state, in breadth first order (symbols in alphabet order,
	 * epsilon transitions last).
	 */
	public List<StateId> reachableStates(){
		return new ArrayList<>(FixpointIteration.reachable(Collections.singletonList(initialState), state -> {
			List<StateId> successors = new ArrayList<>();
			for (SortedSet<StateId> targets : transitionsOf(state).values()){
				successors.addAll(targets);
			}
			successors.addAll(epsilonTargets(state));
			return successors;
		}));
	}

	/**
	 * Creates a copy without the states that aren't reachable from the initial state.
	 */
	public FiniteAutomaton removeUnreachableStates(){
		List<StateId> reachable = reachableStates();
		if (reachable.size() == states.size()){
			return this;
		}
		Set<StateId> reachableSet = new HashSet<>(reachable);
		List<StateId> remaining = new ArrayList<>();
		for (StateId state : states){
			if (reachableSet.contains(state)){
				remaining.add(state);
			}
		}
		Map<StateId, Map<Symbol, SortedSet<StateId>>> trans = new HashMap<>();
		Map<StateId, SortedSet<StateId>> eps = new HashMap<>();
		for (StateId state : remaining){
			trans.put(state, transitionsOf(state));
			eps.put(state, epsilonTargets(state));
		}
		List<StateId> accepting = new ArrayList<>(acceptingStates);
		accepting.retainAll(reachableSet);
		return new FiniteAutomaton(remaining, alphabet, trans, eps, initialState, accepting);
	}

	/**
	 * Makes the powerset construction if the automaton isn't already deterministic.
	 *
	 * @url https://de.wikipedia.org/wiki/Potenzmengenkonstruktion
	 * @return equivalent deterministic automaton
	 */
	public FiniteAutomaton toDeterministicVersion(){
		if (isDeterministic){
			return this;
		}
		return PowersetConstruction.determinize(this);
	}

	/**
	 * Creates the deterministic automaton with the fewest states that accepts the same language.
	 * <p/>
	 * The result is partial (states that can't reach an accepting state are omitted), its states are
	 * numbered in breadth first order starting at the initial state.
	 */
	public FiniteAutomaton toMinimalDeterministicVersion(){
		return Minimization.minimize(toDeterministicVersion());
	}

	/**
	 * Do both automata accept the same language?
	 */
	public boolean isEquivalentTo(FiniteAutomaton other){
		return !findDistinguishingWord(other).isPresent();
	}

	/**
	 * Searches a shortest word that is accepted by exactly one of the automata.
	 *
	 * @return empty if both automata accept the same language
	 */
	public Optional<List<Symbol>> findDistinguishingWord(FiniteAutomaton other){
		return Equivalence.findDistinguishingWord(this.toDeterministicVersion(), other.toDeterministicVersion());
	}

	public MutableGraph toGraphviz(){
		DotUtils dot = new DotUtils("automaton");
		for (StateId state : states){
			dot.state(state.name, isAccepting(state));
		}
		dot.initial(initialState.name);
		for (StateId state : states){
			for (Map.Entry<Symbol, SortedSet<StateId>> entry : transitionsOf(state).entrySet()){
				for (StateId target : entry.getValue()){
					dot.edge(state.name, target.name, entry.getKey().name);
				}
			}
			for (StateId target : epsilonTargets(state)){
				dot.edge(state.name, target.name, "ε");
			}
		}
		return dot.toGraph();
	}

	/**
	 * DOT representation of this automaton
	 */
	public String toGraphvizString(){
		return toGraphviz().toString();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append(isDeterministic ? "DFA" : "NFA")
				.append(" states=").append(states)
				.append(" alphabet=").append(alphabet)
				.append(" initial=").append(initialState)
				.append(" accepting=").append(acceptingStates);
		for (StateId state : states){
			for (Map.Entry<Symbol, SortedSet<StateId>> entry : transitionsOf(state).entrySet()){
				builder.append("\n  ").append(state).append(" --").append(entry.getKey()).append("--> ")
						.append(entry.getValue());
			}
			if (!epsilonTargets(state).isEmpty()){
				builder.append("\n  ").append(state).append(" --ε--> ").append(epsilonTargets(state));
			}
		}
		return builder.toString();
	}
}
