package fla.automata.finite;

import java.util.*;

import fla.StructuralError;
import fla.alphabet.StateId;
import fla.alphabet.Symbol;

/**
 * Allows the simple creation of finite automata, states and symbols are passed as strings.
 *
 * If no alphabet is declared, the symbols used in transitions form the alphabet. States have to be
 * declared before {@link #build()}, undeclared states in transitions are structural errors.
 */
public class FiniteAutomatonBuilder {

	private final boolean deterministic;
	private final Set<StateId> states = new LinkedHashSet<>();
	private final Set<Symbol> alphabet = new LinkedHashSet<>();
	private boolean alphabetDeclared = false;
	private final Map<StateId, Map<Symbol, Set<StateId>>> transitions = new LinkedHashMap<>();
	private final Map<StateId, Set<StateId>> epsilonTransitions = new LinkedHashMap<>();
	private StateId initialState;
	private final Set<StateId> acceptingStates = new LinkedHashSet<>();

	private FiniteAutomatonBuilder(boolean deterministic) {
		this.deterministic = deterministic;
	}

	/**
	 * Builder for a deterministic automaton, {@link #build()} fails if the result isn't deterministic.
	 */
	public static FiniteAutomatonBuilder dfa(){
		return new FiniteAutomatonBuilder(true);
	}

	public static FiniteAutomatonBuilder nfa(){
		return new FiniteAutomatonBuilder(false);
	}

	public FiniteAutomatonBuilder states(String... names){
		for (String name : names){
			states.add(StateId.of(name));
		}
		return this;
	}

	public FiniteAutomatonBuilder alphabet(String... symbols){
		alphabetDeclared = true;
		for (String symbol : symbols){
			alphabet.add(Symbol.of(symbol));
		}
		return this;
	}

	public FiniteAutomatonBuilder initial(String name){
		initialState = StateId.of(name);
		return this;
	}

	public FiniteAutomatonBuilder accepting(String... names){
		for (String name : names){
			acceptingStates.add(StateId.of(name));
		}
		return this;
	}

	public FiniteAutomatonBuilder transition(String from, String symbol, String... to){
		Set<StateId> targets = transitions.computeIfAbsent(StateId.of(from), s -> new LinkedHashMap<>())
				.computeIfAbsent(Symbol.of(symbol), s -> new LinkedHashSet<>());
		for (String target : to){
			targets.add(StateId.of(target));
		}
		return this;
	}

	public FiniteAutomatonBuilder epsilon(String from, String... to){
		if (deterministic){
			throw new StructuralError("Epsilon transitions aren't allowed in deterministic automata");
		}
		Set<StateId> targets = epsilonTransitions.computeIfAbsent(StateId.of(from), s -> new LinkedHashSet<>());
		for (String target : to){
			targets.add(StateId.of(target));
		}
		return this;
	}

	/**
	 * @throws StructuralError if the description is malformed
	 */
	public FiniteAutomaton build(){
		Set<Symbol> usedAlphabet = new LinkedHashSet<>(alphabet);
		if (!alphabetDeclared){
			for (Map<Symbol, Set<StateId>> row : transitions.values()){
				usedAlphabet.addAll(row.keySet());
			}
		}
		FiniteAutomaton automaton = new FiniteAutomaton(states, usedAlphabet, transitions, epsilonTransitions,
				initialState, acceptingStates);
		if (deterministic && !automaton.isDeterministic){
			throw new StructuralError("Duplicate transitions aren't allowed in deterministic automata");
		}
		return automaton;
	}
}
