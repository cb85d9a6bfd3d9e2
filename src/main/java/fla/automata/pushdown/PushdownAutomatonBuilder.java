package fla.automata.pushdown;

import java.util.*;

import fla.StructuralError;
import fla.alphabet.StateId;
import fla.alphabet.Symbol;

/**
 * Allows the simple creation of pushdown automata.
 *
 * Alphabets that aren't declared are collected from the transitions.
 */
public class PushdownAutomatonBuilder {

	private final Set<StateId> states = new LinkedHashSet<>();
	private final Set<Symbol> inputAlphabet = new LinkedHashSet<>();
	private final Set<Symbol> stackAlphabet = new LinkedHashSet<>();
	private boolean inputAlphabetDeclared = false;
	private boolean stackAlphabetDeclared = false;
	private StateId initialState;
	private Symbol initialStackSymbol;
	private final Set<StateId> acceptingStates = new LinkedHashSet<>();
	private final List<PushdownTransition> transitions = new ArrayList<>();

	public PushdownAutomatonBuilder states(String... names){
		for (String name : names){
			states.add(StateId.of(name));
		}
		return this;
	}

	public PushdownAutomatonBuilder inputAlphabet(String... symbols){
		inputAlphabetDeclared = true;
		for (String symbol : symbols){
			inputAlphabet.add(Symbol.of(symbol));
		}
		return this;
	}

	public PushdownAutomatonBuilder stackAlphabet(String... symbols){
		stackAlphabetDeclared = true;
		for (String symbol : symbols){
			stackAlphabet.add(Symbol.of(symbol));
		}
		return this;
	}

	public PushdownAutomatonBuilder initial(String state, String stackSymbol){
		initialState = StateId.of(state);
		initialStackSymbol = Symbol.of(stackSymbol);
		return this;
	}

	public PushdownAutomatonBuilder accepting(String... names){
		for (String name : names){
			acceptingStates.add(StateId.of(name));
		}
		return this;
	}

	/**
	 * Adds a transition that consumes an input symbol.
	 *
	 * @param push replacement of the popped symbol, first symbol is the new top
	 */
	public PushdownAutomatonBuilder transition(String from, String input, String pop, String to, String... push){
		transitions.add(new PushdownTransition(StateId.of(from), Symbol.of(input), Symbol.of(pop), StateId.of(to),
				symbols(push)));
		return this;
	}

	public PushdownAutomatonBuilder epsilonTransition(String from, String pop, String to, String... push){
		transitions.add(new PushdownTransition(StateId.of(from), null, Symbol.of(pop), StateId.of(to), symbols(push)));
		return this;
	}

	private static List<Symbol> symbols(String... names){
		List<Symbol> ret = new ArrayList<>();
		for (String name : names){
			ret.add(Symbol.of(name));
		}
		return ret;
	}

	/**
	 * @throws StructuralError if the description is malformed
	 */
	public PushdownAutomaton build(){
		if (initialState == null){
			throw new StructuralError("Pushdown automaton has no initial state");
		}
		Set<Symbol> input = new LinkedHashSet<>(inputAlphabet);
		Set<Symbol> stack = new LinkedHashSet<>(stackAlphabet);
		if (!stackAlphabetDeclared){
			stack.add(initialStackSymbol);
		}
		for (PushdownTransition transition : transitions){
			if (!inputAlphabetDeclared && transition.input != null){
				input.add(transition.input);
			}
			if (!stackAlphabetDeclared){
				stack.add(transition.pop);
				stack.addAll(transition.push);
			}
		}
		return new PushdownAutomaton(states, input, stack, initialState, initialStackSymbol, acceptingStates,
				transitions);
	}
}
