package fla.automata.turing;

import java.util.*;

import fla.StructuralError;
import fla.alphabet.StateId;
import fla.alphabet.Symbol;

/**
 * Allows the simple creation of Turing machines.
 *
 * The tape alphabet defaults to the input alphabet, the blank and every symbol used in a transition.
 */
public class TuringMachineBuilder {

	private final Set<StateId> states = new LinkedHashSet<>();
	private final Set<Symbol> inputAlphabet = new LinkedHashSet<>();
	private final Set<Symbol> tapeAlphabet = new LinkedHashSet<>();
	private boolean tapeAlphabetDeclared = false;
	private Symbol blank = Symbol.of("_");
	private StateId initialState;
	private StateId acceptState;
	private StateId rejectState;
	private final List<TuringTransition> transitions = new ArrayList<>();

	public TuringMachineBuilder states(String... names){
		for (String name : names){
			states.add(StateId.of(name));
		}
		return this;
	}

	public TuringMachineBuilder inputAlphabet(String... symbols){
		for (String symbol : symbols){
			inputAlphabet.add(Symbol.of(symbol));
		}
		return this;
	}

	public TuringMachineBuilder tapeAlphabet(String... symbols){
		tapeAlphabetDeclared = true;
		for (String symbol : symbols){
			tapeAlphabet.add(Symbol.of(symbol));
		}
		return this;
	}

	/**
	 * Sets the blank symbol, <code>_</code> by default
	 */
	public TuringMachineBuilder blank(String symbol){
		blank = Symbol.of(symbol);
		return this;
	}

	public TuringMachineBuilder initial(String state){
		initialState = StateId.of(state);
		return this;
	}

	public TuringMachineBuilder accept(String state){
		acceptState = StateId.of(state);
		return this;
	}

	public TuringMachineBuilder reject(String state){
		rejectState = StateId.of(state);
		return this;
	}

	public TuringMachineBuilder transition(String from, String read, String to, String write, Move move){
		transitions.add(new TuringTransition(StateId.of(from), Symbol.of(read), StateId.of(to), Symbol.of(write), move));
		return this;
	}

	/**
	 * @throws StructuralError if the description is malformed
	 */
	public TuringMachine build(){
		if (initialState == null || acceptState == null){
			throw new StructuralError("Turing machine needs an initial and an accept state");
		}
		Set<Symbol> tape = new LinkedHashSet<>(tapeAlphabet);
		if (!tapeAlphabetDeclared){
			tape.addAll(inputAlphabet);
			tape.add(blank);
			for (TuringTransition transition : transitions){
				tape.add(transition.read);
				tape.add(transition.write);
			}
		}
		return new TuringMachine(states, inputAlphabet, tape, blank, initialState, acceptState, rejectState,
				transitions);
	}
}
