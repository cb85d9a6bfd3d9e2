package fla.automata.turing;

import java.io.Serializable;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import fla.StructuralError;
import fla.alphabet.StateId;
import fla.alphabet.Symbol;
import fla.util.DotUtils;
import fla.util.Pair;
import fla.util.Utils;
import guru.nidi.graphviz.model.MutableGraph;

/**
 * An immutable deterministic single tape Turing machine.
 * <p/>
 * A missing transition halts the machine and rejects, just like a missing transition in a partial DFA.
 */
public class TuringMachine implements Serializable {

	public static final Logger LOG = Logger.getLogger("Automata");

	private final List<StateId> states;
	private final SortedSet<Symbol> inputAlphabet;
	private final SortedSet<Symbol> tapeAlphabet;
	private final Symbol blank;
	private final StateId initialState;
	private final StateId acceptState;

	/**
	 * Might be null, the machine then rejects only by halting
	 */
	private final StateId rejectState;

	private final Map<Pair<StateId, Symbol>, TuringTransition> transitions;

	/**
	 * @throws StructuralError if the description is malformed or not deterministic
	 */
	public TuringMachine(Collection<StateId> states, Collection<Symbol> inputAlphabet, Collection<Symbol> tapeAlphabet,
	                     Symbol blank, StateId initialState, StateId acceptState, StateId rejectState,
	                     Collection<TuringTransition> transitions) {
		this.states = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(states)));
		this.inputAlphabet = Collections.unmodifiableSortedSet(new TreeSet<>(inputAlphabet));
		this.tapeAlphabet = Collections.unmodifiableSortedSet(new TreeSet<>(tapeAlphabet));
		Set<StateId> stateSet = new HashSet<>(this.states);
		if (blank == null || !this.tapeAlphabet.contains(blank)){
			throw new StructuralError("Blank symbol %s isn't part of the tape alphabet %s", blank, this.tapeAlphabet);
		}
		if (this.inputAlphabet.contains(blank)){
			throw new StructuralError("Blank symbol %s mustn't be part of the input alphabet", blank);
		}
		if (!this.tapeAlphabet.containsAll(this.inputAlphabet)){
			throw new StructuralError("Input alphabet %s isn't part of the tape alphabet %s", this.inputAlphabet,
					this.tapeAlphabet);
		}
		this.blank = blank;
		for (StateId state : Arrays.asList(initialState, acceptState)){
			if (state == null || !stateSet.contains(state)){
				throw new StructuralError("State %s isn't a state of the machine", state);
			}
		}
		if (rejectState != null && !stateSet.contains(rejectState)){
			throw new StructuralError("Reject state %s isn't a state of the machine", rejectState);
		}
		if (acceptState.equals(rejectState)){
			throw new StructuralError("Accept and reject state have to differ, both are %s", acceptState);
		}
		this.initialState = initialState;
		this.acceptState = acceptState;
		this.rejectState = rejectState;
		Map<Pair<StateId, Symbol>, TuringTransition> trans = new HashMap<>();
		for (TuringTransition transition : transitions){
			if (!stateSet.contains(transition.from) || !stateSet.contains(transition.to)){
				throw new StructuralError("Transition %s uses an unknown state", transition);
			}
			if (!this.tapeAlphabet.contains(transition.read) || !this.tapeAlphabet.contains(transition.write)){
				throw new StructuralError("Transition %s uses a symbol outside of the tape alphabet %s", transition,
						this.tapeAlphabet);
			}
			Pair<StateId, Symbol> key = new Pair<>(transition.from, transition.read);
			TuringTransition existing = trans.put(key, transition);
			if (existing != null && !existing.equals(transition)){
				throw new StructuralError("Non deterministic transitions %s and %s", existing, transition);
			}
		}
		this.transitions = Collections.unmodifiableMap(trans);
	}

	public List<StateId> getStates() {
		return states;
	}

	public SortedSet<Symbol> getInputAlphabet() {
		return inputAlphabet;
	}

	public SortedSet<Symbol> getTapeAlphabet() {
		return tapeAlphabet;
	}

	public Symbol getBlank() {
		return blank;
	}

	public StateId getInitialState() {
		return initialState;
	}

	public StateId getAcceptState() {
		return acceptState;
	}

	public Optional<StateId> getRejectState() {
		return Optional.ofNullable(rejectState);
	}

	public Optional<TuringTransition> transition(StateId state, Symbol read){
		return Optional.ofNullable(transitions.get(new Pair<>(state, read)));
	}

	/**
	 * Runs the machine on the passed input, every applied transition costs one step.
	 * Symbols outside of the input alphabet reject the input without running.
	 *
	 * @param stepBudget maximum number of applied transitions, has to be positive
	 */
	public Execution execute(List<Symbol> input, int stepBudget){
		Objects.requireNonNull(input, "input");
		Utils.checkBudget(stepBudget);
		Tape tape = new Tape(blank, input);
		if (!inputAlphabet.containsAll(input)){
			LOG.fine(() -> "Input " + input + " uses symbols outside of the input alphabet " + inputAlphabet);
			return new Execution(Outcome.REJECTED, 0, initialState, tape.contents(), 0);
		}
		StateId state = initialState;
		int head = 0;
		int steps = 0;
		while (true){
			if (state.equals(acceptState)){
				return new Execution(Outcome.ACCEPTED, steps, state, tape.contents(), head);
			}
			if (state.equals(rejectState)){
				return new Execution(Outcome.REJECTED, steps, state, tape.contents(), head);
			}
			TuringTransition transition = transitions.get(new Pair<>(state, tape.read(head)));
			if (transition == null){
				StateId halted = state;
				Symbol read = tape.read(head);
				LOG.fine(() -> String.format("No transition for (%s, %s), halting", halted, read));
				return new Execution(Outcome.REJECTED, steps, state, tape.contents(), head);
			}
			if (steps >= stepBudget){
				return new Execution(Outcome.EXCEEDED, steps, state, tape.contents(), head);
			}
			tape.write(head, transition.write);
			head += transition.move.offset;
			state = transition.to;
			steps++;
			if (LOG.isLoggable(Level.FINEST)){
				LOG.finest(state + " " + tape.toString(head));
			}
		}
	}

	public Outcome run(List<Symbol> input, int stepBudget){
		return execute(input, stepBudget).outcome;
	}

	public Outcome run(String input, int stepBudget){
		return run(Symbol.chars(input), stepBudget);
	}

	/**
	 * Runs the machine as a function.
	 *
	 * @return the tape contents without surrounding blanks if the machine accepts, empty otherwise
	 */
	public Optional<List<Symbol>> compute(List<Symbol> input, int stepBudget){
		Execution execution = execute(input, stepBudget);
		if (execution.outcome != Outcome.ACCEPTED){
			return Optional.empty();
		}
		return Optional.of(execution.tape);
	}

	public Optional<List<Symbol>> compute(String input, int stepBudget){
		return compute(Symbol.chars(input), stepBudget);
	}

	public MutableGraph toGraphviz(){
		DotUtils dot = new DotUtils("tm");
		for (StateId state : states){
			dot.state(state.name, state.equals(acceptState));
		}
		dot.initial(initialState.name);
		List<TuringTransition> sorted = new ArrayList<>(transitions.values());
		sorted.sort(Comparator.comparing((TuringTransition t) -> t.from).thenComparing(t -> t.read));
		for (TuringTransition transition : sorted){
			dot.edge(transition.from.name, transition.to.name, transition.read + " / " + transition.write + ", "
					+ (transition.move == Move.LEFT ? "L" : "R"));
		}
		return dot.toGraph();
	}

	public String toGraphvizString(){
		return toGraphviz().toString();
	}
}
