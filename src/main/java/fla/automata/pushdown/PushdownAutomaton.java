package fla.automata.pushdown;

import java.io.Serializable;
import java.util.*;
import java.util.logging.Logger;

import fla.StructuralError;
import fla.alphabet.StateId;
import fla.alphabet.Symbol;
import fla.util.DotUtils;
import fla.util.Utils;
import guru.nidi.graphviz.model.MutableGraph;

/**
 * An immutable non deterministic pushdown automaton.
 * <p/>
 * Acceptance is decided by a breadth first search over the reachable configurations, bounded by a step
 * budget because the configuration space might be infinite.
 */
public class PushdownAutomaton implements Serializable {

	public static final Logger LOG = Logger.getLogger("Automata");

	private final List<StateId> states;
	private final SortedSet<Symbol> inputAlphabet;
	private final SortedSet<Symbol> stackAlphabet;
	private final StateId initialState;
	private final Symbol initialStackSymbol;
	private final SortedSet<StateId> acceptingStates;

	/**
	 * Transitions per source state, in declaration order
	 */
	private final Map<StateId, List<PushdownTransition>> transitions;

	/**
	 * Result of an acceptance search
	 */
	public static class SearchResult {

		public final Verdict verdict;

		/**
		 * Number of configurations taken from the frontier
		 */
		public final int exploredConfigurations;

		/**
		 * The accepting configuration if the verdict is {@link Verdict#ACCEPT}
		 */
		public final Optional<Configuration> acceptingConfiguration;

		SearchResult(Verdict verdict, int exploredConfigurations, Optional<Configuration> acceptingConfiguration) {
			this.verdict = verdict;
			this.exploredConfigurations = exploredConfigurations;
			this.acceptingConfiguration = acceptingConfiguration;
		}

		@Override
		public String toString() {
			return verdict + " after " + exploredConfigurations + " configurations";
		}
	}

	/**
	 * @throws StructuralError if a transition uses an unknown state or symbol
	 */
	public PushdownAutomaton(Collection<StateId> states, Collection<Symbol> inputAlphabet,
	                         Collection<Symbol> stackAlphabet, StateId initialState, Symbol initialStackSymbol,
	                         Collection<StateId> acceptingStates, Collection<PushdownTransition> transitions) {
		this.states = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(states)));
		this.inputAlphabet = Collections.unmodifiableSortedSet(new TreeSet<>(inputAlphabet));
		this.stackAlphabet = Collections.unmodifiableSortedSet(new TreeSet<>(stackAlphabet));
		Set<StateId> stateSet = new HashSet<>(this.states);
		if (initialState == null || !stateSet.contains(initialState)){
			throw new StructuralError("Initial state %s isn't a state of the automaton", initialState);
		}
		this.initialState = initialState;
		if (initialStackSymbol == null || !this.stackAlphabet.contains(initialStackSymbol)){
			throw new StructuralError("Initial stack symbol %s isn't part of the stack alphabet %s",
					initialStackSymbol, this.stackAlphabet);
		}
		this.initialStackSymbol = initialStackSymbol;
		for (StateId accepting : acceptingStates){
			if (!stateSet.contains(accepting)){
				throw new StructuralError("Accepting state %s isn't a state of the automaton", accepting);
			}
		}
		this.acceptingStates = Collections.unmodifiableSortedSet(new TreeSet<>(acceptingStates));
		Map<StateId, List<PushdownTransition>> trans = new HashMap<>();
		for (PushdownTransition transition : new LinkedHashSet<>(transitions)){
			if (!stateSet.contains(transition.from) || !stateSet.contains(transition.to)){
				throw new StructuralError("Transition %s uses an unknown state", transition);
			}
			if (transition.input != null && !this.inputAlphabet.contains(transition.input)){
				throw new StructuralError("Transition %s reads a symbol outside of the input alphabet %s",
						transition, this.inputAlphabet);
			}
			if (!this.stackAlphabet.contains(transition.pop) || !this.stackAlphabet.containsAll(transition.push)){
				throw new StructuralError("Transition %s uses a symbol outside of the stack alphabet %s",
						transition, this.stackAlphabet);
			}
			trans.computeIfAbsent(transition.from, s -> new ArrayList<>()).add(transition);
		}
		for (StateId state : trans.keySet()){
			trans.put(state, Collections.unmodifiableList(trans.get(state)));
		}
		this.transitions = Collections.unmodifiableMap(trans);
	}

	public List<StateId> getStates() {
		return states;
	}

	public SortedSet<Symbol> getInputAlphabet() {
		return inputAlphabet;
	}

	public SortedSet<Symbol> getStackAlphabet() {
		return stackAlphabet;
	}

	public StateId getInitialState() {
		return initialState;
	}

	public Symbol getInitialStackSymbol() {
		return initialStackSymbol;
	}

	public SortedSet<StateId> getAcceptingStates() {
		return acceptingStates;
	}

	public List<PushdownTransition> transitionsOf(StateId state){
		return transitions.getOrDefault(state, Collections.emptyList());
	}

	public Configuration initialConfiguration(){
		return new Configuration(initialState, 0, Collections.singletonList(initialStackSymbol));
	}

	/**
	 * Acceptance by final state.
	 *
	 * @param stepBudget maximum number of explored configurations, has to be positive
	 */
	public Verdict accepts(List<Symbol> input, int stepBudget){
		return search(input, stepBudget, AcceptanceMode.FINAL_STATE).verdict;
	}

	public Verdict accepts(List<Symbol> input, int stepBudget, AcceptanceMode mode){
		return search(input, stepBudget, mode).verdict;
	}

	public Verdict accepts(String input, int stepBudget){
		return accepts(Symbol.chars(input), stepBudget);
	}

	/**
	 * Explores the configurations breadth first, every configuration taken from the frontier costs one step.
	 * Configurations are deduplicated by (state, position, stack).
	 *
	 * @param input input word
	 * @param stepBudget maximum number of explored configurations, has to be positive
	 * @param mode acceptance condition
	 */
	public SearchResult search(List<Symbol> input, int stepBudget, AcceptanceMode mode){
		Objects.requireNonNull(input, "input");
		Objects.requireNonNull(mode, "mode");
		Utils.checkBudget(stepBudget);
		Set<Configuration> visited = new HashSet<>();
		Deque<Configuration> frontier = new ArrayDeque<>();
		Configuration start = initialConfiguration();
		visited.add(start);
		frontier.add(start);
		int steps = 0;
		while (!frontier.isEmpty()){
			if (steps >= stepBudget){
				int explored = steps;
				LOG.fine(() -> String.format("Step budget of %d exhausted, %d configurations left in the frontier",
						explored, frontier.size()));
				return new SearchResult(Verdict.INCONCLUSIVE, steps, Optional.empty());
			}
			steps++;
			Configuration current = frontier.poll();
			if (isAccepting(current, input.size(), mode)){
				return new SearchResult(Verdict.ACCEPT, steps, Optional.of(current));
			}
			for (Configuration next : successors(current, input)){
				if (visited.add(next)){
					frontier.add(next);
				}
			}
		}
		return new SearchResult(Verdict.REJECT, steps, Optional.empty());
	}

	private boolean isAccepting(Configuration configuration, int inputLength, AcceptanceMode mode){
		if (configuration.position != inputLength){
			return false;
		}
		switch (mode){
			case EMPTY_STACK:
				return configuration.stack.isEmpty();
			case FINAL_STATE:
			default:
				return acceptingStates.contains(configuration.state);
		}
	}

	/**
	 * Configurations reachable in one step, in transition declaration order
	 */
	public List<Configuration> successors(Configuration configuration, List<Symbol> input){
		Optional<Symbol> top = configuration.top();
		if (!top.isPresent()){
			return Collections.emptyList();
		}
		Symbol next = configuration.position < input.size() ? input.get(configuration.position) : null;
		List<Configuration> ret = new ArrayList<>();
		for (PushdownTransition transition : transitionsOf(configuration.state)){
			if (!transition.pop.equals(top.get())){
				continue;
			}
			if (transition.isEpsilonTransition()){
				ret.add(configuration.apply(transition, false));
			} else if (transition.input.equals(next)){
				ret.add(configuration.apply(transition, true));
			}
		}
		return ret;
	}

	public MutableGraph toGraphviz(){
		DotUtils dot = new DotUtils("pda");
		for (StateId state : states){
			dot.state(state.name, acceptingStates.contains(state));
		}
		dot.initial(initialState.name);
		for (StateId state : states){
			for (PushdownTransition transition : transitionsOf(state)){
				dot.edge(state.name, transition.to.name, transition.label());
			}
		}
		return dot.toGraph();
	}

	public String toGraphvizString(){
		return toGraphviz().toString();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append("PDA states=").append(states)
				.append(" input=").append(inputAlphabet)
				.append(" stack=").append(stackAlphabet)
				.append(" initial=").append(initialState).append("/").append(initialStackSymbol)
				.append(" accepting=").append(acceptingStates);
		for (StateId state : states){
			for (PushdownTransition transition : transitionsOf(state)){
				builder.append("\n  ").append(transition);
			}
		}
		return builder.toString();
	}
}
