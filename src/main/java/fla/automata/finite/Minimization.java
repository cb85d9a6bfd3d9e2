package fla.automata.finite;

import java.util.*;

import fla.alphabet.StateId;
import fla.alphabet.Symbol;
import fla.util.FixpointIteration;

import static fla.automata.finite.FiniteAutomaton.LOG;

/**
 * Partition refinement (Moore) on a deterministic automaton.
 * <p/>
 * Unreachable states and states that can't reach an accepting state are removed first, missing transitions
 * lead to an implicit dead block. Blocks of the final partition are numbered breadth first from the block
 * of the initial state.
 */
class Minimization {

	private static final int DEAD_BLOCK = -1;

	static FiniteAutomaton minimize(FiniteAutomaton dfa){
		if (!dfa.isDeterministic){
			throw new IllegalArgumentException("Can only minimize deterministic automata");
		}
		List<StateId> states = liveReachableStates(dfa);
		if (states.isEmpty()){
			LOG.fine("Automaton accepts the empty language");
			StateId only = StateId.numbered(0);
			return new FiniteAutomaton(Collections.singletonList(only), dfa.getAlphabet(), Collections.emptyMap(),
					Collections.emptyMap(), only, Collections.emptyList());
		}
		Set<StateId> live = new HashSet<>(states);
		Map<StateId, Integer> blocks = new HashMap<>();
		for (StateId state : states){
			blocks.put(state, dfa.isAccepting(state) ? 0 : 1);
		}
		int[] blockCount = {new HashSet<>(blocks.values()).size()};
		FixpointIteration.untilStable(() -> {
			Map<List<Integer>, Integer> signatureToBlock = new HashMap<>();
			Map<StateId, Integer> newBlocks = new HashMap<>();
			for (StateId state : states){
				List<Integer> signature = new ArrayList<>();
				signature.add(blocks.get(state));
				for (Symbol symbol : dfa.getAlphabet()){
					signature.add(blockOfTarget(dfa, live, blocks, state, symbol));
				}
				Integer block = signatureToBlock.get(signature);
				if (block == null){
					block = signatureToBlock.size();
					signatureToBlock.put(signature, block);
				}
				newBlocks.put(state, block);
			}
			blocks.putAll(newBlocks);
			boolean split = signatureToBlock.size() != blockCount[0];
			blockCount[0] = signatureToBlock.size();
			return split;
		}, () -> blockCount[0], (round, count) -> LOG.finer(() -> String.format("Round %d: %d blocks", round, count)));

		Map<Integer, StateId> representatives = new HashMap<>();
		for (StateId state : states){
			representatives.putIfAbsent(blocks.get(state), state);
		}
		// number the blocks in breadth first order
		Map<Integer, StateId> blockIds = new LinkedHashMap<>();
		Deque<Integer> toVisit = new ArrayDeque<>();
		int initialBlock = blocks.get(dfa.getInitialState());
		blockIds.put(initialBlock, StateId.numbered(0));
		toVisit.add(initialBlock);
		Map<StateId, Map<Symbol, Set<StateId>>> transitions = new HashMap<>();
		List<StateId> accepting = new ArrayList<>();
		while (!toVisit.isEmpty()){
			int block = toVisit.poll();
			StateId representative = representatives.get(block);
			StateId id = blockIds.get(block);
			if (dfa.isAccepting(representative)){
				accepting.add(id);
			}
			Map<Symbol, Set<StateId>> row = new HashMap<>();
			for (Symbol symbol : dfa.getAlphabet()){
				int target = blockOfTarget(dfa, live, blocks, representative, symbol);
				if (target == DEAD_BLOCK){
					continue;
				}
				if (!blockIds.containsKey(target)){
					blockIds.put(target, StateId.numbered(blockIds.size()));
					toVisit.add(target);
				}
				row.put(symbol, Collections.singleton(blockIds.get(target)));
			}
			transitions.put(id, row);
		}
		LOG.fine(() -> String.format("Minimized %d states to %d states", dfa.getStates().size(), blockIds.size()));
		return new FiniteAutomaton(blockIds.values(), dfa.getAlphabet(), transitions, Collections.emptyMap(),
				StateId.numbered(0), accepting);
	}

	private static int blockOfTarget(FiniteAutomaton dfa, Set<StateId> live, Map<StateId, Integer> blocks,
	                                 StateId state, Symbol symbol){
		SortedSet<StateId> targets = dfa.targets(state, symbol);
		if (targets.isEmpty() || !live.contains(targets.first())){
			return DEAD_BLOCK;
		}
		return blocks.get(targets.first());
	}

	/**
	 * States that are reachable from the initial state and can reach an accepting state,
	 * in breadth first order.
	 */
	private static List<StateId> liveReachableStates(FiniteAutomaton dfa){
		List<StateId> reachable = dfa.reachableStates();
		Map<StateId, List<StateId>> predecessors = new HashMap<>();
		List<StateId> acceptingReachable = new ArrayList<>();
		for (StateId state : reachable){
			if (dfa.isAccepting(state)){
				acceptingReachable.add(state);
			}
			for (SortedSet<StateId> targets : dfa.transitionsOf(state).values()){
				for (StateId target : targets){
					predecessors.computeIfAbsent(target, s -> new ArrayList<>()).add(state);
				}
			}
		}
		Set<StateId> productive = FixpointIteration.reachable(acceptingReachable,
				state -> predecessors.getOrDefault(state, Collections.emptyList()));
		List<StateId> ret = new ArrayList<>();
		for (StateId state : reachable){
			if (productive.contains(state)){
				ret.add(state);
			}
		}
		return ret;
	}
}
