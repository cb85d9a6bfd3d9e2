package fla.grammar;

import java.io.Serializable;
import java.util.*;
import java.util.logging.Logger;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import fla.StructuralError;
import fla.util.FixpointIteration;
import fla.util.FixpointListener;

import static fla.util.Utils.join;
import static fla.util.Utils.unmodifiableCopy;

/**
 * Immutable context free grammar consisting of terminals, non terminals, productions and a start non terminal.
 * <p/>
 * The analyses (nullable non terminals, FIRST and FOLLOW sets) are fix point iterations that are recomputed
 * on every call, no results are cached in the grammar. Use the {@link GrammarBuilder} to build a grammar
 * instance conveniently.
 */
public class Grammar implements Serializable {

	public static final Logger LOG = Logger.getLogger("Grammar");

	/**
	 * Non terminals in declaration order
	 */
	private final List<NonTerminal> nonTerminals;

	private final SortedSet<Terminal> terminals;

	private final List<Production> productions;

	private final NonTerminal start;

	/**
	 * Create a new Grammar object
	 *
	 * Removes duplicate productions, the remaining productions are numbered in their order.
	 *
	 * @param nonTerminals declared non terminals
	 * @param terminals declared terminals
	 * @param productions productions
	 * @param start start non terminal
	 * @throws StructuralError if a used symbol isn't declared
	 */
	public Grammar(Collection<NonTerminal> nonTerminals, Collection<Terminal> terminals,
	               List<Production> productions, NonTerminal start) {
		this.nonTerminals = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(nonTerminals)));
		this.terminals = Collections.unmodifiableSortedSet(new TreeSet<>(terminals));
		if (this.terminals.contains(Terminal.EOF)){
			throw new StructuralError("The end of input marker %s is reserved and can't be a terminal", Terminal.EOF);
		}
		Set<NonTerminal> declared = new HashSet<>(this.nonTerminals);
		if (start == null || !declared.contains(start)){
			throw new StructuralError("Start symbol %s isn't a declared non terminal", start);
		}
		this.start = start;
		LinkedHashSet<Production> uniqueProductions = new LinkedHashSet<>();
		for (Production production : productions){
			if (!declared.contains(production.left)){
				throw new StructuralError("Left side of %s isn't a declared non terminal", production);
			}
			for (NonTerminal nonTerminal : production.nonTerminals){
				if (!declared.contains(nonTerminal)){
					throw new StructuralError("Non terminal %s in %s isn't declared", nonTerminal, production);
				}
			}
			for (Terminal terminal : production.terminals){
				if (!this.terminals.contains(terminal)){
					throw new StructuralError("Terminal %s in %s isn't declared", terminal, production);
				}
			}
			uniqueProductions.add(production);
		}
		List<Production> numbered = new ArrayList<>();
		for (Production production : uniqueProductions){
			numbered.add(production.withId(numbered.size()));
		}
		this.productions = Collections.unmodifiableList(numbered);
	}

	public List<Production> getProductions(){
		return productions;
	}

	public Production getProductionForId(int id){
		return productions.get(id);
	}

	public List<Production> getProductionsOf(NonTerminal nonTerminal) {
		List<Production> ret = new ArrayList<>();
		for (Production production : productions) {
			if (production.left.equals(nonTerminal)) {
				ret.add(production);
			}
		}
		return ret;
	}

	public NonTerminal getStart(){
		return start;
	}

	public List<NonTerminal> getNonTerminals() {
		return nonTerminals;
	}

	public SortedSet<Terminal> getTerminals() {
		return terminals;
	}

	public Optional<NonTerminal> getNonTerminal(String name){
		for (NonTerminal nonTerminal : nonTerminals){
			if (nonTerminal.name.equals(name)){
				return Optional.of(nonTerminal);
			}
		}
		return Optional.empty();
	}

	/**
	 * Calculate the non terminals that can produce an epsilon.
	 */
	public Set<NonTerminal> calculateEpsilonable(){
		return calculateEpsilonable(FixpointListener.ignore());
	}

	/**
	 * Calculate the non terminals that can produce an epsilon.
	 *
	 * A non terminal is nullable if one of its productions consists only of nullable non terminals.
	 *
	 * @param listener gets the set after each round
	 */
	public Set<NonTerminal> calculateEpsilonable(FixpointListener<Set<NonTerminal>> listener){
		Set<NonTerminal> epsSet = new LinkedHashSet<>();
		int rounds = FixpointIteration.untilStable(() -> {
			boolean somethingChanged = false;
			for (Production prod : productions) {
				if (!epsSet.contains(prod.left) && prod.terminals.isEmpty() && epsSet.containsAll(prod.nonTerminals)){
					somethingChanged = epsSet.add(prod.left) || somethingChanged;
				}
			}
			return somethingChanged;
		}, () -> Collections.unmodifiableSet(new LinkedHashSet<>(epsSet)), listener);
		LOG.finer(() -> String.format("Nullable non terminals after %d rounds: %s", rounds, epsSet));
		return Collections.unmodifiableSet(epsSet);
	}

	public Map<NonTerminal, Set<TerminalOrEpsilon>> calculateFirst1Set(){
		return calculateFirst1Set(calculateEpsilonable(), FixpointListener.ignore());
	}

	/**
	 * Calculate the FIRST(1) set of every non terminal.
	 * <p/>
	 * For each production A → X1 X2 … Xn put FIRST(X1) − {ε} into FIRST(A) and continue with X2 while
	 * X1 is nullable and so on. If all Xi are nullable put ε into FIRST(A). Repeat until nothing changes.
	 *
	 * @param epsilonable nullable non terminals
	 * @param listener gets the sets after each round
	 * @return unmodifiable first sets
	 */
	public Map<NonTerminal, Set<TerminalOrEpsilon>> calculateFirst1Set(Set<NonTerminal> epsilonable,
	                                                                   FixpointListener<Map<NonTerminal, Set<TerminalOrEpsilon>>> listener){
		Map<NonTerminal, Set<TerminalOrEpsilon>> first = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : nonTerminals){
			first.put(nonTerminal, new TreeSet<>());
		}
		int rounds = FixpointIteration.untilStable(() -> {
			boolean firstChanged = false;
			for (Production production : productions){
				Set<TerminalOrEpsilon> set = first.get(production.left);
				boolean allNullable = true;
				for (GrammarSymbol symbol : production.right){
					if (symbol instanceof Terminal){
						firstChanged = set.add((Terminal) symbol) || firstChanged;
						allNullable = false;
						break;
					}
					for (TerminalOrEpsilon toe : first.get(symbol)){
						if (toe instanceof Terminal){
							firstChanged = set.add(toe) || firstChanged;
						}
					}
					if (!epsilonable.contains(symbol)){
						allNullable = false;
						break;
					}
				}
				if (allNullable){
					firstChanged = set.add(Epsilon.EPSILON) || firstChanged;
				}
			}
			return firstChanged;
		}, () -> unmodifiableCopy(first), listener);
		LOG.finer(() -> String.format("First sets after %d rounds: %s", rounds, first));
		return unmodifiableCopy(first);
	}

	/**
	 * FIRST(1) set of a sequence of symbols, contains ε if the whole sequence is nullable.
	 */
	public Set<TerminalOrEpsilon> calculateFirst1SetForTerm(List<? extends GrammarSymbol> term,
	                                                        Map<NonTerminal, Set<TerminalOrEpsilon>> firstSets,
	                                                        Set<NonTerminal> epsilonable){
		Set<TerminalOrEpsilon> set = new TreeSet<>();
		for (GrammarSymbol symbol : term){
			if (symbol instanceof Epsilon){
				continue;
			}
			if (symbol instanceof Terminal){
				set.add((Terminal) symbol);
				return set;
			}
			for (TerminalOrEpsilon toe : firstSets.get(symbol)){
				if (toe instanceof Terminal){
					set.add(toe);
				}
			}
			if (!epsilonable.contains(symbol)){
				return set;
			}
		}
		set.add(Epsilon.EPSILON);
		return set;
	}

	public Set<TerminalOrEpsilon> calculateFirst1SetForTerm(List<? extends GrammarSymbol> term){
		Set<NonTerminal> epsilonable = calculateEpsilonable();
		return calculateFirst1SetForTerm(term, calculateFirst1Set(epsilonable, FixpointListener.ignore()), epsilonable);
	}

	public boolean isTermEpsilonable(List<? extends GrammarSymbol> term, Set<NonTerminal> epsilonable){
		for (GrammarSymbol symbol : term){
			if (symbol instanceof Terminal || (symbol instanceof NonTerminal && !epsilonable.contains(symbol))){
				return false;
			}
		}
		return true;
	}

	public Map<NonTerminal, Set<Terminal>> calculateFollow1Set(){
		Set<NonTerminal> epsilonable = calculateEpsilonable();
		return calculateFollow1Set(calculateFirst1Set(epsilonable, FixpointListener.ignore()), epsilonable,
				FixpointListener.ignore());
	}

	/**
	 * Calculate the follow 1 set for all non terminals
	 *
	 * First put $ (the end of input marker) in Follow(S) (S is the start symbol)
	 * If there is a production A → aBb, (where a can be a whole string) then everything in FIRST(b) except for ε is placed in FOLLOW(B).
	 * If there is a production A → aB, then everything in FOLLOW(A) is in FOLLOW(B)
	 * If there is a production A → aBb, where FIRST(b) contains ε, then everything in FOLLOW(A) is in FOLLOW(B)
	 *
	 * @param first first sets of the non terminals
	 * @param epsilonable nullable non terminals
	 * @param listener gets the sets after each round
	 * @return unmodifiable follow sets
	 */
	public Map<NonTerminal, Set<Terminal>> calculateFollow1Set(Map<NonTerminal, Set<TerminalOrEpsilon>> first,
	                                                           Set<NonTerminal> epsilonable,
	                                                           FixpointListener<Map<NonTerminal, Set<Terminal>>> listener){
		Map<NonTerminal, Set<Terminal>> follow = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : nonTerminals){
			follow.put(nonTerminal, new TreeSet<>());
		}
		follow.get(start).add(Terminal.EOF);
		int rounds = FixpointIteration.untilStable(() -> {
			boolean followChanged = false;
			for (Production production : productions){
				// FIRST of the suffix right of the current position, walked from right to left
				Set<Terminal> lastFollow = new TreeSet<>(follow.get(production.left));
				for (int i = production.right.size() - 1; i >= 0; i--){
					GrammarSymbol symbol = production.right.get(i);
					if (symbol instanceof NonTerminal){
						NonTerminal rightPart = (NonTerminal) symbol;
						followChanged = follow.get(rightPart).addAll(lastFollow) || followChanged;
						if (!epsilonable.contains(rightPart)){
							lastFollow.clear();
						}
						for (TerminalOrEpsilon toe : first.get(rightPart)){
							if (toe instanceof Terminal){
								lastFollow.add((Terminal) toe);
							}
						}
					} else {
						lastFollow.clear();
						lastFollow.add((Terminal) symbol);
					}
				}
			}
			return followChanged;
		}, () -> unmodifiableCopy(follow), listener);
		LOG.finer(() -> String.format("Follow sets after %d rounds: %s", rounds, follow));
		return unmodifiableCopy(follow);
	}

	/**
	 * Non terminals that appear in a sentential form derived from the start symbol, in breadth first order.
	 */
	public Set<NonTerminal> calculateReachableNonTerminals(){
		return Collections.unmodifiableSet(FixpointIteration.reachable(Collections.singletonList(start), nonTerminal -> {
			List<NonTerminal> ret = new ArrayList<>();
			for (Production production : getProductionsOf(nonTerminal)){
				ret.addAll(production.nonTerminals);
			}
			return ret;
		}));
	}

	/**
	 * Non terminals A with a derivation A ⇒+ A α, these prevent LL parsing.
	 * <p/>
	 * Builds the graph with an edge A → B for every production A → α B β with a nullable α
	 * and collects the non terminals that lie on a cycle.
	 */
	public SortedSet<NonTerminal> calculateLeftRecursiveNonTerminals(){
		Set<NonTerminal> epsilonable = calculateEpsilonable();
		Graph<NonTerminal, DefaultEdge> leftCorners = new DefaultDirectedGraph<>(DefaultEdge.class);
		for (NonTerminal nonTerminal : nonTerminals){
			leftCorners.addVertex(nonTerminal);
		}
		for (Production production : productions){
			for (GrammarSymbol symbol : production.right){
				if (symbol instanceof Terminal){
					break;
				}
				leftCorners.addEdge(production.left, (NonTerminal) symbol);
				if (!epsilonable.contains(symbol)){
					break;
				}
			}
		}
		SortedSet<NonTerminal> ret = new TreeSet<>(new CycleDetector<>(leftCorners).findCycles());
		for (NonTerminal nonTerminal : nonTerminals){
			if (leftCorners.containsEdge(nonTerminal, nonTerminal)){
				ret.add(nonTerminal);
			}
		}
		return Collections.unmodifiableSortedSet(ret);
	}

	/**
	 * Is every production of the form A → B C or A → a? The start symbol may additionally derive ε
	 * if it doesn't occur on any right hand side.
	 */
	public boolean isInChomskyNormalForm(){
		boolean startIsNullable = false;
		boolean startOnRightSide = false;
		for (Production production : productions){
			startOnRightSide = startOnRightSide || production.nonTerminals.contains(start);
			if (production.isEpsilonProduction()){
				if (!production.left.equals(start)){
					return false;
				}
				startIsNullable = true;
			} else if (production.rightSize() == 1){
				if (!(production.right.get(0) instanceof Terminal)){
					return false;
				}
			} else if (production.rightSize() != 2 || production.nonTerminals.size() != 2){
				return false;
			}
		}
		return !(startIsNullable && startOnRightSide);
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + nonTerminals + "\n" +
				"Terminals: " + terminals + "\n" +
				"Productions: \n" + join(productions, "\n");
	}

	@Override
	public String toString() {
		return join(productions, "; ");
	}
}
