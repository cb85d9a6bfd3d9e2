package fla.parser.ll;

import java.util.*;
import java.util.logging.Logger;

import fla.grammar.*;
import fla.util.FixpointListener;

/**
 * LL(1) parser table, maps a non terminal and a lookahead terminal to the production to expand.
 *
 * Instances only exist for conflict free grammars, use {@link #build(Grammar)} to create them.
 */
public class LLParserTable {

	public static final Logger LOG = Logger.getLogger("Parser");

	public final Grammar grammar;

	private final Map<NonTerminal, SortedMap<Terminal, Production>> table;

	private LLParserTable(Grammar grammar, Map<NonTerminal, SortedMap<Terminal, Production>> table){
		this.grammar = grammar;
		Map<NonTerminal, SortedMap<Terminal, Production>> copy = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : table.keySet()){
			copy.put(nonTerminal, Collections.unmodifiableSortedMap(table.get(nonTerminal)));
		}
		this.table = Collections.unmodifiableMap(copy);
	}

	/**
	 * Registers every production A → α for the terminals in FIRST(α) and, if α is nullable, for the
	 * terminals in FOLLOW(A) (including the end of input marker).
	 * A cell that receives a second production keeps the first one and produces a {@link Conflict}.
	 */
	public static LLTableConstruction build(Grammar grammar){
		Set<NonTerminal> epsilonable = grammar.calculateEpsilonable();
		Map<NonTerminal, Set<TerminalOrEpsilon>> first = grammar.calculateFirst1Set(epsilonable, FixpointListener.ignore());
		Map<NonTerminal, Set<Terminal>> follow = grammar.calculateFollow1Set(first, epsilonable, FixpointListener.ignore());
		Map<NonTerminal, SortedMap<Terminal, Production>> table = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			table.put(nonTerminal, new TreeMap<>());
		}
		List<Conflict> conflicts = new ArrayList<>();
		for (Production production : grammar.getProductions()){
			Set<TerminalOrEpsilon> firstOfRight = grammar.calculateFirst1SetForTerm(production.right, first, epsilonable);
			Set<Terminal> lookaheads = new TreeSet<>();
			for (TerminalOrEpsilon toe : firstOfRight){
				if (toe instanceof Terminal){
					lookaheads.add((Terminal) toe);
				}
			}
			if (firstOfRight.contains(Epsilon.EPSILON)){
				lookaheads.addAll(follow.get(production.left));
			}
			SortedMap<Terminal, Production> row = table.get(production.left);
			for (Terminal lookahead : lookaheads){
				Production present = row.get(lookahead);
				if (present == null){
					row.put(lookahead, production);
				} else if (!present.equals(production)){
					Conflict conflict = new Conflict(production.left, lookahead, present, production);
					LOG.info(conflict::toString);
					conflicts.add(conflict);
				}
			}
		}
		LOG.fine(() -> String.format("Built LL(1) table for %d productions with %d conflicts",
				grammar.getProductions().size(), conflicts.size()));
		return new LLTableConstruction(new LLParserTable(grammar, table), conflicts);
	}

	public Optional<Production> get(NonTerminal nonTerminal, Terminal lookahead){
		SortedMap<Terminal, Production> row = table.get(nonTerminal);
		return row == null ? Optional.empty() : Optional.ofNullable(row.get(lookahead));
	}

	/**
	 * Lookahead terminals with an entry for the passed non terminal
	 */
	public SortedSet<Terminal> expectedTerminals(NonTerminal nonTerminal){
		SortedMap<Terminal, Production> row = table.get(nonTerminal);
		return row == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(new TreeSet<>(row.keySet()));
	}

	/**
	 * Number of filled cells
	 */
	public int size(){
		int size = 0;
		for (SortedMap<Terminal, Production> row : table.values()){
			size += row.size();
		}
		return size;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		List<NonTerminal> nonTerminals = new ArrayList<>(table.keySet());
		Collections.sort(nonTerminals);
		for (int i = 0; i < nonTerminals.size(); i++){
			if (i != 0){
				builder.append("\n");
			}
			builder.append(nonTerminals.get(i)).append(" = {");
			for (Map.Entry<Terminal, Production> entry : table.get(nonTerminals.get(i)).entrySet()){
				builder.append(" ").append(entry.getKey()).append(" = { ")
						.append(entry.getValue().formatRightSide()).append(" }");
			}
			builder.append(" }");
		}
		return builder.toString();
	}
}
