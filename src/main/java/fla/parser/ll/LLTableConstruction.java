package fla.parser.ll;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import fla.FLAException;
import fla.util.Utils;

/**
 * Result of building an LL(1) parser table: either a usable table or every conflict that was found.
 */
public class LLTableConstruction {

	private final LLParserTable table;
	private final List<Conflict> conflicts;

	LLTableConstruction(LLParserTable table, List<Conflict> conflicts) {
		this.table = conflicts.isEmpty() ? table : null;
		this.conflicts = Collections.unmodifiableList(conflicts);
	}

	/**
	 * The table, only present if the grammar is LL(1)
	 */
	public Optional<LLParserTable> getTable() {
		return Optional.ofNullable(table);
	}

	/**
	 * Conflicts in the order they were found
	 */
	public List<Conflict> getConflicts() {
		return conflicts;
	}

	public boolean isLL1(){
		return conflicts.isEmpty();
	}

	/**
	 * @throws FLAException listing the conflicts if the grammar isn't LL(1)
	 */
	public LLParserTable orElseThrow(){
		if (table == null){
			throw new FLAException("Grammar isn't LL(1):\n" + Utils.join(conflicts, "\n"));
		}
		return table;
	}

	@Override
	public String toString() {
		return isLL1() ? table.toString() : Utils.join(conflicts, "\n");
	}
}
