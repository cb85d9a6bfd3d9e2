package fla.parser.ll;

import java.io.Serializable;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

import fla.grammar.Terminal;

/**
 * Describes why an input couldn't be parsed. A value, not an exception.
 */
public final class SyntaxError implements Serializable {

	/**
	 * Index of the offending input symbol, equals the input length at the end of input
	 */
	public final int position;

	/**
	 * The offending terminal, {@link Terminal#EOF} at the end of input
	 */
	public final Terminal found;

	/**
	 * Terminals that would have been valid at the position
	 */
	public final SortedSet<Terminal> expected;

	public final String message;

	public SyntaxError(int position, Terminal found, SortedSet<Terminal> expected, String message) {
		this.position = position;
		this.found = found;
		this.expected = Collections.unmodifiableSortedSet(new TreeSet<>(expected));
		this.message = message;
	}

	@Override
	public String toString() {
		return String.format("Syntax error at %d: %s, found %s, expected %s", position, message, found, expected);
	}
}
