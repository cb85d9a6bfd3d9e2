package fla.automata.turing;

import java.util.*;

import fla.alphabet.Symbol;

/**
 * A tape that is infinite in both directions. Cells are only allocated when they are written,
 * every other cell holds the blank symbol.
 * <p/>
 * Tapes are mutable and belong to a single run.
 */
public class Tape {

	public final Symbol blank;

	/**
	 * Cells 0, 1, 2, …
	 */
	private final List<Symbol> right = new ArrayList<>();

	/**
	 * Cells -1, -2, …
	 */
	private final List<Symbol> left = new ArrayList<>();

	public Tape(Symbol blank, List<Symbol> input) {
		this.blank = blank;
		right.addAll(input);
	}

	public Symbol read(int position){
		List<Symbol> side = position >= 0 ? right : left;
		int index = position >= 0 ? position : -position - 1;
		return index < side.size() ? side.get(index) : blank;
	}

	public void write(int position, Symbol symbol){
		List<Symbol> side = position >= 0 ? right : left;
		int index = position >= 0 ? position : -position - 1;
		while (side.size() <= index){
			side.add(blank);
		}
		side.set(index, symbol);
	}

	/**
	 * Leftmost allocated position
	 */
	public int minPosition(){
		return -left.size();
	}

	/**
	 * Position after the rightmost allocated cell
	 */
	public int maxPosition(){
		return right.size();
	}

	/**
	 * Contents between the leftmost and the rightmost non blank cell.
	 */
	public List<Symbol> contents(){
		List<Symbol> all = new ArrayList<>();
		for (int i = left.size() - 1; i >= 0; i--){
			all.add(left.get(i));
		}
		all.addAll(right);
		int start = 0;
		while (start < all.size() && all.get(start).equals(blank)){
			start++;
		}
		int end = all.size();
		while (end > start && all.get(end - 1).equals(blank)){
			end--;
		}
		return Collections.unmodifiableList(new ArrayList<>(all.subList(start, end)));
	}

	/**
	 * Allocated cells with the head position marked by brackets
	 */
	public String toString(int head){
		StringBuilder builder = new StringBuilder();
		for (int i = Math.min(minPosition(), head); i < Math.max(maxPosition(), head + 1); i++){
			if (i == head){
				builder.append("[").append(read(i)).append("]");
			} else {
				builder.append(read(i));
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return Symbol.join(contents());
	}
}
