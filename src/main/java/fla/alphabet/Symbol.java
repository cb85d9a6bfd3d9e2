package fla.alphabet;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An input, stack or tape symbol.
 *
 * Symbols are immutable and compared by their name, two instances with the same name are the same symbol.
 */
public final class Symbol implements Serializable, Comparable<Symbol> {

	/**
	 * Name of the symbol, typically a single character
	 */
	public final String name;

	private Symbol(String name) {
		this.name = name;
	}

	public static Symbol of(String name){
		Objects.requireNonNull(name, "symbol name");
		if (name.isEmpty()){
			throw new IllegalArgumentException("Symbol names must not be empty");
		}
		return new Symbol(name);
	}

	public static Symbol of(char character){
		return new Symbol(String.valueOf(character));
	}

	/**
	 * Splits the passed string into single character symbols.
	 *
	 * @param word passed string, might be empty
	 * @return unmodifiable list of symbols
	 */
	public static List<Symbol> chars(String word){
		List<Symbol> symbols = new ArrayList<>();
		word.codePoints().forEach(c -> symbols.add(new Symbol(new String(Character.toChars(c)))));
		return Collections.unmodifiableList(symbols);
	}

	/**
	 * Splits the passed string at whitespace into symbols.
	 */
	public static List<Symbol> words(String sentence){
		List<Symbol> symbols = new ArrayList<>();
		for (String part : sentence.trim().split("\\s+")){
			if (!part.isEmpty()){
				symbols.add(new Symbol(part));
			}
		}
		return Collections.unmodifiableList(symbols);
	}

	/**
	 * Concatenates the names of the passed symbols.
	 */
	public static String join(List<Symbol> symbols){
		StringBuilder builder = new StringBuilder();
		for (Symbol symbol : symbols){
			builder.append(symbol.name);
		}
		return builder.toString();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Symbol && ((Symbol) obj).name.equals(name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public int compareTo(Symbol o) {
		return name.compareTo(o.name);
	}

	@Override
	public String toString() {
		return name;
	}
}
