package fla.grammar;

import java.util.Objects;

/**
 * A non terminal symbol, identified by its name.
 */
public final class NonTerminal extends GrammarSymbol {

	/**
	 * Name of the non terminal, typically uppercase
	 */
	public final String name;

	public NonTerminal(String name) {
		this.name = Objects.requireNonNull(name);
		if (name.isEmpty()){
			throw new IllegalArgumentException("Non terminal names must not be empty");
		}
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	int kindOrder() {
		return 3;
	}
}
