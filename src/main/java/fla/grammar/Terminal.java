package fla.grammar;

import java.util.Objects;

import fla.alphabet.Symbol;

/**
 * A terminal symbol, wraps an alphabet symbol.
 */
public final class Terminal extends TerminalOrEpsilon {

	/**
	 * End of input marker, never part of a grammar's terminals
	 */
	public static final Terminal EOF = new Terminal(Symbol.of("$"));

	public final Symbol symbol;

	public Terminal(Symbol symbol) {
		this.symbol = Objects.requireNonNull(symbol);
	}

	public static Terminal of(String name){
		return new Terminal(Symbol.of(name));
	}

	public boolean isEOF(){
		return this.equals(EOF);
	}

	@Override
	public String getName() {
		return symbol.name;
	}

	@Override
	int kindOrder() {
		return isEOF() ? 2 : 1;
	}
}
