package fla.grammar;

/**
 * The empty word
 */
public final class Epsilon extends TerminalOrEpsilon {

	public static final Epsilon EPSILON = new Epsilon();

	private Epsilon() {
	}

	@Override
	public String getName() {
		return "ε";
	}

	@Override
	int kindOrder() {
		return 0;
	}

	private Object readResolve(){
		return EPSILON;
	}
}
