package fla;

/**
 * Thrown if an automaton or grammar description is malformed, e.g. if a transition points to an undeclared
 * state or a production uses an undeclared symbol.
 *
 * Raised while constructing the description, no analysis ever runs on a malformed description.
 */
public class StructuralError extends FLAException {

	public StructuralError(String message) {
		super(message);
	}

	public StructuralError(String format, Object... args) {
		super(String.format(format, args));
	}
}
