package fla.automata.turing;

/**
 * Direction of the head movement
 */
public enum Move {
	LEFT(-1),
	RIGHT(1);

	public final int offset;

	Move(int offset) {
		this.offset = offset;
	}
}
