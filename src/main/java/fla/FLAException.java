package fla;

/**
 * Base class of all exceptions thrown by the analysis engines.
 */
public class FLAException extends RuntimeException {

	public FLAException(String message) {
		super(message);
	}

	public FLAException(String message, Throwable cause) {
		super(message, cause);
	}
}
