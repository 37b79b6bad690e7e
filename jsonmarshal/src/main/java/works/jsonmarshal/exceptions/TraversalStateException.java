package works.jsonmarshal.exceptions;

/**
 * The traversal engine has reached a state that should be impossible.
 * <p>
 * This does not indicate a problem with the input.
 * A correctly working engine would not throw this exception.
 */
public final class TraversalStateException extends JsonMarshalException {
	public TraversalStateException(String message) {
		super(message);
	}

	public TraversalStateException(String message, Throwable cause) {
		super(message, cause);
	}
}
