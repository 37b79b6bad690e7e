package works.jsonmarshal.exceptions;

/**
 * A value reachable from the object being marshalled has no JSON representation.
 */
public final class MarshalException extends JsonMarshalException {
	public MarshalException(String message) {
		super(message);
	}

	public MarshalException(String message, Throwable cause) {
		super(message, cause);
	}
}
