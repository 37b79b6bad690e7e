package works.jsonmarshal.exceptions;

/**
 * The JSON input can't be turned into the requested type:
 * its shape doesn't match, a required key is missing,
 * or a leaf value can't be converted.
 */
public sealed class UnmarshalException extends JsonMarshalException permits SchemaException {
	public UnmarshalException(String message) {
		super(message);
	}

	public UnmarshalException(String message, Throwable cause) {
		super(message, cause);
	}
}
