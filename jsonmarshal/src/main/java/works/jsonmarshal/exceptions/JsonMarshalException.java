package works.jsonmarshal.exceptions;

public sealed abstract class JsonMarshalException extends RuntimeException permits
	MarshalException,
	UnmarshalException,
	TraversalStateException
{
	protected JsonMarshalException(String message) {
		super(message);
	}

	protected JsonMarshalException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same type as {@code exception} whose message
	 * is prefixed with {@code context}, and whose cause is {@code exception}.
	 */
	@SuppressWarnings("unchecked")
	public static <T extends JsonMarshalException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof SchemaException) {
			return (T) new SchemaException(newMessage, exception);
		} else if (exception instanceof UnmarshalException) {
			return (T) new UnmarshalException(newMessage, exception);
		} else if (exception instanceof MarshalException) {
			return (T) new MarshalException(newMessage, exception);
		} else {
			return (T) new TraversalStateException(newMessage, exception);
		}
	}
}
