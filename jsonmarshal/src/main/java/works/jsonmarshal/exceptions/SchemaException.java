package works.jsonmarshal.exceptions;

/**
 * A type was declared in a way this library can't handle.
 * <p>
 * This is thrown while building a schema, or when a schema is classified
 * without the data needed to resolve it,
 * so it can surface before any JSON is examined.
 */
public final class SchemaException extends UnmarshalException {
	public SchemaException(String message) {
		super(message);
	}

	public SchemaException(String message, Throwable cause) {
		super(message, cause);
	}
}
