package works.jsonmarshal.schema;

/**
 * A type represented by a single JSON value:
 * strings, numbers, booleans, identifiers, timestamps and dates.
 * <p>
 * Any class can be described this way;
 * whether it's actually supported is decided by
 * {@link works.jsonmarshal.types.TypeClassifier TypeClassifier}.
 */
public record ScalarSchema(Class<?> javaType) implements Schema {
	@Override
	public String toString() {
		return javaType.getSimpleName();
	}
}
