package works.jsonmarshal.schema;

import java.lang.reflect.Type;

/**
 * Either a value described by {@link #inner} or {@code null}.
 */
public record OptionalSchema(Schema inner) implements Schema {
	public OptionalSchema {
		if (inner instanceof OptionalSchema) {
			throw new IllegalArgumentException("Optional schema can't be nested: " + inner);
		}
		if (inner.javaType() instanceof Class<?> c && c.isPrimitive()) {
			throw new IllegalArgumentException("Primitive type can't be null: " + c);
		}
	}

	@Override
	public Type javaType() {
		return inner.javaType();
	}

	@Override
	public Schema required() {
		return inner;
	}

	@Override
	public String toString() {
		return "Optional[" + inner + "]";
	}
}
