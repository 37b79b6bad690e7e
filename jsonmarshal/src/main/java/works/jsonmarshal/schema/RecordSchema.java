package works.jsonmarshal.schema;

import java.lang.invoke.MethodHandle;
import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * A record represented as a JSON object with one member per {@link SchemaField}.
 *
 * @param fields in the order of the record's components
 * @param constructor the canonical constructor, with type {@code (Object[])Object}
 */
public record RecordSchema(
	Class<?> javaType,
	List<SchemaField> fields,
	MethodHandle constructor
) implements Schema {
	public RecordSchema {
		fields = List.copyOf(fields);
	}

	/**
	 * @return the position of the field with the given {@code name}, or -1 if there's none
	 */
	public int indexOf(String name) {
		for (int i = 0; i < fields.size(); i++) {
			if (fields.get(i).name().equals(name)) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * @param args field values in {@link #fields} order
	 */
	public Object instantiate(Object[] args) throws Throwable {
		return (Object) constructor.invokeExact(args);
	}

	@Override
	public String toString() {
		return javaType.getSimpleName() + fields.stream()
			.map(SchemaField::toString)
			.collect(joining(", ", "{", "}"));
	}
}
