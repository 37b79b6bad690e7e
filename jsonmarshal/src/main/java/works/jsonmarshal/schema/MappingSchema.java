package works.jsonmarshal.schema;

import java.lang.reflect.Type;

/**
 * A {@code Map<String, V>} represented as a JSON object.
 * Its contents are converted wholesale rather than walked field-by-field.
 */
public record MappingSchema(Type javaType, Type valueType) implements Schema {
	@Override
	public String toString() {
		return "Map[String, " + valueType.getTypeName() + "]";
	}
}
