package works.jsonmarshal.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import tools.jackson.databind.JsonNode;
import works.jsonmarshal.exceptions.MarshalException;
import works.jsonmarshal.exceptions.SchemaException;
import works.jsonmarshal.schema.EnumSchema;
import works.jsonmarshal.schema.MappingSchema;
import works.jsonmarshal.schema.OptionalSchema;
import works.jsonmarshal.schema.RecordSchema;
import works.jsonmarshal.schema.ScalarSchema;
import works.jsonmarshal.schema.Schema;
import works.jsonmarshal.schema.SequenceSchema;

import static java.util.Map.entry;
import static works.jsonmarshal.types.ValueKind.BOOLEAN;
import static works.jsonmarshal.types.ValueKind.CALENDAR_DATE;
import static works.jsonmarshal.types.ValueKind.ENUM;
import static works.jsonmarshal.types.ValueKind.FLOAT;
import static works.jsonmarshal.types.ValueKind.IDENTIFIER;
import static works.jsonmarshal.types.ValueKind.INTEGER;
import static works.jsonmarshal.types.ValueKind.MAPPING;
import static works.jsonmarshal.types.ValueKind.NULL;
import static works.jsonmarshal.types.ValueKind.RECORD;
import static works.jsonmarshal.types.ValueKind.SEQUENCE;
import static works.jsonmarshal.types.ValueKind.STRING;
import static works.jsonmarshal.types.ValueKind.TIMESTAMP;

/**
 * Decides which {@link ValueKind} applies to a schema, to JSON data, or to a Java value.
 * <p>
 * Classifying a schema and classifying a Java value of that schema's type
 * always agree, except that a {@code null} value is always {@link ValueKind#NULL NULL}.
 * All methods are pure.
 */
public final class TypeClassifier {
	private TypeClassifier() { }

	public static final Set<Class<?>> TIMESTAMP_CLASSES = Set.of(
		OffsetDateTime.class, ZonedDateTime.class, LocalDateTime.class);

	private static final Map<Class<?>, ValueKind> PRIMITIVE_KINDS = Map.ofEntries(
		entry(String.class, STRING),
		entry(Character.class, STRING),
		entry(char.class, STRING),
		entry(Integer.class, INTEGER),
		entry(int.class, INTEGER),
		entry(Long.class, INTEGER),
		entry(long.class, INTEGER),
		entry(Short.class, INTEGER),
		entry(short.class, INTEGER),
		entry(Byte.class, INTEGER),
		entry(byte.class, INTEGER),
		entry(BigInteger.class, INTEGER),
		entry(Double.class, FLOAT),
		entry(double.class, FLOAT),
		entry(Float.class, FLOAT),
		entry(float.class, FLOAT),
		entry(BigDecimal.class, FLOAT),
		entry(Boolean.class, BOOLEAN),
		entry(boolean.class, BOOLEAN),
		entry(Void.class, NULL)
	);

	/**
	 * Classifies a schema with no data to go by.
	 *
	 * @throws SchemaException if the schema is optional, or unsupported
	 */
	public static ValueKind classify(Schema schema) {
		return classify(schema, null);
	}

	/**
	 * @param data the JSON being read according to {@code schema}, or {@code null} if there is none.
	 *             (JSON null is represented by a {@link tools.jackson.databind.node.NullNode NullNode}.)
	 * @throws SchemaException if the schema is unsupported,
	 * or is optional and there's no {@code data} to resolve it
	 */
	public static ValueKind classify(Schema schema, JsonNode data) {
		if (schema instanceof RecordSchema) {
			return RECORD;
		} else if (schema instanceof EnumSchema) {
			return ENUM;
		} else if (schema instanceof ScalarSchema s && TIMESTAMP_CLASSES.contains(s.javaType())) {
			return TIMESTAMP;
		} else if (schema instanceof ScalarSchema s && s.javaType() == LocalDate.class) {
			return CALENDAR_DATE;
		} else if (schema instanceof OptionalSchema o) {
			if (data == null) {
				throw new SchemaException("Can't classify " + o + " without data to tell whether it's null");
			}
			return data.isNull() ? NULL : classify(o.inner(), data);
		} else if (schema instanceof SequenceSchema) {
			return SEQUENCE;
		} else if (schema instanceof MappingSchema) {
			return MAPPING;
		} else if (schema instanceof ScalarSchema s && s.javaType() == UUID.class) {
			return IDENTIFIER;
		} else if (schema instanceof ScalarSchema s) {
			ValueKind result = PRIMITIVE_KINDS.get(s.javaType());
			if (result == null) {
				throw new SchemaException("Schema type '" + s.javaType().getName() + "' is not currently supported.");
			}
			return result;
		} else {
			throw new SchemaException("Unexpected schema " + schema);
		}
	}

	/**
	 * Classifies a value about to be marshalled, based on its runtime class.
	 *
	 * @throws MarshalException if {@code value} has no JSON representation
	 */
	public static ValueKind classifyValue(Object value) {
		if (value == null) {
			return NULL;
		} else if (value instanceof Record) {
			return RECORD;
		} else if (value instanceof Enum) {
			return ENUM;
		} else if (TIMESTAMP_CLASSES.contains(value.getClass())) {
			return TIMESTAMP;
		} else if (value instanceof LocalDate) {
			return CALENDAR_DATE;
		} else if (value instanceof Collection) {
			return SEQUENCE;
		} else if (value instanceof Map) {
			return MAPPING;
		} else if (value instanceof UUID) {
			return IDENTIFIER;
		}
		ValueKind result = PRIMITIVE_KINDS.get(value.getClass());
		if (result == null) {
			throw new MarshalException(String.format("Unable to marshal data '%s' (%s) to known type.", value, value.getClass().getName()));
		}
		return result;
	}
}
