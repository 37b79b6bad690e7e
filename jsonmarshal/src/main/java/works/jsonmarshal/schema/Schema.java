package works.jsonmarshal.schema;

import java.lang.reflect.Type;

/**
 * Describes how values of one Java type are laid out in JSON.
 * <p>
 * Schemas are immutable and can be shared freely between threads.
 * Record fields refer to their types rather than their schemas,
 * so that self-referential records can be described;
 * use {@link SchemaScanner#schemaFor(SchemaField)} to resolve them.
 */
public sealed interface Schema permits
	RecordSchema,
	SequenceSchema,
	MappingSchema,
	EnumSchema,
	OptionalSchema,
	ScalarSchema
{
	Type javaType();

	/**
	 * @return the schema that governs non-null values
	 */
	default Schema required() {
		return this;
	}
}
