package works.jsonmarshal.schema;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.Type;
import works.jsonmarshal.exceptions.MarshalException;

/**
 * One component of a record, as it appears in JSON.
 *
 * @param name the record component name
 * @param externalKey the JSON object key; defaults to {@code name}
 * @param valueType the component's declared type
 * @param optional the value may be {@code null}, and the key may be absent from input
 * @param omitIfEmpty a {@code null} value is left out of the output entirely.
 *                    Implies {@code optional}.
 * @param accessor has type {@code (Object)Object}
 */
public record SchemaField(
	String name,
	String externalKey,
	Type valueType,
	boolean optional,
	boolean omitIfEmpty,
	MethodHandle accessor
) {
	public SchemaField {
		if (externalKey == null || externalKey.isEmpty()) {
			throw new IllegalArgumentException("Field " + name + " must have a non-empty external key");
		}
		if (omitIfEmpty && !optional) {
			throw new IllegalArgumentException("Field " + name + " can't be omitted if it isn't optional");
		}
	}

	public SchemaField withExternalKey(String externalKey) {
		return new SchemaField(name, externalKey, valueType, optional, omitIfEmpty, accessor);
	}

	public SchemaField withOptional(boolean optional) {
		return new SchemaField(name, externalKey, valueType, optional, omitIfEmpty && optional, accessor);
	}

	public SchemaField withOmitIfEmpty(boolean omitIfEmpty) {
		return new SchemaField(name, externalKey, valueType, optional || omitIfEmpty, omitIfEmpty, accessor);
	}

	public Object read(Object record) {
		try {
			return (Object) accessor.invokeExact(record);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new MarshalException("Unable to read field " + name + " of " + record.getClass().getSimpleName(), e);
		}
	}

	@Override
	public String toString() {
		return name + (name.equals(externalKey) ? "" : "(\"" + externalKey + "\")")
			+ ": " + valueType.getTypeName()
			+ (omitIfEmpty ? " omitempty" : optional ? " optional" : "");
	}
}
