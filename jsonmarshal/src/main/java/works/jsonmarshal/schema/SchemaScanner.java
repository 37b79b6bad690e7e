package works.jsonmarshal.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import java.lang.annotation.Annotation;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonmarshal.exceptions.SchemaException;

import static java.lang.invoke.MethodType.methodType;

/**
 * Reflectively derives {@link Schema}s from Java types, and remembers them.
 * <p>
 * Records become {@link RecordSchema}s, reading these annotations from each component:
 * <ul>
 *     <li>
 *         {@link JsonProperty} sets the external key.
 *     </li>
 *     <li>
 *         {@link Nullable} makes the field optional.
 *     </li>
 *     <li>
 *         {@link JsonInclude} with {@code NON_NULL}, {@code NON_ABSENT} or {@code NON_EMPTY}
 *         makes the field optional and omits it from the output when it's null.
 *     </li>
 * </ul>
 * Enums use the method annotated with {@link JsonValue}, if any, to compute their external values.
 * <p>
 * Generic records can be scanned, but the schema of a field whose type
 * involves a type variable can't be resolved.
 * <p>
 * Customizations ({@link #useLookup}, {@link #customizeField}) should be made before
 * any schemas are requested; after that, this object is effectively read-only
 * and can be shared between threads.
 */
public class SchemaScanner {
	private final Map<Type, Schema> memo = new ConcurrentHashMap<>();
	private final Map<Package, Lookup> lookups = new ConcurrentHashMap<>();
	private final Map<Class<?>, Map<String, UnaryOperator<SchemaField>>> fieldCustomizations = new ConcurrentHashMap<>();

	/**
	 * When scanning types, uses the given {@link Lookup} object to find {@link MethodHandle}s
	 * for any class in the same package as the {@link Lookup}'s {@linkplain Lookup#lookupClass() lookup class}.
	 *
	 * @return {@code this}
	 */
	public SchemaScanner useLookup(Lookup lookup) {
		lookups.put(lookup.lookupClass().getPackage(), lookup);
		return this;
	}

	/**
	 * Applies {@code customization} to the named field of {@code recordType}
	 * after its annotations have been read.
	 * Must be called before the record type is scanned.
	 *
	 * @return {@code this}
	 */
	public SchemaScanner customizeField(Class<? extends Record> recordType, String fieldName, UnaryOperator<SchemaField> customization) {
		if (memo.containsKey(recordType)) {
			throw new IllegalStateException("Can't customize " + recordType.getSimpleName() + "." + fieldName + " after it has been scanned");
		}
		boolean exists = Stream.of(recordType.getRecordComponents())
			.anyMatch(c -> c.getName().equals(fieldName));
		if (!exists) {
			throw new IllegalArgumentException(recordType.getSimpleName() + " has no component named " + fieldName);
		}
		var previous = fieldCustomizations
			.computeIfAbsent(recordType, k -> new ConcurrentHashMap<>())
			.putIfAbsent(fieldName, customization);
		if (previous != null) {
			throw new IllegalStateException("Already customized " + recordType.getSimpleName() + "." + fieldName);
		}
		return this;
	}

	/**
	 * @throws SchemaException if {@code type} can't be described by any schema
	 */
	public Schema schemaFor(Type type) {
		// Not computeIfAbsent: element schemas are scanned recursively
		Schema existing = memo.get(type);
		if (existing != null) {
			return existing;
		}
		Schema computed = computeSchema(type);
		existing = memo.putIfAbsent(type, computed);
		return (existing == null) ? computed : existing;
	}

	public Schema schemaFor(SchemaField field) {
		Schema schema = schemaFor(field.valueType());
		return field.optional() ? new OptionalSchema(schema) : schema;
	}

	public RecordSchema recordSchema(Class<?> recordType) {
		return (RecordSchema) schemaFor(requireKind(recordType, recordType.isRecord(), "record"));
	}

	public EnumSchema enumSchema(Class<?> enumType) {
		return (EnumSchema) schemaFor(requireKind(enumType, enumType.isEnum(), "enum"));
	}

	private static Class<?> requireKind(Class<?> type, boolean isKind, String kind) {
		if (!isKind) {
			throw new SchemaException("Expected " + kind + " type but got " + type);
		}
		return type;
	}

	private Schema computeSchema(Type type) {
		LOGGER.debug("Scanning {}", type);
		if (type instanceof Class<?> c) {
			if (c.isRecord()) {
				return scanRecord(c);
			} else if (c.isEnum()) {
				return scanEnum(c);
			} else if (Iterable.class.isAssignableFrom(c) || Map.class.isAssignableFrom(c)) {
				throw new SchemaException("Raw type " + c.getName() + " has no element type; use a parameterized type");
			} else {
				return new ScalarSchema(c);
			}
		} else if (type instanceof ParameterizedType p && p.getRawType() instanceof Class<?> raw) {
			Type[] args = p.getActualTypeArguments();
			if (raw == List.class || raw == Collection.class || raw == Iterable.class) {
				return new SequenceSchema(p, schemaFor(args[0]));
			} else if (raw == Map.class) {
				if (args[0] != String.class) {
					throw new SchemaException("Map keys must be String: " + p.getTypeName());
				}
				return new MappingSchema(p, args[1]);
			} else {
				throw new SchemaException("Unsupported parameterized type: " + p.getTypeName());
			}
		} else if (type instanceof WildcardType w && w.getLowerBounds().length == 0) {
			return schemaFor(w.getUpperBounds()[0]);
		} else if (type instanceof TypeVariable<?> v) {
			// Generic records can be marshalled from their runtime values, but not unmarshalled
			throw new SchemaException("Type variable " + v.getName() + " of " + v.getGenericDeclaration()
				+ " can't be resolved; generic records are only supported for marshalling");
		} else {
			throw new SchemaException("Unsupported type: " + type.getTypeName());
		}
	}

	private RecordSchema scanRecord(Class<?> recordClass) {
		Lookup lookup = lookupFor(recordClass);
		var customizations = fieldCustomizations.getOrDefault(recordClass, Map.of());
		RecordComponent[] components = recordClass.getRecordComponents();
		List<SchemaField> fields = new ArrayList<>(components.length);
		for (RecordComponent c : components) {
			SchemaField field = scanRecordComponent(c, lookup);
			UnaryOperator<SchemaField> customization = customizations.get(c.getName());
			if (customization != null) {
				field = customization.apply(field);
				LOGGER.debug("Customized {}.{}: {}", recordClass.getSimpleName(), c.getName(), field);
			}
			if (field.optional() && c.getType().isPrimitive()) {
				throw new SchemaException("Primitive component " + recordClass.getSimpleName() + "." + c.getName() + " can't be optional");
			}
			fields.add(field);
		}
		warnAboutDuplicateKeys(recordClass, fields);

		Class<?>[] ctorParameterTypes = Stream.of(components)
			.map(RecordComponent::getType)
			.toArray(Class<?>[]::new);
		MethodHandle constructor;
		try {
			constructor = lookup.unreflectConstructor(recordClass.getDeclaredConstructor(ctorParameterTypes));
		} catch (NoSuchMethodException | IllegalAccessException e) {
			throw new SchemaException(inaccessible("constructor", recordClass), e);
		}
		RecordSchema result = new RecordSchema(
			recordClass,
			fields,
			constructor
				.asSpreader(Object[].class, components.length)
				.asType(methodType(Object.class, Object[].class)));
		LOGGER.debug("Scanned {}", result);
		return result;
	}

	private static SchemaField scanRecordComponent(RecordComponent c, Lookup lookup) {
		MethodHandle accessor;
		try {
			accessor = lookup.unreflect(c.getAccessor());
		} catch (IllegalAccessException e) {
			throw new SchemaException(inaccessible("accessor for " + c.getName(), c.getDeclaringRecord()), e);
		}

		String externalKey = c.getName();
		JsonProperty property = componentAnnotation(c, JsonProperty.class);
		if (property != null && !property.value().isEmpty()) {
			externalKey = property.value();
		}

		boolean omitIfEmpty = false;
		JsonInclude include = componentAnnotation(c, JsonInclude.class);
		if (include != null) {
			switch (include.value()) {
				case NON_NULL, NON_ABSENT, NON_EMPTY -> omitIfEmpty = true;
				default -> { }
			}
		}
		boolean optional = omitIfEmpty || c.isAnnotationPresent(Nullable.class);

		return new SchemaField(
			c.getName(),
			externalKey,
			c.getGenericType(),
			optional,
			omitIfEmpty,
			accessor.asType(methodType(Object.class, Object.class)));
	}

	/**
	 * Jackson's annotations don't target record components,
	 * so javac propagates them to the accessor and the field instead.
	 */
	private static <A extends Annotation> A componentAnnotation(RecordComponent c, Class<A> annotationType) {
		A result = c.getAnnotation(annotationType);
		if (result == null) {
			result = c.getAccessor().getAnnotation(annotationType);
		}
		if (result == null) {
			try {
				result = c.getDeclaringRecord().getDeclaredField(c.getName()).getAnnotation(annotationType);
			} catch (NoSuchFieldException e) {
				throw new IllegalStateException("Record " + c.getDeclaringRecord() + " has no field for component " + c.getName(), e);
			}
		}
		return result;
	}

	private static void warnAboutDuplicateKeys(Class<?> recordClass, List<SchemaField> fields) {
		Map<String, String> namesByKey = new HashMap<>();
		for (SchemaField f : fields) {
			String other = namesByKey.putIfAbsent(f.externalKey(), f.name());
			if (other != null) {
				LOGGER.warn("Record {} fields {} and {} share external key \"{}\"; input will populate both and output will repeat the key",
					recordClass.getSimpleName(), other, f.name(), f.externalKey());
			}
		}
	}

	private EnumSchema scanEnum(Class<?> enumClass) {
		List<Enum<?>> constants = new ArrayList<>();
		for (Object constant : enumClass.getEnumConstants()) {
			constants.add((Enum<?>) constant);
		}
		MethodHandle jsonValue = jsonValueMethod(enumClass);
		List<Object> externalValues = new ArrayList<>(constants.size());
		for (Enum<?> constant : constants) {
			if (jsonValue == null) {
				externalValues.add(constant.name());
			} else {
				Object value;
				try {
					value = (Object) jsonValue.invokeExact((Object) constant);
				} catch (RuntimeException | Error e) {
					throw e;
				} catch (Throwable e) {
					throw new SchemaException("Unable to compute external value of " + constant, e);
				}
				if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
					throw new SchemaException("External value of " + enumClass.getSimpleName() + "." + constant.name()
						+ " must be a string, number or boolean: " + value);
				}
				externalValues.add(value);
			}
		}
		return new EnumSchema(enumClass, constants, externalValues);
	}

	private MethodHandle jsonValueMethod(Class<?> enumClass) {
		for (Method m : enumClass.getDeclaredMethods()) {
			JsonValue annotation = m.getAnnotation(JsonValue.class);
			if (annotation != null && annotation.value() && m.getParameterCount() == 0) {
				try {
					return lookupFor(enumClass).unreflect(m).asType(methodType(Object.class, Object.class));
				} catch (IllegalAccessException e) {
					throw new SchemaException(inaccessible("@JsonValue method " + m.getName(), enumClass), e);
				}
			}
		}
		return null;
	}

	Lookup lookupFor(Class<?> c) {
		Lookup registered = lookups.get(c.getPackage());
		if (registered != null) {
			return registered;
		}
		try {
			return MethodHandles.privateLookupIn(c, MethodHandles.lookup());
		} catch (IllegalAccessException e) {
			LOGGER.debug("No private access to {}; falling back to public lookup", c, e);
			return MethodHandles.publicLookup();
		}
	}

	private static String inaccessible(String member, Class<?> c) {
		return "Unable to access " + member + " of " + c.getName()
			+ "; consider calling useLookup with a Lookup from package " + c.getPackageName();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaScanner.class);
}
