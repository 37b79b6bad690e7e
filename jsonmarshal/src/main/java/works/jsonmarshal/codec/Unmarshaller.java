package works.jsonmarshal.codec;

import java.lang.reflect.Type;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.NullNode;
import works.jsonmarshal.exceptions.JsonMarshalException;
import works.jsonmarshal.exceptions.SchemaException;
import works.jsonmarshal.exceptions.TraversalStateException;
import works.jsonmarshal.exceptions.UnmarshalException;
import works.jsonmarshal.schema.EnumSchema;
import works.jsonmarshal.schema.RecordSchema;
import works.jsonmarshal.schema.Schema;
import works.jsonmarshal.schema.SchemaField;
import works.jsonmarshal.schema.SchemaScanner;
import works.jsonmarshal.schema.SequenceSchema;
import works.jsonmarshal.temporal.TemporalCodec;
import works.jsonmarshal.types.TypeClassifier;
import works.jsonmarshal.types.ValueKind;

import static java.util.stream.Collectors.toCollection;

/**
 * Turns {@link JsonNode} trees into Java values of a given type.
 * <p>
 * Object keys are matched to record fields by external key;
 * keys with no matching field are ignored.
 * An absent key is read as {@code null} if its field is optional, and is an error otherwise.
 * UUIDs may be written with or without hyphens, in braces, or as {@code urn:uuid:} URNs.
 * Lists are returned unmodifiable.
 * The input tree is never modified.
 */
public final class Unmarshaller {
	private static final Pattern UUID_HEX = Pattern.compile("[0-9a-fA-F]{32}");

	private final SchemaScanner scanner;
	private final CodecSettings settings;
	private final ObjectMapper mapper;

	public Unmarshaller(SchemaScanner scanner, CodecSettings settings, ObjectMapper mapper) {
		this.scanner = scanner;
		this.settings = settings;
		this.mapper = mapper;
	}

	/**
	 * @throws UnmarshalException if {@code json} doesn't match {@code type}
	 * @throws SchemaException if {@code type} isn't supported
	 */
	public Object unmarshal(JsonNode json, Type type) {
		LOGGER.debug("Unmarshalling {}", type.getTypeName());
		Schema schema = scanner.schemaFor(type);
		ValueKind kind = classifyAt(schema, json, NodePath.ROOT);
		return new Session().walk(new WorkItem(json, schema, kind, NodePath.ROOT));
	}

	private final class Session extends TreeWalker {
		final TemporalCodec temporal = settings.temporalCodec();

		@Override
		protected void normalize(WorkItem item) {
			JsonNode json = (JsonNode) item.source();
			Schema schema = item.schema().required();
			checkShape(schema, item.kind(), json, item.path());
			switch (item.kind()) {
				case RECORD -> normalizeRecord(item, (RecordSchema) schema, json);
				case SEQUENCE -> normalizeSequence(item, (SequenceSchema) schema, json);
				default -> item.finalized(leafValue(schema, item.kind(), json, item.path()));
			}
		}

		@Override
		protected Object complete(WorkItem item) {
			return item.assembly().finish();
		}

		private void normalizeRecord(WorkItem item, RecordSchema schema, JsonNode json) {
			List<SchemaField> fields = schema.fields();
			Object[] args = new Object[fields.size()];
			List<WorkItem> children = new ArrayList<>();
			for (int i = 0; i < fields.size(); i++) {
				SchemaField field = fields.get(i);
				NodePath path = item.path().then(field.name());
				JsonNode value = json.get(field.externalKey());
				if (value == null) {
					if (!field.optional()) {
						throw new UnmarshalException(String.format(
							"Expected json key is not present in object at position '%s'. '%s' not in %s",
							item.path(), field.externalKey(), availableKeys(json)));
					}
					value = NullNode.getInstance();
				}
				Schema fieldSchema = schemaAt(field, path);
				ValueKind kind = classifyAt(fieldSchema, value, path);
				if (kind.isPrimitive()) {
					checkShape(fieldSchema, kind, value, path);
					args[i] = leafValue(fieldSchema.required(), kind, value, path);
				} else {
					children.add(new WorkItem(value, fieldSchema, kind, path));
				}
			}
			if (LOGGER.isDebugEnabled()) {
				Set<String> ignored = availableKeys(json);
				fields.forEach(f -> ignored.remove(f.externalKey()));
				if (!ignored.isEmpty()) {
					LOGGER.debug("Ignoring unknown keys {} at {}", ignored, item.path());
				}
			}
			item.normalized(new RecordAssembly(schema, args, item.path()), children.iterator());
		}

		private void normalizeSequence(WorkItem item, SequenceSchema schema, JsonNode json) {
			Schema elementSchema = schema.element();
			int size = json.size();
			item.normalized(new ListAssembly(new ArrayList<>(size)), new Iterator<>() {
				int index = 0;

				@Override
				public boolean hasNext() {
					return index < size;
				}

				@Override
				public WorkItem next() {
					if (index >= size) {
						throw new NoSuchElementException();
					}
					JsonNode element = json.get(index);
					NodePath path = item.path().then(index++);
					return new WorkItem(element, elementSchema, classifyAt(elementSchema, element, path), path);
				}
			});
		}

		private Object leafValue(Schema schema, ValueKind kind, JsonNode json, NodePath path) {
			return switch (kind) {
				case NULL -> null;
				case MAPPING -> {
					try {
						yield mapper.convertValue(json, mapper.getTypeFactory().constructType(schema.javaType()));
					} catch (JacksonException e) {
						throw new UnmarshalException("Unable to convert object at " + path + " to " + schema.javaType().getTypeName(), e);
					}
				}
				case ENUM -> {
					Enum<?> result = ((EnumSchema) schema).constantFor(json);
					if (result == null) {
						throw new UnmarshalException(String.format("Unable to use data value '%s' as Enum %s at %s",
							describe(json), ((EnumSchema) schema).javaType().getSimpleName(), path));
					}
					yield result;
				}
				case IDENTIFIER -> {
					UUID result = json.isString() ? parseUuid(json.stringValue()) : null;
					if (result != null) {
						yield result;
					}
					throw new UnmarshalException(String.format("Unable to use data value '%s' as UUID at %s", describe(json), path));
				}
				case TIMESTAMP -> {
					Class<?> targetType = (Class<?>) schema.javaType();
					try {
						yield temporal.parseTimestamp(requireString(json, targetType, path), targetType);
					} catch (DateTimeException e) {
						throw unusable(json, targetType, path, e);
					}
				}
				case CALENDAR_DATE -> {
					try {
						yield temporal.parseDate(requireString(json, LocalDate.class, path));
					} catch (DateTimeException e) {
						throw unusable(json, LocalDate.class, path, e);
					}
				}
				case STRING -> stringValue((Class<?>) schema.javaType(), json, path);
				case INTEGER -> integerValue((Class<?>) schema.javaType(), json, path);
				case FLOAT -> floatValue((Class<?>) schema.javaType(), json);
				case BOOLEAN -> json.booleanValue();
				case RECORD, SEQUENCE -> throw new TraversalStateException("Composite is not a leaf at " + path);
			};
		}
	}

	private static void checkShape(Schema schema, ValueKind kind, JsonNode json, NodePath path) {
		if (kind.hasLeafParser()) {
			// Validated by the parser itself
			return;
		}
		boolean matches = switch (kind) {
			case RECORD, MAPPING -> json.isObject();
			case SEQUENCE -> json.isArray();
			case STRING -> json.isString();
			case INTEGER -> json.isIntegralNumber();
			case FLOAT -> json.isNumber();
			case BOOLEAN -> json.isBoolean();
			default -> throw new TraversalStateException("Unexpected kind " + kind + " at " + path);
		};
		if (!matches) {
			throw new UnmarshalException(String.format(
				"Invalid schema. schema = %s, data = '%s' (%s) at location = %s",
				schema, describe(json), jsonTypeName(json), path));
		}
	}

	private Schema schemaAt(SchemaField field, NodePath path) {
		try {
			return scanner.schemaFor(field);
		} catch (SchemaException e) {
			throw JsonMarshalException.wrap(e, "At " + path);
		}
	}

	private static ValueKind classifyAt(Schema schema, JsonNode json, NodePath path) {
		try {
			return TypeClassifier.classify(schema, json);
		} catch (SchemaException e) {
			throw JsonMarshalException.wrap(e, "At " + path);
		}
	}

	private static Object stringValue(Class<?> targetType, JsonNode json, NodePath path) {
		String value = json.stringValue();
		if (targetType == String.class) {
			return value;
		} else if (value.length() == 1) {
			return value.charAt(0);
		} else {
			throw new UnmarshalException(String.format("Unable to use data value '%s' as %s at %s: expected one character",
				value, targetType.getSimpleName(), path));
		}
	}

	private static Object integerValue(Class<?> targetType, JsonNode json, NodePath path) {
		BigInteger value = json.bigIntegerValue();
		if (targetType == BigInteger.class) {
			return value;
		}
		long min;
		long max;
		if (targetType == Long.class || targetType == long.class) {
			min = Long.MIN_VALUE;
			max = Long.MAX_VALUE;
		} else if (targetType == Integer.class || targetType == int.class) {
			min = Integer.MIN_VALUE;
			max = Integer.MAX_VALUE;
		} else if (targetType == Short.class || targetType == short.class) {
			min = Short.MIN_VALUE;
			max = Short.MAX_VALUE;
		} else {
			min = Byte.MIN_VALUE;
			max = Byte.MAX_VALUE;
		}
		if (value.compareTo(BigInteger.valueOf(min)) < 0 || value.compareTo(BigInteger.valueOf(max)) > 0) {
			throw new UnmarshalException(String.format("Unable to use data value '%s' as %s at %s: out of range",
				value, targetType.getSimpleName(), path));
		}
		long l = value.longValue();
		if (targetType == Long.class || targetType == long.class) {
			return l;
		} else if (targetType == Integer.class || targetType == int.class) {
			return (int) l;
		} else if (targetType == Short.class || targetType == short.class) {
			return (short) l;
		} else {
			return (byte) l;
		}
	}

	private static Object floatValue(Class<?> targetType, JsonNode json) {
		if (targetType == Float.class || targetType == float.class) {
			return json.floatValue();
		} else if (targetType == Double.class || targetType == double.class) {
			return json.doubleValue();
		} else {
			return json.decimalValue();
		}
	}

	/**
	 * Accepts 32 hex digits, optionally hyphenated, wrapped in braces,
	 * or prefixed by {@code urn:} and {@code uuid:}.
	 *
	 * @return null if {@code text} isn't a UUID
	 */
	static UUID parseUuid(String text) {
		String hex = text;
		if (hex.startsWith("urn:")) {
			hex = hex.substring("urn:".length());
		}
		if (hex.startsWith("uuid:")) {
			hex = hex.substring("uuid:".length());
		}
		if (hex.startsWith("{") && hex.endsWith("}")) {
			hex = hex.substring(1, hex.length() - 1);
		}
		hex = hex.replace("-", "");
		if (!UUID_HEX.matcher(hex).matches()) {
			return null;
		}
		return new UUID(
			Long.parseUnsignedLong(hex.substring(0, 16), 16),
			Long.parseUnsignedLong(hex.substring(16), 16));
	}

	private static String requireString(JsonNode json, Class<?> targetType, NodePath path) {
		if (!json.isString()) {
			throw unusable(json, targetType, path, null);
		}
		return json.stringValue();
	}

	private static UnmarshalException unusable(JsonNode json, Class<?> targetType, NodePath path, Throwable cause) {
		String message = String.format("Unable to use data value '%s' as %s at %s", describe(json), targetType.getSimpleName(), path);
		return (cause == null) ? new UnmarshalException(message) : new UnmarshalException(message, cause);
	}

	private static Set<String> availableKeys(JsonNode json) {
		return json.properties().stream()
			.map(Map.Entry::getKey)
			.collect(toCollection(LinkedHashSet::new));
	}

	private static String describe(JsonNode json) {
		return json.isString() ? json.stringValue() : json.toString();
	}

	static String jsonTypeName(JsonNode json) {
		if (json.isObject()) {
			return "object";
		} else if (json.isArray()) {
			return "array";
		} else if (json.isString()) {
			return "string";
		} else if (json.isIntegralNumber()) {
			return "integer";
		} else if (json.isNumber()) {
			return "float";
		} else if (json.isBoolean()) {
			return "boolean";
		} else if (json.isNull()) {
			return "null";
		} else {
			return json.getClass().getSimpleName();
		}
	}

	private static final class RecordAssembly implements Assembly {
		final RecordSchema schema;
		final Object[] args;
		final NodePath path;

		RecordAssembly(RecordSchema schema, Object[] args, NodePath path) {
			this.schema = schema;
			this.args = args;
			this.path = path;
		}

		@Override
		public void attach(Object segment, Object value) {
			args[schema.indexOf((String) segment)] = value;
		}

		@Override
		public Object finish() {
			try {
				return schema.instantiate(args);
			} catch (JsonMarshalException | Error e) {
				throw e;
			} catch (Throwable e) {
				throw new UnmarshalException("Unable to construct " + schema.javaType().getSimpleName() + " at " + path + ": " + e.getMessage(), e);
			}
		}
	}

	private static final class ListAssembly implements Assembly {
		final List<Object> elements;

		ListAssembly(List<Object> elements) {
			this.elements = elements;
		}

		@Override
		public void attach(Object segment, Object value) {
			if ((Integer) segment != elements.size()) {
				throw new TraversalStateException("Expected element " + elements.size() + " but got " + segment);
			}
			elements.add(value);
		}

		@Override
		public Object finish() {
			return Collections.unmodifiableList(elements);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Unmarshaller.class);
}
