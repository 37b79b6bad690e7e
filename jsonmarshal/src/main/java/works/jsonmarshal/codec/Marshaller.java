package works.jsonmarshal.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;
import tools.jackson.databind.node.StringNode;
import works.jsonmarshal.exceptions.MarshalException;
import works.jsonmarshal.exceptions.SchemaException;
import works.jsonmarshal.exceptions.TraversalStateException;
import works.jsonmarshal.schema.RecordSchema;
import works.jsonmarshal.schema.SchemaField;
import works.jsonmarshal.schema.SchemaScanner;
import works.jsonmarshal.temporal.TemporalCodec;
import works.jsonmarshal.types.TypeClassifier;
import works.jsonmarshal.types.ValueKind;

/**
 * Turns Java values into {@link JsonNode} trees.
 * <p>
 * Conversion is driven by each value's runtime type,
 * so no schema needs to be supplied for the root.
 * Records are written as objects, with their fields in declaration order;
 * collections as arrays; maps are converted by the {@link ObjectMapper}.
 * The input is never modified.
 */
public final class Marshaller {
	private final SchemaScanner scanner;
	private final CodecSettings settings;
	private final ObjectMapper mapper;

	public Marshaller(SchemaScanner scanner, CodecSettings settings, ObjectMapper mapper) {
		this.scanner = scanner;
		this.settings = settings;
		this.mapper = mapper;
	}

	/**
	 * @throws MarshalException if {@code value}, or anything reachable from it,
	 * has no JSON representation
	 */
	public JsonNode marshal(Object value) {
		LOGGER.debug("Marshalling value of {}", (value == null) ? "null" : value.getClass());
		ValueKind kind = TypeClassifier.classifyValue(value);
		return (JsonNode) new Session().walk(new WorkItem(value, null, kind, NodePath.ROOT));
	}

	private final class Session extends TreeWalker {
		final JsonNodeFactory nodes = JsonNodeFactory.instance;
		final TemporalCodec temporal = settings.temporalCodec();

		@Override
		protected void normalize(WorkItem item) {
			switch (item.kind()) {
				case RECORD -> normalizeRecord(item);
				case SEQUENCE -> normalizeSequence(item);
				default -> item.finalized(leafNode(item));
			}
		}

		@Override
		protected Object complete(WorkItem item) {
			return item.assembly().finish();
		}

		private void normalizeRecord(WorkItem item) {
			Object record = item.source();
			RecordSchema schema = scanAt(item.path(), () -> scanner.recordSchema(record.getClass()));
			ObjectNode out = nodes.objectNode();
			List<WorkItem> children = new ArrayList<>();
			for (SchemaField field : schema.fields()) {
				Object value = field.read(record);
				if (value == null && field.omitIfEmpty()) {
					continue;
				}
				ValueKind kind = classifyAt(value, item.path().then(field.name()));
				if (kind.isPrimitive()) {
					out.set(field.externalKey(), primitiveNode(kind, value));
				} else {
					// Reserve the key's position until the child is promoted
					out.putNull(field.externalKey());
					children.add(new WorkItem(value, null, kind, item.path().then(field.name())));
				}
			}
			item.normalized(new ObjectAssembly(schema, out), children.iterator());
		}

		private void normalizeSequence(WorkItem item) {
			Iterator<?> elements = ((Collection<?>) item.source()).iterator();
			item.normalized(new ArrayAssembly(nodes.arrayNode()), new Iterator<>() {
				int index = 0;

				@Override
				public boolean hasNext() {
					return elements.hasNext();
				}

				@Override
				public WorkItem next() {
					Object element = elements.next();
					NodePath path = item.path().then(index++);
					return new WorkItem(element, null, classifyAt(element, path), path);
				}
			});
		}

		private JsonNode leafNode(WorkItem item) {
			Object value = item.source();
			try {
				return switch (item.kind()) {
					case MAPPING -> mapper.valueToTree(value);
					case ENUM -> {
						Enum<?> constant = (Enum<?>) value;
						Object external = scanAt(item.path(), () -> scanner.enumSchema(constant.getDeclaringClass())).externalValue(constant);
						yield primitiveNode(TypeClassifier.classifyValue(external), external);
					}
					case IDENTIFIER -> StringNode.valueOf(value.toString());
					case TIMESTAMP -> StringNode.valueOf(temporal.formatTimestamp((TemporalAccessor) value));
					case CALENDAR_DATE -> StringNode.valueOf(temporal.formatDate((LocalDate) value));
					case RECORD, SEQUENCE -> throw new TraversalStateException("Composite is not a leaf: " + item);
					default -> primitiveNode(item.kind(), value);
				};
			} catch (JacksonException | DateTimeException e) {
				throw new MarshalException(String.format("Unable to marshal data '%s' (%s) at %s", value, value.getClass().getName(), item.path()), e);
			}
		}

		private JsonNode primitiveNode(ValueKind kind, Object value) {
			return switch (kind) {
				case NULL -> nodes.nullNode();
				case BOOLEAN -> nodes.booleanNode((Boolean) value);
				case STRING -> StringNode.valueOf(value.toString());
				case INTEGER -> {
					if (value instanceof Long l) {
						yield nodes.numberNode(l);
					} else if (value instanceof BigInteger b) {
						yield nodes.numberNode(b);
					} else {
						yield nodes.numberNode(((Number) value).intValue());
					}
				}
				case FLOAT -> {
					if (value instanceof Float f) {
						yield nodes.numberNode(f);
					} else if (value instanceof BigDecimal b) {
						yield nodes.numberNode(b);
					} else {
						yield nodes.numberNode(((Number) value).doubleValue());
					}
				}
				default -> throw new TraversalStateException("Not a primitive kind: " + kind);
			};
		}

		/**
		 * Schema problems are reported as {@link MarshalException}s,
		 * since the schema here is derived from the value being marshalled.
		 */
		private <S> S scanAt(NodePath path, Supplier<S> scan) {
			try {
				return scan.get();
			} catch (SchemaException e) {
				String message = path.isRoot() ? e.getMessage() : "At " + path + ": " + e.getMessage();
				throw new MarshalException(message, e);
			}
		}

		private ValueKind classifyAt(Object value, NodePath path) {
			try {
				return TypeClassifier.classifyValue(value);
			} catch (MarshalException e) {
				throw MarshalException.wrap(e, "At " + path);
			}
		}
	}

	private static final class ObjectAssembly implements Assembly {
		final RecordSchema schema;
		final ObjectNode out;

		ObjectAssembly(RecordSchema schema, ObjectNode out) {
			this.schema = schema;
			this.out = out;
		}

		@Override
		public void attach(Object segment, Object value) {
			SchemaField field = schema.fields().get(schema.indexOf((String) segment));
			out.set(field.externalKey(), (JsonNode) value);
		}

		@Override
		public Object finish() {
			return out;
		}
	}

	private static final class ArrayAssembly implements Assembly {
		final ArrayNode out;

		ArrayAssembly(ArrayNode out) {
			this.out = out;
		}

		@Override
		public void attach(Object segment, Object value) {
			if ((Integer) segment != out.size()) {
				throw new TraversalStateException("Expected element " + out.size() + " but got " + segment);
			}
			out.add((JsonNode) value);
		}

		@Override
		public Object finish() {
			return out;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Marshaller.class);
}
