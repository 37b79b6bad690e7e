package works.jsonmarshal.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import java.lang.invoke.MethodHandles;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.node.BooleanNode;
import tools.jackson.databind.node.IntNode;
import tools.jackson.databind.node.StringNode;
import works.jsonmarshal.TestRecords.Color;
import works.jsonmarshal.TestRecords.Item;
import works.jsonmarshal.TestRecords.Option;
import works.jsonmarshal.TestRecords.Priority;
import works.jsonmarshal.TestRecords.Tree;
import works.jsonmarshal.exceptions.SchemaException;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_DEFAULT;
import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_EMPTY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaScannerTest {
	SchemaScanner scanner;

	@BeforeEach
	void setupScanner() {
		scanner = new SchemaScanner();
	}

	@Test
	void fieldsFollowComponentOrder() {
		RecordSchema schema = scanner.recordSchema(Item.class);
		assertEquals(
			List.of("intKey", "floatKey", "strKey", "datetimeKey", "dateKey", "enumKey", "uuidKey"),
			schema.fields().stream().map(SchemaField::name).toList());
		assertEquals("int_key", schema.fields().get(0).externalKey());
		assertEquals(3, schema.indexOf("dateKey"));
		assertEquals(-1, schema.indexOf("date_key"));
	}

	@Test
	void annotations() {
		RecordSchema schema = scanner.recordSchema(Annotated.class);
		SchemaField plain = schema.fields().get(0);
		assertEquals("plain", plain.externalKey());
		assertFalse(plain.optional());
		assertFalse(plain.omitIfEmpty());

		SchemaField nullable = schema.fields().get(1);
		assertTrue(nullable.optional());
		assertFalse(nullable.omitIfEmpty());

		SchemaField omitted = schema.fields().get(2);
		assertEquals("gone-if-null", omitted.externalKey());
		assertTrue(omitted.optional());
		assertTrue(omitted.omitIfEmpty());

		SchemaField nonDefault = schema.fields().get(3);
		assertFalse(nonDefault.optional(), "Only null-based inclusion rules make a field optional");
	}

	@Test
	void optionalFieldSchema() {
		RecordSchema record = scanner.recordSchema(Annotated.class);
		Schema nullable = scanner.schemaFor(record.fields().get(1));
		assertInstanceOf(OptionalSchema.class, nullable);
		assertEquals(new ScalarSchema(Integer.class), nullable.required());
		assertEquals(new ScalarSchema(String.class), scanner.schemaFor(record.fields().get(0)));
	}

	@Test
	void primitiveOptional_throws() {
		assertThrows(SchemaException.class, () -> scanner.recordSchema(NullablePrimitive.class));
	}

	@Test
	void accessorAndConstructor() throws Throwable {
		RecordSchema schema = scanner.recordSchema(Annotated.class);
		Annotated value = (Annotated) schema.instantiate(new Object[] { "p", 1, "g", 2 });
		assertEquals(new Annotated("p", 1, "g", 2), value);
		assertEquals("g", schema.fields().get(2).read(value));
	}

	@Test
	void sequencesAndMappings() {
		var listType = new TypeReference<List<List<Item>>>() { }.getType();
		SequenceSchema outer = (SequenceSchema) scanner.schemaFor(listType);
		SequenceSchema inner = (SequenceSchema) outer.element();
		assertSame(scanner.recordSchema(Item.class), inner.element());

		var mapType = new TypeReference<Map<String, List<Integer>>>() { }.getType();
		assertInstanceOf(MappingSchema.class, scanner.schemaFor(mapType));
	}

	@Test
	void unsupportedCollections_throw() {
		assertThrows(SchemaException.class, () -> scanner.schemaFor(List.class));
		assertThrows(SchemaException.class, () -> scanner.schemaFor(new TypeReference<Map<Integer, String>>() { }.getType()));
		assertThrows(SchemaException.class, () -> scanner.schemaFor(new TypeReference<java.util.Optional<String>>() { }.getType()));
	}

	@Test
	void genericRecord_fieldTypeUnresolvable() {
		RecordSchema box = scanner.recordSchema(Box.class);
		assertEquals(List.of("value", "label"), box.fields().stream().map(SchemaField::name).toList());
		assertEquals(new ScalarSchema(String.class), scanner.schemaFor(box.fields().get(1)));
		var e = assertThrows(SchemaException.class, () -> scanner.schemaFor(box.fields().get(0)));
		assertTrue(e.getMessage().startsWith("Type variable T"), e.getMessage());
	}

	@Test
	void notARecord_throws() {
		assertThrows(SchemaException.class, () -> scanner.recordSchema(String.class));
		assertThrows(SchemaException.class, () -> scanner.enumSchema(Item.class));
	}

	@Test
	void schemasAreRemembered() {
		assertSame(scanner.schemaFor(Item.class), scanner.schemaFor(Item.class));
		assertSame(scanner.recordSchema(Tree.class), scanner.recordSchema(Tree.class));
	}

	@Test
	void selfReference() {
		RecordSchema tree = scanner.recordSchema(Tree.class);
		SequenceSchema children = (SequenceSchema) scanner.schemaFor(tree.fields().get(1));
		assertSame(tree, children.element());
	}

	@Test
	void enumByName() {
		EnumSchema schema = scanner.enumSchema(Option.class);
		assertEquals(List.of("ONE", "TWO"), schema.externalValues());
		assertEquals(Option.TWO, schema.constantFor(StringNode.valueOf("TWO")));
		assertNull(schema.constantFor(StringNode.valueOf("two")));
	}

	@Test
	void enumByJsonValue() {
		EnumSchema colors = scanner.enumSchema(Color.class);
		assertEquals("green", colors.externalValue(Color.GREEN));
		assertEquals(Color.RED, colors.constantFor(StringNode.valueOf("red")));

		EnumSchema priorities = scanner.enumSchema(Priority.class);
		assertEquals(2, priorities.externalValue(Priority.HIGH));
		assertEquals(Priority.HIGH, priorities.constantFor(IntNode.valueOf(2)));
		assertNull(priorities.constantFor(StringNode.valueOf("2")), "Types must match");

		EnumSchema switches = scanner.enumSchema(Switch.class);
		assertEquals(Switch.ON, switches.constantFor(BooleanNode.TRUE));
	}

	@Test
	void enumWithUnsupportedExternalValue_throws() {
		assertThrows(SchemaException.class, () -> scanner.enumSchema(Weird.class));
	}

	@Test
	void customizeField() {
		scanner.customizeField(Annotated.class, "plain", f -> f.withExternalKey("PLAIN").withOmitIfEmpty(true));
		SchemaField field = scanner.recordSchema(Annotated.class).fields().get(0);
		assertEquals("PLAIN", field.externalKey());
		assertTrue(field.optional());
		assertTrue(field.omitIfEmpty());
	}

	@Test
	void customizeField_rejectsMistakes() {
		assertThrows(IllegalArgumentException.class, () -> scanner.customizeField(Annotated.class, "nope", f -> f));
		scanner.customizeField(Annotated.class, "plain", f -> f);
		assertThrows(IllegalStateException.class, () -> scanner.customizeField(Annotated.class, "plain", f -> f));
		scanner.recordSchema(Annotated.class);
		assertThrows(IllegalStateException.class, () -> scanner.customizeField(Annotated.class, "nullable", f -> f));
	}

	@Test
	void customizeField_primitiveOptional_throws() {
		scanner.customizeField(Annotated.class, "primitive", f -> f.withOptional(true));
		assertThrows(SchemaException.class, () -> scanner.recordSchema(Annotated.class));
	}

	@Test
	void useLookup() {
		var lookup = MethodHandles.lookup();
		assertSame(lookup, scanner.useLookup(lookup).lookupFor(Annotated.class));
	}

	@Test
	void schemaFieldValidation() {
		SchemaField field = scanner.recordSchema(Annotated.class).fields().get(0);
		assertThrows(IllegalArgumentException.class, () -> field.withExternalKey(""));
		assertFalse(field.withOmitIfEmpty(true).withOptional(false).omitIfEmpty());
	}

	record Annotated(
		String plain,
		@Nullable Integer nullable,
		@JsonProperty("gone-if-null") @JsonInclude(NON_EMPTY) String omitted,
		@JsonInclude(NON_DEFAULT) int primitive
	) { }

	record NullablePrimitive(@Nullable int value) { }

	record Box<T>(T value, String label) { }

	enum Switch {
		ON(true), OFF(false);

		final boolean on;

		Switch(boolean on) {
			this.on = on;
		}

		@JsonValue
		boolean on() {
			return on;
		}
	}

	enum Weird {
		ONLY;

		@JsonValue
		Object value() {
			return List.of();
		}
	}
}
