package works.jsonmarshal;

import java.util.function.Supplier;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.jsonmarshal.codec.CodecSettings;
import works.jsonmarshal.codec.Marshaller;
import works.jsonmarshal.codec.Unmarshaller;
import works.jsonmarshal.exceptions.MarshalException;
import works.jsonmarshal.exceptions.UnmarshalException;
import works.jsonmarshal.schema.SchemaScanner;

/**
 * Converts between Java records and JSON.
 * <p>
 * The tree-level methods {@link #marshal} and {@link #unmarshal} do the real work;
 * the text-level methods just add a parsing or printing step using the {@link ObjectMapper}.
 * <p>
 * Instances are immutable and thread-safe, provided the {@link SchemaScanner}
 * is fully customized before the first conversion.
 */
public final class JsonMarshal {
	private final SchemaScanner scanner;
	private final CodecSettings settings;
	private final ObjectMapper mapper;
	private final Marshaller marshaller;
	private final Unmarshaller unmarshaller;

	private JsonMarshal(SchemaScanner scanner, CodecSettings settings, ObjectMapper mapper) {
		this.scanner = scanner;
		this.settings = settings;
		this.mapper = mapper;
		this.marshaller = new Marshaller(scanner, settings, mapper);
		this.unmarshaller = new Unmarshaller(scanner, settings, mapper);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return a {@code JsonMarshal} with default settings
	 */
	public static JsonMarshal create() {
		return builder().build();
	}

	/**
	 * @return a {@code JsonMarshal} sharing this one's schemas but using the given {@code settings}
	 */
	public JsonMarshal withSettings(CodecSettings settings) {
		return new JsonMarshal(scanner, settings, mapper);
	}

	public SchemaScanner scanner() {
		return scanner;
	}

	public CodecSettings settings() {
		return settings;
	}

	/**
	 * @throws MarshalException if {@code value} can't be represented as JSON
	 */
	public JsonNode marshal(Object value) {
		return marshaller.marshal(value);
	}

	/**
	 * @throws UnmarshalException if {@code json} can't be read as a {@code type}
	 */
	public <T> T unmarshal(JsonNode json, Class<T> type) {
		return type.cast(unmarshaller.unmarshal(json, type));
	}

	/**
	 * For generic types like {@code List<Item>}.
	 *
	 * @throws UnmarshalException if {@code json} can't be read as a {@code type}
	 */
	@SuppressWarnings("unchecked")
	public <T> T unmarshal(JsonNode json, TypeReference<T> type) {
		return (T) unmarshaller.unmarshal(json, type.getType());
	}

	public String writeValueAsString(Object value) {
		return mapper.writeValueAsString(marshal(value));
	}

	public <T> T readValue(String json, Class<T> type) {
		return unmarshal(parse(json), type);
	}

	public <T> T readValue(String json, TypeReference<T> type) {
		return unmarshal(parse(json), type);
	}

	/**
	 * Adapts a source of raw JSON, such as an HTTP client call,
	 * into a source of typed results.
	 * Each {@link Supplier#get() get} on the returned supplier
	 * calls {@code response} and unmarshals what it returns.
	 */
	public <T> Supplier<T> unmarshalling(Class<T> type, Supplier<? extends JsonNode> response) {
		return () -> unmarshal(response.get(), type);
	}

	public <T> Supplier<T> unmarshalling(TypeReference<T> type, Supplier<? extends JsonNode> response) {
		return () -> unmarshal(response.get(), type);
	}

	private JsonNode parse(String json) {
		try {
			return mapper.readTree(json);
		} catch (JacksonException e) {
			throw new UnmarshalException("Unable to parse JSON text: " + e.getOriginalMessage(), e);
		}
	}

	public static final class Builder {
		private SchemaScanner scanner;
		private CodecSettings settings = CodecSettings.DEFAULT;
		private ObjectMapper mapper;

		private Builder() { }

		public Builder scanner(SchemaScanner scanner) {
			this.scanner = scanner;
			return this;
		}

		public Builder settings(CodecSettings settings) {
			this.settings = settings;
			return this;
		}

		/**
		 * Used to parse and print JSON text, and to convert {@link java.util.Map} values.
		 */
		public Builder mapper(ObjectMapper mapper) {
			this.mapper = mapper;
			return this;
		}

		public JsonMarshal build() {
			return new JsonMarshal(
				(scanner == null) ? new SchemaScanner() : scanner,
				settings,
				(mapper == null) ? JsonMapper.builder().build() : mapper);
		}
	}
}
