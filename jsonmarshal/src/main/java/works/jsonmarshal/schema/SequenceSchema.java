package works.jsonmarshal.schema;

import java.lang.reflect.Type;

/**
 * A list represented as a JSON array whose elements are described by {@link #element}.
 */
public record SequenceSchema(Type javaType, Schema element) implements Schema {
	@Override
	public String toString() {
		return "List[" + element + "]";
	}
}
