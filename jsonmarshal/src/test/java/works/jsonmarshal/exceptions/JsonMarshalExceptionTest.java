package works.jsonmarshal.exceptions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class JsonMarshalExceptionTest {
	@Test
	void wrapKeepsType() {
		checkWrap(new MarshalException("bad value"));
		checkWrap(new UnmarshalException("bad data"));
		checkWrap(new SchemaException("bad type"));
		checkWrap(new TraversalStateException("bad state"));
	}

	@Test
	void wrapNests() {
		var inner = new SchemaException("unsupported");
		var outer = JsonMarshalException.wrap(JsonMarshalException.wrap(inner, "At a"), "In b");
		assertEquals("In b: At a: unsupported", outer.getMessage());
		assertSame(inner, outer.getCause().getCause());
	}

	private static void checkWrap(JsonMarshalException original) {
		JsonMarshalException wrapped = JsonMarshalException.wrap(original, "At items.0");
		assertSame(original.getClass(), wrapped.getClass());
		assertEquals("At items.0: " + original.getMessage(), wrapped.getMessage());
		assertSame(original, wrapped.getCause());
	}
}
