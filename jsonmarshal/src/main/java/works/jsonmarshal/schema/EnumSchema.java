package works.jsonmarshal.schema;

import java.math.BigDecimal;
import java.util.List;
import tools.jackson.databind.JsonNode;

/**
 * An enum whose constants are represented by their {@link #externalValues}.
 * By default, each constant's external value is its {@link Enum#name() name}.
 *
 * @param constants in declaration order
 * @param externalValues parallel to {@code constants}; each a {@link String}, {@link Number} or {@link Boolean}
 */
public record EnumSchema(
	Class<?> javaType,
	List<Enum<?>> constants,
	List<Object> externalValues
) implements Schema {
	public EnumSchema {
		constants = List.copyOf(constants);
		externalValues = List.copyOf(externalValues);
		if (constants.size() != externalValues.size()) {
			throw new IllegalArgumentException("Expected one external value per constant of " + javaType);
		}
	}

	public Object externalValue(Enum<?> constant) {
		return externalValues.get(constant.ordinal());
	}

	/**
	 * @return the constant whose external value equals {@code json}, or {@code null} if there's none
	 */
	public Enum<?> constantFor(JsonNode json) {
		for (int i = 0; i < constants.size(); i++) {
			if (matches(externalValues.get(i), json)) {
				return constants.get(i);
			}
		}
		return null;
	}

	private static boolean matches(Object external, JsonNode json) {
		if (external instanceof String s) {
			return json.isString() && s.equals(json.stringValue());
		} else if (external instanceof Boolean b) {
			return json.isBoolean() && b == json.booleanValue();
		} else if (external instanceof Number n) {
			return json.isNumber() && new BigDecimal(n.toString()).compareTo(json.decimalValue()) == 0;
		} else {
			return false;
		}
	}

	@Override
	public String toString() {
		return "Enum[" + javaType.getSimpleName() + "]";
	}
}
