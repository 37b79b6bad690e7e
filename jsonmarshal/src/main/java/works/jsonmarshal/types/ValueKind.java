package works.jsonmarshal.types;

/**
 * The closed set of shapes a value can take on either side of a conversion.
 */
public enum ValueKind {
	RECORD,
	SEQUENCE,
	MAPPING,
	ENUM,
	IDENTIFIER,
	TIMESTAMP,
	CALENDAR_DATE,
	STRING,
	INTEGER,
	FLOAT,
	BOOLEAN,
	NULL;

	/**
	 * @return true if values of this kind are JSON primitives that need no conversion
	 * beyond unboxing, and can therefore be written directly into their parent
	 */
	public boolean isPrimitive() {
		return switch (this) {
			case STRING, INTEGER, FLOAT, BOOLEAN, NULL -> true;
			default -> false;
		};
	}

	/**
	 * @return true if values of this kind are read by a dedicated parser
	 * rather than by checking the JSON node type
	 */
	public boolean hasLeafParser() {
		return switch (this) {
			case NULL, IDENTIFIER, ENUM, TIMESTAMP, CALENDAR_DATE -> true;
			default -> false;
		};
	}
}
