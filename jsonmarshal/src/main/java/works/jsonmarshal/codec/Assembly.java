package works.jsonmarshal.codec;

/**
 * Accumulates the finished children of a composite {@link WorkItem}
 * and builds the composite's own result once they've all arrived.
 */
interface Assembly {
	/**
	 * @param segment the child's {@link NodePath#lastSegment() last path segment}
	 */
	void attach(Object segment, Object value);

	Object finish();
}
