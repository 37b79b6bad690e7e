package works.jsonmarshal.codec;

import java.util.ArrayList;
import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * Identifies a node by the field names and list indexes leading to it from the root,
 * rendered as {@code items.2.date_key}.
 * Field segments use the record component names, not the external keys.
 *
 * @param segments each a {@link String} field name or an {@link Integer} index
 */
public record NodePath(List<Object> segments) {
	public static final NodePath ROOT = new NodePath(List.of());

	public NodePath {
		segments = List.copyOf(segments);
		for (Object segment : segments) {
			if (!(segment instanceof String || segment instanceof Integer)) {
				throw new IllegalArgumentException("Unexpected path segment: " + segment);
			}
		}
	}

	public NodePath then(String fieldName) {
		return append(fieldName);
	}

	public NodePath then(int index) {
		return append(index);
	}

	private NodePath append(Object segment) {
		List<Object> result = new ArrayList<>(segments.size() + 1);
		result.addAll(segments);
		result.add(segment);
		return new NodePath(result);
	}

	public boolean isRoot() {
		return segments.isEmpty();
	}

	public NodePath parent() {
		if (isRoot()) {
			throw new IllegalStateException("Root has no parent");
		}
		return new NodePath(segments.subList(0, segments.size() - 1));
	}

	public Object lastSegment() {
		if (isRoot()) {
			throw new IllegalStateException("Root has no segments");
		}
		return segments.get(segments.size() - 1);
	}

	@Override
	public String toString() {
		if (isRoot()) {
			return "<root>";
		}
		return segments.stream()
			.map(Object::toString)
			.collect(joining("."));
	}
}
