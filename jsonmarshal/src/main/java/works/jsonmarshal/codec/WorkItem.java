package works.jsonmarshal.codec;

import java.util.Iterator;
import works.jsonmarshal.schema.Schema;
import works.jsonmarshal.types.ValueKind;

/**
 * One node of the tree being converted, as tracked by a {@link TreeWalker}.
 * <p>
 * An item moves through {@link Stage}s in order, never backward.
 * A composite item gets an {@link Assembly} and a cursor over its children when it's normalized.
 * Children are taken from the cursor one at a time,
 * and the item can be finalized only once the cursor is exhausted
 * and every child taken from it has been attached.
 */
final class WorkItem {
	enum Stage { RAW, NORMALIZED, FINALIZED }

	private final Object source;
	private final Schema schema;
	private final ValueKind kind;
	private final NodePath path;
	private final NodePath parentPath;

	private Stage stage = Stage.RAW;
	private Assembly assembly;
	private Iterator<WorkItem> pendingChildren;
	private Object result;
	private int outstanding;

	/**
	 * @param source the JSON node or Java value to convert
	 * @param schema governs the conversion, or null when it's driven by the runtime type of {@code source}
	 */
	WorkItem(Object source, Schema schema, ValueKind kind, NodePath path) {
		this.source = source;
		this.schema = schema;
		this.kind = kind;
		this.path = path;
		this.parentPath = path.isRoot() ? null : path.parent();
	}

	Object source() { return source; }
	Schema schema() { return schema; }
	ValueKind kind() { return kind; }
	NodePath path() { return path; }
	NodePath parentPath() { return parentPath; }
	Stage stage() { return stage; }
	int outstanding() { return outstanding; }

	boolean isFinalized() {
		return stage == Stage.FINALIZED;
	}

	Object result() {
		assert isFinalized(): "Result of " + this + " is not ready";
		return result;
	}

	Assembly assembly() {
		return assembly;
	}

	/**
	 * @param children produces the child items lazily, in order
	 */
	void normalized(Assembly assembly, Iterator<WorkItem> children) {
		advanceTo(Stage.NORMALIZED);
		this.assembly = assembly;
		this.pendingChildren = children;
	}

	void finalized(Object result) {
		advanceTo(Stage.FINALIZED);
		this.assembly = null;
		this.pendingChildren = null;
		this.result = result;
	}

	boolean hasPendingChildren() {
		return pendingChildren != null && pendingChildren.hasNext();
	}

	WorkItem nextChild() {
		WorkItem child = pendingChildren.next();
		outstanding++;
		return child;
	}

	void attach(WorkItem child) {
		assembly.attach(child.path().lastSegment(), child.result());
		outstanding--;
	}

	private void advanceTo(Stage next) {
		if (next.compareTo(stage) <= 0) {
			throw new IllegalStateException("Can't move " + this + " to " + next);
		}
		stage = next;
	}

	@Override
	public String toString() {
		return kind + "@" + path + "(" + stage + (outstanding == 0 ? "" : ", " + outstanding + " outstanding") + ")";
	}
}
