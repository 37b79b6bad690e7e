package works.jsonmarshal.codec;

import java.util.ArrayDeque;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonmarshal.exceptions.TraversalStateException;

/**
 * Converts a tree iteratively, without recursion, using a work list and a side buffer.
 * <p>
 * Each {@link WorkItem} is popped from the work list and stepped:
 * a {@link WorkItem.Stage#RAW RAW} item is {@link #normalize normalized}, which either finalizes it
 * directly (leaves) or gives it a cursor over its children (composites).
 * A composite then takes one child at a time from its cursor into the side buffer,
 * and the child is moved onto the work list directly above its parent.
 * <p>
 * After each step, finalized children are {@link #promote promoted}:
 * attached to the parent directly beneath them.
 * When a composite is revisited with nothing outstanding, it takes its next child,
 * or is finalized if there are none left.
 * The walk ends when the only remaining item is finalized.
 * <p>
 * Only one child per composite is ever on the work list,
 * so the list is never deeper than the tree,
 * and each parent receives its children in order.
 * <p>
 * Instances are single-use and not thread-safe.
 */
abstract class TreeWalker {
	private final Deque<WorkItem> workList = new ArrayDeque<>();
	private final Deque<WorkItem> sideBuffer = new ArrayDeque<>();

	/**
	 * Moves {@code item} from {@link WorkItem.Stage#RAW RAW} to a later stage:
	 * {@link WorkItem#finalized finalized} for a leaf, or
	 * {@link WorkItem#normalized normalized} with a cursor over the children of a composite.
	 */
	protected abstract void normalize(WorkItem item);

	/**
	 * @return the result for a composite {@code item} whose children have all been attached
	 */
	protected abstract Object complete(WorkItem item);

	final Object walk(WorkItem root) {
		workList.push(root);
		while (true) {
			WorkItem item = workList.pop();
			if (workList.isEmpty() && item.isFinalized()) {
				return item.result();
			}
			step(item);
			promote();
		}
	}

	private void step(WorkItem item) {
		LOGGER.trace("Step {}", item);
		switch (item.stage()) {
			case RAW -> {
				normalize(item);
				advance(item);
			}
			case NORMALIZED -> {
				if (item.outstanding() != 0 || !sideBuffer.isEmpty()) {
					// A child is always directly above its parent, so the parent can't be revisited before it's attached
					throw new TraversalStateException("Traversal stalled at " + item);
				}
				advance(item);
			}
			case FINALIZED -> {
				// Waiting to be promoted
			}
		}
		workList.push(item);
	}

	/**
	 * Takes the next child of a normalized composite, or finalizes it if there are none left.
	 */
	private void advance(WorkItem item) {
		if (item.stage() != WorkItem.Stage.NORMALIZED) {
			return;
		}
		if (item.hasPendingChildren()) {
			sideBuffer.push(item.nextChild());
		} else {
			item.finalized(complete(item));
		}
	}

	/**
	 * Attaches finalized items to the parents directly beneath them on the work list,
	 * setting aside anything that isn't ready and restoring it afterward.
	 */
	private void promote() {
		if (!sideBuffer.isEmpty()) {
			// Newly spawned children must be processed first
			flushSideBuffer();
			return;
		}
		while (workList.size() >= 2) {
			WorkItem child = workList.pop();
			WorkItem parent = workList.pop();
			if (!child.isFinalized()) {
				sideBuffer.push(child);
				workList.push(parent);
			} else if (!parent.path().equals(child.parentPath())) {
				workList.push(child);
				sideBuffer.push(parent);
			} else {
				LOGGER.trace("Promote {} into {}", child, parent);
				parent.attach(child);
				workList.push(parent);
			}
		}
		flushSideBuffer();
	}

	private void flushSideBuffer() {
		while (!sideBuffer.isEmpty()) {
			workList.push(sideBuffer.pop());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeWalker.class);
}
