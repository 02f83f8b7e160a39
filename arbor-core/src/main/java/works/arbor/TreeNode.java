package works.arbor;

import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of every generated tree node.
 * <p>
 * A node's fields that refer to other nodes are all {@link Edge edges}:
 * {@link Maybe}, {@link One}, {@link Any} and {@link Many} own their children,
 * while {@link OptLink} and {@link Link} merely observe nodes owned elsewhere.
 * Subclasses list those edges, in declaration order, in {@link #forEachEdge};
 * traversal, well-formedness checking and lifetime tracking are all built on that.
 *
 * <h2>Lifetime</h2>
 * Each owning edge holding a node counts as one owner of it.
 * When the last owner lets go, the node is <em>released</em>:
 * links observing it become empty, and the node lets go of its own children in turn.
 * A node that has never been owned, such as a root held in a local variable, is alive.
 * A released node may be attached again, but links captured before its release stay expired.
 */
public abstract class TreeNode implements Completable {
	private int owners = 0;
	private int generation = 0;
	private boolean released = false;

	/**
	 * Stable tag identifying this node's type in diagnostics.
	 */
	public String typeName() {
		return getClass().getSimpleName();
	}

	/**
	 * Passes each of this node's edges to {@code action}, in declaration order.
	 */
	public abstract void forEachEdge(Consumer<? super Edge<?>> action);

	/**
	 * Shallow copy: a new node with equal scalar fields, whose owning edges
	 * hold the <em>same</em> child nodes as this one.
	 * The result must have the same class as this node.
	 * <p>
	 * Note that the result is not well-formed together with this node,
	 * since the children are then owned twice.
	 */
	public abstract TreeNode copy();

	/**
	 * Deep copy: a new node with equal scalar fields, whose owning edges
	 * hold deep copies of this node's children.
	 * The result must have the same class as this node.
	 * <p>
	 * Links are copied as-is, so links within the result still point
	 * into the original tree unless the subclass re-resolves them.
	 */
	public abstract TreeNode deepClone();

	/**
	 * Double-dispatch entry point. Generated subclasses call the visitor method
	 * specific to their own class when {@code visitor} has one.
	 */
	public void visit(NodeVisitor visitor) {
		visitor.visitNode(this);
	}

	/**
	 * Visits the children held by this node's owning edges, in order.
	 */
	public void visitChildren(NodeVisitor visitor) {
		forEachEdge(edge -> {
			if (edge.kind().isOwning()) {
				edge.visit(visitor);
			}
		});
	}

	@Override
	public void findReachable(PointerMap map) {
		forEachEdge(edge -> edge.findReachable(map));
	}

	@Override
	public void checkComplete(PointerMap map) {
		forEachEdge(edge -> edge.checkComplete(map));
	}

	/**
	 * Structural equality: scalar fields compare by value, and edges compare
	 * the nodes at their other ends structurally.
	 */
	@Override
	public abstract boolean equals(Object obj);

	@Override
	public abstract int hashCode();

	/**
	 * @return false once this node has been released by its last owner
	 */
	public final boolean isAlive() {
		return !released;
	}

	final int generation() {
		return generation;
	}

	final void acquire() {
		if (owners++ == 0 && released) {
			released = false;
			LOGGER.trace("Reattaching released {}", typeName());
			forEachEdge(edge -> {
				if (edge instanceof Maybe<?> m) {
					m.resume();
				} else if (edge instanceof Any<?> a) {
					a.resume();
				}
			});
		}
	}

	final void release() {
		if (owners <= 0) {
			throw new IllegalStateException("Node of type " + typeName() + " released more times than acquired");
		}
		if (--owners == 0) {
			released = true;
			++generation;
			LOGGER.trace("Released {}", typeName());
			forEachEdge(edge -> {
				if (edge instanceof Maybe<?> m) {
					m.suspend();
				} else if (edge instanceof Any<?> a) {
					a.suspend();
				}
			});
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeNode.class);
}
