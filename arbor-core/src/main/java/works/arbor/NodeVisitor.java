package works.arbor;

/**
 * Root of the visitor interfaces of generated trees.
 * <p>
 * A generated visitor interface extends this one with a method per node class,
 * each defaulting to {@link #visitNode}. Each generated node's {@link TreeNode#visit}
 * calls its specific method when the visitor understands it, and {@link #visitNode} otherwise.
 */
public interface NodeVisitor {
	void visitNode(TreeNode node);
}
