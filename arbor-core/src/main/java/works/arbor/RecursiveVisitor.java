package works.arbor;

/**
 * A {@link NodeVisitor} that walks the owning edges depth-first, in declaration order.
 * <p>
 * Override {@link #visitNode} to act on each node; call {@code super.visitNode(node)}
 * to continue into the node's children. Weak edges are never followed,
 * so back-references cannot cause an endless walk.
 */
public abstract class RecursiveVisitor implements NodeVisitor {
	@Override
	public void visitNode(TreeNode node) {
		node.visitChildren(this);
	}
}
