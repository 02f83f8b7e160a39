package works.arbor;

import java.util.List;

/**
 * An edge holding strong, exclusive ownership of zero or more child nodes.
 * A node stays alive for as long as at least one owning edge holds it.
 */
public sealed interface OwningEdge<T extends TreeNode> extends Edge<T> permits Maybe, Any {
	/**
	 * @return the nodes currently held, in order. The list is a snapshot.
	 */
	List<T> contents();
}
