package works.arbor;

import java.util.Optional;

/**
 * An edge that observes a node owned elsewhere without extending its lifetime.
 * Once the target is released by its last owner, the edge reads as empty.
 */
public sealed interface WeakEdge<T extends TreeNode> extends Edge<T> permits OptLink {
	Optional<T> toOptional();
}
