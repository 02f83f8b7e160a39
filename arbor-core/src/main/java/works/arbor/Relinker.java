package works.arbor;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Points the links of a deep copy at the copy's own nodes.
 * <p>
 * {@link TreeNode#deepClone} leaves links alone, so links within a clone
 * still point into the original tree, and the clone is generally not
 * well-formed on its own. This class offers the alternative explicitly:
 * every link in the clone whose target lies within the original tree
 * is moved to the corresponding node of the clone.
 * Links to nodes outside the original tree are left as they are.
 */
public final class Relinker {
	private Relinker() {}

	/**
	 * @return a {@link TreeNode#deepClone deep clone} of {@code root} whose internal links point within the clone
	 */
	@SuppressWarnings("unchecked")
	public static <N extends TreeNode> N deepCloneRelinked(N root) {
		N clone = (N) root.getClass().cast(root.deepClone());
		relink(root, clone);
		return clone;
	}

	/**
	 * Moves each link in {@code clone} that points at a node of {@code original}
	 * to the node of {@code clone} in the same position.
	 *
	 * @param clone must have the same shape as {@code original}
	 * @throws IllegalArgumentException if the two trees have different shapes
	 */
	public static void relink(TreeNode original, TreeNode clone) {
		List<TreeNode> originalNodes = register(original);
		List<TreeNode> cloneNodes = register(clone);
		if (originalNodes.size() != cloneNodes.size()) {
			throw new IllegalArgumentException("Clone has " + cloneNodes.size() + " nodes; original has " + originalNodes.size());
		}
		Map<TreeNode, TreeNode> counterparts = new IdentityHashMap<>();
		for (int i = 0; i < originalNodes.size(); i++) {
			TreeNode o = originalNodes.get(i);
			TreeNode c = cloneNodes.get(i);
			if (o.getClass() != c.getClass()) {
				throw new IllegalArgumentException("Node " + i + " of clone is " + c.typeName() + "; original is " + o.typeName());
			}
			counterparts.put(o, c);
		}

		int[] moved = {0};
		for (TreeNode node : cloneNodes) {
			node.forEachEdge(edge -> {
				if (edge instanceof OptLink<?> link) {
					TreeNode counterpart = counterparts.get(link.current());
					if (counterpart != null) {
						link.retarget(counterpart);
						moved[0]++;
					}
				}
			});
		}
		LOGGER.debug("Relinked {} links across {} nodes of {}", moved[0], cloneNodes.size(), clone.typeName());
	}

	private static List<TreeNode> register(TreeNode root) {
		PointerMap map = new PointerMap();
		map.add(root, root.typeName());
		root.findReachable(map);
		return map.nodes();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Relinker.class);
}
