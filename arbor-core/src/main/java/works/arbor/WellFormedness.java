package works.arbor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.arbor.exceptions.NotWellFormedException;

/**
 * Runs the reachability pass followed by the completeness pass
 * against a single fresh {@link PointerMap}.
 */
final class WellFormedness {
	private WellFormedness() {}

	static void check(Completable root, CheckConfig config) {
		PointerMap map = new PointerMap(config.typeNaming());
		if (config.registerRoot() && root instanceof TreeNode node) {
			map.add(node, node.typeName());
		}
		try {
			root.findReachable(map);
			LOGGER.trace("Registered {} nodes reachable from {}", map.size(), describe(root));
			root.checkComplete(map);
		} catch (NotWellFormedException e) {
			LOGGER.debug("Tree rooted at {} is not well-formed: {}", describe(root), e.getMessage());
			throw e;
		}
		LOGGER.debug("Tree rooted at {} is well-formed ({} nodes)", describe(root), map.size());
	}

	private static String describe(Completable root) {
		if (root instanceof TreeNode node) {
			return node.typeName();
		} else {
			return root.getClass().getSimpleName();
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(WellFormedness.class);
}
