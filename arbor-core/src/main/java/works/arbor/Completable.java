package works.arbor;

import works.arbor.exceptions.NotWellFormedException;

/**
 * Common interface of tree nodes and the edge containers that connect them,
 * providing the two passes of the well-formedness check.
 */
public interface Completable {
	/**
	 * Registers every node reachable through owning edges with the given map.
	 * Because a node can only be registered once, this also detects
	 * nodes owned through more than one edge.
	 *
	 * @throws works.arbor.exceptions.DuplicateNodeException if a node is registered twice
	 */
	void findReachable(PointerMap map);

	/**
	 * Checks completeness against a map populated by {@link #findReachable}:
	 * <ul>
	 *     <li>all {@link One}, {@link Link}, and {@link Many} edges have at least one entry; and</li>
	 *     <li>all {@link Link} and non-empty {@link OptLink} edges point at a node registered in the map.</li>
	 * </ul>
	 *
	 * @throws NotWellFormedException if not complete
	 */
	void checkComplete(PointerMap map);

	/**
	 * Checks that the tree starting here is well-formed:
	 * complete in the sense of {@link #checkComplete},
	 * with no node owned through more than one edge.
	 *
	 * @throws NotWellFormedException describing the first violation found
	 */
	default void checkWellFormed() {
		checkWellFormed(CheckConfig.simple());
	}

	default void checkWellFormed(CheckConfig config) {
		WellFormedness.check(this, config);
	}

	/**
	 * @return true if {@link #checkWellFormed()} would succeed
	 */
	default boolean isWellFormed() {
		return isWellFormed(CheckConfig.simple());
	}

	default boolean isWellFormed(CheckConfig config) {
		try {
			checkWellFormed(config);
			return true;
		} catch (NotWellFormedException e) {
			return false;
		}
	}
}
