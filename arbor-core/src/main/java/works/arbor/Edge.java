package works.arbor;

/**
 * One field of a {@link TreeNode} that connects it to other nodes.
 * <p>
 * Generated node classes declare their fields exclusively as edges:
 * {@link OwningEdge owning edges} form the tree itself,
 * and {@link WeakEdge weak edges} cross-reference nodes owned elsewhere in the same tree.
 *
 * @param <T> the declared type of the node(s) at the other end
 */
public sealed interface Edge<T extends TreeNode> extends Completable permits OwningEdge, WeakEdge {
	/**
	 * The declared type of this edge's target.
	 * Also used as the type tag in diagnostics.
	 */
	Class<T> elementType();

	Kind kind();

	boolean empty();

	int size();

	/**
	 * Passes {@code visitor} to each node present at the other end of this edge.
	 * Absent nodes are skipped.
	 */
	void visit(NodeVisitor visitor);

	enum Kind {
		MAYBE("Maybe", true, false),
		ONE("One", true, true),
		ANY("Any", true, false),
		MANY("Many", true, true),
		OPT_LINK("OptLink", false, false),
		LINK("Link", false, true);

		private final String displayName;
		private final boolean owning;
		private final boolean mandatory;

		Kind(String displayName, boolean owning, boolean mandatory) {
			this.displayName = displayName;
			this.owning = owning;
			this.mandatory = mandatory;
		}

		public String displayName() {
			return displayName;
		}

		public boolean isOwning() {
			return owning;
		}

		/**
		 * @return true if the completeness check requires this kind of edge to be non-empty
		 */
		public boolean isMandatory() {
			return mandatory;
		}
	}
}
