package works.arbor.exceptions;

/**
 * The same node is reachable through two owning edges,
 * so the owning edges form a graph where a tree is required.
 */
public final class DuplicateNodeException extends NotWellFormedException {
	public DuplicateNodeException(String typeName) {
		super(typeName, "Duplicate node of type " + typeName + " found in tree");
	}

	DuplicateNodeException(String typeName, String message, Throwable cause) {
		super(typeName, message, cause);
	}

	@Override
	public Kind kind() {
		return Kind.DUPLICATE_NODE;
	}
}
