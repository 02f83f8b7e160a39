package works.arbor.exceptions;

/**
 * A non-empty link points at a node that is not owned anywhere in the tree being checked.
 */
public final class UnresolvedReferenceException extends NotWellFormedException {
	public UnresolvedReferenceException(String typeName) {
		super(typeName, "Link to node of type " + typeName + " does not resolve to a node in the tree");
	}

	UnresolvedReferenceException(String typeName, String message, Throwable cause) {
		super(typeName, message, cause);
	}

	@Override
	public Kind kind() {
		return Kind.UNRESOLVED_REFERENCE;
	}
}
