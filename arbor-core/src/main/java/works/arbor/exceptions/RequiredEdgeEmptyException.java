package works.arbor.exceptions;

/**
 * A {@code One} or {@code Link} edge was empty when completeness was checked.
 */
public final class RequiredEdgeEmptyException extends NotWellFormedException {
	private final String edgeKind;

	/**
	 * @param edgeKind "One" or "Link"
	 */
	public RequiredEdgeEmptyException(String edgeKind, String typeName) {
		super(typeName, "'" + edgeKind + "' edge of type " + typeName + " is empty");
		this.edgeKind = edgeKind;
	}

	RequiredEdgeEmptyException(String edgeKind, String typeName, String message, Throwable cause) {
		super(typeName, message, cause);
		this.edgeKind = edgeKind;
	}

	public String edgeKind() {
		return edgeKind;
	}

	@Override
	public Kind kind() {
		return Kind.REQUIRED_EDGE_EMPTY;
	}
}
