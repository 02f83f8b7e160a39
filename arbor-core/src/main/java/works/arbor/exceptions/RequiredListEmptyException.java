package works.arbor.exceptions;

/**
 * A {@code Many} edge had no elements when completeness was checked.
 */
public final class RequiredListEmptyException extends NotWellFormedException {
	public RequiredListEmptyException(String typeName) {
		super(typeName, "'Many' edge of type " + typeName + " is empty");
	}

	RequiredListEmptyException(String typeName, String message, Throwable cause) {
		super(typeName, message, cause);
	}

	@Override
	public Kind kind() {
		return Kind.REQUIRED_LIST_EMPTY;
	}
}
