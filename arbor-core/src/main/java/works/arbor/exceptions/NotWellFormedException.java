package works.arbor.exceptions;

/**
 * A tree failed its well-formedness check.
 * <p>
 * There is one subclass per kind of violation, so callers can either catch
 * this class to handle all of them alike, or catch a specific subclass.
 * The message always starts with the violation and names the type tag
 * of the offending edge.
 */
public sealed abstract class NotWellFormedException extends RuntimeException permits
	DuplicateNodeException,
	RequiredEdgeEmptyException,
	RequiredListEmptyException,
	UnresolvedReferenceException
{
	private final String typeName;

	protected NotWellFormedException(String typeName, String message) {
		super(message);
		this.typeName = typeName;
	}

	protected NotWellFormedException(String typeName, String message, Throwable cause) {
		super(message, cause);
		this.typeName = typeName;
	}

	/**
	 * @return the type tag of the edge at which the violation was found
	 */
	public String typeName() {
		return typeName;
	}

	public abstract Kind kind();

	public enum Kind {
		DUPLICATE_NODE,
		UNRESOLVED_REFERENCE,
		REQUIRED_EDGE_EMPTY,
		REQUIRED_LIST_EMPTY,
	}

	/**
	 * @return an exception of the same class as {@code exception} whose message
	 * is prefixed by {@code context}, having {@code exception} as its cause.
	 */
	@SuppressWarnings("unchecked")
	public static <T extends NotWellFormedException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		String typeName = exception.typeName();
		if (exception instanceof DuplicateNodeException) {
			return (T) new DuplicateNodeException(typeName, newMessage, exception);
		} else if (exception instanceof UnresolvedReferenceException) {
			return (T) new UnresolvedReferenceException(typeName, newMessage, exception);
		} else if (exception instanceof RequiredEdgeEmptyException e) {
			return (T) new RequiredEdgeEmptyException(e.edgeKind(), typeName, newMessage, exception);
		} else if (exception instanceof RequiredListEmptyException) {
			return (T) new RequiredListEmptyException(typeName, newMessage, exception);
		} else {
			throw new AssertionError("Unexpected exception class: " + exception.getClass());
		}
	}
}
