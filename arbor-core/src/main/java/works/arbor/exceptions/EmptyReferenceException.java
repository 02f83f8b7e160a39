package works.arbor.exceptions;

import java.util.NoSuchElementException;

/**
 * Attempted to dereference an empty {@code Maybe} or {@code One}.
 * <p>
 * This indicates a programming error rather than a malformed tree:
 * check {@code empty()} first, or use {@code toOptional()}.
 */
public class EmptyReferenceException extends NoSuchElementException {
	public EmptyReferenceException(String message) {
		super(message);
	}
}
