package works.arbor.exceptions;

import java.util.NoSuchElementException;

/**
 * Attempted to dereference an {@code OptLink} or {@code Link} that was never set,
 * was reset, or whose target has since been released by its last owner.
 */
public class ExpiredReferenceException extends NoSuchElementException {
	public ExpiredReferenceException(String message) {
		super(message);
	}
}
