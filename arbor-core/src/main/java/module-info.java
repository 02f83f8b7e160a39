/**
 * Edge containers and well-formedness checking for generated tree classes.
 * <p>
 * Start with {@link works.arbor the root package}.
 * Exceptions raised by malformed trees and bad dereferences live in {@link works.arbor.exceptions}.
 */
module works.arbor.core {
	requires transitive org.jetbrains.annotations;
	requires org.slf4j;

	exports works.arbor;
	exports works.arbor.exceptions;
}
