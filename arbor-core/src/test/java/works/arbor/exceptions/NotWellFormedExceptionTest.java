package works.arbor.exceptions;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import works.arbor.exceptions.NotWellFormedException.Kind;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class NotWellFormedExceptionTest {

	@Test
	void messages_nameTheTypeTag() {
		assertEquals("Duplicate node of type Block found in tree", new DuplicateNodeException("Block").getMessage());
		assertEquals("Link to node of type Block does not resolve to a node in the tree", new UnresolvedReferenceException("Block").getMessage());
		assertEquals("'One' edge of type Block is empty", new RequiredEdgeEmptyException("One", "Block").getMessage());
		assertEquals("'Link' edge of type Block is empty", new RequiredEdgeEmptyException("Link", "Block").getMessage());
		assertEquals("'Many' edge of type Block is empty", new RequiredListEmptyException("Block").getMessage());
	}

	@ParameterizedTest
	@MethodSource("exceptions")
	void wrap_preservesClassAndDetails(NotWellFormedException original) {
		NotWellFormedException wrapped = NotWellFormedException.wrap(original, "While checking main");
		assertSame(original.getClass(), wrapped.getClass());
		assertSame(original, wrapped.getCause());
		assertEquals(original.kind(), wrapped.kind());
		assertEquals(original.typeName(), wrapped.typeName());
		assertThat(wrapped.getMessage(), startsWith("While checking main: "));
		assertEquals("While checking main: " + original.getMessage(), wrapped.getMessage());
	}

	@Test
	void wrap_keepsEdgeKind() {
		RequiredEdgeEmptyException wrapped = NotWellFormedException.wrap(new RequiredEdgeEmptyException("Link", "Declaration"), "context");
		assertEquals("Link", wrapped.edgeKind());
		assertEquals(Kind.REQUIRED_EDGE_EMPTY, wrapped.kind());
	}

	static Stream<NotWellFormedException> exceptions() {
		return Stream.of(
			new DuplicateNodeException("Statement"),
			new UnresolvedReferenceException("Declaration"),
			new RequiredEdgeEmptyException("One", "Expression"),
			new RequiredListEmptyException("FunctionDef"));
	}
}
