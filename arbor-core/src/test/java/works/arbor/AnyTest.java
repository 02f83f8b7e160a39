package works.arbor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.arbor.example.BinaryOp;
import works.arbor.example.Expression;
import works.arbor.example.Literal;
import works.arbor.example.VariableRef;
import works.arbor.exceptions.RequiredEdgeEmptyException;
import works.arbor.exceptions.RequiredListEmptyException;

import static java.util.stream.Collectors.toList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnyTest {
	Literal zero, one, two;
	Any<Expression> any;

	@BeforeEach
	void setup() {
		zero = new Literal(0);
		one = new Literal(1);
		two = new Literal(2);
		any = new Any<>(Expression.class);
		any.add(zero);
		any.add(one);
		any.add(two);
	}

	@Test
	void add_noPosition_appends() {
		assertEquals(List.of(zero, one, two), any.contents());
		assertEquals(3, any.size());
	}

	@Test
	void add_atPosition_insertsBeforeExistingElement() {
		Literal inserted = new Literal(99);
		any.add(inserted, 1);
		assertEquals(List.of(zero, inserted, one, two), any.contents());
	}

	@Test
	void add_atZero_prepends() {
		Literal inserted = new Literal(99);
		any.add(inserted, 0);
		assertSame(inserted, any.get(0));
	}

	@ParameterizedTest
	@ValueSource(ints = {-1, -100, 3, 4, 1000})
	void add_positionOutOfRange_appends(int position) {
		Literal inserted = new Literal(99);
		any.add(inserted, position);
		assertEquals(List.of(zero, one, two, inserted), any.contents());
	}

	@Test
	void add_emptyValue_noOp() {
		any.add((Expression) null);
		any.add(new Maybe<>(Expression.class));
		any.add(new One<>(Expression.class), 0);
		assertEquals(3, any.size());
	}

	@Test
	void add_fromOwningEdge_sharesItsNode() {
		Literal literal = new Literal(5);
		any.add(new One<>(Literal.class, literal), 0);
		assertSame(literal, any.get(0));
	}

	@Test
	void emplace_appendsConstructedNode() {
		Any<Expression> result = any.emplace(VariableRef::new);
		assertSame(any, result);
		assertEquals(4, any.size());
		assertTrue(any.get(3) instanceof VariableRef);
	}

	@Test
	void remove_noPosition_removesLast() {
		any.remove();
		assertEquals(List.of(zero, one), any.contents());
	}

	@Test
	void remove_atPosition_removesThatElement() {
		any.remove(1);
		assertEquals(List.of(zero, two), any.contents());
	}

	@ParameterizedTest
	@ValueSource(ints = {-1, 3, 42})
	void remove_positionOutOfRange_removesLast(int position) {
		any.remove(position);
		assertEquals(List.of(zero, one), any.contents());
	}

	@Test
	void remove_empty_noOp() {
		Any<Expression> empty = new Any<>(Expression.class);
		empty.remove();
		empty.remove(0);
		assertTrue(empty.empty());
	}

	@Test
	void reset_removesAll() {
		any.reset();
		assertTrue(any.empty());
		assertEquals(0, any.size());
	}

	@Test
	void get_outOfRange_throws() {
		assertThrows(IndexOutOfBoundsException.class, () -> any.get(3));
		assertThrows(IndexOutOfBoundsException.class, () -> any.get(-1));
	}

	@Test
	void back_returnsLastWithoutRemoving() {
		assertSame(two, any.back().orElseThrow());
		assertEquals(3, any.size());
		assertEquals(Optional.empty(), new Any<>(Expression.class).back());
	}

	@Test
	void iteration_followsStoredOrder() {
		List<Expression> iterated = new ArrayList<>();
		for (Expression e : any) {
			iterated.add(e);
		}
		assertEquals(List.of(zero, one, two), iterated);
		assertEquals(List.of(zero, one, two), any.stream().collect(toList()));
	}

	@Test
	void iterator_cannotRemove() {
		var iterator = any.iterator();
		iterator.next();
		assertThrows(UnsupportedOperationException.class, iterator::remove);
	}

	@Test
	void extend_appendsOtherElementsInOrder() {
		Literal three = new Literal(3);
		Literal four = new Literal(4);
		Any<Literal> other = new Any<>(Literal.class);
		other.add(three);
		other.add(four);

		any.extend(other);
		assertEquals(List.of(zero, one, two, three, four), any.contents());
		assertEquals(List.of(three, four), other.contents(), "Source should be unchanged");
	}

	@Test
	void extend_sharesNodesBetweenContainers() {
		VariableRef ref = new VariableRef();
		Any<Expression> other = new Any<>(Expression.class);
		other.add(ref);
		any.extend(other);
		assertSame(other.get(0), any.get(3));
	}

	@Test
	void extend_withItself_doublesContents() {
		any.extend(any);
		assertEquals(List.of(zero, one, two, zero, one, two), any.contents());
	}

	static Stream<Arguments> equalityCases() {
		return Stream.of(
			Arguments.of(List.of(), List.of(), true),
			Arguments.of(List.of(1, 2), List.of(1, 2), true),
			Arguments.of(List.of(1, 2), List.of(2, 1), false),
			Arguments.of(List.of(1, 2), List.of(1, 2, 3), false),
			Arguments.of(List.of(1), List.of(), false)
		);
	}

	@ParameterizedTest
	@MethodSource("equalityCases")
	void equals_pairwiseInOrder(List<Integer> left, List<Integer> right, boolean expected) {
		Any<Expression> a = literals(left);
		Any<Expression> b = literals(right);
		assertEquals(expected, a.equals(b));
		assertEquals(expected, b.equals(a));
		if (expected) {
			assertEquals(a.hashCode(), b.hashCode());
		}
	}

	@Test
	void equals_anyAndMany_comparesContents() {
		Many<Expression> many = new Many<>(Expression.class);
		many.add(new Literal(0));
		many.add(new Literal(1));
		many.add(new Literal(2));
		assertEquals(any, many);
		many.remove();
		assertNotEquals(any, many);
	}

	@Test
	void copy_copiesEachElement() {
		BinaryOpFixture fixture = new BinaryOpFixture();
		Any<Expression> copy = fixture.any.copy();
		assertEquals(fixture.any, copy);
		assertNotSame(fixture.op, copy.get(0));
		assertSame(fixture.leaf, ((BinaryOp) copy.get(0)).lhs.get());
	}

	@Test
	void deepClone_clonesEachElement() {
		BinaryOpFixture fixture = new BinaryOpFixture();
		Any<Expression> clone = fixture.any.deepClone();
		assertEquals(fixture.any, clone);
		assertNotSame(fixture.op, clone.get(0));
		assertNotSame(fixture.leaf, ((BinaryOp) clone.get(0)).lhs.get());
	}

	@Test
	void copy_ofMany_isMany() {
		Many<Expression> many = new Many<>(Expression.class);
		many.add(new Literal(1));
		Many<Expression> copy = many.copy();
		Many<Expression> clone = many.deepClone();
		assertEquals(Edge.Kind.MANY, copy.kind());
		assertEquals(Edge.Kind.MANY, clone.kind());
	}

	@Test
	void checkComplete_emptyMany_throws() {
		Many<Expression> many = new Many<>(Expression.class);
		RequiredListEmptyException e = assertThrows(RequiredListEmptyException.class, many::checkWellFormed);
		assertEquals("'Many' edge of type Expression is empty", e.getMessage());
	}

	@Test
	void checkComplete_manyWithOneElement_succeeds() {
		Many<Expression> many = new Many<>(Expression.class);
		many.add(new Literal(1));
		many.checkWellFormed();
	}

	@Test
	void checkComplete_emptyAny_succeeds() {
		assertTrue(new Any<>(Expression.class).isWellFormed());
	}

	@Test
	void checkComplete_incompleteElement_throws() {
		any.add(new VariableRef());
		assertThrows(RequiredEdgeEmptyException.class, any::checkWellFormed);
	}

	@Test
	void checkWellFormed_sameNodeTwice_fails() {
		any.add(zero);
		assertFalse(any.isWellFormed());
	}

	private static Any<Expression> literals(List<Integer> values) {
		Any<Expression> result = new Any<>(Expression.class);
		values.forEach(v -> result.add(new Literal(v)));
		return result;
	}

	private static final class BinaryOpFixture {
		final Literal leaf = new Literal(7);
		final BinaryOp op = new BinaryOp("-", leaf, new Literal(8));
		final Any<Expression> any = new Any<>(Expression.class);

		BinaryOpFixture() {
			any.add(op);
		}
	}
}
