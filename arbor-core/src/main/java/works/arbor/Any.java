package works.arbor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Owning edge to an ordered sequence of zero or more child nodes.
 * <p>
 * Positions are zero-based. Where a position is optional, omitting it,
 * or passing one that is negative or not less than {@link #size()},
 * means "at the end".
 */
public sealed class Any<T extends TreeNode> implements OwningEdge<T>, Iterable<T> permits Many {
	final Class<T> elementType;
	private final boolean detached;
	private boolean suspended = false;
	final List<T> elements = new ArrayList<>();

	public Any(@NotNull Class<T> elementType) {
		this(elementType, false);
	}

	Any(Class<T> elementType, boolean detached) {
		this.elementType = requireNonNull(elementType);
		this.detached = detached;
	}

	/**
	 * Appends {@code value}. No-op if {@code value} is null.
	 */
	public void add(@Nullable T value) {
		add(value, -1);
	}

	/**
	 * Inserts {@code value} before the element currently at {@code position}.
	 * No-op if {@code value} is null.
	 */
	public void add(@Nullable T value, int position) {
		if (value == null) {
			return;
		}
		elementType.cast(value);
		if (isOwner()) {
			value.acquire();
		}
		if (position < 0 || position >= elements.size()) {
			elements.add(value);
		} else {
			elements.add(position, value);
		}
	}

	/**
	 * Appends the node held by {@code value}, which then shares it with this edge.
	 * No-op if {@code value} is empty.
	 */
	public void add(@NotNull Maybe<? extends T> value) {
		add(value.value, -1);
	}

	public void add(@NotNull Maybe<? extends T> value, int position) {
		add(value.value, position);
	}

	/**
	 * Appends a newly constructed node.
	 *
	 * @return this edge
	 */
	public <S extends T> Any<T> emplace(Supplier<S> constructor) {
		add(requireNonNull(constructor.get(), "constructor returned null"));
		return this;
	}

	/**
	 * Appends all of {@code other}'s elements, in order.
	 * The nodes are not copied: afterward, both edges hold the same nodes.
	 */
	public void extend(@NotNull Any<? extends T> other) {
		for (T element : List.copyOf(other.elements)) {
			add(element);
		}
	}

	/**
	 * Removes the last element. No-op if there are none.
	 */
	public void remove() {
		remove(-1);
	}

	/**
	 * Removes the element at {@code position}. No-op if there are none.
	 */
	public void remove(int position) {
		if (elements.isEmpty()) {
			return;
		}
		if (position < 0 || position >= elements.size()) {
			position = elements.size() - 1;
		}
		T removed = elements.remove(position);
		if (isOwner()) {
			removed.release();
		}
	}

	public void reset() {
		List<T> removed = List.copyOf(elements);
		elements.clear();
		if (isOwner()) {
			removed.forEach(TreeNode::release);
		}
	}

	@Override
	public Class<T> elementType() {
		return elementType;
	}

	@Override
	public Kind kind() {
		return Kind.ANY;
	}

	@Override
	public boolean empty() {
		return elements.isEmpty();
	}

	@Override
	public int size() {
		return elements.size();
	}

	/**
	 * @throws IndexOutOfBoundsException if {@code index} is out of range
	 */
	public T get(int index) {
		return elements.get(index);
	}

	/**
	 * @return the last element, without removing it
	 */
	public Optional<T> back() {
		if (elements.isEmpty()) {
			return Optional.empty();
		} else {
			return Optional.of(elements.get(elements.size() - 1));
		}
	}

	@Override
	public @NotNull Iterator<T> iterator() {
		return Collections.unmodifiableList(elements).iterator();
	}

	public Stream<T> stream() {
		return elements.stream();
	}

	@Override
	public List<T> contents() {
		return List.copyOf(elements);
	}

	/**
	 * @return a new edge holding the {@link TreeNode#copy shallow copy} of each element, in order
	 */
	public Any<T> copy() {
		Any<T> result = newDetached();
		for (T element : elements) {
			result.add(elementType.cast(element.copy()));
		}
		return result;
	}

	/**
	 * @return a new edge holding the {@link TreeNode#deepClone deep copy} of each element, in order
	 */
	public Any<T> deepClone() {
		Any<T> result = newDetached();
		for (T element : elements) {
			result.add(elementType.cast(element.deepClone()));
		}
		return result;
	}

	Any<T> newDetached() {
		return new Any<>(elementType, true);
	}

	@Override
	public void visit(NodeVisitor visitor) {
		for (T element : List.copyOf(elements)) {
			element.visit(visitor);
		}
	}

	@Override
	public void findReachable(PointerMap map) {
		for (T element : elements) {
			map.add(element, elementType);
			element.findReachable(map);
		}
	}

	@Override
	public void checkComplete(PointerMap map) {
		for (T element : elements) {
			element.checkComplete(map);
		}
	}

	private boolean isOwner() {
		return !detached && !suspended;
	}

	/**
	 * @see Maybe#suspend
	 */
	void suspend() {
		if (!suspended) {
			suspended = true;
			if (!detached) {
				List.copyOf(elements).forEach(TreeNode::release);
			}
		}
	}

	/**
	 * @see Maybe#resume
	 */
	void resume() {
		if (suspended) {
			suspended = false;
			if (!detached) {
				List.copyOf(elements).forEach(TreeNode::acquire);
			}
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Any<?> other)) {
			return false;
		}
		return elements.equals(other.elements);
	}

	@Override
	public int hashCode() {
		return elements.hashCode();
	}

	@Override
	public String toString() {
		return kind().displayName() + elements;
	}
}
