package works.arbor;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.arbor.exceptions.EmptyReferenceException;

import static java.util.Objects.requireNonNull;

/**
 * Owning edge to an optional child node.
 * <p>
 * Setting a node here makes this edge one of its owners;
 * replacing or {@link #reset resetting} it lets go.
 * Placing the same node in two owning edges is allowed during construction,
 * but such a tree is not {@link Completable#checkWellFormed well-formed}.
 *
 * @param <T> the declared type of the child; the child may be any subtype
 */
public sealed class Maybe<T extends TreeNode> implements OwningEdge<T> permits One {
	final Class<T> elementType;
	private final boolean detached;
	private boolean suspended = false;
	@Nullable T value = null;

	public Maybe(@NotNull Class<T> elementType) {
		this(elementType, false);
	}

	public Maybe(@NotNull Class<T> elementType, @Nullable T value) {
		this(elementType, false);
		replace(value);
	}

	/**
	 * @param detached if true, this edge holds its node without owning it.
	 *                 Used for the results of {@link #copy} and {@link #deepClone},
	 *                 whose nodes are meant to be handed on to their real owner.
	 */
	Maybe(Class<T> elementType, boolean detached) {
		this.elementType = requireNonNull(elementType);
		this.detached = detached;
	}

	/**
	 * Replaces the contents of this edge with {@code newValue}.
	 */
	public void set(@NotNull T newValue) {
		replace(requireNonNull(newValue));
	}

	/**
	 * Replaces the contents of this edge with those of {@code other},
	 * which then share the same node. Empties this edge if {@code other} is empty.
	 */
	public void set(@NotNull Maybe<? extends T> other) {
		replace(other.value);
	}

	public void reset() {
		replace(null);
	}

	private void replace(@Nullable T newValue) {
		if (newValue != null) {
			elementType.cast(newValue);
			if (isOwner()) {
				newValue.acquire();
			}
		}
		T oldValue = value;
		value = newValue;
		if (oldValue != null && isOwner()) {
			oldValue.release();
		}
	}

	@Override
	public Class<T> elementType() {
		return elementType;
	}

	@Override
	public Kind kind() {
		return Kind.MAYBE;
	}

	@Override
	public boolean empty() {
		return value == null;
	}

	public boolean isPresent() {
		return value != null;
	}

	@Override
	public int size() {
		return (value == null) ? 0 : 1;
	}

	/**
	 * @throws EmptyReferenceException if this edge is empty
	 */
	public T get() {
		if (value == null) {
			throw new EmptyReferenceException("Dereferencing empty " + kind().displayName() + " of type " + elementType.getSimpleName());
		}
		return value;
	}

	public Optional<T> toOptional() {
		return Optional.ofNullable(value);
	}

	@Override
	public List<T> contents() {
		return (value == null) ? List.of() : List.of(value);
	}

	/**
	 * Safe downcast.
	 *
	 * @return the same node if it's an instance of {@code type}; otherwise empty
	 */
	public <S extends TreeNode> Optional<S> as(Class<S> type) {
		if (type.isInstance(value)) {
			return Optional.of(type.cast(value));
		} else {
			return Optional.empty();
		}
	}

	/**
	 * @return a new edge holding the child's {@link TreeNode#copy shallow copy}, or an empty edge if this one is empty
	 */
	public Maybe<T> copy() {
		Maybe<T> result = newDetached();
		if (value != null) {
			result.replace(elementType.cast(value.copy()));
		}
		return result;
	}

	/**
	 * @return a new edge holding the child's {@link TreeNode#deepClone deep copy}, or an empty edge if this one is empty
	 */
	public Maybe<T> deepClone() {
		Maybe<T> result = newDetached();
		if (value != null) {
			result.replace(elementType.cast(value.deepClone()));
		}
		return result;
	}

	Maybe<T> newDetached() {
		return new Maybe<>(elementType, true);
	}

	@Override
	public void visit(NodeVisitor visitor) {
		if (value != null) {
			value.visit(visitor);
		}
	}

	@Override
	public void findReachable(PointerMap map) {
		if (value != null) {
			map.add(value, elementType);
			value.findReachable(map);
		}
	}

	@Override
	public void checkComplete(PointerMap map) {
		if (value != null) {
			value.checkComplete(map);
		}
	}

	private boolean isOwner() {
		return !detached && !suspended;
	}

	/**
	 * Called when the node holding this edge is released.
	 */
	void suspend() {
		if (!suspended) {
			suspended = true;
			if (value != null && !detached) {
				value.release();
			}
		}
	}

	/**
	 * Called when the node holding this edge is attached again after its release.
	 */
	void resume() {
		if (suspended) {
			suspended = false;
			if (value != null && !detached) {
				value.acquire();
			}
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Maybe<?> other)) {
			return false;
		}
		return Objects.equals(value, other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}

	@Override
	public String toString() {
		return kind().displayName() + "(" + value + ")";
	}
}
