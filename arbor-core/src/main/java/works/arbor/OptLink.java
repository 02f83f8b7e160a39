package works.arbor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.arbor.exceptions.ExpiredReferenceException;

import static java.util.Objects.requireNonNull;

/**
 * Weak edge to an optional node owned elsewhere in the same tree.
 * <p>
 * A link never affects its target's lifetime. It reads as empty if it was
 * never set, if it was {@link #reset}, or if its target has been released
 * by its last owner since the link was set; these cases are indistinguishable.
 * Any number of links may point at the same node, including at an ancestor
 * of the node holding the link.
 */
public sealed class OptLink<T extends TreeNode> implements WeakEdge<T> permits Link {
	final Class<T> elementType;
	@Nullable private T target = null;
	private int targetGeneration = 0;

	public OptLink(@NotNull Class<T> elementType) {
		this.elementType = requireNonNull(elementType);
	}

	public OptLink(@NotNull Class<T> elementType, @Nullable T target) {
		this(elementType);
		point(target, (target == null) ? 0 : target.generation());
	}

	public void set(@NotNull T target) {
		point(requireNonNull(target), target.generation());
	}

	/**
	 * Points this link at the node held by {@code owner}, or empties it if {@code owner} is empty.
	 */
	public void set(@NotNull Maybe<? extends T> owner) {
		T node = owner.value;
		point(node, (node == null) ? 0 : node.generation());
	}

	/**
	 * Points this link at the same node as {@code other}.
	 * If {@code other} has expired, so has this link.
	 */
	public void set(@NotNull OptLink<? extends T> other) {
		point(other.target, other.targetGeneration);
	}

	public void reset() {
		point(null, 0);
	}

	/**
	 * @throws ClassCastException if {@code newTarget} is not a {@code T}
	 */
	void retarget(TreeNode newTarget) {
		T node = elementType.cast(newTarget);
		point(node, node.generation());
	}

	private void point(@Nullable T newTarget, int generation) {
		if (newTarget != null) {
			elementType.cast(newTarget);
		}
		this.target = newTarget;
		this.targetGeneration = generation;
	}

	@Override
	public Class<T> elementType() {
		return elementType;
	}

	@Override
	public Kind kind() {
		return Kind.OPT_LINK;
	}

	/**
	 * @return true if this link was never set, was reset, or its target has been released
	 */
	@Override
	public boolean empty() {
		return current() == null;
	}

	@Override
	public int size() {
		return empty() ? 0 : 1;
	}

	/**
	 * @throws ExpiredReferenceException if this link is empty or expired
	 */
	public T get() {
		T result = current();
		if (result == null) {
			throw new ExpiredReferenceException("Dereferencing empty or expired " + kind().displayName() + " of type " + elementType.getSimpleName());
		}
		return result;
	}

	@Override
	public Optional<T> toOptional() {
		return Optional.ofNullable(current());
	}

	/**
	 * Identity comparison. An empty link links to null.
	 */
	public boolean linksTo(@Nullable TreeNode node) {
		return current() == node;
	}

	/**
	 * @return true if this link points at the node held by {@code owner},
	 * or if both are empty
	 */
	public boolean linksTo(@NotNull Maybe<?> owner) {
		return current() == owner.value;
	}

	/**
	 * Safe downcast.
	 *
	 * @return the target if it's an instance of {@code type}; otherwise empty
	 */
	public <S extends TreeNode> Optional<S> as(Class<S> type) {
		T node = current();
		if (type.isInstance(node)) {
			return Optional.of(type.cast(node));
		} else {
			return Optional.empty();
		}
	}

	@Nullable T current() {
		if (target == null || !target.isAlive() || target.generation() != targetGeneration) {
			return null;
		} else {
			return target;
		}
	}

	@Override
	public void visit(NodeVisitor visitor) {
		T node = current();
		if (node != null) {
			node.visit(visitor);
		}
	}

	/**
	 * Links own nothing, so there's nothing to register.
	 */
	@Override
	public void findReachable(PointerMap map) {
	}

	@Override
	public void checkComplete(PointerMap map) {
		T node = current();
		if (node != null) {
			map.get(node, elementType);
		}
	}

	/**
	 * Structural equality through dereference: two links are equal if both are empty,
	 * or both targets are equal. Expired and never-set links are equivalent.
	 * <p>
	 * Links may point back at an ancestor, so comparing two targets can lead back to
	 * the same pair of links. Such a pair is taken to be equal, since nothing further
	 * along the cycle can tell them apart.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof OptLink<?> other)) {
			return false;
		}
		T mine = current();
		TreeNode theirs = other.current();
		if (mine == theirs) {
			return true;
		} else if (mine == null || theirs == null) {
			return false;
		}
		Deque<Comparison> inProgress = COMPARISONS.get();
		for (Comparison c : inProgress) {
			if (c.left() == this && c.right() == other) {
				return true;
			}
		}
		inProgress.push(new Comparison(this, other));
		try {
			return mine.equals(theirs);
		} finally {
			inProgress.pop();
		}
	}

	/**
	 * Stops at the link rather than hashing the target's structure,
	 * which could lead back here. Equal targets have the same class.
	 */
	@Override
	public int hashCode() {
		T node = current();
		return (node == null) ? 0 : node.getClass().hashCode();
	}

	@Override
	public String toString() {
		T node = current();
		if (node == null) {
			return kind().displayName() + "()";
		} else {
			// Not the target's toString, which could lead back here
			return kind().displayName() + "(" + node.typeName() + "@" + Integer.toHexString(System.identityHashCode(node)) + ")";
		}
	}

	/**
	 * Compared by identity only: the components' own {@code equals} is what's being computed.
	 */
	private record Comparison(OptLink<?> left, OptLink<?> right) {}

	private static final ThreadLocal<Deque<Comparison>> COMPARISONS = ThreadLocal.withInitial(ArrayDeque::new);
}
