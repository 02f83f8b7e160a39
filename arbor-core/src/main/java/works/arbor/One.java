package works.arbor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.arbor.exceptions.RequiredEdgeEmptyException;

/**
 * Owning edge to exactly one child node.
 * <p>
 * Behaves exactly like {@link Maybe} while the tree is being built,
 * so it starts out empty; but the completeness check fails if it is still empty.
 */
public final class One<T extends TreeNode> extends Maybe<T> {
	public One(@NotNull Class<T> elementType) {
		super(elementType);
	}

	public One(@NotNull Class<T> elementType, @Nullable T value) {
		super(elementType, value);
	}

	One(Class<T> elementType, boolean detached) {
		super(elementType, detached);
	}

	@Override
	public Kind kind() {
		return Kind.ONE;
	}

	@Override
	public One<T> copy() {
		return (One<T>) super.copy();
	}

	@Override
	public One<T> deepClone() {
		return (One<T>) super.deepClone();
	}

	@Override
	One<T> newDetached() {
		return new One<>(elementType, true);
	}

	@Override
	public void checkComplete(PointerMap map) {
		if (value == null) {
			throw new RequiredEdgeEmptyException(kind().displayName(), map.typeName(elementType));
		}
		value.checkComplete(map);
	}
}
