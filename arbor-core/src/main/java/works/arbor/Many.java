package works.arbor;

import java.util.function.Supplier;
import org.jetbrains.annotations.NotNull;
import works.arbor.exceptions.RequiredListEmptyException;

/**
 * Owning edge to an ordered sequence of one or more child nodes.
 * <p>
 * Behaves exactly like {@link Any} while the tree is being built;
 * the completeness check fails if it has no elements.
 */
public final class Many<T extends TreeNode> extends Any<T> {
	public Many(@NotNull Class<T> elementType) {
		super(elementType);
	}

	Many(Class<T> elementType, boolean detached) {
		super(elementType, detached);
	}

	@Override
	public Kind kind() {
		return Kind.MANY;
	}

	@Override
	public <S extends T> Many<T> emplace(Supplier<S> constructor) {
		super.emplace(constructor);
		return this;
	}

	@Override
	public Many<T> copy() {
		return (Many<T>) super.copy();
	}

	@Override
	public Many<T> deepClone() {
		return (Many<T>) super.deepClone();
	}

	@Override
	Many<T> newDetached() {
		return new Many<>(elementType, true);
	}

	@Override
	public void checkComplete(PointerMap map) {
		if (elements.isEmpty()) {
			throw new RequiredListEmptyException(map.typeName(elementType));
		}
		super.checkComplete(map);
	}
}
