package works.arbor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.arbor.exceptions.RequiredEdgeEmptyException;

/**
 * Weak edge to exactly one node owned elsewhere in the same tree.
 * <p>
 * Behaves exactly like {@link OptLink} while the tree is being built;
 * the completeness check fails if it is empty or expired.
 */
public final class Link<T extends TreeNode> extends OptLink<T> {
	public Link(@NotNull Class<T> elementType) {
		super(elementType);
	}

	public Link(@NotNull Class<T> elementType, @Nullable T target) {
		super(elementType, target);
	}

	@Override
	public Kind kind() {
		return Kind.LINK;
	}

	@Override
	public void checkComplete(PointerMap map) {
		T node = current();
		if (node == null) {
			throw new RequiredEdgeEmptyException(kind().displayName(), map.typeName(elementType));
		}
		map.get(node, elementType);
	}
}
