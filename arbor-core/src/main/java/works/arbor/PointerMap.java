package works.arbor;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import works.arbor.CheckConfig.TypeNaming;
import works.arbor.exceptions.DuplicateNodeException;
import works.arbor.exceptions.UnresolvedReferenceException;

/**
 * Assigns unique, stable sequence numbers to the nodes of a tree,
 * and checks well-formedness in terms of duplicate nodes and dangling links.
 * <p>
 * Nodes are identified by object identity, never by {@link Object#equals equals}:
 * two structurally equal nodes are still two different nodes.
 * Numbers start at zero and are handed out in registration order;
 * the first registration of a node wins.
 */
public final class PointerMap {
	private final TypeNaming typeNaming;
	private final Map<TreeNode, Integer> sequenceNumbers = new IdentityHashMap<>();
	private final List<TreeNode> nodes = new ArrayList<>();

	public PointerMap() {
		this(TypeNaming.SIMPLE);
	}

	public PointerMap(TypeNaming typeNaming) {
		this.typeNaming = typeNaming;
	}

	/**
	 * Registers {@code node} and gives it the next sequence number.
	 *
	 * @param typeName used only for the error message
	 * @return the sequence number assigned to {@code node}
	 * @throws DuplicateNodeException if {@code node} was already registered
	 */
	public int add(TreeNode node, String typeName) {
		int next = nodes.size();
		Integer existing = sequenceNumbers.putIfAbsent(node, next);
		if (existing != null) {
			throw new DuplicateNodeException(typeName);
		}
		nodes.add(node);
		return next;
	}

	public int add(TreeNode node, Class<?> declaredType) {
		return add(node, typeName(declaredType));
	}

	/**
	 * @param typeName used only for the error message
	 * @return the sequence number previously assigned to {@code node}
	 * @throws UnresolvedReferenceException if {@code node} was never registered
	 */
	public int get(TreeNode node, String typeName) {
		Integer result = sequenceNumbers.get(node);
		if (result == null) {
			throw new UnresolvedReferenceException(typeName);
		}
		return result;
	}

	public int get(TreeNode node, Class<?> declaredType) {
		return get(node, typeName(declaredType));
	}

	public boolean contains(TreeNode node) {
		return sequenceNumbers.containsKey(node);
	}

	public int size() {
		return nodes.size();
	}

	/**
	 * @return the registered nodes, ordered by sequence number
	 */
	public List<TreeNode> nodes() {
		return List.copyOf(nodes);
	}

	/**
	 * @return the type tag for {@code type} as it should appear in diagnostics
	 */
	public String typeName(Class<?> type) {
		return typeNaming.nameOf(type);
	}

	@Override
	public String toString() {
		return "PointerMap(size=" + nodes.size() + ", typeNaming=" + typeNaming + ")";
	}
}
