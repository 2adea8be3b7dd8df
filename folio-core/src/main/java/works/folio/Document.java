package works.folio;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.folio.exceptions.DuplicateNodeIdException;
import works.folio.node.DocumentNode;

import static java.util.Arrays.asList;

/**
 * An ordered list of {@link DocumentNode}s, each with an id unique within the document.
 * <p>
 * A plain {@code Document} never changes. Its subclass {@link MutableDocument} adds editing operations;
 * everything here reads that document's current state.
 * <p>
 * Lookups by id are linear scans. That suits the document sizes this model targets;
 * a caller needing faster access can maintain its own id-to-index map,
 * refreshing it from {@link MutableDocument}'s change events.
 */
public class Document {
	/**
	 * Returned by {@link #getNodeIndexById} when there is no such node.
	 */
	public static final int NOT_FOUND = -1;

	private static final Document EMPTY = new Document(List.of());

	private final PVector<DocumentNode> initialNodes;

	/**
	 * @throws DuplicateNodeIdException if two of the {@code nodes} share an id
	 */
	public Document(List<? extends DocumentNode> nodes) {
		this.initialNodes = persistentCopyOf(nodes);
		checkUniqueIds(initialNodes);
	}

	public static Document empty() {
		return EMPTY;
	}

	public static Document of(DocumentNode... nodes) {
		return new Document(asList(nodes));
	}

	/**
	 * The node list as of now. {@link MutableDocument} overrides this to supply its current state;
	 * every other accessor goes through here.
	 */
	PVector<DocumentNode> vector() {
		return initialNodes;
	}

	/**
	 * @return all nodes in order, as an unmodifiable list.
	 * For a {@link MutableDocument}, the list is a snapshot that later edits won't affect.
	 */
	public List<DocumentNode> nodes() {
		return vector();
	}

	public int nodeCount() {
		return vector().size();
	}

	public boolean isEmpty() {
		return vector().isEmpty();
	}

	public boolean containsNode(String nodeId) {
		return getNodeIndexById(nodeId) != NOT_FOUND;
	}

	public @Nullable DocumentNode nodeById(String nodeId) {
		int index = getNodeIndexById(nodeId);
		return (index == NOT_FOUND) ? null : vector().get(index);
	}

	/**
	 * @throws IndexOutOfBoundsException unless {@code 0 <= index < nodeCount()}
	 */
	public DocumentNode nodeAt(int index) {
		return vector().get(index);
	}

	/**
	 * @return the node following {@code nodeId}, or null if that's the last node or there's no such node
	 */
	public @Nullable DocumentNode nodeAfter(String nodeId) {
		PVector<DocumentNode> nodes = vector();
		int index = indexIn(nodes, nodeId);
		if (index == NOT_FOUND || index >= nodes.size() - 1) {
			return null;
		}
		return nodes.get(index + 1);
	}

	/**
	 * @return the node preceding {@code nodeId}, or null if that's the first node or there's no such node
	 */
	public @Nullable DocumentNode nodeBefore(String nodeId) {
		PVector<DocumentNode> nodes = vector();
		int index = indexIn(nodes, nodeId);
		if (index <= 0) {
			return null;
		}
		return nodes.get(index - 1);
	}

	/**
	 * @return the zero-based index of the node with the given id, or {@link #NOT_FOUND}
	 */
	public int getNodeIndexById(String nodeId) {
		return indexIn(vector(), nodeId);
	}

	static int indexIn(List<DocumentNode> nodes, String nodeId) {
		for (int i = 0; i < nodes.size(); i++) {
			if (nodes.get(i).id().equals(nodeId)) {
				return i;
			}
		}
		return NOT_FOUND;
	}

	static PVector<DocumentNode> persistentCopyOf(List<? extends DocumentNode> nodes) {
		if (nodes instanceof PVector<?>) {
			@SuppressWarnings("unchecked")
			PVector<DocumentNode> result = (PVector<DocumentNode>) nodes;
			return result;
		}
		return TreePVector.from(nodes);
	}

	private static void checkUniqueIds(List<DocumentNode> nodes) {
		Set<String> ids = new HashSet<>();
		for (DocumentNode node : nodes) {
			if (!ids.add(node.id())) {
				throw new DuplicateNodeIdException(node.id());
			}
		}
	}

	/**
	 * Documents are equal if they hold equal nodes in the same order,
	 * regardless of whether either is a {@link MutableDocument}.
	 */
	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Document other)) {
			return false;
		}
		return vector().equals(other.vector());
	}

	@Override
	public int hashCode() {
		return vector().hashCode();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(nodeCount: " + nodeCount() + ", nodes: " + vector() + ")";
	}
}
