package works.folio;

/**
 * Describes one structural or content change made by a {@link MutableDocument} operation.
 * Indexes are zero-based positions in {@link Document#nodes()}.
 */
public sealed interface DocumentChangeEvent {

	/**
	 * @param index the position of the new node after insertion
	 */
	record NodeInserted(String nodeId, int index) implements DocumentChangeEvent { }

	/**
	 * @param index the position the node occupied before deletion
	 */
	record NodeDeleted(String nodeId, int index) implements DocumentChangeEvent { }

	/**
	 * The node {@code oldNodeId} was replaced, at the same index, by {@code newNodeId}.
	 * The two ids are equal when a node is replaced by a new version of itself.
	 */
	record NodeReplaced(String oldNodeId, String newNodeId) implements DocumentChangeEvent { }

	record NodeMoved(String nodeId, int oldIndex, int newIndex) implements DocumentChangeEvent { }

	/**
	 * The {@link works.folio.text.AttributedText AttributedText} of a text node changed.
	 */
	record TextChanged(String nodeId) implements DocumentChangeEvent { }
}
