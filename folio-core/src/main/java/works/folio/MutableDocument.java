package works.folio;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;
import org.pcollections.PVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.folio.DocumentChangeEvent.NodeDeleted;
import works.folio.DocumentChangeEvent.NodeInserted;
import works.folio.DocumentChangeEvent.NodeMoved;
import works.folio.DocumentChangeEvent.NodeReplaced;
import works.folio.DocumentChangeEvent.TextChanged;
import works.folio.exceptions.DuplicateNodeIdException;
import works.folio.exceptions.NodeNotFoundException;
import works.folio.node.DocumentNode;
import works.folio.node.NodeIdGenerator;
import works.folio.node.TextNode;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Document} that can be edited.
 * <p>
 * Each editing operation either completes entirely or throws without changing anything.
 * On success, it records the {@link DocumentChangeEvent events} describing the change as
 * the {@link #latestChanges() latest batch}, notifies every {@link DocumentChangeListener listener}
 * once with that batch, and returns it.
 *
 * <h2>Change notification</h2>
 * Only the most recent batch is retained: {@link #latestChanges()} is overwritten by each mutation,
 * and no log of earlier batches is kept. A listener sees every batch because it is called
 * synchronously during each mutation; code that polls {@link #latestChanges()} instead
 * will miss any batch superseded before it looks.
 *
 * <h2>Threading</h2>
 * Not synchronized. All mutations must come from a single owner, such as one editing session
 * or one event loop. The node list is replaced wholesale on each mutation,
 * so lists returned by {@link #nodes()} and documents returned by {@link #snapshot()}
 * are immutable and safe to hand to other threads.
 */
public class MutableDocument extends Document {
	private final String name;
	private final NodeIdGenerator nodeIdGenerator;
	private final List<DocumentChangeListener> listeners = new CopyOnWriteArrayList<>();
	private PVector<DocumentNode> current;
	private List<DocumentChangeEvent> latestChanges = List.of();

	public MutableDocument() {
		this(List.of());
	}

	public MutableDocument(List<? extends DocumentNode> initialNodes) {
		this(initialNodes, DocumentConfig.simple());
	}

	public MutableDocument(List<? extends DocumentNode> initialNodes, DocumentConfig config) {
		super(initialNodes);
		this.name = requireNonNull(config.getName());
		this.nodeIdGenerator = requireNonNull(config.getNodeIdGenerator());
		this.current = super.vector();
	}

	@Override
	PVector<DocumentNode> vector() {
		return current;
	}

	public String name() {
		return name;
	}

	/**
	 * @return an immutable document holding the current nodes, unaffected by later edits
	 */
	public Document snapshot() {
		return new Document(current);
	}

	/**
	 * @return a fresh id from the configured {@link NodeIdGenerator}, skipping any already used in this document
	 */
	public String newNodeId() {
		String id;
		do {
			id = nodeIdGenerator.nextId();
		} while (containsNode(id));
		return id;
	}

	//
	// Mutations
	//

	/**
	 * Inserts {@code node} at {@code index}, shifting later nodes along.
	 *
	 * @return {@code [NodeInserted(node.id, index)]}
	 * @throws IndexOutOfBoundsException unless {@code 0 <= index <= nodeCount()}
	 * @throws DuplicateNodeIdException if the document already has a node with that id
	 */
	public List<DocumentChangeEvent> insertNode(int index, DocumentNode node) {
		requireNonNull(node);
		Objects.checkIndex(index, current.size() + 1);
		if (containsNode(node.id())) {
			throw new DuplicateNodeIdException(node.id());
		}
		current = current.plus(index, node);
		return commit(List.of(new NodeInserted(node.id(), index)));
	}

	/**
	 * @return {@code [NodeDeleted(nodeId, formerIndex)]}
	 * @throws NodeNotFoundException if there's no such node
	 */
	public List<DocumentChangeEvent> deleteNode(String nodeId) {
		int index = requireIndexOf(nodeId);
		current = current.minus(index);
		return commit(List.of(new NodeDeleted(nodeId, index)));
	}

	/**
	 * Puts {@code newNode} where the node {@code oldNodeId} was.
	 *
	 * @return {@code [NodeReplaced(oldNodeId, newNode.id)]}
	 * @throws NodeNotFoundException if there's no node {@code oldNodeId}
	 * @throws DuplicateNodeIdException if {@code newNode}'s id belongs to some other node
	 */
	public List<DocumentChangeEvent> replaceNode(String oldNodeId, DocumentNode newNode) {
		requireNonNull(newNode);
		int index = requireIndexOf(oldNodeId);
		checkIdAvailable(oldNodeId, newNode.id());
		current = current.with(index, newNode);
		return commit(List.of(new NodeReplaced(oldNodeId, newNode.id())));
	}

	/**
	 * Removes the node and reinserts it at {@code newIndex}, which is interpreted
	 * relative to the list after the removal.
	 *
	 * @return {@code [NodeMoved(nodeId, oldIndex, newIndex)]}, even if the two indexes are equal
	 * @throws NodeNotFoundException if there's no such node
	 * @throws IndexOutOfBoundsException unless {@code 0 <= newIndex < nodeCount()}
	 */
	public List<DocumentChangeEvent> moveNode(String nodeId, int newIndex) {
		int oldIndex = requireIndexOf(nodeId);
		Objects.checkIndex(newIndex, current.size());
		DocumentNode node = current.get(oldIndex);
		current = current.minus(oldIndex).plus(newIndex, node);
		return commit(List.of(new NodeMoved(nodeId, oldIndex, newIndex)));
	}

	/**
	 * Replaces the node with the result of applying {@code updater} to it.
	 * If {@code updater} throws, the document is unchanged.
	 *
	 * @return {@code [NodeReplaced(old.id, new.id)]}, followed by {@code TextChanged(new.id)}
	 * when both old and new nodes are {@link TextNode}s with different text
	 * @throws NodeNotFoundException if there's no such node
	 * @throws DuplicateNodeIdException if the updated node's id belongs to some other node
	 */
	public List<DocumentChangeEvent> updateNode(String nodeId, UnaryOperator<DocumentNode> updater) {
		requireNonNull(updater);
		int index = requireIndexOf(nodeId);
		DocumentNode oldNode = current.get(index);
		DocumentNode newNode = requireNonNull(updater.apply(oldNode), "updater returned null");
		checkIdAvailable(oldNode.id(), newNode.id());
		current = current.with(index, newNode);

		List<DocumentChangeEvent> events = new ArrayList<>(2);
		events.add(new NodeReplaced(oldNode.id(), newNode.id()));
		if (oldNode instanceof TextNode oldText
			&& newNode instanceof TextNode newText
			&& !oldText.text().equals(newText.text())) {
			events.add(new TextChanged(newNode.id()));
		}
		return commit(events);
	}

	//
	// Observation
	//

	/**
	 * @return the events from the most recent successful mutation, or an empty list if there hasn't been one
	 */
	public List<DocumentChangeEvent> latestChanges() {
		return latestChanges;
	}

	/**
	 * Listeners are called in registration order. Registering the same listener twice
	 * causes it to be called twice per mutation.
	 */
	public void addListener(DocumentChangeListener listener) {
		listeners.add(requireNonNull(listener));
		LOGGER.debug("{}: added listener {}", name, listener);
	}

	/**
	 * @return true if the listener was registered
	 */
	public boolean removeListener(DocumentChangeListener listener) {
		boolean removed = listeners.remove(listener);
		if (removed) {
			LOGGER.debug("{}: removed listener {}", name, listener);
		}
		return removed;
	}

	//
	// Helpers
	//

	private int requireIndexOf(String nodeId) {
		int index = getNodeIndexById(requireNonNull(nodeId));
		if (index == NOT_FOUND) {
			throw new NodeNotFoundException(nodeId);
		}
		return index;
	}

	private void checkIdAvailable(String outgoingId, String incomingId) {
		if (!incomingId.equals(outgoingId) && containsNode(incomingId)) {
			throw new DuplicateNodeIdException(incomingId);
		}
	}

	/**
	 * The mutation has already been applied by the time we get here,
	 * so a failing listener is logged rather than thrown to the caller.
	 */
	private List<DocumentChangeEvent> commit(List<DocumentChangeEvent> events) {
		List<DocumentChangeEvent> batch = List.copyOf(events);
		latestChanges = batch;
		LOGGER.debug("{}: {}", name, batch);
		for (DocumentChangeListener listener : listeners) {
			try {
				listener.documentChanged(batch);
			} catch (RuntimeException e) {
				LOGGER.error("{}: listener {} failed on {}", name, listener, batch, e);
			}
		}
		return batch;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MutableDocument.class);
}
