package works.folio.exceptions;

import java.util.NoSuchElementException;

/**
 * Thrown by {@link works.folio.MutableDocument} operations that name a node id
 * the document doesn't contain.
 */
public class NodeNotFoundException extends NoSuchElementException {
	private final String nodeId;

	public NodeNotFoundException(String nodeId) {
		super("No node with id \"" + nodeId + "\" found in document");
		this.nodeId = nodeId;
	}

	public String nodeId() {
		return nodeId;
	}
}
