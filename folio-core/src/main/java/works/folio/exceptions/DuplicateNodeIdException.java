package works.folio.exceptions;

/**
 * Thrown when an operation would leave two nodes with the same id in one document.
 */
public class DuplicateNodeIdException extends IllegalArgumentException {
	private final String nodeId;

	public DuplicateNodeIdException(String nodeId) {
		super("Document already contains a node with id \"" + nodeId + "\"");
		this.nodeId = nodeId;
	}

	public String nodeId() {
		return nodeId;
	}
}
