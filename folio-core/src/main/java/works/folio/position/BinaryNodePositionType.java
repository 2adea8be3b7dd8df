package works.folio.position;

public enum BinaryNodePositionType {
	/**
	 * Before the node's content.
	 */
	UPSTREAM,

	/**
	 * After the node's content.
	 */
	DOWNSTREAM
}
