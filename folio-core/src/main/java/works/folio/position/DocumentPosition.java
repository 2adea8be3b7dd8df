package works.folio.position;

import lombok.With;

import static java.util.Objects.requireNonNull;

/**
 * A location in a {@link works.folio.Document}: a node id plus a position within that node.
 * <p>
 * Nothing checks that the node exists, or that {@code nodePosition} suits the kind of node it names;
 * the pairing is interpreted lazily by whoever resolves the position against a document.
 */
@With
public record DocumentPosition(String nodeId, NodePosition nodePosition) {
	public DocumentPosition {
		requireNonNull(nodeId);
		requireNonNull(nodePosition);
	}

	public static DocumentPosition text(String nodeId, int offset) {
		return new DocumentPosition(nodeId, TextNodePosition.at(offset));
	}

	public static DocumentPosition upstreamOf(String nodeId) {
		return new DocumentPosition(nodeId, BinaryNodePosition.upstream());
	}

	public static DocumentPosition downstreamOf(String nodeId) {
		return new DocumentPosition(nodeId, BinaryNodePosition.downstream());
	}
}
