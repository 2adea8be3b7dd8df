package works.folio.position;

import static java.util.Objects.requireNonNull;

/**
 * A position in a node with no text, which has exactly two:
 * before its content and after it.
 */
public record BinaryNodePosition(BinaryNodePositionType type) implements NodePosition {
	private static final BinaryNodePosition UPSTREAM = new BinaryNodePosition(BinaryNodePositionType.UPSTREAM);
	private static final BinaryNodePosition DOWNSTREAM = new BinaryNodePosition(BinaryNodePositionType.DOWNSTREAM);

	public BinaryNodePosition {
		requireNonNull(type);
	}

	public static BinaryNodePosition upstream() {
		return UPSTREAM;
	}

	public static BinaryNodePosition downstream() {
		return DOWNSTREAM;
	}
}
