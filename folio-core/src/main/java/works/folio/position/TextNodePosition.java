package works.folio.position;

import lombok.With;

import static java.util.Objects.requireNonNull;

/**
 * A character offset within a {@link works.folio.node.TextNode TextNode}.
 */
@With
public record TextNodePosition(int offset, TextAffinity affinity) implements NodePosition {
	public TextNodePosition {
		if (offset < 0) {
			throw new IndexOutOfBoundsException("Text offset can't be negative: " + offset);
		}
		requireNonNull(affinity);
	}

	/**
	 * @return a {@link TextAffinity#DOWNSTREAM downstream} position at {@code offset}
	 */
	public static TextNodePosition at(int offset) {
		return new TextNodePosition(offset, TextAffinity.DOWNSTREAM);
	}
}
