package works.folio.position;

import lombok.With;
import works.folio.Document;

import static java.util.Objects.requireNonNull;
import static works.folio.position.TextAffinity.DOWNSTREAM;
import static works.folio.position.TextAffinity.UPSTREAM;

/**
 * A possibly multi-node range of a {@link Document}, from the {@code base}
 * where the selection started to the {@code extent} where it currently ends.
 * When the two are equal, the selection is a caret.
 * <p>
 * No direction is stored: {@link #affinity} computes it on demand against a document,
 * since the same pair of positions may be ordered differently in different documents.
 */
@With
public record DocumentSelection(DocumentPosition base, DocumentPosition extent) {
	public DocumentSelection {
		requireNonNull(base);
		requireNonNull(extent);
	}

	public static DocumentSelection collapsed(DocumentPosition position) {
		return new DocumentSelection(position, position);
	}

	public boolean isCollapsed() {
		return base.equals(extent);
	}

	public boolean isExpanded() {
		return !isCollapsed();
	}

	/**
	 * @return {@link TextAffinity#DOWNSTREAM DOWNSTREAM} if the extent is at or after the base
	 * in {@code document} order, and {@link TextAffinity#UPSTREAM UPSTREAM} if it's before.
	 * Collapsed selections are always downstream.
	 * <p>
	 * Within one node, two {@link TextNodePosition}s are ordered by offset,
	 * and for two {@link BinaryNodePosition}s, upstream comes before downstream.
	 * Any other combination within one node is considered downstream.
	 */
	public TextAffinity affinity(Document document) {
		if (isCollapsed()) {
			return DOWNSTREAM;
		}
		int baseIndex = document.getNodeIndexById(base.nodeId());
		int extentIndex = document.getNodeIndexById(extent.nodeId());
		if (extentIndex > baseIndex) {
			return DOWNSTREAM;
		} else if (extentIndex < baseIndex) {
			return UPSTREAM;
		}

		NodePosition basePosition = base.nodePosition();
		NodePosition extentPosition = extent.nodePosition();
		if (basePosition instanceof TextNodePosition b && extentPosition instanceof TextNodePosition e) {
			return (e.offset() >= b.offset()) ? DOWNSTREAM : UPSTREAM;
		} else if (basePosition instanceof BinaryNodePosition b && extentPosition instanceof BinaryNodePosition e) {
			if (b.equals(e)) {
				return DOWNSTREAM;
			}
			return (e.type() == BinaryNodePositionType.DOWNSTREAM) ? DOWNSTREAM : UPSTREAM;
		} else {
			return DOWNSTREAM;
		}
	}

	/**
	 * @return this selection if it's collapsed or already downstream;
	 * otherwise a copy with base and extent swapped, so that base comes first in {@code document}.
	 */
	public DocumentSelection normalize(Document document) {
		if (isCollapsed() || affinity(document) == DOWNSTREAM) {
			return this;
		}
		return new DocumentSelection(extent, base);
	}
}
