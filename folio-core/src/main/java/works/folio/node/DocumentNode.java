package works.folio.node;

import java.util.Map;
import works.folio.position.NodePosition;

/**
 * One block-level unit of a {@link works.folio.Document}: a paragraph, a list item, an image, and so on.
 * <p>
 * Nodes are immutable values with structural equality over all their fields, metadata included.
 * To change a node, derive a copy with one of its {@code withXxx} methods
 * and install it with {@link works.folio.MutableDocument#replaceNode replaceNode}
 * or {@link works.folio.MutableDocument#updateNode updateNode}.
 * <p>
 * The set of node kinds is closed. Nodes that carry rich text implement {@link TextNode}
 * and are addressed with {@link works.folio.position.TextNodePosition TextNodePosition};
 * the others ({@link ImageNode}, {@link HorizontalRuleNode}) are addressed with
 * {@link works.folio.position.BinaryNodePosition BinaryNodePosition}.
 */
public sealed interface DocumentNode permits TextNode, ImageNode, HorizontalRuleNode {
	/**
	 * Unique within any one {@link works.folio.Document}.
	 */
	String id();

	/**
	 * Extensible per-node properties such as renderer hints.
	 * Always unmodifiable; never null.
	 */
	Map<String, Object> metadata();

	DocumentNode withId(String id);

	DocumentNode withMetadata(Map<String, Object> metadata);

	/**
	 * @return the first addressable position in this node
	 */
	NodePosition beginningPosition();

	/**
	 * @return the last addressable position in this node
	 */
	NodePosition endPosition();
}
