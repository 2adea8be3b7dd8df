package works.folio.node;

import java.util.Map;
import lombok.With;
import works.folio.text.AttributedText;

/**
 * One item of a bulleted or numbered list.
 *
 * @param indent nesting depth; zero is the top level
 */
@With
public record ListItemNode(
	String id,
	AttributedText text,
	ListItemType type,
	int indent,
	Map<String, Object> metadata
) implements TextNode {
	public ListItemNode {
		id = NodeIds.validated(id);
		text = (text == null) ? AttributedText.empty() : text;
		type = (type == null) ? ListItemType.UNORDERED : type;
		if (indent < 0) {
			throw new IllegalArgumentException("List item indent can't be negative: " + indent);
		}
		metadata = NodeIds.frozen(metadata);
	}

	public static ListItemNode unordered(String id, String text) {
		return new ListItemNode(id, AttributedText.of(text), ListItemType.UNORDERED, 0, Map.of());
	}

	public static ListItemNode ordered(String id, String text) {
		return new ListItemNode(id, AttributedText.of(text), ListItemType.ORDERED, 0, Map.of());
	}
}
