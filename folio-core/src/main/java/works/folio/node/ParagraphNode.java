package works.folio.node;

import java.util.Map;
import lombok.With;
import works.folio.text.AttributedText;

/**
 * The most common node: body text, a heading, or a blockquote, according to its {@link #blockType}.
 */
@With
public record ParagraphNode(
	String id,
	AttributedText text,
	ParagraphBlockType blockType,
	Map<String, Object> metadata
) implements TextNode {
	public ParagraphNode {
		id = NodeIds.validated(id);
		text = (text == null) ? AttributedText.empty() : text;
		blockType = (blockType == null) ? ParagraphBlockType.PARAGRAPH : blockType;
		metadata = NodeIds.frozen(metadata);
	}

	public static ParagraphNode of(String id) {
		return of(id, AttributedText.empty());
	}

	public static ParagraphNode of(String id, String text) {
		return of(id, AttributedText.of(text));
	}

	public static ParagraphNode of(String id, AttributedText text) {
		return new ParagraphNode(id, text, ParagraphBlockType.PARAGRAPH, Map.of());
	}
}
