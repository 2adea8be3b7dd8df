package works.folio.node;

import works.folio.position.TextNodePosition;
import works.folio.text.AttributedText;

/**
 * A {@link DocumentNode} whose content is an {@link AttributedText}.
 */
public sealed interface TextNode extends DocumentNode permits ParagraphNode, ListItemNode, CodeBlockNode {
	AttributedText text();

	TextNode withText(AttributedText text);

	@Override
	default TextNodePosition beginningPosition() {
		return TextNodePosition.at(0);
	}

	@Override
	default TextNodePosition endPosition() {
		return TextNodePosition.at(text().length());
	}
}
