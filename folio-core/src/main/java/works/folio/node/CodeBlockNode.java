package works.folio.node;

import java.util.Map;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import works.folio.text.AttributedText;

/**
 * A fenced block of source code.
 *
 * @param language identifies the syntax for highlighting, or null if undeclared
 */
@With
public record CodeBlockNode(
	String id,
	AttributedText text,
	@Nullable String language,
	Map<String, Object> metadata
) implements TextNode {
	public CodeBlockNode {
		id = NodeIds.validated(id);
		text = (text == null) ? AttributedText.empty() : text;
		metadata = NodeIds.frozen(metadata);
	}

	public static CodeBlockNode of(String id, String code, @Nullable String language) {
		return new CodeBlockNode(id, AttributedText.of(code), language, Map.of());
	}
}
