package works.folio.node;

import java.util.Map;
import lombok.With;
import works.folio.position.BinaryNodePosition;

/**
 * A thematic break with no content of its own.
 */
@With
public record HorizontalRuleNode(
	String id,
	Map<String, Object> metadata
) implements DocumentNode {
	public HorizontalRuleNode {
		id = NodeIds.validated(id);
		metadata = NodeIds.frozen(metadata);
	}

	public static HorizontalRuleNode of(String id) {
		return new HorizontalRuleNode(id, Map.of());
	}

	@Override
	public BinaryNodePosition beginningPosition() {
		return BinaryNodePosition.upstream();
	}

	@Override
	public BinaryNodePosition endPosition() {
		return BinaryNodePosition.downstream();
	}
}
