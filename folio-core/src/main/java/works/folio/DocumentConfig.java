package works.folio;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.folio.node.NodeIdGenerator;

/**
 * Settings for a {@link MutableDocument}.
 */
@Value
@Builder(toBuilder = true)
public class DocumentConfig {
	/**
	 * Identifies the document in log messages.
	 */
	@Default String name = "document";

	/**
	 * Source of ids for {@link MutableDocument#newNodeId()}.
	 * Each built config gets its own sequential generator unless one is supplied.
	 */
	@Default NodeIdGenerator nodeIdGenerator = NodeIdGenerator.sequential("node-");

	public static DocumentConfig simple() {
		return builder().build();
	}
}
