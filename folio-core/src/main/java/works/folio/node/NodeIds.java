package works.folio.node;

import java.util.Map;

import static java.util.Objects.requireNonNull;

final class NodeIds {
	private NodeIds() { }

	static String validated(String id) {
		requireNonNull(id, "Node id");
		if (id.isEmpty()) {
			throw new IllegalArgumentException("Node id can't be empty");
		}
		return id;
	}

	/**
	 * Null means empty. Null keys and values are rejected.
	 */
	static Map<String, Object> frozen(Map<String, Object> metadata) {
		return (metadata == null) ? Map.of() : Map.copyOf(metadata);
	}
}
