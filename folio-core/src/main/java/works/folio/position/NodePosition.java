package works.folio.position;

/**
 * A location within a single {@link works.folio.node.DocumentNode}.
 * Each kind of node has its own kind of position.
 */
public sealed interface NodePosition permits TextNodePosition, BinaryNodePosition {
}
