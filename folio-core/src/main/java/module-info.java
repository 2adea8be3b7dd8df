/**
 * Folio's document model: everything needed to build, mutate and address
 * a block-structured rich-text document.
 * <p>
 * Start with {@link works.folio the root package} for {@link works.folio.Document}
 * and {@link works.folio.MutableDocument}.
 * Additional packages provide attributed text ({@link works.folio.text}),
 * document nodes ({@link works.folio.node}),
 * positions and selections ({@link works.folio.position}),
 * and the exceptions callers may need to catch ({@link works.folio.exceptions}).
 */
module works.folio.core {
	requires transitive org.jetbrains.annotations;
	requires org.pcollections;
	requires org.slf4j;

	requires static lombok;

	exports works.folio;
	exports works.folio.exceptions;
	exports works.folio.node;
	exports works.folio.position;
	exports works.folio.text;
}
