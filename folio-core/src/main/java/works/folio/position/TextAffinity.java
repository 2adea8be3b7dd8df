package works.folio.position;

/**
 * Which way something leans in document order.
 * <p>
 * For a {@link TextNodePosition}, whether the offset associates with the character before it
 * ({@link #UPSTREAM}) or after it ({@link #DOWNSTREAM}), which matters at line breaks.
 * For a {@link DocumentSelection}, whether the extent precedes or follows the base.
 */
public enum TextAffinity {
	UPSTREAM,
	DOWNSTREAM
}
