package works.folio.text;

/**
 * A named tag, such as bold or a hyperlink, that can be applied to a span of an {@link AttributedText}.
 * <p>
 * {@link #id()} identifies the <em>kind</em> of attribution, not the attribution itself:
 * two {@link LinkAttribution links} to different URLs share the id {@code "link"}
 * but are distinct attributions. Use {@link #equals} for identity.
 * <p>
 * {@link #canMergeWith} decides whether two adjacent or overlapping spans
 * collapse into one. It must define an equivalence relation
 * (reflexive, symmetric and transitive) over the attributions used in one text;
 * {@link AttributedText} groups spans into merge classes assuming so,
 * and a predicate that violates this is a caller error.
 * A typical implementation is {@code this.equals(other)}.
 * <p>
 * Attributions are used as hash keys, so implementations need value-based
 * {@link Object#equals equals} and {@link Object#hashCode hashCode}; records are a natural fit.
 */
public interface Attribution {
	String id();

	boolean canMergeWith(Attribution other);
}
