package works.folio.text;

import static java.util.Objects.requireNonNull;

/**
 * An attribution identified entirely by its {@link #id}, used for the common inline styles.
 */
public record NamedAttribution(String id) implements Attribution {
	public static final NamedAttribution BOLD = new NamedAttribution("bold");
	public static final NamedAttribution ITALICS = new NamedAttribution("italics");
	public static final NamedAttribution UNDERLINE = new NamedAttribution("underline");
	public static final NamedAttribution STRIKETHROUGH = new NamedAttribution("strikethrough");
	public static final NamedAttribution CODE = new NamedAttribution("code");

	public NamedAttribution {
		requireNonNull(id);
		if (id.isEmpty()) {
			throw new IllegalArgumentException("Attribution id can't be empty");
		}
	}

	@Override
	public boolean canMergeWith(Attribution other) {
		return this.equals(other);
	}

	@Override
	public String toString() {
		return "NamedAttribution(" + id + ")";
	}
}
