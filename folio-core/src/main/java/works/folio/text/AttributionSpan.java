package works.folio.text;

import static java.util.Objects.requireNonNull;

/**
 * A resolved span: {@code attribution} covers every offset from {@code start} to {@code end}, both inclusive.
 */
public record AttributionSpan(
	Attribution attribution,
	int start,
	int end
) {
	public AttributionSpan {
		requireNonNull(attribution);
		if (start > end) {
			throw new IllegalArgumentException("Span start " + start + " is after end " + end);
		}
	}

	public boolean contains(int offset) {
		return start <= offset && offset <= end;
	}

	/**
	 * @return true if this span shares at least one offset with {@code [rangeStart, rangeEnd]}
	 */
	public boolean overlaps(int rangeStart, int rangeEnd) {
		return start <= rangeEnd && end >= rangeStart;
	}

	@Override
	public String toString() {
		return "AttributionSpan(" + attribution + ", " + start + ".." + end + ")";
	}
}
