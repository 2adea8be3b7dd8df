package works.folio.text;

import java.util.Comparator;
import lombok.With;

import static java.util.Objects.requireNonNull;

/**
 * One boundary of an attribution span.
 * <p>
 * Markers sort by offset, then {@link SpanMarkerType#START start} before {@link SpanMarkerType#END end}.
 * Remaining ties are broken by attribution id and then by the attribution's string form,
 * which gives a normalized marker list a single canonical order.
 */
@With
public record SpanMarker(
	Attribution attribution,
	int offset,
	SpanMarkerType markerType
) implements Comparable<SpanMarker> {
	public SpanMarker {
		requireNonNull(attribution);
		requireNonNull(markerType);
	}

	public static SpanMarker start(Attribution attribution, int offset) {
		return new SpanMarker(attribution, offset, SpanMarkerType.START);
	}

	public static SpanMarker end(Attribution attribution, int offset) {
		return new SpanMarker(attribution, offset, SpanMarkerType.END);
	}

	public boolean isStart() {
		return markerType == SpanMarkerType.START;
	}

	/**
	 * A marker at {@link Integer#MAX_VALUE} stays there, so a span ending there keeps running
	 * to the end of the text. Other offsets saturate rather than overflow.
	 */
	public SpanMarker shiftedBy(int delta) {
		return withOffset(shift(offset, delta));
	}

	static int shift(int offset, int delta) {
		if (offset == Integer.MAX_VALUE) {
			return offset;
		}
		return (int) Math.min((long) offset + delta, Integer.MAX_VALUE);
	}

	@Override
	public int compareTo(SpanMarker other) {
		return ORDER.compare(this, other);
	}

	private static final Comparator<SpanMarker> ORDER = Comparator
		.comparingInt(SpanMarker::offset)
		.thenComparing(SpanMarker::markerType)
		.thenComparing(m -> m.attribution().id())
		.thenComparing(m -> m.attribution().toString());
}
