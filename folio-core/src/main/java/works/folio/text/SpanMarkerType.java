package works.folio.text;

/**
 * Whether a {@link SpanMarker} opens or closes a span.
 * Declaration order is significant: at equal offsets, {@link #START} sorts first.
 */
public enum SpanMarkerType {
	START,
	END
}
