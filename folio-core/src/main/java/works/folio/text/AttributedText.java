package works.folio.text;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Immutable rich text: a {@link String} plus a sorted list of {@link SpanMarker}s
 * delimiting the {@link AttributionSpan spans} of each {@link Attribution}.
 * <p>
 * Every "mutation" method returns a new instance; the receiver is never modified.
 * Offsets are {@code char} indexes into {@link #text()}.
 *
 * <h2>Marker invariants</h2>
 * The marker list is always sorted in {@link SpanMarker#compareTo} order, and always normalized:
 * spans whose attributions {@link Attribution#canMergeWith can merge}
 * and that overlap or touch (a gap of at most one offset) are collapsed into a single span.
 * Any markers supplied to the constructor are normalized the same way.
 *
 * <h2>Ranges</h2>
 * Attribution ranges ({@link #applyAttribution}, {@link #removeAttribution},
 * {@link #toggleAttribution}, {@link #replaceSub}) are inclusive on both ends,
 * like {@link AttributionSpan}. Text ranges ({@link #copyText}, {@link #delete})
 * are half-open, like {@link String#substring(int, int)}.
 * Attribution ranges aren't limited to the text length; a span ending at {@link Integer#MAX_VALUE}
 * runs to the end of the text however it is later edited.
 */
public final class AttributedText {
	private static final AttributedText EMPTY = new AttributedText("", List.of());

	private final String text;
	private final List<SpanMarker> markers;
	private final List<AttributionSpan> spans;

	public AttributedText(String text, Collection<SpanMarker> markers) {
		this.text = requireNonNull(text);
		this.markers = normalize(markers);
		this.spans = resolveSpans(this.markers);
	}

	public AttributedText(String text) {
		this(text, List.of());
	}

	public static AttributedText empty() {
		return EMPTY;
	}

	public static AttributedText of(String text) {
		return text.isEmpty() ? EMPTY : new AttributedText(text);
	}

	public String text() {
		return text;
	}

	public int length() {
		return text.length();
	}

	public boolean isEmpty() {
		return text.isEmpty();
	}

	/**
	 * @return the normalized markers, in sorted order. The list is unmodifiable.
	 */
	public List<SpanMarker> markers() {
		return markers;
	}

	/**
	 * @return every resolved span, in the order their end markers appear
	 */
	public List<AttributionSpan> spans() {
		return spans;
	}

	//
	// Queries
	//

	public Set<Attribution> getAttributionsAt(int offset) {
		Set<Attribution> result = new LinkedHashSet<>();
		for (AttributionSpan span : spans) {
			if (span.contains(offset)) {
				result.add(span.attribution());
			}
		}
		return result;
	}

	public boolean hasAttributionAt(int offset, Attribution attribution) {
		return getAttributionSpanAt(offset, attribution) != null;
	}

	public @Nullable AttributionSpan getAttributionSpanAt(int offset, Attribution attribution) {
		for (AttributionSpan span : spans) {
			if (span.attribution().equals(attribution) && span.contains(offset)) {
				return span;
			}
		}
		return null;
	}

	/**
	 * @return every span sharing at least one offset with {@code [start, end]}
	 */
	public List<AttributionSpan> getAttributionSpansInRange(int start, int end) {
		return spans.stream()
			.filter(span -> span.overlaps(start, end))
			.toList();
	}

	//
	// Attribution changes
	//

	/**
	 * @return a copy with {@code attribution} covering {@code [start, end]},
	 * merged with any overlapping or adjacent span it can merge with.
	 */
	public AttributedText applyAttribution(Attribution attribution, int start, int end) {
		requireNonNull(attribution);
		checkAttributionRange(start, end);
		List<SpanMarker> updated = new ArrayList<>(markers.size() + 2);
		updated.addAll(markers);
		updated.add(SpanMarker.start(attribution, start));
		updated.add(SpanMarker.end(attribution, end));
		return new AttributedText(text, updated);
	}

	/**
	 * Removes {@code attribution} from {@code [start, end]}.
	 * The parts of existing spans that lie outside the range survive as separate spans.
	 *
	 * @return {@code this} if {@code attribution} appears nowhere in this text
	 */
	public AttributedText removeAttribution(Attribution attribution, int start, int end) {
		requireNonNull(attribution);
		checkAttributionRange(start, end);
		List<AttributionSpan> existing = spans.stream()
			.filter(s -> s.attribution().equals(attribution))
			.toList();
		if (existing.isEmpty()) {
			return this;
		}

		List<SpanMarker> updated = new ArrayList<>(markers.size() + 2);
		for (SpanMarker marker : markers) {
			if (!marker.attribution().equals(attribution)) {
				updated.add(marker);
			}
		}
		for (AttributionSpan span : existing) {
			if (span.start() < start) {
				addSpanMarkers(updated, attribution, span.start(), Math.min(span.end(), start - 1));
			}
			if (span.end() > end) {
				addSpanMarkers(updated, attribution, Math.max(span.start(), end + 1), span.end());
			}
		}
		return new AttributedText(text, updated);
	}

	/**
	 * If {@code attribution} already covers every offset in {@code [start, end]}, removes it from that range;
	 * otherwise applies it to the whole range, not just the uncovered parts.
	 */
	public AttributedText toggleAttribution(Attribution attribution, int start, int end) {
		requireNonNull(attribution);
		checkAttributionRange(start, end);
		if (isFullyCovered(attribution, start, end)) {
			return removeAttribution(attribution, start, end);
		} else {
			return applyAttribution(attribution, start, end);
		}
	}

	//
	// Text changes
	//

	public AttributedText copyText(int start) {
		return copyText(start, length());
	}

	/**
	 * @return the text in {@code [start, end)}, with spans clipped to that range
	 * and re-indexed so that {@code start} becomes offset zero.
	 */
	public AttributedText copyText(int start, int end) {
		checkTextRange(start, end);
		List<SpanMarker> copied = new ArrayList<>();
		for (AttributionSpan span : spans) {
			int clippedStart = Math.max(span.start(), start);
			int clippedEnd = Math.min(span.end(), end - 1);
			if (clippedStart <= clippedEnd) {
				addSpanMarkers(copied, span.attribution(), clippedStart - start, clippedEnd - start);
			}
		}
		return new AttributedText(text.substring(start, end), copied);
	}

	/**
	 * Splices {@code other} in at {@code offset}.
	 * Markers of this text at or after {@code offset} shift right by {@code other.length()};
	 * markers of {@code other} shift right by {@code offset}.
	 * Spans that meet across the splice merge as usual.
	 */
	public AttributedText insert(int offset, AttributedText other) {
		requireNonNull(other);
		Objects.checkIndex(offset, length() + 1);
		int insertedLength = other.length();
		List<SpanMarker> combined = new ArrayList<>(markers.size() + other.markers.size());
		for (SpanMarker marker : markers) {
			combined.add(marker.offset() >= offset ? marker.shiftedBy(insertedLength) : marker);
		}
		for (SpanMarker marker : other.markers) {
			combined.add(marker.shiftedBy(offset));
		}
		String newText = text.substring(0, offset) + other.text + text.substring(offset);
		return new AttributedText(newText, combined);
	}

	/**
	 * Removes the characters in {@code [start, end)}.
	 * Spans wholly inside the range are dropped, spans after it shift left,
	 * and spans straddling either boundary are clipped.
	 */
	public AttributedText delete(int start, int end) {
		checkTextRange(start, end);
		int deletedLength = end - start;
		List<SpanMarker> remaining = new ArrayList<>(markers.size());
		for (AttributionSpan span : spans) {
			if (span.start() >= start && span.end() < end) {
				continue;
			}
			if (span.start() >= end) {
				addSpanMarkers(remaining, span.attribution(),
					span.start() - deletedLength, SpanMarker.shift(span.end(), -deletedLength));
			} else if (span.end() < start) {
				addSpanMarkers(remaining, span.attribution(), span.start(), span.end());
			} else {
				int newStart = Math.min(span.start(), start);
				int newEnd = (span.end() >= end) ? SpanMarker.shift(span.end(), -deletedLength) : start - 1;
				if (newStart <= newEnd) {
					addSpanMarkers(remaining, span.attribution(), newStart, newEnd);
				}
			}
		}
		return new AttributedText(text.substring(0, start) + text.substring(end), remaining);
	}

	/**
	 * Replaces {@code [start, end]}, both inclusive, with {@code replacement}.
	 * Equivalent to {@code delete(start, end + 1).insert(start, replacement)}.
	 */
	public AttributedText replaceSub(int start, int end, AttributedText replacement) {
		requireNonNull(replacement);
		if (start > end) {
			throw new IllegalArgumentException("Range start " + start + " is after end " + end);
		}
		return delete(start, end + 1).insert(start, replacement);
	}

	//
	// Object methods
	//

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof AttributedText other)) {
			return false;
		}
		return text.equals(other.text) && markers.equals(other.markers);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text, markers);
	}

	@Override
	public String toString() {
		return "AttributedText(\"" + text + "\", markers: " + markers + ")";
	}

	//
	// Span algebra
	//

	private boolean isFullyCovered(Attribution attribution, int start, int end) {
		List<AttributionSpan> candidates = spans.stream()
			.filter(s -> s.attribution().equals(attribution))
			.sorted(Comparator.comparingInt(AttributionSpan::start))
			.toList();
		int firstUncovered = start;
		for (AttributionSpan span : candidates) {
			if (span.start() > firstUncovered) {
				return false;
			}
			if (span.end() >= end) {
				return true;
			}
			firstUncovered = Math.max(firstUncovered, span.end() + 1);
		}
		return false;
	}

	private static void checkAttributionRange(int start, int end) {
		if (start > end) {
			throw new IllegalArgumentException("Range start " + start + " is after end " + end);
		}
		if (start < 0) {
			throw new IndexOutOfBoundsException("Range start " + start + " is negative");
		}
	}

	private void checkTextRange(int start, int end) {
		if (start > end) {
			throw new IllegalArgumentException("Range start " + start + " is after end " + end);
		}
		Objects.checkFromToIndex(start, end, length());
	}

	private static void addSpanMarkers(List<SpanMarker> markers, Attribution attribution, int start, int end) {
		markers.add(SpanMarker.start(attribution, start));
		markers.add(SpanMarker.end(attribution, end));
	}

	/**
	 * Sorts the markers, resolves them into spans, merges each merge class,
	 * and converts the result back into sorted markers.
	 */
	static List<SpanMarker> normalize(Collection<SpanMarker> markers) {
		if (markers.isEmpty()) {
			return List.of();
		}
		List<SpanMarker> sorted = new ArrayList<>(markers);
		sorted.sort(null);
		List<AttributionSpan> merged = mergeSpans(resolveSpans(sorted));
		List<SpanMarker> result = new ArrayList<>(merged.size() * 2);
		merged.forEach(span -> addSpanMarkers(result, span.attribution(), span.start(), span.end()));
		result.sort(null);
		return List.copyOf(result);
	}

	/**
	 * Pairs up sorted markers using one stack of open start offsets per attribution.
	 * An end marker closes the most recently opened span of an equal attribution;
	 * unmatched markers are ignored.
	 */
	static List<AttributionSpan> resolveSpans(List<SpanMarker> sortedMarkers) {
		List<AttributionSpan> result = new ArrayList<>(sortedMarkers.size() / 2);
		Map<Attribution, Deque<Integer>> openStarts = new HashMap<>();
		for (SpanMarker marker : sortedMarkers) {
			if (marker.isStart()) {
				openStarts.computeIfAbsent(marker.attribution(), a -> new ArrayDeque<>()).push(marker.offset());
			} else {
				Deque<Integer> starts = openStarts.get(marker.attribution());
				if (starts != null && !starts.isEmpty()) {
					result.add(new AttributionSpan(marker.attribution(), starts.pop(), marker.offset()));
				}
			}
		}
		return List.copyOf(result);
	}

	/**
	 * Partitions spans into merge classes with a union-find over their distinct attributions,
	 * joining two attributions when each accepts merging with the other,
	 * then folds each class's overlapping or adjacent spans together.
	 * A folded span keeps the attribution of its earliest member.
	 */
	static List<AttributionSpan> mergeSpans(List<AttributionSpan> spans) {
		if (spans.isEmpty()) {
			return List.of();
		}

		List<Attribution> distinct = new ArrayList<>();
		Map<Attribution, Integer> indexByAttribution = new HashMap<>();
		for (AttributionSpan span : spans) {
			indexByAttribution.computeIfAbsent(span.attribution(), a -> {
				distinct.add(a);
				return distinct.size() - 1;
			});
		}

		int[] parent = new int[distinct.size()];
		for (int i = 0; i < parent.length; i++) {
			parent[i] = i;
		}
		for (int i = 0; i < distinct.size(); i++) {
			for (int j = i + 1; j < distinct.size(); j++) {
				Attribution a = distinct.get(i);
				Attribution b = distinct.get(j);
				if (a.canMergeWith(b) && b.canMergeWith(a)) {
					union(parent, i, j);
				}
			}
		}

		Map<Integer, List<AttributionSpan>> classes = new LinkedHashMap<>();
		for (AttributionSpan span : spans) {
			int root = find(parent, indexByAttribution.get(span.attribution()));
			classes.computeIfAbsent(root, r -> new ArrayList<>()).add(span);
		}

		List<AttributionSpan> result = new ArrayList<>(spans.size());
		for (List<AttributionSpan> members : classes.values()) {
			members.sort(Comparator.comparingInt(AttributionSpan::start).thenComparingInt(AttributionSpan::end));
			AttributionSpan current = members.get(0);
			for (AttributionSpan next : members.subList(1, members.size())) {
				if (next.start() - 1 <= current.end()) {
					if (next.end() > current.end()) {
						current = new AttributionSpan(current.attribution(), current.start(), next.end());
					}
				} else {
					result.add(current);
					current = next;
				}
			}
			result.add(current);
		}
		return result;
	}

	private static int find(int[] parent, int i) {
		while (parent[i] != i) {
			parent[i] = parent[parent[i]];
			i = parent[i];
		}
		return i;
	}

	private static void union(int[] parent, int i, int j) {
		int rootI = find(parent, i);
		int rootJ = find(parent, j);
		// Lower index wins, so the representative is the first attribution encountered
		if (rootI < rootJ) {
			parent[rootJ] = rootI;
		} else if (rootJ < rootI) {
			parent[rootI] = rootJ;
		}
	}
}
