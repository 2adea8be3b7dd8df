package works.folio.text;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.folio.text.NamedAttribution.BOLD;
import static works.folio.text.NamedAttribution.ITALICS;
import static works.folio.text.NamedAttribution.UNDERLINE;

class AttributedTextTest {
	static final AttributedText HELLO = new AttributedText("hello world");

	@ParameterizedTest
	@CsvSource({"0,0", "2,5", "0,10", "4,4"})
	void applyAttribution_coversExactlyTheRange(int start, int end) {
		AttributedText text = HELLO.applyAttribution(BOLD, start, end);
		for (int offset = start; offset <= end; offset++) {
			assertTrue(text.hasAttributionAt(offset, BOLD), "offset " + offset);
		}
		assertFalse(text.hasAttributionAt(start - 1, BOLD));
		assertFalse(text.hasAttributionAt(end + 1, BOLD));
	}

	@Test
	void overlappingApplications_merge() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 0, 4)
			.applyAttribution(BOLD, 3, 8);
		assertEquals(List.of(new AttributionSpan(BOLD, 0, 8)), text.spans());
		assertEquals(new AttributionSpan(BOLD, 0, 8), text.getAttributionSpanAt(5, BOLD));
		assertFalse(text.hasAttributionAt(9, BOLD));
	}

	@Test
	void adjacentApplications_merge() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 0, 3)
			.applyAttribution(BOLD, 4, 7);
		assertEquals(List.of(new AttributionSpan(BOLD, 0, 7)), text.spans());
		assertEquals(2, text.markers().size());
	}

	@Test
	void separatedApplications_remainSeparate() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 0, 3)
			.applyAttribution(BOLD, 5, 7);
		assertEquals(List.of(
			new AttributionSpan(BOLD, 0, 3),
			new AttributionSpan(BOLD, 5, 7)
		), text.spans());
		assertFalse(text.hasAttributionAt(4, BOLD));
	}

	@Test
	void applyTwice_sameAsOnce() {
		AttributedText once = HELLO.applyAttribution(ITALICS, 2, 6);
		assertEquals(once, once.applyAttribution(ITALICS, 2, 6));
	}

	@Test
	void differentAttributions_doNotMerge() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 0, 3)
			.applyAttribution(ITALICS, 2, 5);
		assertEquals(Set.of(BOLD, ITALICS), text.getAttributionsAt(2));
		assertEquals(Set.of(ITALICS), text.getAttributionsAt(4));
		assertEquals(Set.of(), text.getAttributionsAt(6));
	}

	@Test
	void linksToDifferentUrls_stayDistinct() {
		LinkAttribution first = LinkAttribution.to("https://example.com/a");
		LinkAttribution second = LinkAttribution.to("https://example.com/b");
		AttributedText text = HELLO
			.applyAttribution(first, 0, 3)
			.applyAttribution(second, 2, 5);
		assertEquals(Set.of(first, second), text.getAttributionsAt(2));
		assertEquals(new AttributionSpan(first, 0, 3), text.getAttributionSpanAt(2, first));
		assertEquals(new AttributionSpan(second, 2, 5), text.getAttributionSpanAt(2, second));
	}

	@Test
	void linksToSameUrl_merge() {
		AttributedText text = HELLO
			.applyAttribution(LinkAttribution.to("https://example.com"), 0, 3)
			.applyAttribution(LinkAttribution.to("https://example.com"), 4, 6);
		assertEquals(List.of(new AttributionSpan(LinkAttribution.to("https://example.com"), 0, 6)), text.spans());
	}

	@Test
	void mergeablyUnequalAttributions_mergeIntoEarliest() {
		Highlight yellow = new Highlight("yellow");
		Highlight green = new Highlight("green");
		AttributedText text = HELLO
			.applyAttribution(yellow, 0, 3)
			.applyAttribution(green, 2, 6);
		assertEquals(List.of(new AttributionSpan(yellow, 0, 6)), text.spans());
		assertTrue(text.hasAttributionAt(5, yellow));
		assertFalse(text.hasAttributionAt(5, green));
	}

	@Test
	void getAttributionSpansInRange_returnsOverlappingSpans() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 0, 2)
			.applyAttribution(ITALICS, 5, 7)
			.applyAttribution(UNDERLINE, 9, 10);
		assertThat(text.getAttributionSpansInRange(2, 5), containsInAnyOrder(
			new AttributionSpan(BOLD, 0, 2),
			new AttributionSpan(ITALICS, 5, 7)
		));
		assertEquals(List.of(), text.getAttributionSpansInRange(3, 4));
	}

	@Test
	void getAttributionSpanAt_missing_returnsNull() {
		assertNull(HELLO.applyAttribution(BOLD, 0, 2).getAttributionSpanAt(3, BOLD));
		assertNull(HELLO.applyAttribution(BOLD, 0, 2).getAttributionSpanAt(1, ITALICS));
	}

	@Test
	void removeAttribution_middle_splitsSpan() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 0, 10)
			.removeAttribution(BOLD, 3, 5);
		assertEquals(List.of(
			new AttributionSpan(BOLD, 0, 2),
			new AttributionSpan(BOLD, 6, 10)
		), text.spans());
	}

	@Test
	void removeAttribution_wholeSpan_leavesPlainText() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 2, 4)
			.removeAttribution(BOLD, 0, 10);
		assertEquals(HELLO, text);
	}

	@Test
	void removeAttribution_absent_returnsSameInstance() {
		AttributedText text = HELLO.applyAttribution(ITALICS, 0, 3);
		assertSame(text, text.removeAttribution(BOLD, 0, 3));
	}

	@Test
	void removeAttribution_elsewhere_leavesSpanAlone() {
		AttributedText text = HELLO.applyAttribution(BOLD, 0, 1);
		assertEquals(text, text.removeAttribution(BOLD, 5, 6));
	}

	@Test
	void removeAttribution_leavesOtherAttributions() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 0, 4)
			.applyAttribution(ITALICS, 0, 4)
			.removeAttribution(BOLD, 0, 4);
		assertEquals(List.of(new AttributionSpan(ITALICS, 0, 4)), text.spans());
	}

	@Test
	void toggleAttribution_twice_restoresOriginal() {
		AttributedText original = HELLO.applyAttribution(ITALICS, 1, 3);
		AttributedText toggled = original.toggleAttribution(BOLD, 2, 6);
		assertTrue(toggled.hasAttributionAt(4, BOLD));
		assertEquals(original, toggled.toggleAttribution(BOLD, 2, 6));
	}

	@Test
	void toggleAttribution_partiallyCovered_appliesWholeRange() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 0, 2)
			.toggleAttribution(BOLD, 0, 5);
		assertEquals(List.of(new AttributionSpan(BOLD, 0, 5)), text.spans());
	}

	@Test
	void toggleAttribution_coveredByLargerSpan_removesRange() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 0, 10)
			.toggleAttribution(BOLD, 3, 5);
		assertEquals(List.of(
			new AttributionSpan(BOLD, 0, 2),
			new AttributionSpan(BOLD, 6, 10)
		), text.spans());
	}

	@Test
	void copyText_clipsAndReindexesSpans() {
		AttributedText copy = HELLO
			.applyAttribution(BOLD, 3, 7)
			.copyText(2, 6);
		assertEquals("llo ", copy.text());
		assertEquals(List.of(new AttributionSpan(BOLD, 1, 3)), copy.spans());
	}

	@Test
	void copyText_defaultEnd_copiesToEnd() {
		AttributedText copy = HELLO
			.applyAttribution(BOLD, 3, 7)
			.copyText(6);
		assertEquals("world", copy.text());
		assertEquals(List.of(new AttributionSpan(BOLD, 0, 1)), copy.spans());
	}

	@Test
	void copyText_emptyRange_isEmpty() {
		AttributedText copy = HELLO
			.applyAttribution(BOLD, 3, 7)
			.copyText(5, 5);
		assertEquals(AttributedText.empty(), copy);
	}

	@Test
	void insert_insideSpan_extendsSpan() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 0, 4)
			.insert(2, new AttributedText("XX"));
		assertEquals("heXXllo world", text.text());
		assertEquals(List.of(new AttributionSpan(BOLD, 0, 6)), text.spans());
	}

	@Test
	void insert_afterSpan_leavesSpan() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 0, 4)
			.insert(5, new AttributedText(","));
		assertEquals("hello, world", text.text());
		assertEquals(List.of(new AttributionSpan(BOLD, 0, 4)), text.spans());
	}

	@Test
	void insert_shiftsInsertedSpans() {
		AttributedText inserted = new AttributedText("XY").applyAttribution(ITALICS, 0, 1);
		AttributedText text = new AttributedText("ab").insert(1, inserted);
		assertEquals("aXYb", text.text());
		assertEquals(List.of(new AttributionSpan(ITALICS, 1, 2)), text.spans());
	}

	@Test
	void insert_adjacentSpansAcrossSplice_merge() {
		AttributedText inserted = new AttributedText("XY").applyAttribution(BOLD, 0, 1);
		AttributedText text = new AttributedText("abcd")
			.applyAttribution(BOLD, 0, 1)
			.insert(2, inserted);
		assertEquals("abXYcd", text.text());
		assertEquals(List.of(new AttributionSpan(BOLD, 0, 3)), text.spans());
	}

	@Test
	void delete_shiftsLaterSpans() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 6, 10)
			.delete(0, 6);
		assertEquals("world", text.text());
		assertEquals(List.of(new AttributionSpan(BOLD, 0, 4)), text.spans());
	}

	@Test
	void delete_spanEndingInside_isClipped() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 2, 4)
			.delete(3, 6);
		assertEquals("helworld", text.text());
		assertEquals(List.of(new AttributionSpan(BOLD, 2, 2)), text.spans());
	}

	@Test
	void delete_spanExtendingPast_keepsTail() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 4, 8)
			.delete(2, 6);
		assertEquals("heworld", text.text());
		assertEquals(List.of(new AttributionSpan(BOLD, 2, 4)), text.spans());
	}

	@Test
	void delete_spanInside_isDropped() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 3, 4)
			.delete(2, 6);
		assertEquals(List.of(), text.spans());
	}

	@Test
	void deleteThenInsert_restoresOriginal() {
		AttributedText original = HELLO
			.applyAttribution(BOLD, 0, 8)
			.applyAttribution(ITALICS, 2, 3);
		AttributedText extracted = original.copyText(3, 6);
		assertEquals(original, original.delete(3, 6).insert(3, extracted));
	}

	@Test
	void copyAndReinsert_restoresText() {
		AttributedText original = HELLO.applyAttribution(UNDERLINE, 1, 9);
		AttributedText head = original.copyText(0, 4);
		AttributedText tail = original.copyText(4);
		AttributedText rebuilt = tail.insert(0, head);
		assertEquals(original.text(), rebuilt.text());
		for (int offset = 1; offset <= 9; offset++) {
			assertTrue(rebuilt.hasAttributionAt(offset, UNDERLINE), "offset " + offset);
		}
	}

	@Test
	void replaceSub_replacesInclusiveRange() {
		AttributedText text = HELLO
			.applyAttribution(BOLD, 6, 10)
			.replaceSub(0, 4, new AttributedText("howdy"));
		assertEquals("howdy world", text.text());
		assertEquals(List.of(new AttributionSpan(BOLD, 6, 10)), text.spans());
	}

	@Test
	void constructor_normalizesMarkers() {
		AttributedText text = new AttributedText("abcdef", List.of(
			SpanMarker.end(BOLD, 5),
			SpanMarker.start(BOLD, 3),
			SpanMarker.end(BOLD, 2),
			SpanMarker.start(BOLD, 0)
		));
		assertEquals(new AttributedText("abcdef").applyAttribution(BOLD, 0, 5), text);
	}

	@Test
	void constructor_unmatchedMarkers_areIgnored() {
		AttributedText text = new AttributedText("abc", List.of(SpanMarker.end(BOLD, 2)));
		assertEquals(new AttributedText("abc"), text);
	}

	@Test
	void invalidRanges_throw() {
		assertThrows(IllegalArgumentException.class, () -> HELLO.applyAttribution(BOLD, 5, 2));
		assertThrows(IllegalArgumentException.class, () -> HELLO.removeAttribution(BOLD, 5, 2));
		assertThrows(IllegalArgumentException.class, () -> HELLO.delete(4, 2));
		assertThrows(IllegalArgumentException.class, () -> HELLO.replaceSub(4, 2, AttributedText.empty()));
		assertThrows(IndexOutOfBoundsException.class, () -> HELLO.applyAttribution(BOLD, -1, 2));
		assertThrows(IndexOutOfBoundsException.class, () -> HELLO.copyText(0, 100));
		assertThrows(IndexOutOfBoundsException.class, () -> HELLO.delete(0, 12));
		assertThrows(IndexOutOfBoundsException.class, () -> HELLO.insert(12, AttributedText.empty()));
	}

	@Test
	void equalTexts_haveEqualHashCodes() {
		AttributedText a = HELLO.applyAttribution(BOLD, 1, 3).applyAttribution(ITALICS, 1, 3);
		AttributedText b = HELLO.applyAttribution(ITALICS, 1, 3).applyAttribution(BOLD, 1, 3);
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
	}

	/**
	 * Merges with any other highlight, whatever its colour.
	 */
	record Highlight(String color) implements Attribution {
		@Override
		public String id() {
			return "highlight";
		}

		@Override
		public boolean canMergeWith(Attribution other) {
			return other instanceof Highlight;
		}
	}

	@Test
	void openEndedSpan_appliedTwice_staysSingle() {
		AttributedText text = AttributedText.of("hello")
			.applyAttribution(BOLD, 0, Integer.MAX_VALUE)
			.applyAttribution(BOLD, 0, Integer.MAX_VALUE);
		assertEquals(List.of(new AttributionSpan(BOLD, 0, Integer.MAX_VALUE)), text.spans());
		assertEquals(2, text.markers().size());
	}

	@Test
	void openEndedSpan_mergesWithAdjacentSpan() {
		AttributedText text = AttributedText.of("hello")
			.applyAttribution(BOLD, 4, Integer.MAX_VALUE)
			.applyAttribution(BOLD, 0, 3);
		assertEquals(List.of(new AttributionSpan(BOLD, 0, Integer.MAX_VALUE)), text.spans());
	}

	@Test
	void openEndedSpan_toggledTwice_restoresPlainText() {
		AttributedText plain = AttributedText.of("hello");
		AttributedText toggled = plain.toggleAttribution(BOLD, 0, Integer.MAX_VALUE);
		assertTrue(toggled.hasAttributionAt(4, BOLD));
		assertEquals(plain, toggled.toggleAttribution(BOLD, 0, Integer.MAX_VALUE));
	}

	@Test
	void openEndedSpan_survivesInsertAndDelete() {
		AttributedText bold = AttributedText.of("hello").applyAttribution(BOLD, 1, Integer.MAX_VALUE);

		AttributedText inserted = bold.insert(2, AttributedText.of("X"));
		assertEquals("heXllo", inserted.text());
		assertEquals(List.of(new AttributionSpan(BOLD, 1, Integer.MAX_VALUE)), inserted.spans());

		AttributedText deleted = bold.delete(0, 1);
		assertEquals(List.of(new AttributionSpan(BOLD, 0, Integer.MAX_VALUE)), deleted.spans());
	}
}
