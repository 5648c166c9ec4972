package io.attrspans.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.Set;

import static io.attrspans.core.MarkerInvariants.span;
import static io.attrspans.core.MarkerInvariants.spansOf;
import static io.attrspans.core.NamedAttribution.BOLD;
import static io.attrspans.core.NamedAttribution.ITALICS;
import static io.attrspans.core.NamedAttribution.UNDERLINE;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for flattening all lanes into multi-attribution segments.
 */
class CollapseSpansTest {

    private static MultiAttributionSpan seg(int start, int end, Attribution... attributions) {
        return new MultiAttributionSpan(Set.of(attributions), start, end);
    }

    @Test
    void zero_length_content_has_no_segments() {
        assertEquals(List.of(), spansOf(span(BOLD, 0, 4)).collapseSpans(0));
    }

    @Test
    void negative_length_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new AttributedSpans().collapseSpans(-1));
    }

    @Test
    void no_markers_gives_one_unattributed_segment() {
        assertEquals(List.of(seg(0, 9)), new AttributedSpans().collapseSpans(10));
    }

    @Test
    void single_span_followed_by_plain_tail() {
        var spans = spansOf(span(BOLD, 0, 4));

        assertEquals(List.of(seg(0, 4, BOLD), seg(5, 9)), spans.collapseSpans(10));
    }

    @Test
    void overlapping_spans_produce_combined_segment() {
        var spans = spansOf(span(BOLD, 0, 5), span(ITALICS, 3, 8));

        assertEquals(List.of(
                seg(0, 2, BOLD),
                seg(3, 5, BOLD, ITALICS),
                seg(6, 8, ITALICS),
                seg(9, 9)
        ), spans.collapseSpans(10));
    }

    @Test
    void single_unit_span_in_the_middle() {
        var spans = spansOf(span(BOLD, 2, 2));

        assertEquals(List.of(seg(0, 1), seg(2, 2, BOLD), seg(3, 4)), spans.collapseSpans(5));
    }

    @Test
    void adjacent_spans_of_same_attribution_stay_separate_segments() {
        var spans = spansOf(span(BOLD, 0, 2), span(BOLD, 3, 5));

        assertEquals(List.of(seg(0, 2, BOLD), seg(3, 5, BOLD)), spans.collapseSpans(6));
    }

    @Test
    void spans_starting_together_share_a_segment() {
        var spans = spansOf(span(BOLD, 1, 3), span(ITALICS, 1, 3), span(UNDERLINE, 1, 6));

        assertEquals(List.of(
                seg(0, 0),
                seg(1, 3, BOLD, ITALICS, UNDERLINE),
                seg(4, 6, UNDERLINE)
        ), spans.collapseSpans(7));
    }

    @Test
    void markers_beyond_content_are_ignored() {
        var spans = spansOf(span(BOLD, 12, 14));

        assertEquals(List.of(seg(0, 9)), spans.collapseSpans(10));
    }

    @Test
    void span_running_past_content_is_clipped() {
        assertEquals(List.of(seg(0, 4), seg(5, 9, BOLD)), spansOf(span(BOLD, 5, 20)).collapseSpans(10));
        assertEquals(List.of(seg(0, 9, BOLD)), spansOf(span(BOLD, 0, 20)).collapseSpans(10));
        assertEquals(List.of(seg(0, 9, BOLD)), spansOf(span(BOLD, 0, 10)).collapseSpans(10));
    }

    @Test
    void segment_attribution_sets_are_immutable() {
        var segments = spansOf(span(BOLD, 0, 4)).collapseSpans(5);

        assertThrows(UnsupportedOperationException.class, () -> segments.get(0).attributions().add(ITALICS));
    }

    @Test
    void collapse_partitions_content_and_matches_point_queries() {
        var rnd = new Random(2024);
        Attribution[] pool = {BOLD, ITALICS, UNDERLINE, new LinkAttribution("https://example.com")};

        for (int round = 0; round < 50; round++) {
            var spans = new AttributedSpans();
            for (int i = 0; i < 6; i++) {
                int start = rnd.nextInt(20);
                spans.addAttribution(pool[rnd.nextInt(pool.length)], start, start + rnd.nextInt(6));
            }
            int length = 1 + rnd.nextInt(25);

            List<MultiAttributionSpan> segments = spans.collapseSpans(length);

            assertFalse(segments.isEmpty());
            assertEquals(0, segments.get(0).start());
            assertEquals(length - 1, segments.get(segments.size() - 1).end());
            for (int i = 0; i < segments.size(); i++) {
                MultiAttributionSpan s = segments.get(i);
                assertTrue(s.start() <= s.end(), "empty segment " + s);
                if (i > 0) {
                    assertEquals(segments.get(i - 1).end() + 1, s.start(), "gap or overlap before " + s);
                }
                for (int offset = s.start(); offset <= s.end(); offset++) {
                    assertEquals(spans.getAllAttributionsAt(offset), s.attributions(),
                            "round " + round + ", offset " + offset + ": " + spans);
                }
            }
        }
    }
}
