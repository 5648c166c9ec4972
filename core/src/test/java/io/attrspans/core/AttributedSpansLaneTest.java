package io.attrspans.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static io.attrspans.core.MarkerInvariants.assertConsistent;
import static io.attrspans.core.MarkerInvariants.span;
import static io.attrspans.core.MarkerInvariants.spansOf;
import static io.attrspans.core.NamedAttribution.BOLD;
import static io.attrspans.core.NamedAttribution.ITALICS;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for attributions that share a lane and merge without being equal,
 * and for ranges that reach the top of the offset space.
 */
class AttributedSpansLaneTest {

    /** Same lane and mergeable across versions, but never equal across them. */
    private record Versioned(String name, int version) implements Attribution {
        @Override
        public String id() {
            return name;
        }

        @Override
        public boolean canMergeWith(Attribution other) {
            return other instanceof Versioned v && v.name.equals(name);
        }
    }

    private static final Versioned COLOR_V1 = new Versioned("color", 1);
    private static final Versioned COLOR_V2 = new Versioned("color", 2);

    private static final int MAX = Integer.MAX_VALUE;

    // ---------- mergeable, unequal ----------

    @Test
    void lookup_sees_mergeable_relative() {
        var spans = spansOf(span(COLOR_V1, 0, 9));

        assertTrue(spans.hasAttributionAt(4, COLOR_V2));
        assertEquals(new AttributionSpan(COLOR_V2, 0, 9), spans.expandAttributionToSpan(COLOR_V2, 4));
    }

    @Test
    void add_over_end_of_relative_covers_whole_range() {
        var spans = spansOf(span(COLOR_V1, 0, 5));
        spans.addAttribution(COLOR_V2, 3, 8);

        assertConsistent(spans);
        assertEquals(spansOf(span(COLOR_V2, 0, 8)), spans);
        for (int i = 0; i <= 8; i++) {
            assertTrue(spans.hasAttributionAt(i, COLOR_V2), "offset " + i + ": " + spans);
        }
    }

    @Test
    void add_inside_relative_relabels_the_span() {
        var spans = spansOf(span(COLOR_V1, 0, 9));
        spans.addAttribution(COLOR_V2, 3, 5);

        assertConsistent(spans);
        assertEquals(spansOf(span(COLOR_V2, 0, 9)), spans);
    }

    @Test
    void add_over_start_of_relative_absorbs_it() {
        var spans = spansOf(span(COLOR_V1, 6, 12));
        spans.addAttribution(COLOR_V2, 0, 8);

        assertConsistent(spans);
        assertEquals(spansOf(span(COLOR_V2, 0, 12)), spans);
    }

    @Test
    void add_bridging_relatives_fuses_them() {
        var spans = spansOf(span(COLOR_V1, 0, 3), span(COLOR_V1, 5, 9));
        spans.addAttribution(COLOR_V2, 2, 5);

        assertConsistent(spans);
        assertEquals(spansOf(span(COLOR_V2, 0, 9)), spans);
    }

    @Test
    void remove_relative_from_middle_keeps_outer_attribution() {
        var spans = spansOf(span(COLOR_V1, 0, 9));
        spans.removeAttribution(COLOR_V2, 3, 5);

        assertConsistent(spans);
        assertEquals(spansOf(span(COLOR_V1, 0, 2), span(COLOR_V1, 6, 9)), spans);
        assertEquals(List.of(
                new MultiAttributionSpan(Set.of(COLOR_V1), 0, 2),
                new MultiAttributionSpan(Set.of(), 3, 5),
                new MultiAttributionSpan(Set.of(COLOR_V1), 6, 9)
        ), spans.collapseSpans(10));
    }

    @Test
    void toggle_relative_over_covered_range_removes() {
        var spans = spansOf(span(COLOR_V1, 0, 9));
        spans.toggleAttribution(COLOR_V2, 3, 5);

        assertEquals(spansOf(span(COLOR_V1, 0, 2), span(COLOR_V1, 6, 9)), spans);
    }

    @Test
    void random_versions_match_a_lane_coverage_model() {
        int length = 30;
        Attribution[] attributions = {COLOR_V1, COLOR_V2, BOLD};
        int[] laneOf = {0, 0, 1};
        boolean[][] model = new boolean[2][length];
        var spans = new AttributedSpans();
        var rnd = new Random(99);

        for (int step = 0; step < 400; step++) {
            int which = rnd.nextInt(attributions.length);
            int start = rnd.nextInt(length);
            int end = start + rnd.nextInt(length - start);
            boolean add = rnd.nextBoolean();

            if (add) {
                spans.addAttribution(attributions[which], start, end);
            } else {
                spans.removeAttribution(attributions[which], start, end);
            }
            for (int i = start; i <= end; i++) {
                model[laneOf[which]][i] = add;
            }

            assertConsistent(spans);
            for (int a = 0; a < attributions.length; a++) {
                for (int i = 0; i < length; i++) {
                    assertEquals(model[laneOf[a]][i], spans.hasAttributionAt(i, attributions[a]),
                            "step " + step + ", " + attributions[a] + " at " + i + ": " + spans);
                }
            }
        }
    }

    // ---------- ranges ending at Integer.MAX_VALUE ----------

    @Test
    void add_and_toggle_up_to_max_offset() {
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            var spans = new AttributedSpans();
            spans.addAttribution(BOLD, MAX - 1, MAX);

            assertEquals(List.of(SpanMarker.start(BOLD, MAX - 1), SpanMarker.end(BOLD, MAX)), spans.markers());

            spans.toggleAttribution(BOLD, MAX - 1, MAX);
            assertTrue(spans.isEmpty(), spans.toString());
        });
    }

    @Test
    void remove_up_to_max_offset() {
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            var spans = spansOf(span(BOLD, 3, 5), span(ITALICS, 1, 8));
            spans.removeAttribution(BOLD, 0, MAX);
            spans.removeAttribution(ITALICS, 4, MAX);

            assertEquals(spansOf(span(ITALICS, 1, 3)), spans);
        });
    }

    @Test
    void range_queries_up_to_max_offset() {
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            var spans = spansOf(span(BOLD, 3, 5), span(ITALICS, MAX - 2, MAX));

            assertEquals(
                    Set.of(new AttributionSpan(BOLD, 3, 5), new AttributionSpan(ITALICS, MAX - 2, MAX)),
                    spans.getAttributionSpansInRange(a -> true, 0, MAX));
            assertEquals(
                    Set.of(new AttributionSpan(ITALICS, MAX - 2, MAX)),
                    spans.getAttributionSpansInRange(a -> true, 6, MAX, true));
            assertTrue(spans.hasAttributionsWithin(Set.of(BOLD, ITALICS), 0, MAX));
            assertFalse(spans.hasAttributionsWithin(Set.of(BOLD), 6, MAX));
            assertEquals(Set.of(BOLD), spans.getMatchingAttributionsWithin(Set.of(BOLD), 4, MAX));
        });
    }
}
