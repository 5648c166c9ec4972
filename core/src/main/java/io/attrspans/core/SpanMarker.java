// file: core/src/main/java/io/attrspans/core/SpanMarker.java
package io.attrspans.core;

import java.util.Objects;

/**
 * Start or end boundary of one attribution span.
 * <p>
 * Ordering:
 *  - primarily by offset, ascending;
 *  - at equal offsets, START sorts before END, so a sweep over a sorted
 *    marker list opens every span at an offset before closing any.
 * <p>
 * Equality is structural (attribution + offset + type). Note that
 * compareTo is coarser than equals: markers of different attributions
 * at the same offset and type compare as 0.
 */
public record SpanMarker(
        Attribution attribution,
        int offset,
        SpanMarkerType type
) implements Comparable<SpanMarker> {

    public SpanMarker {
        Objects.requireNonNull(attribution, "attribution");
        Objects.requireNonNull(type, "type");
    }

    public static SpanMarker start(Attribution attribution, int offset) {
        return new SpanMarker(attribution, offset, SpanMarkerType.START);
    }

    public static SpanMarker end(Attribution attribution, int offset) {
        return new SpanMarker(attribution, offset, SpanMarkerType.END);
    }

    public boolean isStart() { return type == SpanMarkerType.START; }

    public boolean isEnd() { return type == SpanMarkerType.END; }

    /** Copy of this marker moved to {@code newOffset}. */
    public SpanMarker withOffset(int newOffset) {
        return new SpanMarker(attribution, newOffset, type);
    }

    @Override
    public int compareTo(SpanMarker other) {
        int byOffset = Integer.compare(offset, other.offset);
        if (byOffset != 0) {
            return byOffset;
        }
        if (type != other.type) {
            return isStart() ? -1 : 1;
        }
        return 0;
    }

    @Override
    public String toString() {
        return "[SpanMarker] - attribution: " + attribution + ", offset: " + offset + ", type: " + type;
    }
}
