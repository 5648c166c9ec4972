package io.attrspans.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Single sweep over a sorted marker list that flattens every lane into one
 * sequence of {@link MultiAttributionSpan}s.
 * <p>
 * Output properties for contentLength n &gt; 0:
 *  - segments are ordered, contiguous and non-overlapping,
 *  - the first starts at 0 and the last ends at n - 1,
 *  - each carries the set of attributions active on all of its offsets.
 */
final class SpanCollapser {

    private static final Logger log = Logger.getLogger(SpanCollapser.class.getName());

    private SpanCollapser() {
        // utility
    }

    static List<MultiAttributionSpan> collapse(List<SpanMarker> sortedMarkers, int contentLength) {
        if (contentLength == 0) {
            return List.of();
        }
        int lastOffset = contentLength - 1;

        if (sortedMarkers.isEmpty() || sortedMarkers.get(0).offset() > lastOffset) {
            // Content, but nothing applies to it.
            return List.of(new MultiAttributionSpan(Set.of(), 0, lastOffset));
        }

        List<MultiAttributionSpan> collapsed = new ArrayList<>();
        Set<Attribution> active = new LinkedHashSet<>();
        int currentStart = 0;

        for (SpanMarker marker : sortedMarkers) {
            if (marker.offset() > lastOffset) {
                // Remaining markers lie past the content; the tail is committed below.
                log.finer("ran out of markers within the requested contentLength, breaking early");
                break;
            }

            if ((marker.isStart() && marker.offset() > currentStart)
                    || (marker.isEnd() && marker.offset() >= currentStart)) {
                // Boundary: an END closes its own offset, a START opens a new segment at its offset.
                int currentEnd = marker.isEnd() ? marker.offset() : marker.offset() - 1;
                collapsed.add(new MultiAttributionSpan(active, currentStart, currentEnd));
                currentStart = marker.isStart() ? marker.offset() : marker.offset() + 1;
            }

            if (marker.isStart()) {
                active.add(marker.attribution());
            } else {
                active.remove(marker.attribution());
            }
        }

        if (collapsed.isEmpty() || collapsed.get(collapsed.size() - 1).end() < lastOffset) {
            collapsed.add(new MultiAttributionSpan(active, currentStart, lastOffset));
        }

        log.fine(() -> "collapsed " + sortedMarkers.size() + " markers into " + collapsed.size() + " segments");
        return collapsed;
    }
}
