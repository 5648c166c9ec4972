// file: core/src/main/java/io/attrspans/core/MarkerList.java
package io.attrspans.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered storage for {@link SpanMarker}s.
 * <p>
 * Invariant: {@code markers} is sorted by {@link SpanMarker#compareTo} at all
 * times. Inserts go after every marker that orders equal to the new one, so
 * insertion order is kept among ties.
 * <p>
 * This class only maintains ordering. Start/End alternation is the job of
 * {@link AttributedSpans}, which composes inserts and removals into
 * invariant-preserving operations.
 */
final class MarkerList {

    private final ArrayList<SpanMarker> markers;

    MarkerList() {
        this.markers = new ArrayList<>();
    }

    /** Copy and sort the given markers. Alternation is not validated. */
    MarkerList(Collection<SpanMarker> initial) {
        this.markers = new ArrayList<>(initial);
        // List.sort is stable: equal-ordered markers keep the caller's order.
        this.markers.sort(null);
    }

    int size() { return markers.size(); }

    boolean isEmpty() { return markers.isEmpty(); }

    SpanMarker get(int index) { return markers.get(index); }

    SpanMarker last() {
        return markers.isEmpty() ? null : markers.get(markers.size() - 1);
    }

    /** Read-only view; callers must not hold it across mutations. */
    List<SpanMarker> view() {
        return Collections.unmodifiableList(markers);
    }

    /**
     * Insert a marker at its sorted position.
     * Precondition: no structurally equal marker is present.
     */
    void insert(SpanMarker marker) {
        markers.add(upperBound(marker), marker);
    }

    /** Remove every listed marker. */
    void removeAll(Collection<SpanMarker> toRemove) {
        if (toRemove.isEmpty()) return;
        Set<SpanMarker> doomed = new HashSet<>(toRemove);
        markers.removeIf(doomed::contains);
    }

    /**
     * Replace the whole content. {@code sorted} must already be in order;
     * used by splice operations that rebuild the list in one pass.
     */
    void replaceAll(List<SpanMarker> sorted) {
        markers.clear();
        markers.addAll(sorted);
    }

    /** Distinct attributions in order of first appearance. */
    Set<Attribution> attributions() {
        Set<Attribution> out = new LinkedHashSet<>();
        for (SpanMarker m : markers) {
            out.add(m.attribution());
        }
        return out;
    }

    // ---------- lane-aware lookups ----------

    /**
     * True if {@code marker} sits in the same lane as {@code attribution}:
     * same id and mergeable. A null attribution matches every marker.
     */
    static boolean inLane(SpanMarker marker, Attribution attribution) {
        return attribution == null
                || (marker.attribution().id().equals(attribution.id())
                    && marker.attribution().canMergeWith(attribution));
    }

    /**
     * Nearest START marker at or before {@code offset} in the lane of
     * {@code attribution}, searching backwards from the end.
     */
    SpanMarker startingMarkerAtOrBefore(int offset, Attribution attribution) {
        for (int i = markers.size() - 1; i >= 0; i--) {
            SpanMarker m = markers.get(i);
            if (m.isStart() && m.offset() <= offset && inLane(m, attribution)) {
                return m;
            }
        }
        return null;
    }

    /** First END marker at or after {@code offset} in the lane of {@code attribution}. */
    SpanMarker endingMarkerAtOrAfter(int offset, Attribution attribution) {
        for (SpanMarker m : markers) {
            if (m.isEnd() && m.offset() >= offset && inLane(m, attribution)) {
                return m;
            }
        }
        return null;
    }

    /**
     * Index of the last marker at or before {@code offset} in the lane of
     * {@code attribution} with the given type, or -1.
     */
    int indexOfNearestAtOrBefore(int offset, Attribution attribution, SpanMarkerType type) {
        int found = -1;
        for (int i = 0; i < markers.size(); i++) {
            SpanMarker m = markers.get(i);
            if (m.offset() > offset) {
                break;
            }
            if (m.type() == type && inLane(m, attribution)) {
                found = i;
            }
        }
        return found;
    }

    /** Next marker in the lane of {@code attribution} after {@code index}, or null. */
    SpanMarker nextOf(int index, Attribution attribution) {
        for (int i = index + 1; i < markers.size(); i++) {
            SpanMarker m = markers.get(i);
            if (inLane(m, attribution)) {
                return m;
            }
        }
        return null;
    }

    /** True if a marker of {@code type} in the lane of {@code attribution} sits at {@code offset}. */
    boolean containsInLaneAt(Attribution attribution, int offset, SpanMarkerType type) {
        for (SpanMarker m : markers) {
            if (m.offset() > offset) break;
            if (m.offset() == offset && m.type() == type && inLane(m, attribution)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Markers in the lane of {@code attribution} whose offset lies in
     * [fromInclusive, toInclusive], in list order.
     */
    List<SpanMarker> markersInLane(Attribution attribution, int fromInclusive, int toInclusive) {
        List<SpanMarker> out = new ArrayList<>();
        for (SpanMarker m : markers) {
            if (m.offset() > toInclusive) break;
            if (m.offset() >= fromInclusive && inLane(m, attribution)) {
                out.add(m);
            }
        }
        return out;
    }

    // ---------- helpers ----------

    /** First index whose marker orders strictly after {@code marker}. */
    private int upperBound(SpanMarker marker) {
        int lo = 0, hi = markers.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (markers.get(mid).compareTo(marker) <= 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
