// file: core/src/main/java/io/attrspans/core/AttributedSpans.java
package io.attrspans.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A set of attribution spans laid over a discrete range of offsets
 * (for example, character offsets in a piece of text).
 * <p>
 * Think of it as a set of lanes, one per attribution id:
 * <pre>
 * Bold    :  {xxxx}                      {xxxxx}
 * Italics :             {xxxxxxxx}
 * Link    :                              {xxxxx}
 * </pre>
 * Spans in the same lane never overlap; spans in different lanes may.
 * <p>
 * Each span is stored as a START and an END {@link SpanMarker}. The marker
 * list is kept sorted, and for every attribution the markers alternate
 * START, END, START, END... with nothing left open. Every public mutation
 * re-establishes that before returning and validates its input before
 * touching the list, so a failed call leaves the spans unchanged.
 * <p>
 * Not thread safe. Concurrent reads are fine as long as nothing mutates.
 */
public final class AttributedSpans {

    private static final Logger log = Logger.getLogger(AttributedSpans.class.getName());

    private final MarkerList markers;

    /** Empty spans. */
    public AttributedSpans() {
        this.markers = new MarkerList();
    }

    /**
     * Spans built from the given markers, which are copied and sorted.
     * The caller is responsible for supplying markers that alternate
     * correctly; this constructor does not check.
     */
    public AttributedSpans(Collection<SpanMarker> initialMarkers) {
        Objects.requireNonNull(initialMarkers, "initialMarkers");
        this.markers = new MarkerList(initialMarkers);
    }

    /** Snapshot of all markers in order. */
    public List<SpanMarker> markers() {
        return List.copyOf(markers.view());
    }

    public boolean isEmpty() {
        return markers.isEmpty();
    }

    /** Independent copy of these spans. */
    public AttributedSpans copy() {
        return new AttributedSpans(markers.view());
    }

    // =====================================================================
    // Queries
    // =====================================================================

    /** True if any attribution covers {@code offset}. */
    public boolean hasAttributionAt(int offset) {
        for (Attribution attribution : markers.attributions()) {
            if (hasAttributionAt(offset, attribution)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if {@code attribution}, or a same-lane attribution it can merge
     * with, covers {@code offset}.
     *
     * @throws InconsistentMarkersException if the covering START has no END
     */
    public boolean hasAttributionAt(int offset, Attribution attribution) {
        Objects.requireNonNull(attribution, "attribution");
        SpanMarker before = markers.startingMarkerAtOrBefore(offset, attribution);
        if (before == null) {
            return false;
        }
        SpanMarker after = markers.endingMarkerAtOrAfter(before.offset(), attribution);
        if (after == null) {
            throw inconsistent("Found an open-ended attribution. It starts with: " + before);
        }
        return before.offset() <= offset && offset <= after.offset();
    }

    /**
     * Full span of {@code attribution} that contains {@code offset}.
     * <p>
     * Example: with "bold" applied to "Hello, |world!|" (offsets 7..14),
     * expanding at offset 10 returns bold from 7 to 14.
     *
     * @throws IllegalArgumentException if the attribution is not present at {@code offset}
     */
    public AttributionSpan expandAttributionToSpan(Attribution attribution, int offset) {
        if (!hasAttributionAt(offset, attribution)) {
            throw new IllegalArgumentException("Tried to expand attribution (" + attribution + ") at offset "
                    + offset + " but the given attribution does not exist at that offset.");
        }
        // Both lookups succeed: hasAttributionAt just found the same pair.
        SpanMarker before = markers.startingMarkerAtOrBefore(offset, attribution);
        SpanMarker after = markers.endingMarkerAtOrAfter(before.offset(), attribution);
        return new AttributionSpan(attribution, before.offset(), after.offset());
    }

    /** Every attribution whose span covers {@code offset}. */
    public Set<Attribution> getAllAttributionsAt(int offset) {
        Set<Attribution> atOffset = new LinkedHashSet<>();
        for (Attribution attribution : markers.attributions()) {
            if (hasAttributionAt(offset, attribution)) {
                atOffset.add(attribution);
            }
        }
        log.finer(() -> "attributions at " + offset + ": " + atOffset);
        return atOffset;
    }

    /**
     * True if each of {@code attributions} covers at least one offset in
     * [start, end]. Scanning stops as soon as all of them were seen.
     */
    public boolean hasAttributionsWithin(Set<? extends Attribution> attributions, int start, int end) {
        Set<Attribution> toFind = new LinkedHashSet<>(attributions);
        if (toFind.isEmpty()) {
            return true;
        }
        if (start > end) {
            return false;
        }
        toFind.removeIf(a -> firstOffsetWith(a, start, end) != null);
        return toFind.isEmpty();
    }

    /**
     * Attributions present anywhere in [start, end] whose id matches the id
     * of any of {@code attributions}. Matching is by lane, not by equality,
     * so a link to a different URL is still returned.
     */
    public Set<Attribution> getMatchingAttributionsWithin(Set<? extends Attribution> attributions, int start, int end) {
        Set<String> ids = new HashSet<>();
        for (Attribution a : attributions) {
            ids.add(a.id());
        }
        Set<Attribution> matching = new LinkedHashSet<>();
        if (start > end) {
            return matching;
        }
        for (Attribution present : markers.attributions()) {
            if (ids.contains(present.id()) && firstOffsetWith(present, start, end) != null) {
                matching.add(present);
            }
        }
        return matching;
    }

    /** Same as {@link #getAttributionSpansInRange(Predicate, int, int, boolean)} without resizing. */
    public Set<AttributionSpan> getAttributionSpansInRange(Predicate<Attribution> filter, int start, int end) {
        return getAttributionSpansInRange(filter, start, end, false);
    }

    /**
     * Spans of every attribution accepted by {@code filter} that at least
     * partially covers [start, end].
     * <p>
     * By default each span is returned whole, including the parts before
     * {@code start} or after {@code end}. With {@code resizeToFit} the
     * returned spans are clipped to [start, end]. The stored markers are
     * never modified.
     */
    public Set<AttributionSpan> getAttributionSpansInRange(
            Predicate<Attribution> filter,
            int start,
            int end,
            boolean resizeToFit
    ) {
        Objects.requireNonNull(filter, "filter");
        Set<AttributionSpan> spans = new LinkedHashSet<>();
        if (start > end) {
            return spans;
        }
        for (Attribution attribution : markers.attributions()) {
            if (!filter.test(attribution)) {
                continue;
            }
            for (int offset : entryOffsets(attribution, start, end)) {
                if (!hasAttributionAt(offset, attribution)) {
                    continue;
                }
                AttributionSpan span = expandAttributionToSpan(attribution, offset);
                spans.add(resizeToFit ? span.constrain(start, end) : span);
            }
        }
        return spans;
    }

    // =====================================================================
    // Mutations
    // =====================================================================

    /**
     * Apply {@code newAttribution} from {@code start} to {@code end}, inclusive.
     * <p>
     * Existing compatible spans touching the range are merged with it into
     * one span. An invalid range (start &lt; 0 or start &gt; end) is ignored.
     *
     * @throws IncompatibleOverlapException if the range overlaps a same-lane
     *         attribution that cannot merge with {@code newAttribution}
     */
    public void addAttribution(Attribution newAttribution, int start, int end) {
        Objects.requireNonNull(newAttribution, "newAttribution");
        if (start < 0 || start > end) {
            log.fine(() -> "ignoring addAttribution with invalid range " + start + " -> " + end);
            return;
        }

        for (Attribution existing : getMatchingAttributionsWithin(Set.of(newAttribution), start, end)) {
            if (!newAttribution.canMergeWith(existing) || !existing.canMergeWith(newAttribution)) {
                Integer conflictAt = firstOffsetWith(existing, start, end);
                if (conflictAt == null) {
                    // getMatchingAttributionsWithin only returns attributions seen in the range.
                    throw inconsistent("Attribution " + existing + " was found in " + start + " -> " + end + " and then lost");
                }
                throw new IncompatibleOverlapException(existing, newAttribution, conflictAt);
            }
        }

        log.fine(() -> "adding " + newAttribution + " from " + start + " to " + end);
        boolean insertedStart = false;
        if (hasAttributionAt(start, newAttribution)) {
            // A merged span carries the new attribution from START to END.
            relabel(markers.startingMarkerAtOrBefore(start, newAttribution), newAttribution);
        } else {
            log.finer(() -> "adding start marker at: " + start);
            markers.insert(SpanMarker.start(newAttribution, start));
            insertedStart = true;
        }

        // Interior boundaries are absorbed into the new span. The START at
        // `start` (new or pre-existing) stays; an END at `start` goes, since
        // the span now continues past it.
        List<SpanMarker> toDelete = new ArrayList<>();
        for (SpanMarker m : markers.markersInLane(newAttribution, start, end)) {
            if (m.offset() > start || m.isEnd()) {
                toDelete.add(m);
            }
        }
        log.finer(() -> "removing " + toDelete.size() + " markers between " + start + " and " + end);
        markers.removeAll(toDelete);

        SpanMarker lastDeleted = toDelete.isEmpty() ? null : toDelete.get(toDelete.size() - 1);
        // No deletions: a new span needs its END, while a pre-existing span
        // covering `start` already ends after `end`.
        // Last deletion was an END: the merged span is open and needs a cap.
        // Last deletion was a START: that span already ends after `end`.
        boolean needsEnd = lastDeleted == null ? insertedStart : lastDeleted.isEnd();
        if (needsEnd) {
            log.finer(() -> "inserting ending marker at: " + end);
            markers.insert(SpanMarker.end(newAttribution, end));
        } else {
            SpanMarker closing = markers.endingMarkerAtOrAfter(end, newAttribution);
            if (closing == null) {
                throw inconsistent("Merged " + newAttribution + " into a span with no `end` marker after " + end);
            }
            relabel(closing, newAttribution);
        }

        if (log.isLoggable(Level.FINER)) {
            log.finer("markers after add: " + markers.markersInLane(newAttribution, Integer.MIN_VALUE, Integer.MAX_VALUE));
        }
    }

    /**
     * Remove {@code attribution} from {@code start} to {@code end}, inclusive.
     * Parts of a span outside the range are kept, capped at start - 1 and
     * end + 1.
     *
     * @throws IllegalArgumentException if start &lt; 0 or start &gt; end
     */
    public void removeAttribution(Attribution attribution, int start, int end) {
        Objects.requireNonNull(attribution, "attribution");
        log.fine(() -> "Removing attribution " + attribution + " from " + start + " to " + end);
        if (start < 0 || start > end) {
            throw new IllegalArgumentException(
                    "removeAttribution() requires 0 <= start <= end, start: " + start + ", end: " + end);
        }

        if (!hasAttributionsWithin(Set.of(attribution), start, end)) {
            log.fine("No such attribution exists in the given span range");
            return;
        }

        // Cap spans that begin before and/or continue after the removal range.
        //
        //    ---[xxxxx]---[yyyyyy]----     spans
        //          |-remove-|
        //    ---[xx]|xxx]---[yy|[yyy]----  caps inserted (temporarily illegal)
        //    ---[xx]--------[yyy]----      interior markers removed
        //
        // Both caps are decided before either is inserted: a new END at
        // start - 1 would hide the span from the lookup at end + 1.
        // A cap keeps the attribution of the span it cuts, which may be a
        // mergeable relative of the one being removed.
        List<SpanMarker> caps = new ArrayList<>(2);
        if (hasAttributionAt(start - 1, attribution)
                && !markers.containsInLaneAt(attribution, start - 1, SpanMarkerType.END)) {
            log.finer(() -> "Creating a new END marker before the removal range at " + (start - 1));
            Attribution cut = markers.startingMarkerAtOrBefore(start - 1, attribution).attribution();
            caps.add(SpanMarker.end(cut, start - 1));
        }
        if (end < Integer.MAX_VALUE
                && hasAttributionAt(end + 1, attribution)
                && !markers.containsInLaneAt(attribution, end + 1, SpanMarkerType.START)) {
            log.finer(() -> "Creating a new START marker after the removal range at " + (end + 1));
            Attribution cut = markers.endingMarkerAtOrAfter(end + 1, attribution).attribution();
            caps.add(SpanMarker.start(cut, end + 1));
        }
        caps.forEach(markers::insert);

        List<SpanMarker> toDelete = markers.markersInLane(attribution, start, end);
        log.finer(() -> "removing " + toDelete.size() + " markers between " + start + " and " + end);
        markers.removeAll(toDelete);
    }

    /**
     * If {@code attribution} covers every offset in [start, end] without a
     * break, remove it from that range. Otherwise apply it to the whole range.
     */
    public void toggleAttribution(Attribution attribution, int start, int end) {
        Objects.requireNonNull(attribution, "attribution");
        log.fine(() -> "Toggling attribution " + attribution + " from " + start + " to " + end);
        if (isContinuousAttribution(attribution, start, end)) {
            removeAttribution(attribution, start, end);
        } else {
            addAttribution(attribution, start, end);
        }
    }

    private boolean isContinuousAttribution(Attribution attribution, int start, int end) {
        int indexBefore = markers.indexOfNearestAtOrBefore(start, attribution, SpanMarkerType.START);
        if (indexBefore < 0) {
            return false;
        }
        SpanMarker markerBefore = markers.get(indexBefore);
        SpanMarker next = markers.nextOf(indexBefore, attribution);
        log.finer(() -> "marker before: " + markerBefore + ", next marker: " + next);

        if (next == null) {
            throw inconsistent("Inconsistent attributions state. Found a `start` marker with no matching `end`: "
                    + markerBefore);
        }
        if (next.isStart()) {
            throw inconsistent("Inconsistent attributions state. Found a `start` marker following a `start` marker: "
                    + next);
        }
        // Any marker inside the range would mean a break in coverage.
        return next.offset() >= end;
    }

    // =====================================================================
    // Splicing
    // =====================================================================

    /** Shift every marker forward by {@code offset}. */
    public void pushAttributionsBack(int offset) {
        List<SpanMarker> pushed = new ArrayList<>(markers.size());
        for (SpanMarker m : markers.view()) {
            pushed.add(m.withOffset(m.offset() + offset));
        }
        markers.replaceAll(pushed);
    }

    /**
     * Cut the region [startOffset, startOffset + count) out of the spans and
     * pull everything after it back by {@code count}.
     * <p>
     * Spans that cross the cut are shortened rather than dropped: a START
     * removed from the window is re-created at {@code startOffset}, an END
     * removed from the window is re-created just before it.
     */
    public void contractAttributions(int startOffset, int count) {
        log.fine(() -> "removing " + count + " units starting at " + startOffset);
        int windowEnd = startOffset + count;

        List<SpanMarker> contracted = new ArrayList<>(markers.size());
        Set<Attribution> needToStart = new LinkedHashSet<>();
        Set<Attribution> needToEnd = new LinkedHashSet<>();
        List<SpanMarker> after = new ArrayList<>();

        for (SpanMarker m : markers.view()) {
            if (m.offset() < startOffset) {
                contracted.add(m);
            } else if (m.offset() < windowEnd) {
                log.finer(() -> "removing " + m.type() + " at " + m.offset());
                Attribution a = m.attribution();
                if (m.isStart()) {
                    // A START cancels an END removed earlier in the window.
                    if (!needToEnd.remove(a)) {
                        needToStart.add(a);
                    }
                } else {
                    if (!needToStart.remove(a)) {
                        needToEnd.add(a);
                    }
                }
            } else {
                after.add(m.withOffset(m.offset() - count));
            }
        }

        for (Attribution a : needToStart) {
            log.finer(() -> "adding back a start marker at " + startOffset);
            contracted.add(SpanMarker.start(a, startOffset));
        }
        int endCap = Math.max(startOffset - 1, 0);
        for (Attribution a : needToEnd) {
            log.finer(() -> "adding back an end marker at " + endCap);
            contracted.add(SpanMarker.end(a, endCap));
        }
        contracted.addAll(after);

        // Re-created markers can land between kept ones.
        contracted.sort(null);
        markers.replaceAll(contracted);
    }

    /**
     * Copy from {@code startOffset} to the offset of the last marker
     * (or 0 when there are none).
     */
    public AttributedSpans copyAttributionRegion(int startOffset) {
        SpanMarker last = markers.last();
        return copyAttributionRegion(startOffset, last == null ? 0 : last.offset());
    }

    /**
     * New spans covering [startOffset, endOffset], re-based so that
     * {@code startOffset} becomes offset 0.
     * <p>
     * Spans that are already open at {@code startOffset} get a START at 0 in
     * the copy; spans still open past {@code endOffset} get an END at
     * {@code endOffset - startOffset}.
     *
     * @throws InconsistentMarkersException if the markers outside the region
     *         do not balance out
     */
    public AttributedSpans copyAttributionRegion(int startOffset, int endOffset) {
        log.fine(() -> "copying region start: " + startOffset + ", end: " + endOffset);
        List<SpanMarker> cut = new ArrayList<>();

        // Net START count per attribution before the region: 1 means still open.
        Map<Attribution, Integer> openBefore = new LinkedHashMap<>();
        for (SpanMarker m : markers.view()) {
            if (m.offset() >= startOffset) break;
            openBefore.merge(m.attribution(), m.isStart() ? 1 : -1, Integer::sum);
        }
        for (Map.Entry<Attribution, Integer> e : openBefore.entrySet()) {
            int count = e.getValue();
            if (count == 1) {
                log.finer(() -> "inserting " + e.getKey() + " START at the beginning of the copy region");
                cut.add(SpanMarker.start(e.getKey(), 0));
            } else if (count != 0) {
                throw inconsistent("Found an unbalanced number of `start` and `end` markers before offset: "
                        + startOffset + " - " + this);
            }
        }

        for (SpanMarker m : markers.view()) {
            if (startOffset <= m.offset() && m.offset() <= endOffset) {
                cut.add(m.withOffset(m.offset() - startOffset));
            }
        }

        // Net END count per attribution after the region, scanning backwards.
        Map<Attribution, Integer> openAfter = new LinkedHashMap<>();
        List<SpanMarker> all = markers.view();
        for (int i = all.size() - 1; i >= 0; i--) {
            SpanMarker m = all.get(i);
            if (m.offset() <= endOffset) break;
            openAfter.merge(m.attribution(), m.isEnd() ? 1 : -1, Integer::sum);
        }
        for (Map.Entry<Attribution, Integer> e : openAfter.entrySet()) {
            int count = e.getValue();
            if (count == 1) {
                log.finer(() -> "inserting " + e.getKey() + " END at the end of the copy region");
                cut.add(SpanMarker.end(e.getKey(), endOffset - startOffset));
            } else if (count != 0) {
                throw inconsistent("Found an unbalanced number of `start` and `end` markers after offset: "
                        + endOffset + " - " + this);
            }
        }

        return new AttributedSpans(cut);
    }

    /**
     * Append {@code other} after these spans so that its offset 0 lands on
     * {@code index}. Same attributions meeting at the seam (an END at
     * index - 1 and a START at index) are fused into one span.
     *
     * @throws IllegalArgumentException if {@code index} is not after the last marker
     */
    public void addAt(AttributedSpans other, int index) {
        Objects.requireNonNull(other, "other");
        SpanMarker last = markers.last();
        if (last != null && last.offset() >= index) {
            throw new IllegalArgumentException("Another AttributedSpans can only be appended after the final "
                    + "marker in this AttributedSpans. Final marker: " + last + ", index: " + index);
        }

        log.fine(() -> "pushing `other` markers by: " + index);
        AttributedSpans pushed = other.copy();
        pushed.pushAttributionsBack(index);

        List<SpanMarker> combined = new ArrayList<>(markers.view());
        combined.addAll(pushed.markers.view());
        mergeBackToBackAttributions(combined, index);
        markers.replaceAll(combined);
    }

    /** Fuse END markers at {@code mergePoint - 1} with equal-attribution STARTs at {@code mergePoint}. */
    private static void mergeBackToBackAttributions(List<SpanMarker> combined, int mergePoint) {
        List<SpanMarker> endsAtSeam = new ArrayList<>();
        List<SpanMarker> startsAtSeam = new ArrayList<>();
        for (SpanMarker m : combined) {
            if (m.isEnd() && m.offset() == mergePoint - 1) endsAtSeam.add(m);
            if (m.isStart() && m.offset() == mergePoint) startsAtSeam.add(m);
        }
        for (SpanMarker start : startsAtSeam) {
            for (SpanMarker end : endsAtSeam) {
                if (end.attribution().equals(start.attribution())) {
                    log.finer(() -> "combining left/right spans of " + start.attribution() + " at " + mergePoint);
                    combined.remove(start);
                    combined.remove(end);
                    break;
                }
            }
        }
    }

    // =====================================================================
    // Collapsing
    // =====================================================================

    /**
     * Flatten all lanes into ordered, gapless segments covering
     * [0, contentLength - 1], each listing every attribution active on it.
     * Markers at or past {@code contentLength} are ignored.
     */
    public List<MultiAttributionSpan> collapseSpans(int contentLength) {
        if (contentLength < 0) {
            throw new IllegalArgumentException("contentLength must be >= 0: " + contentLength);
        }
        return SpanCollapser.collapse(markers.view(), contentLength);
    }

    // ---------- helpers ----------

    /**
     * Offsets in [start, end] where coverage by the lane of {@code attribution}
     * can begin: {@code start} itself and every lane START after it. Any span
     * touching the range covers at least one of them.
     */
    private List<Integer> entryOffsets(Attribution attribution, int start, int end) {
        List<Integer> offsets = new ArrayList<>();
        offsets.add(start);
        for (SpanMarker m : markers.markersInLane(attribution, start, end)) {
            if (m.isStart() && m.offset() > start) {
                offsets.add(m.offset());
            }
        }
        return offsets;
    }

    /** First offset in [start, end] covered by {@code attribution}'s lane, or null. */
    private Integer firstOffsetWith(Attribution attribution, int start, int end) {
        for (int offset : entryOffsets(attribution, start, end)) {
            if (hasAttributionAt(offset, attribution)) {
                return offset;
            }
        }
        return null;
    }

    /** Swap {@code marker} for one at the same place carrying {@code attribution}. */
    private void relabel(SpanMarker marker, Attribution attribution) {
        if (marker.attribution().equals(attribution)) {
            return;
        }
        log.finer(() -> "relabelling " + marker + " as " + attribution);
        markers.removeAll(List.of(marker));
        markers.insert(new SpanMarker(attribution, marker.offset(), marker.type()));
    }

    private InconsistentMarkersException inconsistent(String message) {
        log.warning(message);
        log.warning(this::toString);
        return new InconsistentMarkersException(message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributedSpans other)) return false;
        return markers.size() == other.markers.size()
                && new HashSet<>(markers.view()).equals(new HashSet<>(other.markers.view()));
    }

    @Override
    public int hashCode() {
        return new HashSet<>(markers.view()).hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[AttributedSpans] (")
                .append(Math.round(markers.size() / 2.0))
                .append(" spans):");
        for (SpanMarker m : markers.view()) {
            sb.append("\n - ").append(m);
        }
        return sb.toString();
    }
}
