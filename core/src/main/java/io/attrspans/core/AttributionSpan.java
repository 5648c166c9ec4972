package io.attrspans.core;

import java.util.Objects;

/**
 * One attribution applied from {@code start} to {@code end}, inclusive.
 * Derived from a Start/End marker pair on demand; holds no reference back
 * to the {@link AttributedSpans} it came from.
 */
public record AttributionSpan(Attribution attribution, int start, int end) {

    public AttributionSpan {
        Objects.requireNonNull(attribution, "attribution");
    }

    /** Clip this span to fit within [start, end]. */
    public AttributionSpan constrain(int start, int end) {
        return new AttributionSpan(attribution, Math.max(this.start, start), Math.min(this.end, end));
    }

    @Override
    public String toString() {
        return "[AttributionSpan] - " + attribution + ", " + start + " -> " + end;
    }
}
