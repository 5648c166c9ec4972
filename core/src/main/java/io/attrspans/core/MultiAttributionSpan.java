package io.attrspans.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A segment of content from {@code start} to {@code end}, inclusive, with
 * every attribution that is active on it. Produced by
 * {@link AttributedSpans#collapseSpans(int)}.
 * <p>
 * The attribution set is copied on construction and keeps the order in
 * which the attributions were opened.
 */
public record MultiAttributionSpan(Set<Attribution> attributions, int start, int end) {

    public MultiAttributionSpan {
        Objects.requireNonNull(attributions, "attributions");
        attributions = Collections.unmodifiableSet(new LinkedHashSet<>(attributions));
    }

    @Override
    public String toString() {
        return "[MultiAttributionSpan] - attributions: " + attributions + ", start: " + start + ", end: " + end;
    }
}
