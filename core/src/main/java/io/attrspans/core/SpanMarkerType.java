package io.attrspans.core;

/** Whether a {@link SpanMarker} opens or closes a span. */
public enum SpanMarkerType {
    START, END
}
