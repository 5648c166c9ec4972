package io.attrspans.core;

/**
 * Thrown by {@link AttributedSpans#addAttribution(Attribution, int, int)} when
 * the new attribution would overlap a same-lane attribution it cannot merge with.
 * The spans are left unchanged.
 */
public final class IncompatibleOverlapException extends RuntimeException {

    private final Attribution existingAttribution;
    private final Attribution newAttribution;
    private final int conflictStart;

    public IncompatibleOverlapException(Attribution existingAttribution, Attribution newAttribution, int conflictStart) {
        super("Tried to insert attribution (" + newAttribution + ") over a conflicting existing attribution ("
                + existingAttribution + "). The overlap began at index " + conflictStart);
        this.existingAttribution = existingAttribution;
        this.newAttribution = newAttribution;
        this.conflictStart = conflictStart;
    }

    public Attribution existingAttribution() { return existingAttribution; }

    public Attribution newAttribution() { return newAttribution; }

    /** First offset of the requested range where the existing attribution is present. */
    public int conflictStart() { return conflictStart; }
}
