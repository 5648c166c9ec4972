package io.attrspans.core;

/**
 * The marker list broke its own Start/End alternation (an open-ended span,
 * two consecutive starts, unbalanced boundary markers).
 * <p>
 * Signals a bug in the engine or markers handed to the constructor that were
 * already corrupt. Callers are not expected to recover from it.
 */
public final class InconsistentMarkersException extends IllegalStateException {

    public InconsistentMarkersException(String message) {
        super(message);
    }
}
