package io.attrspans.cli;

/** An edit script could not be read or one of its operations failed. */
public final class ScriptException extends RuntimeException {

    public ScriptException(String message) {
        super(message);
    }

    public ScriptException(String message, Throwable cause) {
        super(message, cause);
    }
}
