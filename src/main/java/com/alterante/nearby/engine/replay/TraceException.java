package com.alterante.nearby.engine.replay;

/**
 * Malformed engine trace.
 */
public class TraceException extends Exception {

    private final int line;

    public TraceException(int line, String message) {
        super("line " + line + ": " + message);
        this.line = line;
    }

    public TraceException(int line, String message, Throwable cause) {
        super("line " + line + ": " + message, cause);
        this.line = line;
    }

    public int line() {
        return line;
    }
}
