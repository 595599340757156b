package com.alterante.nearby.coordinator;

/**
 * Failure of a coordinator operation, classified by {@link ErrorKind}.
 */
public class CoordinatorException extends Exception {

    private final ErrorKind kind;

    public CoordinatorException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CoordinatorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return "CoordinatorException[" + kind + "]: " + getMessage();
    }
}
