package com.alterante.nearby.engine;

/**
 * Thrown when the protocol engine cannot carry out a request.
 */
public class EngineException extends Exception {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
