package com.alterante.nearby.coordinator;

public enum ErrorKind {
    SERVICE_UNAVAILABLE,    // engine stopped, stopping or failed to start
    NOT_INITIALIZED,        // engine still starting
    NO_SUCH_ENDPOINT,
    NO_SUCH_TRANSFER,
    INVALID_ACTION,         // not allowed in the session's current state
    ENGINE_FAILURE          // the engine rejected or failed the request
}
