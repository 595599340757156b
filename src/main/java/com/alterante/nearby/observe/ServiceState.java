package com.alterante.nearby.observe;

/**
 * Engine lifecycle as shown to the user.
 */
public enum ServiceState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING,
    UNAVAILABLE     // start or restart failed; the user may retry
}
