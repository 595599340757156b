package com.alterante.nearby.coordinator;

/**
 * Which side a supervised task runs on.
 */
public enum Scheduler {
    RUNTIME,    // engine calls, channel relays, timers
    SESSION     // loops that apply changes through the session loop
}
