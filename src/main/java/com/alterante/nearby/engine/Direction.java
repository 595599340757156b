package com.alterante.nearby.engine;

/**
 * Which side initiated a transfer.
 */
public enum Direction {
    INBOUND,
    OUTBOUND
}
