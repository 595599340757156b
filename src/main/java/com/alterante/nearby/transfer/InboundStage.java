package com.alterante.nearby.transfer;

/**
 * What the presentation layer should show for the inbound slot.
 */
public enum InboundStage {
    AWAITING_CONSENT,   // consent prompt
    IN_PROGRESS,        // accepted, progress view
    DECLINED,           // declined or timed out, waiting for the engine to wind down
    CANCELLING,         // user cancelled a running transfer
    CLOSED              // terminal engine state seen, slot released
}
