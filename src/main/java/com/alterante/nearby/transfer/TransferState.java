package com.alterante.nearby.transfer;

/**
 * Presentation-level state of an outbound session.
 */
public enum TransferState {
    AWAITING_CONSENT_OR_IDLE,   // default; also where a cancelled send lands
    QUEUED,                     // send requested while another transfer holds the link
    REQUESTED_FOR_CONSENT,      // request delivered, remote user deciding
    ONGOING_TRANSFER,
    FAILED,
    DONE;

    /** States that occupy the single transfer slot of the protocol. */
    public boolean holdsTransferSlot() {
        return this == REQUESTED_FOR_CONSENT || this == ONGOING_TRANSFER;
    }

    /** States a recipient refresh discards. */
    public boolean isRefreshable() {
        return this == AWAITING_CONSENT_OR_IDLE || this == FAILED || this == DONE;
    }
}
