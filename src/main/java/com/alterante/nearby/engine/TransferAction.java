package com.alterante.nearby.engine;

/**
 * Actions the client sends back to the engine on the message channel.
 */
public enum TransferAction {
    CONSENT_ACCEPT,
    CONSENT_DECLINE,
    TRANSFER_CANCEL
}
