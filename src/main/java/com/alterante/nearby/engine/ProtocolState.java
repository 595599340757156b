package com.alterante.nearby.engine;

/**
 * Transfer phases reported by the protocol engine.
 * Handshake sub-states are only meaningful to the engine itself.
 */
public enum ProtocolState {

    INITIAL,

    // inbound handshake
    RECEIVED_CONNECTION_REQUEST,
    SENT_UKEY_SERVER_INIT,
    RECEIVED_UKEY_CLIENT_FINISH,
    SENT_CONNECTION_RESPONSE,
    SENT_PAIRED_KEY_RESULT,
    RECEIVED_PAIRED_KEY_RESULT,
    SENT_PAIRED_KEY_ENCRYPTION,
    WAITING_FOR_USER_CONSENT,
    RECEIVING_FILES,

    // outbound handshake
    SENT_UKEY_CLIENT_INIT,
    SENT_UKEY_CLIENT_FINISH,
    SENT_INTRODUCTION,
    SENDING_FILES,

    DISCONNECTED,
    REJECTED,
    CANCELLED,
    FINISHED;

    /** True for states after which the engine emits nothing more for the transfer. */
    public boolean isTerminal() {
        return switch (this) {
            case DISCONNECTED, REJECTED, CANCELLED, FINISHED -> true;
            default -> false;
        };
    }

    /** Outbound states that mean the request is sitting with the remote user. */
    public boolean isOutboundRequest() {
        return this == SENT_UKEY_CLIENT_INIT
                || this == SENT_UKEY_CLIENT_FINISH
                || this == SENT_INTRODUCTION;
    }
}
