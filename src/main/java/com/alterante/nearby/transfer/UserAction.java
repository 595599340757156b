package com.alterante.nearby.transfer;

import com.alterante.nearby.engine.TransferAction;

/**
 * Local decision on an inbound transfer. Unset is represented by an empty value.
 */
public enum UserAction {
    CONSENT_ACCEPT(TransferAction.CONSENT_ACCEPT),
    CONSENT_DECLINE(TransferAction.CONSENT_DECLINE),
    TRANSFER_CANCEL(TransferAction.TRANSFER_CANCEL);

    private final TransferAction engineAction;

    UserAction(TransferAction engineAction) {
        this.engineAction = engineAction;
    }

    public TransferAction engineAction() {
        return engineAction;
    }
}
