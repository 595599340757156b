package com.alterante.nearby.observe;

import java.util.Optional;

/**
 * Follow-up actions offered on notifications, by their wire id.
 */
public enum NotificationAction {
    CONSENT_ACCEPT("consent-accept"),
    CONSENT_DECLINE("consent-decline"),
    TRANSFER_CANCEL("transfer-cancel"),
    OPEN_FOLDER("open-folder"),
    COPY_TEXT("copy-text");

    private final String id;

    NotificationAction(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<NotificationAction> fromId(String id) {
        for (NotificationAction a : values()) {
            if (a.id.equals(id)) return Optional.of(a);
        }
        return Optional.empty();
    }
}
