package com.alterante.nearby.observe;

import java.util.List;

/**
 * Something worth a desktop notification.
 *
 * @param kind           what happened
 * @param notificationId id to replace or withdraw the notification by
 * @param transferId     transfer the milestone belongs to
 * @param title          usually the remote device name
 * @param body           user-facing text
 * @param actions        follow-up action ids, see {@link NotificationAction}
 * @param parameter      action parameter (folder to open, text to copy), may be null
 */
public record Milestone(
        Kind kind,
        String notificationId,
        String transferId,
        String title,
        String body,
        List<NotificationAction> actions,
        String parameter) {

    public Milestone {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public enum Kind {
        INCOMING_REQUEST,
        TRANSFER_PROGRESS,
        TRANSFER_FINISHED,
        TRANSFER_CANCELLED,
        TRANSFER_FAILED,
        REQUEST_TIMED_OUT
    }
}
