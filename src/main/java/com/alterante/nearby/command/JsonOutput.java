package com.alterante.nearby.command;

import com.alterante.nearby.engine.EndpointInfo;
import com.alterante.nearby.engine.Visibility;
import com.alterante.nearby.observe.Milestone;
import com.alterante.nearby.observe.NotificationAction;
import com.alterante.nearby.observe.ServiceState;
import com.alterante.nearby.transfer.InboundSession;
import com.alterante.nearby.transfer.OutboundSession;
import com.alterante.nearby.transfer.TransferState;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Emits newline-delimited JSON events to stdout for machine-readable output.
 * Used by ReplayCommand when --json flag is set.
 */
final class JsonOutput {

    private JsonOutput() {}

    static void service(ServiceState state) {
        emit("{\"event\":\"service\",\"state\":\"%s\"}", state.name().toLowerCase());
    }

    static void endpoint(EndpointInfo e, boolean created) {
        emit("{\"event\":\"%s\",\"id\":\"%s\",\"name\":\"%s\",\"present\":%b}",
                created ? "endpoint_added" : "endpoint_updated",
                escapeJson(e.id()),
                escapeJson(e.displayName()),
                e.present());
    }

    static void outbound(OutboundSession s, TransferState previous) {
        emit("{\"event\":\"outbound\",\"id\":\"%s\",\"state\":\"%s\",\"previous\":\"%s\",\"pin\":\"%s\",\"percent\":%.1f,\"eta\":\"%s\"}",
                escapeJson(s.id()),
                s.state().name().toLowerCase(),
                previous.name().toLowerCase(),
                escapeJson(s.pinCode()),
                s.progress() * 100,
                escapeJson(s.eta().estimate()));
    }

    static void outboundRemoved(OutboundSession s) {
        emit("{\"event\":\"outbound_removed\",\"id\":\"%s\"}", escapeJson(s.id()));
    }

    static void inbound(InboundSession s) {
        emit("{\"event\":\"inbound\",\"id\":\"%s\",\"device\":\"%s\",\"stage\":\"%s\",\"state\":\"%s\",\"pin\":\"%s\",\"percent\":%.1f}",
                escapeJson(s.transferId()),
                escapeJson(s.deviceName()),
                s.stage().name().toLowerCase(),
                s.lastEvent().state().name().toLowerCase(),
                escapeJson(s.pinCode()),
                s.progress() * 100);
    }

    static void inboundClosed(InboundSession s) {
        emit("{\"event\":\"inbound_closed\",\"id\":\"%s\",\"state\":\"%s\",\"timed_out\":%b}",
                escapeJson(s.transferId()),
                s.lastEvent().state().name().toLowerCase(),
                s.isTimedOut());
    }

    static void milestone(Milestone m) {
        String actions = m.actions().stream()
                .map(NotificationAction::id)
                .map(a -> "\"" + a + "\"")
                .collect(Collectors.joining(","));
        emit("{\"event\":\"milestone\",\"kind\":\"%s\",\"transfer\":\"%s\",\"title\":\"%s\",\"body\":\"%s\",\"actions\":[%s]}",
                m.kind().name().toLowerCase(),
                escapeJson(m.transferId()),
                escapeJson(m.title()),
                escapeJson(m.body()),
                actions);
    }

    static void withdrawn(String notificationId) {
        emit("{\"event\":\"milestone_withdrawn\",\"notification\":\"%s\"}", escapeJson(notificationId));
    }

    static void visibility(Visibility v) {
        emit("{\"event\":\"visibility\",\"value\":\"%s\"}", v.name().toLowerCase());
    }

    static void summary(int outbound, long done, long failed) {
        emit("{\"event\":\"summary\",\"outbound\":%d,\"done\":%d,\"failed\":%d}", outbound, done, failed);
    }

    static void error(String message) {
        emit("{\"event\":\"error\",\"message\":\"%s\"}", escapeJson(message));
    }

    private static void emit(String format, Object... args) {
        System.out.println(String.format(Locale.ROOT, format, args));
        System.out.flush();
    }

    private static String escapeJson(String s) {
        if (s == null) return "";
        return s.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
