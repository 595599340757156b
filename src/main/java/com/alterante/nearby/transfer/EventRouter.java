package com.alterante.nearby.transfer;

import com.alterante.nearby.engine.ChannelMessage;
import com.alterante.nearby.engine.EngineException;
import com.alterante.nearby.engine.ProtocolEvent;
import com.alterante.nearby.engine.ProtocolState;
import com.alterante.nearby.engine.TransferAction;
import com.alterante.nearby.observe.Milestone;
import com.alterante.nearby.observe.MilestoneSink;
import com.alterante.nearby.observe.NotificationAction;
import com.alterante.nearby.observe.SessionObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Applies engine messages to the session they belong to.
 *
 * Runs on the session loop only: the forwarding loop calls {@link #route} once per
 * message, in arrival order, and user decisions come in through {@link #applyUserAction}.
 *
 * <pre>
 * engine-internal (lib) message     -> dropped
 * handshake sub-states              -> dropped
 * WaitingForUserConsent             -> new inbound session (direction tag not trusted)
 * other states, direction INBOUND   -> inbound slot, if the id still matches
 * other states, direction OUTBOUND  -> outbound session with that id, if any
 * </pre>
 */
public class EventRouter {

    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    private final TransferStore store;
    private final SessionObserver observer;
    private final MilestoneSink milestones;
    private final ActionSink actions;
    private final ScheduledExecutorService timers;
    private final Executor sessionLoop;
    private final Duration consentTimeout;
    private final Supplier<Path> downloadDir;

    public EventRouter(TransferStore store,
                       SessionObserver observer,
                       MilestoneSink milestones,
                       ActionSink actions,
                       ScheduledExecutorService timers,
                       Executor sessionLoop,
                       Duration consentTimeout,
                       Supplier<Path> downloadDir) {
        this.store = store;
        this.observer = observer;
        this.milestones = milestones;
        this.actions = actions;
        this.timers = timers;
        this.sessionLoop = sessionLoop;
        this.consentTimeout = consentTimeout;
        this.downloadDir = downloadDir;
    }

    /** Apply one message from the engine's channel. */
    public void route(ChannelMessage message) {
        if (!message.isClient()) {
            log.trace("Ignoring lib message {} for {}", message.action(), message.transferId());
            return;
        }
        ProtocolEvent event = message.event();
        log.debug("Routing {} {} for {}", event.direction(), event.state(), event.transferId());

        switch (event.state()) {
            case INITIAL,
                 RECEIVED_CONNECTION_REQUEST,
                 SENT_UKEY_SERVER_INIT,
                 SENT_PAIRED_KEY_ENCRYPTION,
                 RECEIVED_UKEY_CLIENT_FINISH,
                 SENT_CONNECTION_RESPONSE,
                 SENT_PAIRED_KEY_RESULT,
                 RECEIVED_PAIRED_KEY_RESULT -> {
                // handshake internals
            }
            case WAITING_FOR_USER_CONSENT -> startInbound(event);
            default -> {
                switch (event.direction()) {
                    case INBOUND -> applyInbound(event);
                    case OUTBOUND -> applyOutbound(event);
                }
            }
        }
    }

    // ---- outbound ----

    private void applyOutbound(ProtocolEvent event) {
        Optional<OutboundSession> found = store.outbound(event.transferId());
        if (found.isEmpty()) {
            log.debug("No outbound session for {}, dropping {}", event.transferId(), event.state());
            return;
        }
        OutboundSession session = found.get();
        TransferState previous = store.locked(() -> session.apply(event));
        observer.outboundChanged(session, previous);
    }

    // ---- inbound ----

    private void startInbound(ProtocolEvent event) {
        InboundSession session = new InboundSession(event);
        if (!store.occupyInbound(session)) {
            InboundSession current = store.inbound().orElse(null);
            if (current != null && current.transferId().equals(event.transferId())) {
                log.debug("Duplicate consent request for {}", event.transferId());
                return;
            }
            log.warn("Inbound request {} from {} while {} is active, declining",
                    event.transferId(), event.deviceName(), current == null ? "?" : current.transferId());
            try {
                actions.sendAction(event.transferId(), TransferAction.CONSENT_DECLINE);
            } catch (EngineException e) {
                log.warn("Could not decline {}: {}", event.transferId(), e.getMessage());
            }
            return;
        }

        log.info("Incoming request {} from {} (pin {})", session.transferId(), session.deviceName(), session.pinCode());
        session.armAutoDecline(AutoDecline.start(timers, consentTimeout,
                () -> sessionLoop.execute(() -> onConsentTimeout(session))));

        milestones.publish(new Milestone(
                Milestone.Kind.INCOMING_REQUEST,
                session.notificationId(),
                session.transferId(),
                session.deviceName(),
                requestBody(session),
                List.of(NotificationAction.CONSENT_ACCEPT, NotificationAction.CONSENT_DECLINE),
                null));
        observer.inboundChanged(session);
    }

    private void onConsentTimeout(InboundSession session) {
        if (!isCurrentInbound(session)) {
            return;
        }
        if (!store.locked(() -> session.canSetUserAction(UserAction.CONSENT_DECLINE))) {
            return;
        }
        try {
            actions.sendAction(session.transferId(), TransferAction.CONSENT_DECLINE);
        } catch (EngineException e) {
            log.warn("Could not send timeout decline for {}: {}", session.transferId(), e.getMessage());
        }
        if (!store.locked(session::timeOut)) {
            return;
        }
        log.info("Request {} from {} timed out", session.transferId(), session.deviceName());
        milestones.withdraw(session.notificationId());
        milestones.publish(new Milestone(
                Milestone.Kind.REQUEST_TIMED_OUT,
                session.notificationId(),
                session.transferId(),
                session.deviceName(),
                "Request timed out",
                List.of(),
                null));
        observer.inboundChanged(session);
    }

    /**
     * Apply a user decision to the inbound slot and forward it to the engine.
     *
     * @return false if the session is no longer in the slot or the action is not
     *         allowed in its current phase
     * @throws EngineException if the engine did not take the action; the session is left unchanged
     */
    public boolean applyUserAction(InboundSession session, UserAction action) throws EngineException {
        if (!isCurrentInbound(session) || !store.locked(() -> session.canSetUserAction(action))) {
            return false;
        }
        actions.sendAction(session.transferId(), action.engineAction());
        if (!store.locked(() -> session.trySetUserAction(action))) {
            return false;
        }
        log.info("Inbound {}: {}", session.transferId(), action);

        switch (action) {
            case CONSENT_ACCEPT -> milestones.publish(new Milestone(
                    Milestone.Kind.TRANSFER_PROGRESS,
                    session.notificationId(),
                    session.transferId(),
                    session.deviceName(),
                    "Receiving...",
                    List.of(NotificationAction.TRANSFER_CANCEL),
                    null));
            case CONSENT_DECLINE, TRANSFER_CANCEL -> milestones.withdraw(session.notificationId());
        }
        observer.inboundChanged(session);
        return true;
    }

    private void applyInbound(ProtocolEvent event) {
        Optional<InboundSession> found = store.inbound()
                .filter(s -> s.transferId().equals(event.transferId()));
        if (found.isEmpty()) {
            log.debug("No inbound session for {}, dropping {}", event.transferId(), event.state());
            return;
        }
        InboundSession session = found.get();
        store.locked(() -> session.apply(event));

        ProtocolState ps = event.state();
        if (!ps.isTerminal()) {
            observer.inboundChanged(session);
            return;
        }

        switch (ps) {
            case DISCONNECTED -> milestones.publish(new Milestone(
                    Milestone.Kind.TRANSFER_FAILED,
                    session.notificationId(),
                    session.transferId(),
                    session.deviceName(),
                    "Unexpected disconnection",
                    List.of(),
                    null));
            case CANCELLED -> {
                // also emitted after our own cancel
                if (!session.isUserCancelled()) {
                    milestones.publish(new Milestone(
                            Milestone.Kind.TRANSFER_CANCELLED,
                            session.notificationId(),
                            session.transferId(),
                            session.deviceName(),
                            "Transfer cancelled by sender",
                            List.of(),
                            null));
                }
            }
            case FINISHED -> {
                if (session.wasAccepted()) {
                    milestones.publish(finishedMilestone(session));
                }
            }
            default -> {
            }
        }

        store.releaseInbound(session.transferId());
        log.info("Inbound {} closed on {}", session.transferId(), ps);
        observer.inboundClosed(session);
    }

    private Milestone finishedMilestone(InboundSession session) {
        Optional<String> text = session.transferredText();
        if (text.isPresent()) {
            return new Milestone(
                    Milestone.Kind.TRANSFER_FINISHED,
                    session.notificationId(),
                    session.transferId(),
                    session.deviceName(),
                    "Received " + session.payloadKind().name().toLowerCase(),
                    List.of(NotificationAction.COPY_TEXT),
                    text.get());
        }
        int n = session.files().size();
        Path folder = downloadDir.get();
        return new Milestone(
                Milestone.Kind.TRANSFER_FINISHED,
                session.notificationId(),
                session.transferId(),
                session.deviceName(),
                "Received " + n + (n == 1 ? " file" : " files"),
                List.of(NotificationAction.OPEN_FOLDER),
                folder == null ? null : folder.toString());
    }

    private boolean isCurrentInbound(InboundSession session) {
        return store.inbound().map(s -> s == session).orElse(false);
    }

    private static String requestBody(InboundSession session) {
        if (session.isTextType()) {
            return session.deviceName() + " wants to share "
                    + session.textPreview().map(p -> "\"" + p + "\"").orElse("text");
        }
        int n = session.files().size();
        return session.deviceName() + " wants to share " + n + (n == 1 ? " file" : " files");
    }
}
