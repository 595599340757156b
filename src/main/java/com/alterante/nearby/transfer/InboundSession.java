package com.alterante.nearby.transfer;

import com.alterante.nearby.engine.PayloadKind;
import com.alterante.nearby.engine.ProtocolEvent;
import com.alterante.nearby.engine.ProtocolState;
import com.alterante.nearby.engine.TransferMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * The single inbound transfer, from the consent request to a terminal engine state.
 *
 * User actions are write-once per phase: accept or decline while unset, cancel only
 * after an accept.
 */
public class InboundSession {

    private static final Logger log = LoggerFactory.getLogger(InboundSession.class);

    private final String transferId;
    private final String notificationId;
    private final ProtocolEvent request;
    private final EtaEstimator eta;

    private volatile ProtocolEvent lastEvent;
    private volatile UserAction userAction;
    private volatile InboundStage stage = InboundStage.AWAITING_CONSENT;
    private volatile boolean userCancelled;
    private volatile boolean timedOut;
    private volatile AutoDecline autoDecline = AutoDecline.settled();

    public InboundSession(ProtocolEvent request) {
        this(request, UUID.randomUUID().toString());
    }

    InboundSession(ProtocolEvent request, String notificationId) {
        if (request.state() != ProtocolState.WAITING_FOR_USER_CONSENT) {
            throw new IllegalArgumentException("Inbound session must start on a consent request, got " + request.state());
        }
        this.request = request;
        this.lastEvent = request;
        this.transferId = request.transferId();
        this.notificationId = Objects.requireNonNull(notificationId, "notificationId");
        this.eta = new EtaEstimator(Math.max(0, request.totalBytes()));
    }

    void armAutoDecline(AutoDecline race) {
        this.autoDecline = race;
    }

    /**
     * Record the user's decision.
     *
     * @return false if the action is not allowed in the current phase
     */
    public boolean trySetUserAction(UserAction action) {
        if (!canSetUserAction(action)) {
            log.debug("Inbound {}: ignoring {} (current action {}, stage {})", transferId, action, userAction, stage);
            return false;
        }
        autoDecline.cancel();
        userAction = action;
        switch (action) {
            case CONSENT_ACCEPT -> stage = InboundStage.IN_PROGRESS;
            case CONSENT_DECLINE -> stage = InboundStage.DECLINED;
            case TRANSFER_CANCEL -> {
                userCancelled = true;
                stage = InboundStage.CANCELLING;
            }
        }
        return true;
    }

    /** Whether {@link #trySetUserAction} would accept the action right now. */
    public boolean canSetUserAction(UserAction action) {
        UserAction current = userAction;
        return switch (action) {
            case CONSENT_ACCEPT, CONSENT_DECLINE -> current == null && stage == InboundStage.AWAITING_CONSENT;
            case TRANSFER_CANCEL -> current == UserAction.CONSENT_ACCEPT && stage == InboundStage.IN_PROGRESS;
        };
    }

    /**
     * Decline because nobody answered in time. Only succeeds while no action is set.
     */
    boolean timeOut() {
        if (!trySetUserAction(UserAction.CONSENT_DECLINE)) {
            return false;
        }
        timedOut = true;
        return true;
    }

    /**
     * Apply an inbound engine event with a matching id.
     */
    public void apply(ProtocolEvent event) {
        if (!transferId.equals(event.transferId())) {
            throw new IllegalArgumentException("Event for " + event.transferId() + " applied to inbound " + transferId);
        }
        autoDecline.cancel();
        lastEvent = event;

        ProtocolState ps = event.state();
        if (ps == ProtocolState.RECEIVING_FILES && !isTextType() && event.metadata() != null) {
            if (eta.totalLen() == 0 && event.totalBytes() > 0 && eta.isIdle()) {
                eta.prepareForNewTransfer(OptionalLong.of(event.totalBytes()));
            }
            if (event.ackBytes() >= eta.totalTransferred()) {
                eta.stepWith(event.ackBytes());
            }
        } else if (ps.isTerminal()) {
            stage = InboundStage.CLOSED;
        }
    }

    /** True if a running transfer was cancelled from this side. */
    public boolean isUserCancelled() {
        return userCancelled;
    }

    public boolean wasAccepted() {
        UserAction a = userAction;
        return a == UserAction.CONSENT_ACCEPT || a == UserAction.TRANSFER_CANCEL;
    }

    public String deviceName() {
        return request.deviceName();
    }

    public List<String> files() {
        TransferMetadata m = request.metadata();
        return m == null ? List.of() : m.files();
    }

    public Optional<String> textPreview() {
        TransferMetadata m = request.metadata();
        return m == null ? Optional.empty() : Optional.ofNullable(m.textPreview());
    }

    public boolean isTextType() {
        return request.isTextType();
    }

    public PayloadKind payloadKind() {
        TransferMetadata m = request.metadata();
        return m == null ? PayloadKind.FILES : m.payloadKind();
    }

    /** The received text, once a text-like transfer has finished. */
    public Optional<String> transferredText() {
        TransferMetadata m = lastEvent.metadata();
        if (m == null || !m.payloadKind().isText()) return Optional.empty();
        return Optional.ofNullable(m.textPayload());
    }

    public String pinCode() {
        String pin = request.pinCode();
        return pin == null ? "???" : pin;
    }

    public String etaText() {
        return "About " + eta.estimate() + " left";
    }

    public double progress() {
        TransferMetadata m = lastEvent.metadata();
        return m == null ? 0 : m.fraction();
    }

    public String transferId() { return transferId; }
    public String notificationId() { return notificationId; }
    public ProtocolEvent request() { return request; }
    public ProtocolEvent lastEvent() { return lastEvent; }
    public Optional<UserAction> userAction() { return Optional.ofNullable(userAction); }
    public InboundStage stage() { return stage; }
    public boolean isTimedOut() { return timedOut; }
    public EtaEstimator eta() { return eta; }
    public AutoDecline autoDecline() { return autoDecline; }

    @Override
    public String toString() {
        return "InboundSession{" + transferId + " " + stage + " action=" + userAction + "}";
    }
}
