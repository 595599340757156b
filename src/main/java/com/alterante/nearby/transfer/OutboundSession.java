package com.alterante.nearby.transfer;

import com.alterante.nearby.engine.EndpointInfo;
import com.alterante.nearby.engine.ProtocolEvent;
import com.alterante.nearby.engine.ProtocolState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A send attempt towards one endpoint. Keyed by endpoint id, which the engine
 * also uses as the transfer id of outbound events.
 *
 * Mutated only on the session loop while holding the {@link TransferStore} lock.
 */
public class OutboundSession {

    private static final Logger log = LoggerFactory.getLogger(OutboundSession.class);

    private final String id;
    private volatile EndpointInfo endpoint;
    private volatile List<Path> files = List.of();
    private volatile TransferState state = TransferState.AWAITING_CONSENT_OR_IDLE;
    private volatile ProtocolEvent lastEvent;
    private final EtaEstimator eta;

    public OutboundSession(EndpointInfo endpoint) {
        this(endpoint, new EtaEstimator(0));
    }

    OutboundSession(EndpointInfo endpoint, EtaEstimator eta) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.id = endpoint.id();
        this.eta = eta;
    }

    /**
     * Apply an engine event for this session's id.
     *
     * @return the state before the event
     */
    public TransferState apply(ProtocolEvent event) {
        if (!id.equals(event.transferId())) {
            throw new IllegalArgumentException("Event for " + event.transferId() + " applied to session " + id);
        }
        TransferState previous = state;
        ProtocolState ps = event.state();

        if (ps.isOutboundRequest()) {
            state = TransferState.REQUESTED_FOR_CONSENT;
            eta.prepareForNewTransfer(OptionalLong.empty());
            lastEvent = event;
        } else if (ps == ProtocolState.SENDING_FILES) {
            state = TransferState.ONGOING_TRANSFER;
            stepEta(event);
            lastEvent = event;
        } else if (ps == ProtocolState.DISCONNECTED || ps == ProtocolState.REJECTED) {
            // The engine does not tell a declined request from a dropped link yet.
            state = TransferState.FAILED;
            lastEvent = event;
        } else if (ps == ProtocolState.CANCELLED) {
            state = TransferState.AWAITING_CONSENT_OR_IDLE;
            lastEvent = null;
        } else if (ps == ProtocolState.FINISHED) {
            state = TransferState.DONE;
            lastEvent = event;
        } else {
            lastEvent = event;
        }

        if (previous != state) {
            log.debug("Outbound {}: {} -> {} on {}", id, previous, state, ps);
        }
        return previous;
    }

    private void stepEta(ProtocolEvent event) {
        if (event.metadata() == null) return;
        if (eta.totalLen() == 0 && event.totalBytes() > 0 && eta.isIdle()) {
            eta.prepareForNewTransfer(OptionalLong.of(event.totalBytes()));
        }
        long ack = event.ackBytes();
        if (ack < eta.totalTransferred()) {
            log.debug("Outbound {}: ack count went back from {} to {}, restarting estimate",
                    id, eta.totalTransferred(), ack);
            eta.prepareForNewTransfer(OptionalLong.empty());
        }
        eta.stepWith(ack);
    }

    /**
     * Record the files of a send request and restart the estimate with their size.
     */
    void prepareSend(List<Path> files, long totalSize) {
        this.files = List.copyOf(files);
        eta.prepareForNewTransfer(OptionalLong.of(totalSize));
    }

    void markQueued() {
        state = TransferState.QUEUED;
    }

    /** The engine refused the send request before emitting any event for it. */
    TransferState markFailed() {
        TransferState previous = state;
        state = TransferState.FAILED;
        return previous;
    }

    void updateEndpoint(EndpointInfo endpoint) {
        if (!id.equals(endpoint.id())) {
            throw new IllegalArgumentException("Endpoint " + endpoint.id() + " does not belong to session " + id);
        }
        this.endpoint = endpoint;
    }

    /** True while the engine is still working on the last attempt. */
    public boolean hasActiveEvent() {
        ProtocolEvent e = lastEvent;
        return e != null && e.state() != ProtocolState.INITIAL && !e.state().isTerminal();
    }

    /** Pin code to compare with the receiving device, while consent is pending. */
    public String pinCode() {
        ProtocolEvent e = lastEvent;
        if (state != TransferState.REQUESTED_FOR_CONSENT || e == null || e.pinCode() == null) {
            return "???";
        }
        return e.pinCode();
    }

    public double progress() {
        ProtocolEvent e = lastEvent;
        return e == null || e.metadata() == null ? 0 : e.metadata().fraction();
    }

    public String etaText() {
        return "About " + eta.estimate() + " left";
    }

    public String finishedSummary() {
        int n = files.size();
        return "Sent " + n + (n == 1 ? " file" : " files");
    }

    public String id() { return id; }
    public EndpointInfo endpoint() { return endpoint; }
    public List<Path> files() { return files; }
    public TransferState state() { return state; }
    public ProtocolEvent lastEvent() { return lastEvent; }
    public EtaEstimator eta() { return eta; }

    @Override
    public String toString() {
        return "OutboundSession{" + id + " " + state + " " + endpoint + "}";
    }
}
