package com.alterante.nearby.transfer;

import com.alterante.nearby.engine.EndpointInfo;
import com.alterante.nearby.observe.SessionObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Applies discovery records to the outbound sessions of a {@link TransferStore}:
 * one session per endpoint id, carrying the latest record seen for it.
 */
public class DiscoveryRegistry {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryRegistry.class);

    private final TransferStore store;
    private final SessionObserver observer;
    private volatile boolean discoveryOn;

    public DiscoveryRegistry(TransferStore store, SessionObserver observer) {
        this.store = store;
        this.observer = observer;
    }

    /**
     * Insert or update the session for a discovered endpoint.
     */
    public TransferStore.Upsert upsert(EndpointInfo endpoint) {
        TransferStore.Upsert result = store.upsertEndpoint(endpoint);
        if (result.created()) {
            log.info("Discovered endpoint {}", endpoint);
            observer.outboundAdded(result.session());
        } else {
            log.info("Updated endpoint {}", endpoint);
            observer.endpointUpdated(result.session());
        }
        return result;
    }

    /** Endpoints of all current outbound sessions, newest first. */
    public List<EndpointInfo> endpoints() {
        return store.outboundSessions().stream()
                .map(OutboundSession::endpoint)
                .toList();
    }

    public boolean isDiscoveryOn() {
        return discoveryOn;
    }

    /** Record whether discovery is running, so it can be restored after an engine restart. */
    public void discoveryStarted() {
        discoveryOn = true;
    }

    public void discoveryStopped() {
        discoveryOn = false;
    }
}
