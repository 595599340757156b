package com.alterante.nearby.transfer;

import com.alterante.nearby.engine.EndpointInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owner of all session state: outbound sessions by id (plus their presentation order,
 * newest first) and the single inbound slot.
 *
 * One instance is shared by the event forwarding loops and the coordinator's
 * user-triggered operations; every access goes through the same lock.
 */
public class TransferStore {

    private static final Logger log = LoggerFactory.getLogger(TransferStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, OutboundSession> outboundById = new HashMap<>();
    private final List<OutboundSession> outboundOrder = new ArrayList<>();
    private InboundSession inbound;

    /** Run a compound operation atomically with respect to every other store access. */
    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void locked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    // ---- outbound ----

    public Optional<OutboundSession> outbound(String id) {
        return locked(() -> Optional.ofNullable(outboundById.get(id)));
    }

    /**
     * Insert a session for a newly seen endpoint, or refresh the endpoint of an existing one.
     */
    public Upsert upsertEndpoint(EndpointInfo endpoint) {
        return locked(() -> {
            OutboundSession existing = outboundById.get(endpoint.id());
            if (existing != null) {
                existing.updateEndpoint(endpoint);
                return new Upsert(existing, false);
            }
            OutboundSession created = new OutboundSession(endpoint);
            outboundById.put(created.id(), created);
            outboundOrder.add(0, created);
            return new Upsert(created, true);
        });
    }

    /**
     * Record a send request on a session, queueing it if another session holds the
     * transfer slot.
     *
     * @return the session's state after the request
     */
    public TransferState prepareSend(OutboundSession session, List<Path> files, long totalSize) {
        return locked(() -> {
            session.prepareSend(files, totalSize);
            if (otherHoldsTransferSlot(session.id())) {
                session.markQueued();
                log.info("Send to {} queued behind an active transfer", session.endpoint().displayName());
            }
            return session.state();
        });
    }

    /**
     * Mark a session failed after the engine rejected its send request.
     *
     * @return the state before
     */
    public TransferState markSendFailed(OutboundSession session) {
        return locked(session::markFailed);
    }

    private boolean otherHoldsTransferSlot(String id) {
        for (OutboundSession s : outboundOrder) {
            if (!s.id().equals(id) && s.state().holdsTransferSlot()) return true;
        }
        return false;
    }

    public boolean anyHoldsTransferSlot() {
        return locked(() -> otherHoldsTransferSlot(null));
    }

    /** Snapshot in presentation order, newest first. */
    public List<OutboundSession> outboundSessions() {
        return locked(() -> List.copyOf(outboundOrder));
    }

    public int outboundCount() {
        return locked(outboundById::size);
    }

    /**
     * Drop every idle, failed or finished session. Queued and active ones survive.
     *
     * @return the removed sessions
     */
    public List<OutboundSession> refresh() {
        return locked(() -> {
            List<OutboundSession> removed = new ArrayList<>();
            outboundOrder.removeIf(s -> {
                if (s.state().isRefreshable()) {
                    outboundById.remove(s.id());
                    removed.add(s);
                    return true;
                }
                return false;
            });
            return removed;
        });
    }

    /** True if no outbound session has a non-terminal engine event outstanding. */
    public boolean isNoFileBeingSent() {
        return locked(() -> {
            for (OutboundSession s : outboundOrder) {
                if (s.hasActiveEvent()) return false;
            }
            return true;
        });
    }

    // ---- inbound ----

    public Optional<InboundSession> inbound() {
        return locked(() -> Optional.ofNullable(inbound));
    }

    /**
     * Put a session in the inbound slot.
     *
     * @return false if the slot is already taken
     */
    public boolean occupyInbound(InboundSession session) {
        return locked(() -> {
            if (inbound != null) {
                return false;
            }
            inbound = session;
            return true;
        });
    }

    /**
     * Release the slot, but only for the transfer it was created for.
     */
    public Optional<InboundSession> releaseInbound(String transferId) {
        return locked(() -> {
            if (inbound == null || !inbound.transferId().equals(transferId)) {
                return Optional.empty();
            }
            InboundSession released = inbound;
            inbound = null;
            return Optional.of(released);
        });
    }

    /** Result of {@link #upsertEndpoint}. */
    public record Upsert(OutboundSession session, boolean created) {
    }
}
