package com.alterante.nearby.observe;

import com.alterante.nearby.engine.Visibility;
import com.alterante.nearby.transfer.InboundSession;
import com.alterante.nearby.transfer.OutboundSession;
import com.alterante.nearby.transfer.TransferState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans notifications out to every registered observer. A failing observer is logged
 * and skipped so it cannot stall the loop delivering the notification.
 */
public class Observers implements SessionObserver {

    private static final Logger log = LoggerFactory.getLogger(Observers.class);

    private final List<SessionObserver> observers = new CopyOnWriteArrayList<>();

    public void add(SessionObserver observer) {
        observers.add(observer);
    }

    public void remove(SessionObserver observer) {
        observers.remove(observer);
    }

    private void each(Consumer<SessionObserver> call) {
        for (SessionObserver o : observers) {
            try {
                call.accept(o);
            } catch (RuntimeException e) {
                log.warn("Observer {} failed: {}", o, e.getMessage(), e);
            }
        }
    }

    @Override
    public void outboundAdded(OutboundSession session) {
        each(o -> o.outboundAdded(session));
    }

    @Override
    public void endpointUpdated(OutboundSession session) {
        each(o -> o.endpointUpdated(session));
    }

    @Override
    public void outboundChanged(OutboundSession session, TransferState previous) {
        each(o -> o.outboundChanged(session, previous));
    }

    @Override
    public void outboundRemoved(OutboundSession session) {
        each(o -> o.outboundRemoved(session));
    }

    @Override
    public void inboundChanged(InboundSession session) {
        each(o -> o.inboundChanged(session));
    }

    @Override
    public void inboundClosed(InboundSession session) {
        each(o -> o.inboundClosed(session));
    }

    @Override
    public void serviceStateChanged(ServiceState state, Throwable cause) {
        each(o -> o.serviceStateChanged(state, cause));
    }

    @Override
    public void visibilityChanged(Visibility visibility) {
        each(o -> o.visibilityChanged(visibility));
    }
}
