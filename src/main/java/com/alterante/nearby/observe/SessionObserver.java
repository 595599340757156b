package com.alterante.nearby.observe;

import com.alterante.nearby.engine.Visibility;
import com.alterante.nearby.transfer.InboundSession;
import com.alterante.nearby.transfer.OutboundSession;
import com.alterante.nearby.transfer.TransferState;

/**
 * Session change notifications for the presentation layer.
 *
 * Session callbacks are delivered on the session loop thread, in event order.
 * Implementations must not block.
 */
public interface SessionObserver {

    /** A newly discovered endpoint got a session. */
    default void outboundAdded(OutboundSession session) {}

    /** Discovery reported new details for a known endpoint. */
    default void endpointUpdated(OutboundSession session) {}

    /**
     * An event or local action was applied. Fired on every progress update;
     * compare {@code previous} with {@link OutboundSession#state()} for transitions.
     */
    default void outboundChanged(OutboundSession session, TransferState previous) {}

    default void outboundRemoved(OutboundSession session) {}

    default void inboundChanged(InboundSession session) {}

    /** The inbound slot was released after a terminal engine state. */
    default void inboundClosed(InboundSession session) {}

    default void serviceStateChanged(ServiceState state, Throwable cause) {}

    default void visibilityChanged(Visibility visibility) {}
}
