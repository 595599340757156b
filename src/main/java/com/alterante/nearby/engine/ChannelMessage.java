package com.alterante.nearby.engine;

import java.util.Objects;

/**
 * One message on the engine's bidirectional channel.
 *
 * Client messages carry a {@link ProtocolEvent} produced by the engine. Lib messages
 * carry a {@link TransferAction} published by this client and are echoed back to
 * every subscriber, so consumers must skip them.
 */
public record ChannelMessage(String transferId, ProtocolEvent event, TransferAction action) {

    public ChannelMessage {
        Objects.requireNonNull(transferId, "transferId");
        if ((event == null) == (action == null)) {
            throw new IllegalArgumentException("exactly one of event or action must be set");
        }
    }

    public static ChannelMessage client(ProtocolEvent event) {
        return new ChannelMessage(event.transferId(), event, null);
    }

    public static ChannelMessage lib(String transferId, TransferAction action) {
        return new ChannelMessage(transferId, null, action);
    }

    public boolean isClient() {
        return event != null;
    }
}
