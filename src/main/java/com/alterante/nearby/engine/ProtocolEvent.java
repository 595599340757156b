package com.alterante.nearby.engine;

import java.util.Objects;

/**
 * A transfer-state message emitted by the engine. Immutable.
 */
public record ProtocolEvent(String transferId, Direction direction, ProtocolState state, TransferMetadata metadata) {

    public ProtocolEvent {
        Objects.requireNonNull(transferId, "transferId");
        Objects.requireNonNull(direction, "direction");
        if (state == null) state = ProtocolState.INITIAL;
    }

    public ProtocolEvent(String transferId, Direction direction, ProtocolState state) {
        this(transferId, direction, state, null);
    }

    public long ackBytes() {
        return metadata == null ? 0 : metadata.ackBytes();
    }

    public long totalBytes() {
        return metadata == null ? 0 : metadata.totalBytes();
    }

    public String pinCode() {
        return metadata == null ? null : metadata.pinCode();
    }

    public String deviceName() {
        if (metadata == null || metadata.sourceDeviceName() == null) {
            return EndpointInfo.UNKNOWN_DEVICE;
        }
        return metadata.sourceDeviceName();
    }

    public boolean isTextType() {
        return metadata != null && metadata.payloadKind().isText();
    }
}
