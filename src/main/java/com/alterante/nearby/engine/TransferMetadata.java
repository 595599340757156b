package com.alterante.nearby.engine;

import java.util.List;

/**
 * Metadata attached to a client event.
 *
 * @param totalBytes       size of the whole payload, 0 if not yet known
 * @param ackBytes         cumulative bytes acknowledged so far
 * @param pinCode          short code shown on both devices, may be null
 * @param payloadKind      what is being transferred
 * @param files            file names for FILES payloads
 * @param textPreview      short preview for text-like payloads
 * @param textPayload      full text once a text-like transfer finished
 * @param sourceDeviceName name of the sending device for inbound transfers
 */
public record TransferMetadata(
        long totalBytes,
        long ackBytes,
        String pinCode,
        PayloadKind payloadKind,
        List<String> files,
        String textPreview,
        String textPayload,
        String sourceDeviceName) {

    public TransferMetadata {
        files = files == null ? List.of() : List.copyOf(files);
        if (payloadKind == null) payloadKind = PayloadKind.FILES;
    }

    public static TransferMetadata progress(long totalBytes, long ackBytes) {
        return new TransferMetadata(totalBytes, ackBytes, null, PayloadKind.FILES, List.of(), null, null, null);
    }

    public double fraction() {
        if (totalBytes <= 0) return 0;
        return (double) ackBytes / totalBytes;
    }
}
