package com.alterante.nearby.engine;

import java.nio.file.Path;
import java.util.List;

/**
 * Outbound payload handed to {@link ProtocolEngine#send}.
 *
 * @param endpointId target endpoint; the engine reuses it as the transfer id
 * @param name       display name of the target
 * @param address    "ip:port" of the target
 * @param files      files to send
 */
public record SendRequest(String endpointId, String name, String address, List<Path> files) {

    public SendRequest {
        files = List.copyOf(files);
    }

    public static SendRequest to(EndpointInfo endpoint, List<Path> files) {
        return new SendRequest(endpoint.id(), endpoint.displayName(), endpoint.socketAddress(), files);
    }
}
