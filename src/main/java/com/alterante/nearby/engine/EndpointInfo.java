package com.alterante.nearby.engine;

import java.util.Objects;

/**
 * A discovered remote device.
 *
 * @param id      engine-assigned endpoint id, stable across rediscovery
 * @param name    advertised device name, may be null
 * @param address IP address, may be null until resolved
 * @param port    service port, 0 if unknown
 * @param present whether the device is currently reachable
 */
public record EndpointInfo(String id, String name, String address, int port, boolean present) {

    public static final String UNKNOWN_DEVICE = "Unknown device";

    public EndpointInfo {
        Objects.requireNonNull(id, "id");
    }

    public String displayName() {
        return name == null || name.isBlank() ? UNKNOWN_DEVICE : name;
    }

    /** "ip:port" as the engine expects it in a send request. */
    public String socketAddress() {
        return (address == null ? "" : address) + ":" + (port > 0 ? port : "");
    }

    @Override
    public String toString() {
        return "{ id=" + id + " present=" + present + " name=" + displayName() + " }";
    }
}
