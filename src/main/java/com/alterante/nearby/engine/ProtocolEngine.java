package com.alterante.nearby.engine;

import com.alterante.nearby.channel.BroadcastChannel;
import com.alterante.nearby.coordinator.CoordinatorConfig;

import java.util.concurrent.CompletableFuture;

/**
 * The nearby-sharing protocol engine: handshake, encryption, discovery and the
 * chunked transfer itself all live behind this interface.
 *
 * Channels returned here are only valid between a completed {@link #start} and the
 * following {@link #stop}; a restart hands out new channels.
 */
public interface ProtocolEngine {

    /** Bring the engine up with the given settings. */
    CompletableFuture<Void> start(CoordinatorConfig config);

    /** Shut the engine down. Completes when all engine tasks have exited. */
    CompletableFuture<Void> stop();

    /**
     * Bidirectional transfer channel. The engine publishes client messages with
     * transfer state; the client publishes lib messages with {@link TransferAction}s.
     */
    BroadcastChannel<ChannelMessage> messages();

    /** Endpoints found by discovery, repeated whenever their details change. */
    BroadcastChannel<EndpointInfo> discovery();

    /** Visibility as the engine currently applies it. */
    BroadcastChannel<Visibility> visibility();

    /**
     * Queue an outbound transfer. The engine reports its progress on
     * {@link #messages()} with the endpoint id as transfer id.
     */
    CompletableFuture<Void> send(SendRequest request);

    void startDiscovery() throws EngineException;

    void stopDiscovery();

    void changeVisibility(Visibility visibility);
}
