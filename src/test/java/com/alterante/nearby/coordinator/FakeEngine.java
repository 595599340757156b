package com.alterante.nearby.coordinator;

import com.alterante.nearby.channel.BroadcastChannel;
import com.alterante.nearby.channel.ChannelClosedException;
import com.alterante.nearby.channel.ChannelLaggedException;
import com.alterante.nearby.engine.ChannelMessage;
import com.alterante.nearby.engine.EndpointInfo;
import com.alterante.nearby.engine.EngineException;
import com.alterante.nearby.engine.ProtocolEngine;
import com.alterante.nearby.engine.ProtocolEvent;
import com.alterante.nearby.engine.SendRequest;
import com.alterante.nearby.engine.Visibility;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory engine for coordinator tests. Tests push events with {@link #emit} and
 * {@link #discover} and inspect what the coordinator asked for.
 */
class FakeEngine implements ProtocolEngine {

    final AtomicInteger starts = new AtomicInteger();
    final AtomicInteger stops = new AtomicInteger();
    final AtomicInteger discoveryStarts = new AtomicInteger();
    final List<SendRequest> sends = new CopyOnWriteArrayList<>();
    final List<ChannelMessage> actions = new CopyOnWriteArrayList<>();
    final List<Visibility> visibilityChanges = new CopyOnWriteArrayList<>();

    volatile boolean failStart;
    volatile boolean throwOnStart;
    volatile boolean throwOnStop;
    volatile boolean failSend;
    volatile boolean discoveryOn;
    volatile CoordinatorConfig lastConfig;

    private volatile BroadcastChannel<ChannelMessage> messages;
    private volatile BroadcastChannel<EndpointInfo> discovery;
    private volatile BroadcastChannel<Visibility> visibility;

    @Override
    public CompletableFuture<Void> start(CoordinatorConfig config) {
        starts.incrementAndGet();
        if (throwOnStart) {
            throw new IllegalStateException("native library missing");
        }
        if (failStart) {
            return CompletableFuture.failedFuture(new EngineException("port in use"));
        }
        lastConfig = config;
        messages = new BroadcastChannel<>("messages", 16);
        discovery = new BroadcastChannel<>("discovery", 16);
        visibility = new BroadcastChannel<>("visibility", 16);
        BroadcastChannel<ChannelMessage>.Subscription sub = messages.subscribe();
        Thread t = new Thread(() -> {
            try (sub) {
                while (true) {
                    try {
                        ChannelMessage m = sub.receive();
                        if (!m.isClient()) actions.add(m);
                    } catch (ChannelLaggedException e) {
                        // keep going
                    }
                }
            } catch (ChannelClosedException | InterruptedException e) {
                // engine stopped
            }
        }, "fake-engine-actions");
        t.setDaemon(true);
        t.start();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> stop() {
        stops.incrementAndGet();
        if (throwOnStop) {
            throw new IllegalStateException("runtime already torn down");
        }
        discoveryOn = false;
        if (messages != null) {
            messages.close();
            discovery.close();
            visibility.close();
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public BroadcastChannel<ChannelMessage> messages() {
        return messages;
    }

    @Override
    public BroadcastChannel<EndpointInfo> discovery() {
        return discovery;
    }

    @Override
    public BroadcastChannel<Visibility> visibility() {
        return visibility;
    }

    @Override
    public CompletableFuture<Void> send(SendRequest request) {
        if (failSend) {
            return CompletableFuture.failedFuture(new EngineException("unreachable"));
        }
        sends.add(request);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void startDiscovery() {
        discoveryStarts.incrementAndGet();
        discoveryOn = true;
    }

    @Override
    public void stopDiscovery() {
        discoveryOn = false;
    }

    @Override
    public void changeVisibility(Visibility v) {
        visibilityChanges.add(v);
        try {
            visibility.publish(v);
        } catch (ChannelClosedException e) {
            throw new IllegalStateException(e);
        }
    }

    void emit(ProtocolEvent event) throws ChannelClosedException {
        messages.publish(ChannelMessage.client(event));
    }

    void discover(EndpointInfo endpoint) throws ChannelClosedException {
        discovery.publish(endpoint);
    }
}
