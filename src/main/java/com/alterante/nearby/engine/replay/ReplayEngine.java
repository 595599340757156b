package com.alterante.nearby.engine.replay;

import com.alterante.nearby.channel.BroadcastChannel;
import com.alterante.nearby.channel.ChannelClosedException;
import com.alterante.nearby.channel.ChannelLaggedException;
import com.alterante.nearby.coordinator.CoordinatorConfig;
import com.alterante.nearby.engine.ChannelMessage;
import com.alterante.nearby.engine.EndpointInfo;
import com.alterante.nearby.engine.EngineException;
import com.alterante.nearby.engine.ProtocolEngine;
import com.alterante.nearby.engine.SendRequest;
import com.alterante.nearby.engine.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * A {@link ProtocolEngine} that plays back a recorded trace instead of talking to
 * real devices. Sends and client actions are recorded and can be waited on by
 * {@code await} steps.
 *
 * Playback starts with {@link #play()}, after the client has subscribed.
 */
public class ReplayEngine implements ProtocolEngine {

    private static final Logger log = LoggerFactory.getLogger(ReplayEngine.class);

    static final int CHANNEL_CAPACITY = 64;

    private final List<TraceStep> steps;
    private final Semaphore sendPermits = new Semaphore(0);
    private final Semaphore actionPermits = new Semaphore(0);
    private final List<SendRequest> sendRequests = new CopyOnWriteArrayList<>();
    private final List<ChannelMessage> clientActions = new CopyOnWriteArrayList<>();

    private volatile BroadcastChannel<ChannelMessage> messages;
    private volatile BroadcastChannel<EndpointInfo> discovery;
    private volatile BroadcastChannel<Visibility> visibility;
    private volatile boolean running;
    private volatile boolean discoveryOn;
    private volatile Thread actionListener;
    private volatile Thread player;

    public ReplayEngine(List<TraceStep> steps) {
        this.steps = List.copyOf(steps);
    }

    @Override
    public synchronized CompletableFuture<Void> start(CoordinatorConfig config) {
        if (running) {
            return CompletableFuture.failedFuture(new EngineException("Replay engine already running"));
        }
        messages = new BroadcastChannel<>("transfers", CHANNEL_CAPACITY);
        discovery = new BroadcastChannel<>("discovery", CHANNEL_CAPACITY);
        visibility = new BroadcastChannel<>("visibility", CHANNEL_CAPACITY);

        BroadcastChannel<ChannelMessage>.Subscription sub = messages.subscribe();
        Thread listener = new Thread(() -> listenForActions(sub), "replay-actions");
        listener.setDaemon(true);
        listener.start();
        actionListener = listener;

        running = true;
        discoveryOn = false;
        log.info("Replay engine started as '{}' with {} steps", config.deviceName(), steps.size());
        return CompletableFuture.completedFuture(null);
    }

    private void listenForActions(BroadcastChannel<ChannelMessage>.Subscription sub) {
        try (sub) {
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    ChannelMessage m = sub.receive();
                    if (m.isClient()) continue;
                    log.info("Client action {} for {}", m.action(), m.transferId());
                    clientActions.add(m);
                    actionPermits.release();
                } catch (ChannelLaggedException e) {
                    log.warn("Replay action listener skipped {} messages", e.skipped());
                }
            }
        } catch (ChannelClosedException e) {
            log.debug("Replay action listener done: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Play every step on a background thread.
     *
     * @return completes after the last step, or exceptionally if an await timed out
     */
    public synchronized CompletableFuture<Void> play() {
        if (!running) {
            return CompletableFuture.failedFuture(new EngineException("Replay engine is not running"));
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        Thread t = new Thread(() -> {
            try {
                for (TraceStep step : steps) {
                    playStep(step);
                }
                log.info("Replay finished");
                done.complete(null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                done.completeExceptionally(new EngineException("Replay interrupted"));
            } catch (EngineException | ChannelClosedException e) {
                done.completeExceptionally(e);
            }
        }, "replay");
        t.setDaemon(true);
        player = t;
        t.start();
        return done;
    }

    private void playStep(TraceStep step) throws InterruptedException, EngineException, ChannelClosedException {
        switch (step.kind()) {
            case ENDPOINT -> {
                if (!discoveryOn) {
                    log.debug("Discovery off, skipping endpoint {}", step.endpoint().id());
                    return;
                }
                discovery.publish(step.endpoint());
            }
            case EVENT -> messages.publish(ChannelMessage.client(step.event()));
            case DELAY -> Thread.sleep(step.duration().toMillis());
            case AWAIT_SEND -> await(sendPermits, step.duration(), "a send request");
            case AWAIT_ACTION -> await(actionPermits, step.duration(), "a client action");
            case VISIBILITY -> visibility.publish(step.visibility());
        }
    }

    private static void await(Semaphore permits, Duration timeout, String what)
            throws InterruptedException, EngineException {
        log.debug("Waiting up to {} for {}", timeout, what);
        if (!permits.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new EngineException("Timed out after " + timeout.toMillis() + "ms waiting for " + what);
        }
    }

    @Override
    public synchronized CompletableFuture<Void> stop() {
        if (!running) {
            return CompletableFuture.completedFuture(null);
        }
        running = false;
        discoveryOn = false;
        Thread p = player;
        if (p != null) p.interrupt();
        messages.close();
        discovery.close();
        visibility.close();
        Thread l = actionListener;
        if (l != null) l.interrupt();
        log.info("Replay engine stopped");
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
        if (!running) {
            return CompletableFuture.failedFuture(new EngineException("Replay engine is not running"));
        }
        log.info("Send request to {} ({}) with {} file(s)", request.name(), request.address(), request.files().size());
        sendRequests.add(request);
        sendPermits.release();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void startDiscovery() throws EngineException {
        if (!running) {
            throw new EngineException("Replay engine is not running");
        }
        discoveryOn = true;
    }

    @Override
    public void stopDiscovery() {
        discoveryOn = false;
    }

    @Override
    public void changeVisibility(Visibility v) {
        BroadcastChannel<Visibility> ch = visibility;
        if (!running || ch == null) {
            log.warn("Ignoring visibility change to {}, engine not running", v);
            return;
        }
        try {
            ch.publish(v);
        } catch (ChannelClosedException e) {
            log.warn("Visibility channel closed: {}", e.getMessage());
        }
    }

    public List<SendRequest> sendRequests() {
        return List.copyOf(sendRequests);
    }

    /** Lib messages the client published, in order. */
    public List<ChannelMessage> clientActions() {
        return List.copyOf(clientActions);
    }
}
