package com.alterante.nearby.coordinator;

import com.alterante.nearby.channel.BroadcastChannel;
import com.alterante.nearby.channel.ChannelClosedException;
import com.alterante.nearby.channel.ChannelLaggedException;
import com.alterante.nearby.engine.ChannelMessage;
import com.alterante.nearby.engine.EndpointInfo;
import com.alterante.nearby.engine.EngineException;
import com.alterante.nearby.engine.ProtocolEngine;
import com.alterante.nearby.engine.SendRequest;
import com.alterante.nearby.engine.TransferAction;
import com.alterante.nearby.engine.Visibility;
import com.alterante.nearby.observe.MilestoneSink;
import com.alterante.nearby.observe.NotificationAction;
import com.alterante.nearby.observe.Observers;
import com.alterante.nearby.observe.ServiceState;
import com.alterante.nearby.observe.SessionObserver;
import com.alterante.nearby.transfer.DiscoveryRegistry;
import com.alterante.nearby.transfer.EventRouter;
import com.alterante.nearby.transfer.InboundSession;
import com.alterante.nearby.transfer.InboundStage;
import com.alterante.nearby.transfer.OutboundSession;
import com.alterante.nearby.transfer.TransferState;
import com.alterante.nearby.transfer.TransferStore;
import com.alterante.nearby.transfer.UserAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Entry point for the presentation layer. Owns the engine lifecycle, the supervised
 * forwarding loops and every user-triggered transfer operation.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>runtime: engine calls, channel relays, consent timers</li>
 *   <li>session loop: the only thread that mutates sessions and notifies observers</li>
 *   <li>forwarders: hand each relayed message to the session loop and wait until it is
 *       applied, so a relay never runs more than one message ahead</li>
 * </ul>
 *
 * Operations return futures that fail with a {@link CoordinatorException} when the
 * engine is not running or the request does not fit the session's state.
 */
public class NearbyCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NearbyCoordinator.class);

    private static final long ENGINE_STOP_TIMEOUT_SECONDS = 10;

    private final ProtocolEngine engine;
    private final MilestoneSink milestones;
    private final Observers observers = new Observers();
    private final TransferStore store = new TransferStore();
    private final DiscoveryRegistry discovery = new DiscoveryRegistry(store, observers);

    private final ExecutorService runtime = Executors.newCachedThreadPool(new NamedThreadFactory("nearby-runtime"));
    private final ScheduledExecutorService timers =
            Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("nearby-timer"));
    private final ExecutorService forwarders = Executors.newCachedThreadPool(new NamedThreadFactory("session-forwarder"));
    private final SessionLoop sessionLoop = new SessionLoop("session-loop");
    private final TaskSupervisor supervisor = new TaskSupervisor(runtime, forwarders);

    // start/stop/restart/shutdown are serialized on this lock
    private final ReentrantLock lifecycle = new ReentrantLock();

    private volatile CoordinatorConfig config;
    private volatile ServiceState serviceState = ServiceState.STOPPED;
    private volatile EventRouter router;
    private volatile boolean shutDown;

    public NearbyCoordinator(ProtocolEngine engine, CoordinatorConfig config, MilestoneSink milestones) {
        this.engine = engine;
        this.config = config;
        this.milestones = milestones == null ? MilestoneSink.NONE : milestones;
    }

    public NearbyCoordinator(ProtocolEngine engine, CoordinatorConfig config) {
        this(engine, config, MilestoneSink.NONE);
    }

    public void addObserver(SessionObserver observer) {
        observers.add(observer);
    }

    public void removeObserver(SessionObserver observer) {
        observers.remove(observer);
    }

    // ---- lifecycle ----

    /** Start the engine and the forwarding loops. */
    public CompletableFuture<Void> start() {
        return lifecycleTask(this::doStart);
    }

    /** Cancel the forwarding loops and stop the engine. Sessions are kept. */
    public CompletableFuture<Void> stop() {
        return lifecycleTask(this::doStop);
    }

    /** Stop, then start again with the current settings. */
    public CompletableFuture<Void> restart() {
        return lifecycleTask(() -> {
            log.info("Restarting engine");
            doStop();
            doStart();
        });
    }

    /**
     * Replace the settings. Restarts a running engine if any engine-side setting changed.
     */
    public CompletableFuture<Void> updateConfig(CoordinatorConfig newConfig) {
        return lifecycleTask(() -> {
            CoordinatorConfig old = config;
            config = newConfig;
            if (serviceState != ServiceState.RUNNING) {
                return;
            }
            if (old.requiresRestart(newConfig)) {
                log.info("Settings changed, restarting engine");
                doStop();
                doStart();
            } else if (old.visibility() != newConfig.visibility()) {
                engine.changeVisibility(newConfig.visibility());
            }
        });
    }

    private CompletableFuture<Void> lifecycleTask(LifecycleStep step) {
        if (shutDown) {
            return CompletableFuture.failedFuture(
                    new CoordinatorException(ErrorKind.SERVICE_UNAVAILABLE, "Coordinator is shut down"));
        }
        return CompletableFuture.runAsync(() -> {
            lifecycle.lock();
            try {
                step.run();
            } catch (CoordinatorException e) {
                throw new CompletionException(e);
            } finally {
                lifecycle.unlock();
            }
        }, runtime);
    }

    private void doStart() throws CoordinatorException {
        if (serviceState == ServiceState.RUNNING) {
            log.debug("Engine already running");
            return;
        }
        setServiceState(ServiceState.STARTING, null);
        CoordinatorConfig cfg = config;
        log.info("Starting engine as '{}' ({}), downloads to {}", cfg.deviceName(), cfg.visibility(), cfg.downloadDir());
        try {
            engine.start(cfg).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw unavailable("Interrupted while starting engine", e);
        } catch (ExecutionException e) {
            throw unavailable("Engine failed to start: " + e.getCause().getMessage(), e.getCause());
        } catch (RuntimeException e) {
            throw unavailable("Engine failed to start: " + e.getMessage(), e);
        }

        router = new EventRouter(store, observers, milestones, this::publishAction, timers, sessionLoop,
                cfg.consentTimeout(), () -> config.downloadDir());
        try {
            spawnLoops();
        } catch (RuntimeException e) {
            supervisor.stopAll();
            throw unavailable("Could not subscribe to engine channels: " + e.getMessage(), e);
        }

        if (cfg.discoveryOnStart() || discovery.isDiscoveryOn()) {
            try {
                engine.startDiscovery();
                discovery.discoveryStarted();
            } catch (EngineException e) {
                log.warn("Could not start discovery: {}", e.getMessage());
                discovery.discoveryStopped();
            }
        }
        setServiceState(ServiceState.RUNNING, null);
        log.info("Engine running, {} supervised tasks", supervisor.size());
    }

    private void doStop() throws CoordinatorException {
        if (serviceState == ServiceState.STOPPED) {
            return;
        }
        setServiceState(ServiceState.STOPPING, null);
        int cancelled = supervisor.stopAll();
        log.info("Stopping engine ({} tasks cancelled)", cancelled);
        dropInboundTransfer();
        try {
            engine.stop().get(ENGINE_STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw unavailable("Interrupted while stopping engine", e);
        } catch (ExecutionException e) {
            throw unavailable("Engine failed to stop: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw unavailable("Engine did not stop within " + ENGINE_STOP_TIMEOUT_SECONDS + "s", e);
        } catch (RuntimeException e) {
            throw unavailable("Engine failed to stop: " + e.getMessage(), e);
        }
        setServiceState(ServiceState.STOPPED, null);
    }

    /**
     * A stopped engine never reports the end of an inbound transfer, so the slot is
     * released here and its notification withdrawn.
     */
    private void dropInboundTransfer() {
        try {
            sessionLoop.runAndWait(() -> store.inbound()
                    .filter(s -> s.stage() != InboundStage.CLOSED)
                    .ifPresent(s -> {
                        s.autoDecline().cancel();
                        milestones.withdraw(s.notificationId());
                        store.releaseInbound(s.transferId());
                        log.info("Inbound {} dropped with the engine", s.transferId());
                        observers.inboundClosed(s);
                    }));
        } catch (InterruptedException e) {
            // engine.stop() below reports the interrupt
            Thread.currentThread().interrupt();
        }
    }

    private CoordinatorException unavailable(String message, Throwable cause) {
        log.error(message);
        setServiceState(ServiceState.UNAVAILABLE, cause);
        return new CoordinatorException(ErrorKind.SERVICE_UNAVAILABLE, message, cause);
    }

    private void setServiceState(ServiceState state, Throwable cause) {
        ServiceState previous = serviceState;
        serviceState = state;
        if (previous != state) {
            log.debug("Service {} -> {}", previous, state);
            sessionLoop.execute(() -> observers.serviceStateChanged(state, cause));
        }
    }

    // ---- supervised loops ----

    private void spawnLoops() {
        // Subscribe before spawning so nothing published after start is missed.
        BroadcastChannel<ChannelMessage>.Subscription events = engine.messages().subscribe();
        BroadcastChannel<EndpointInfo>.Subscription endpoints = engine.discovery().subscribe();
        BroadcastChannel<Visibility>.Subscription visibility = engine.visibility().subscribe();

        BlockingQueue<ChannelMessage> eventHandoff = new ArrayBlockingQueue<>(1);
        BlockingQueue<EndpointInfo> endpointHandoff = new ArrayBlockingQueue<>(1);
        EventRouter r = router;

        supervisor.spawn(Scheduler.RUNTIME, "event-relay", () -> relay("event-relay", events, eventHandoff));
        supervisor.spawn(Scheduler.SESSION, "event-forwarder", () -> forward(eventHandoff, r::route));
        supervisor.spawn(Scheduler.RUNTIME, "discovery-relay", () -> relay("discovery-relay", endpoints, endpointHandoff));
        supervisor.spawn(Scheduler.SESSION, "discovery-forwarder", () -> forward(endpointHandoff, discovery::upsert));
        supervisor.spawn(Scheduler.RUNTIME, "visibility-watcher", () -> watchVisibility(visibility));
    }

    private <T> void relay(String name, BroadcastChannel<T>.Subscription sub, BlockingQueue<T> handoff) {
        try (sub) {
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    handoff.put(sub.receive());
                } catch (ChannelLaggedException e) {
                    log.warn("{}: lagged behind, {} messages skipped", name, e.skipped());
                }
            }
        } catch (ChannelClosedException e) {
            channelClosed(name, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private <T> void forward(BlockingQueue<T> handoff, Consumer<T> apply) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                T item = handoff.take();
                sessionLoop.runAndWait(() -> apply.accept(item));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void watchVisibility(BroadcastChannel<Visibility>.Subscription sub) {
        try (sub) {
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    Visibility v = sub.receive();
                    log.debug("Engine visibility is now {}", v);
                    sessionLoop.execute(() -> observers.visibilityChanged(v));
                } catch (ChannelLaggedException e) {
                    log.warn("visibility-watcher: lagged behind, {} messages skipped", e.skipped());
                }
            }
        } catch (ChannelClosedException e) {
            channelClosed("visibility-watcher", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void channelClosed(String name, ChannelClosedException e) {
        // a cancelled loop may still see the close that follows its cancellation
        if (serviceState != ServiceState.RUNNING || Thread.currentThread().isInterrupted()) {
            log.debug("{}: channel closed during shutdown", name);
            return;
        }
        log.error("{}: {}, restart required", name, e.getMessage());
        setServiceState(ServiceState.UNAVAILABLE, e);
    }

    private void publishAction(String transferId, TransferAction action) throws EngineException {
        if (serviceState != ServiceState.RUNNING) {
            throw new EngineException("Engine is not running (" + serviceState + ")");
        }
        try {
            engine.messages().publish(ChannelMessage.lib(transferId, action));
        } catch (ChannelClosedException e) {
            throw new EngineException("Transfer channel closed", e);
        }
    }

    // ---- outbound ----

    /**
     * Send files to a discovered endpoint. Queued if another transfer is in progress.
     */
    public CompletableFuture<Void> send(String endpointId, List<Path> files) {
        CompletableFuture<Void> notReady = requireRunning();
        if (notReady != null) return notReady;
        if (files == null || files.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new CoordinatorException(ErrorKind.INVALID_ACTION, "Nothing to send"));
        }
        return CompletableFuture.supplyAsync(() -> totalSize(files), runtime)
                .thenCompose(size -> sessionLoop.submit(() -> prepareSend(endpointId, files, size)))
                .thenCompose(session -> engineSend(session, files));
    }

    /**
     * Send to an endpoint that may not have been discovered yet.
     */
    public CompletableFuture<Void> sendTo(EndpointInfo endpoint, List<Path> files) {
        CompletableFuture<Void> notReady = requireRunning();
        if (notReady != null) return notReady;
        return sessionLoop.submit(() -> discovery.upsert(endpoint))
                .thenCompose(u -> send(endpoint.id(), files));
    }

    /**
     * Send the previous file set of a failed or finished session again.
     */
    public CompletableFuture<Void> retry(String endpointId) {
        CompletableFuture<Void> notReady = requireRunning();
        if (notReady != null) return notReady;
        return sessionLoop.submit(() -> {
            OutboundSession session = store.outbound(endpointId).orElseThrow(() -> noSuchEndpoint(endpointId));
            TransferState state = session.state();
            if (state != TransferState.FAILED && state != TransferState.DONE
                    && state != TransferState.AWAITING_CONSENT_OR_IDLE) {
                throw new CoordinatorException(ErrorKind.INVALID_ACTION,
                        "Cannot retry " + endpointId + " while " + state);
            }
            if (session.files().isEmpty()) {
                throw new CoordinatorException(ErrorKind.INVALID_ACTION, "Nothing was sent to " + endpointId);
            }
            log.info("Retrying send of {} file(s) to {}", session.files().size(), session.endpoint().displayName());
            return session.files();
        }).thenCompose(files -> send(endpointId, files));
    }

    private long totalSize(List<Path> files) {
        long total = 0;
        for (Path f : files) {
            try {
                total += Files.size(f);
            } catch (IOException e) {
                throw new CompletionException(new CoordinatorException(ErrorKind.INVALID_ACTION,
                        "Cannot read " + f + ": " + e.getMessage(), e));
            }
        }
        return total;
    }

    private OutboundSession prepareSend(String endpointId, List<Path> files, long size) throws CoordinatorException {
        OutboundSession session = store.outbound(endpointId).orElseThrow(() -> noSuchEndpoint(endpointId));
        TransferState previous = session.state();
        if (previous == TransferState.QUEUED || previous.holdsTransferSlot()) {
            throw new CoordinatorException(ErrorKind.INVALID_ACTION,
                    "A send to " + endpointId + " is already " + previous);
        }
        TransferState now = store.prepareSend(session, files, size);
        log.info("Sending {} file(s), {} bytes to {}", files.size(), size, session.endpoint().displayName());
        observers.outboundChanged(session, previous);
        if (now == TransferState.QUEUED) {
            log.debug("Send to {} is queued", endpointId);
        }
        return session;
    }

    private CompletableFuture<Void> engineSend(OutboundSession session, List<Path> files) {
        CompletableFuture<Void> sent;
        try {
            sent = engine.send(SendRequest.to(session.endpoint(), files));
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        return sent.handle((v, err) -> {
            if (err == null) return null;
            Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
            log.warn("Engine refused send to {}: {}", session.id(), cause.getMessage());
            sessionLoop.execute(() -> {
                TransferState previous = store.markSendFailed(session);
                observers.outboundChanged(session, previous);
            });
            throw new CompletionException(new CoordinatorException(ErrorKind.ENGINE_FAILURE,
                    "Send to " + session.id() + " failed: " + cause.getMessage(), cause));
        });
    }

    /**
     * Drop idle, failed and finished outbound sessions and restart discovery.
     *
     * @return the removed sessions
     */
    public CompletableFuture<List<OutboundSession>> refreshRecipients() {
        CompletableFuture<Void> notReady = requireRunning();
        if (notReady != null) return notReady.thenApply(v -> List.of());
        return sessionLoop.submit(() -> {
            List<OutboundSession> removed = store.refresh();
            removed.forEach(observers::outboundRemoved);
            log.info("Refreshed recipients: {} removed, {} kept", removed.size(), store.outboundCount());
            return removed;
        }).thenApplyAsync(removed -> {
            engine.stopDiscovery();
            try {
                engine.startDiscovery();
                discovery.discoveryStarted();
            } catch (EngineException e) {
                discovery.discoveryStopped();
                throw new CompletionException(new CoordinatorException(ErrorKind.ENGINE_FAILURE,
                        "Could not restart discovery: " + e.getMessage(), e));
            }
            return removed;
        }, runtime);
    }

    public CompletableFuture<Void> startDiscovery() {
        CompletableFuture<Void> notReady = requireRunning();
        if (notReady != null) return notReady;
        return CompletableFuture.runAsync(() -> {
            try {
                engine.startDiscovery();
                discovery.discoveryStarted();
                log.info("Discovery started");
            } catch (EngineException e) {
                throw new CompletionException(new CoordinatorException(ErrorKind.ENGINE_FAILURE,
                        "Could not start discovery: " + e.getMessage(), e));
            }
        }, runtime);
    }

    public CompletableFuture<Void> stopDiscovery() {
        CompletableFuture<Void> notReady = requireRunning();
        if (notReady != null) return notReady;
        return CompletableFuture.runAsync(() -> {
            engine.stopDiscovery();
            discovery.discoveryStopped();
            log.info("Discovery stopped");
        }, runtime);
    }

    public CompletableFuture<Void> setVisibility(boolean visible) {
        CompletableFuture<Void> notReady = requireRunning();
        if (notReady != null) return notReady;
        Visibility v = Visibility.of(visible);
        return CompletableFuture.runAsync(() -> {
            engine.changeVisibility(v);
            config = config.withVisibility(v);
            log.info("Visibility set to {}", v);
        }, runtime);
    }

    // ---- inbound and cancel ----

    /** Accept or decline the pending inbound request. */
    public CompletableFuture<Void> respondToConsent(boolean accept) {
        UserAction action = accept ? UserAction.CONSENT_ACCEPT : UserAction.CONSENT_DECLINE;
        CompletableFuture<Void> notReady = requireRunning();
        if (notReady != null) return notReady;
        return sessionLoop.submit(() -> {
            InboundSession session = store.inbound()
                    .orElseThrow(() -> new CoordinatorException(ErrorKind.NO_SUCH_TRANSFER, "No pending inbound request"));
            applyInbound(session, action);
            return null;
        });
    }

    /**
     * Cancel a transfer by id: the inbound one if it matches, else the outbound
     * session with that id.
     */
    public CompletableFuture<Void> cancel(String transferId) {
        CompletableFuture<Void> notReady = requireRunning();
        if (notReady != null) return notReady;
        return sessionLoop.submit(() -> {
            Optional<InboundSession> inbound = store.inbound().filter(s -> s.transferId().equals(transferId));
            if (inbound.isPresent()) {
                applyInbound(inbound.get(), UserAction.TRANSFER_CANCEL);
                return null;
            }
            OutboundSession session = store.outbound(transferId)
                    .orElseThrow(() -> new CoordinatorException(ErrorKind.NO_SUCH_TRANSFER, "No transfer " + transferId));
            TransferState state = session.state();
            if (state == TransferState.QUEUED) {
                // the engine already holds the request and would start it once the slot frees
                try {
                    publishAction(transferId, TransferAction.TRANSFER_CANCEL);
                } catch (EngineException e) {
                    throw new CoordinatorException(ErrorKind.ENGINE_FAILURE, e.getMessage(), e);
                }
                log.info("Dropping queued send to {}", transferId);
                TransferState previous = store.markSendFailed(session);
                observers.outboundChanged(session, previous);
                return null;
            }
            if (!state.holdsTransferSlot()) {
                throw new CoordinatorException(ErrorKind.INVALID_ACTION, "Nothing to cancel for " + transferId + " (" + state + ")");
            }
            try {
                publishAction(transferId, TransferAction.TRANSFER_CANCEL);
            } catch (EngineException e) {
                throw new CoordinatorException(ErrorKind.ENGINE_FAILURE, e.getMessage(), e);
            }
            log.info("Cancel requested for outbound {}", transferId);
            return null;
        });
    }

    /**
     * Run a notification follow-up action. Only the inbound consent and cancel
     * actions are handled here; open-folder and copy-text belong to the desktop side.
     */
    public CompletableFuture<Void> handleNotificationAction(String actionId) {
        Optional<NotificationAction> parsed = NotificationAction.fromId(actionId);
        if (parsed.isEmpty()) {
            log.warn("Unknown notification action '{}'", actionId);
            return CompletableFuture.failedFuture(
                    new CoordinatorException(ErrorKind.INVALID_ACTION, "Unknown action " + actionId));
        }
        return switch (parsed.get()) {
            case CONSENT_ACCEPT -> respondToConsent(true);
            case CONSENT_DECLINE -> respondToConsent(false);
            case TRANSFER_CANCEL -> {
                CompletableFuture<Void> notReady = requireRunning();
                if (notReady != null) yield notReady;
                yield sessionLoop.submit(() -> {
                    InboundSession session = store.inbound()
                            .orElseThrow(() -> new CoordinatorException(ErrorKind.NO_SUCH_TRANSFER, "No inbound transfer"));
                    applyInbound(session, UserAction.TRANSFER_CANCEL);
                    return null;
                });
            }
            case OPEN_FOLDER, COPY_TEXT -> CompletableFuture.failedFuture(
                    new CoordinatorException(ErrorKind.INVALID_ACTION, actionId + " is handled by the desktop integration"));
        };
    }

    private void applyInbound(InboundSession session, UserAction action) throws CoordinatorException {
        EventRouter r = router;
        if (r == null) {
            throw new CoordinatorException(ErrorKind.NOT_INITIALIZED, "Engine has not finished starting");
        }
        boolean applied;
        try {
            applied = r.applyUserAction(session, action);
        } catch (EngineException e) {
            throw new CoordinatorException(ErrorKind.ENGINE_FAILURE, e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new CoordinatorException(ErrorKind.NOT_INITIALIZED, e.getMessage(), e);
        }
        if (!applied) {
            throw new CoordinatorException(ErrorKind.INVALID_ACTION,
                    action + " not allowed for " + session.transferId() + " (" + session.stage() + ")");
        }
    }

    private CompletableFuture<Void> requireRunning() {
        ServiceState s = serviceState;
        if (shutDown) {
            return CompletableFuture.failedFuture(
                    new CoordinatorException(ErrorKind.SERVICE_UNAVAILABLE, "Coordinator is shut down"));
        }
        return switch (s) {
            case RUNNING -> null;
            case STARTING -> CompletableFuture.failedFuture(
                    new CoordinatorException(ErrorKind.NOT_INITIALIZED, "Engine is still starting"));
            default -> CompletableFuture.failedFuture(
                    new CoordinatorException(ErrorKind.SERVICE_UNAVAILABLE, "Engine is " + s.name().toLowerCase()));
        };
    }

    private static CoordinatorException noSuchEndpoint(String endpointId) {
        return new CoordinatorException(ErrorKind.NO_SUCH_ENDPOINT, "No endpoint " + endpointId);
    }

    // ---- queries ----

    /** True if no outbound session is waiting on the engine. */
    public boolean isNoTransferActive() {
        return store.isNoFileBeingSent();
    }

    public ServiceState serviceState() {
        return serviceState;
    }

    public CoordinatorConfig config() {
        return config;
    }

    public boolean isDiscoveryOn() {
        return discovery.isDiscoveryOn();
    }

    public List<OutboundSession> outboundSessions() {
        return store.outboundSessions();
    }

    public Optional<OutboundSession> outbound(String endpointId) {
        return store.outbound(endpointId);
    }

    public Optional<InboundSession> inbound() {
        return store.inbound();
    }

    public List<EndpointInfo> endpoints() {
        return discovery.endpoints();
    }

    TaskSupervisor supervisor() {
        return supervisor;
    }

    // ---- shutdown ----

    /**
     * Withdraw a pending inbound notification, stop the engine and release all threads.
     * Blocks until the engine has stopped.
     */
    public void shutdown() {
        if (shutDown) return;
        lifecycle.lock();
        try {
            if (shutDown) return;
            log.info("Shutting down");
            try {
                doStop();
            } catch (CoordinatorException e) {
                log.warn("Engine did not stop cleanly: {}", e.getMessage());
            }
            shutDown = true;
        } finally {
            lifecycle.unlock();
        }
        supervisor.stopAll();
        timers.shutdownNow();
        forwarders.shutdownNow();
        sessionLoop.close();
        runtime.shutdownNow();
    }

    @Override
    public void close() {
        shutdown();
    }

    @FunctionalInterface
    private interface LifecycleStep {
        void run() throws CoordinatorException;
    }
}
