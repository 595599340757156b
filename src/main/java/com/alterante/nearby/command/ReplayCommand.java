package com.alterante.nearby.command;

import com.alterante.nearby.coordinator.CoordinatorConfig;
import com.alterante.nearby.coordinator.NearbyCoordinator;
import com.alterante.nearby.engine.Visibility;
import com.alterante.nearby.engine.replay.ReplayEngine;
import com.alterante.nearby.engine.replay.TraceReader;
import com.alterante.nearby.engine.replay.TraceStep;
import com.alterante.nearby.observe.SessionObserver;
import com.alterante.nearby.transfer.InboundSession;
import com.alterante.nearby.transfer.InboundStage;
import com.alterante.nearby.transfer.OutboundSession;
import com.alterante.nearby.transfer.TransferState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

@CommandLine.Command(
        name = "replay",
        description = "Run the transfer coordinator against a recorded engine trace",
        mixinStandardHelpOptions = true
)
public class ReplayCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplayCommand.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"--script", "-s"}, description = "Engine trace (NDJSON)", required = true)
    private Path script;

    @CommandLine.Option(names = {"--json"}, description = "Output newline-delimited JSON events instead of human-readable text")
    private boolean json;

    @CommandLine.Option(names = {"--auto-accept"}, description = "Accept incoming requests")
    private boolean autoAccept;

    @CommandLine.Option(names = {"--auto-decline"}, description = "Decline incoming requests")
    private boolean autoDecline;

    @CommandLine.Option(names = {"--consent-timeout"}, description = "Seconds before an unanswered request is declined (default: ${DEFAULT-VALUE})",
            defaultValue = "60")
    private long consentTimeoutSeconds;

    @CommandLine.Option(names = {"--device-name", "-n"}, description = "Name advertised to other devices (default: ${DEFAULT-VALUE})",
            defaultValue = "nearby-share")
    private String deviceName;

    @CommandLine.Option(names = {"--visible"}, negatable = true, defaultValue = "true",
            description = "Let other devices discover this one (default: ${DEFAULT-VALUE})")
    private boolean visible;

    @CommandLine.Option(names = {"--download-dir", "-o"}, description = "Where received files go (default: ${DEFAULT-VALUE})",
            defaultValue = "${sys:user.home}/Downloads")
    private Path downloadDir;

    @CommandLine.Option(names = {"--port"}, description = "Fixed service port")
    private Integer port;

    @CommandLine.Option(names = {"--send-to"}, description = "Endpoint id to send --file to once it is discovered")
    private String sendTo;

    @CommandLine.Option(names = {"--file", "-f"}, description = "File to send (repeatable)")
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(names = {"--settle"}, description = "Milliseconds to wait after the trace ends (default: ${DEFAULT-VALUE})",
            defaultValue = "300")
    private long settleMs;

    @Override
    public Integer call() throws Exception {
        try {
            return doReplay();
        } catch (Exception e) {
            if (json) {
                JsonOutput.error(e.getMessage());
                return 1;
            }
            throw e;
        }
    }

    private Integer doReplay() throws Exception {
        if (autoAccept && autoDecline) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--auto-accept and --auto-decline are mutually exclusive");
        }
        if (sendTo != null && files.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--send-to needs at least one --file");
        }

        List<TraceStep> steps = TraceReader.read(script);
        ReplayEngine engine = new ReplayEngine(steps);
        CoordinatorConfig config = new CoordinatorConfig(
                deviceName,
                Visibility.of(visible),
                downloadDir,
                port == null ? OptionalInt.empty() : OptionalInt.of(port),
                Duration.ofSeconds(consentTimeoutSeconds),
                true);

        SessionPrinter printer = new SessionPrinter(json);
        NearbyCoordinator coordinator = new NearbyCoordinator(engine, config, printer);
        coordinator.addObserver(printer);
        coordinator.addObserver(new AutoResponder(coordinator));

        Thread shutdownHook = new Thread(() -> {
            if (!json) System.out.println("\nShutting down...");
            coordinator.shutdown();
        });
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        if (!json) System.out.println("Replaying " + steps.size() + " steps from " + script + "...");
        int exit = 0;
        try {
            coordinator.start().get();
            try {
                engine.play().get();
            } catch (ExecutionException e) {
                exit = 1;
                report("Replay failed: " + e.getCause().getMessage());
            }
            Thread.sleep(settleMs);
            printSummary(coordinator.outboundSessions());
        } finally {
            coordinator.shutdown();
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down");
            }
        }
        return exit;
    }

    private void printSummary(List<OutboundSession> sessions) {
        long done = sessions.stream().filter(s -> s.state() == TransferState.DONE).count();
        long failed = sessions.stream().filter(s -> s.state() == TransferState.FAILED).count();
        if (json) {
            JsonOutput.summary(sessions.size(), done, failed);
            return;
        }
        System.out.println();
        System.out.printf("%d recipient(s), %d done, %d failed%n", sessions.size(), done, failed);
        for (OutboundSession s : sessions) {
            System.out.printf("  %-24s %s%n", s.endpoint().displayName(), s.state().name().toLowerCase());
        }
    }

    private void report(String message) {
        if (json) {
            JsonOutput.error(message);
        } else {
            System.err.println(message);
        }
    }

    /**
     * Answers consent requests per --auto-accept/--auto-decline and starts the --send-to
     * transfer once its endpoint shows up. Runs on the session loop, so it only
     * submits operations and never waits on them.
     */
    private class AutoResponder implements SessionObserver {

        private final NearbyCoordinator coordinator;
        private final Set<String> answered = ConcurrentHashMap.newKeySet();
        private volatile boolean sendStarted;

        AutoResponder(NearbyCoordinator coordinator) {
            this.coordinator = coordinator;
        }

        @Override
        public void inboundChanged(InboundSession session) {
            if (session.stage() != InboundStage.AWAITING_CONSENT || !(autoAccept || autoDecline)) return;
            if (!answered.add(session.transferId())) return;
            coordinator.respondToConsent(autoAccept).whenComplete((v, err) -> {
                if (err != null) report("Could not answer " + session.transferId() + ": " + err.getMessage());
            });
        }

        @Override
        public void outboundAdded(OutboundSession session) {
            if (sendTo == null || sendStarted || !sendTo.equals(session.id())) return;
            sendStarted = true;
            coordinator.send(sendTo, files).whenComplete((v, err) -> {
                if (err != null) report("Send to " + sendTo + " failed: " + err.getMessage());
            });
        }
    }
}
