package com.alterante.nearby.engine.replay;

import com.alterante.nearby.engine.Direction;
import com.alterante.nearby.engine.EndpointInfo;
import com.alterante.nearby.engine.PayloadKind;
import com.alterante.nearby.engine.ProtocolEvent;
import com.alterante.nearby.engine.ProtocolState;
import com.alterante.nearby.engine.TransferMetadata;
import com.alterante.nearby.engine.Visibility;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads engine traces: one JSON object per line, blank lines and lines starting
 * with {@code #} ignored.
 *
 * Enum values may be written as {@code WAITING_FOR_USER_CONSENT} or
 * {@code WaitingForUserConsent}.
 */
public final class TraceReader {

    private static final Logger log = LoggerFactory.getLogger(TraceReader.class);

    static final Duration DEFAULT_AWAIT_TIMEOUT = Duration.ofMinutes(2);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TraceReader() {}

    public static List<TraceStep> read(Path file) throws IOException, TraceException {
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<TraceStep> steps = read(in);
            log.debug("Read {} trace steps from {}", steps.size(), file);
            return steps;
        }
    }

    public static List<TraceStep> read(Reader source) throws IOException, TraceException {
        BufferedReader in = new BufferedReader(source);
        List<TraceStep> steps = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = in.readLine()) != null) {
            lineNo++;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            TraceRecord record;
            try {
                record = MAPPER.readValue(trimmed, TraceRecord.class);
            } catch (JsonProcessingException e) {
                throw new TraceException(lineNo, "invalid JSON: " + e.getOriginalMessage(), e);
            }
            steps.add(toStep(lineNo, record));
        }
        return steps;
    }

    static TraceStep toStep(int line, TraceRecord r) throws TraceException {
        if (r.type() == null) {
            throw new TraceException(line, "missing \"type\"");
        }
        return switch (r.type().toLowerCase(Locale.ROOT)) {
            case "endpoint" -> TraceStep.endpoint(new EndpointInfo(
                    require(line, r.id(), "id"),
                    r.name(),
                    r.address(),
                    r.port() == null ? 0 : r.port(),
                    r.present() == null || r.present()));
            case "event" -> TraceStep.event(toEvent(line, r));
            case "delay" -> TraceStep.delay(Duration.ofMillis(nonNegative(line, r.ms(), "ms")));
            case "await" -> {
                Duration timeout = r.timeoutMs() == null
                        ? DEFAULT_AWAIT_TIMEOUT
                        : Duration.ofMillis(nonNegative(line, r.timeoutMs(), "timeoutMs"));
                String on = require(line, r.on(), "on").toLowerCase(Locale.ROOT);
                yield switch (on) {
                    case "send" -> TraceStep.awaitSend(timeout);
                    case "action" -> TraceStep.awaitAction(timeout);
                    default -> throw new TraceException(line, "unknown await target '" + r.on() + "'");
                };
            }
            case "visibility" -> TraceStep.visibility(
                    parseEnum(line, Visibility.class, require(line, r.value(), "value")));
            default -> throw new TraceException(line, "unknown record type '" + r.type() + "'");
        };
    }

    private static ProtocolEvent toEvent(int line, TraceRecord r) throws TraceException {
        String id = require(line, r.id(), "id");
        Direction direction = parseEnum(line, Direction.class, require(line, r.direction(), "direction"));
        ProtocolState state = parseEnum(line, ProtocolState.class, require(line, r.state(), "state"));
        TransferMetadata meta = null;
        if (r.total() != null || r.ack() != null || r.pin() != null || r.kind() != null
                || r.files() != null || r.preview() != null || r.text() != null || r.device() != null) {
            meta = new TransferMetadata(
                    r.total() == null ? 0 : r.total(),
                    r.ack() == null ? 0 : r.ack(),
                    r.pin(),
                    r.kind() == null ? PayloadKind.FILES : parseEnum(line, PayloadKind.class, r.kind()),
                    r.files(),
                    r.preview(),
                    r.text(),
                    r.device());
        }
        return new ProtocolEvent(id, direction, state, meta);
    }

    private static String require(int line, String value, String field) throws TraceException {
        if (value == null || value.isBlank()) {
            throw new TraceException(line, "missing \"" + field + "\"");
        }
        return value;
    }

    private static long nonNegative(int line, Long value, String field) throws TraceException {
        if (value == null || value < 0) {
            throw new TraceException(line, "\"" + field + "\" must be a non-negative number");
        }
        return value;
    }

    /** Accepts UPPER_SNAKE, lower_snake or CamelCase spellings. */
    static <E extends Enum<E>> E parseEnum(int line, Class<E> type, String raw) throws TraceException {
        String name = raw.strip()
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new TraceException(line, "unknown " + type.getSimpleName() + " '" + raw + "'");
        }
    }
}
