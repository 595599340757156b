package com.alterante.nearby.engine.replay;

import com.alterante.nearby.engine.EndpointInfo;
import com.alterante.nearby.engine.ProtocolEvent;
import com.alterante.nearby.engine.Visibility;

import java.time.Duration;
import java.util.Objects;

/**
 * A validated trace line, ready to be played. Which payload field is set depends on
 * the {@link Kind}:
 * <pre>
 * ENDPOINT    endpoint
 * EVENT       event
 * DELAY       duration
 * AWAIT_SEND  duration (timeout)
 * AWAIT_ACTION duration (timeout)
 * VISIBILITY  visibility
 * </pre>
 */
public record TraceStep(Kind kind, EndpointInfo endpoint, ProtocolEvent event, Duration duration, Visibility visibility) {

    public enum Kind {
        ENDPOINT,
        EVENT,
        DELAY,
        AWAIT_SEND,     // block until the client calls send
        AWAIT_ACTION,   // block until the client publishes a lib message
        VISIBILITY
    }

    public TraceStep {
        Objects.requireNonNull(kind, "kind");
    }

    public static TraceStep endpoint(EndpointInfo endpoint) {
        return new TraceStep(Kind.ENDPOINT, Objects.requireNonNull(endpoint), null, null, null);
    }

    public static TraceStep event(ProtocolEvent event) {
        return new TraceStep(Kind.EVENT, null, Objects.requireNonNull(event), null, null);
    }

    public static TraceStep delay(Duration d) {
        return new TraceStep(Kind.DELAY, null, null, d, null);
    }

    public static TraceStep awaitSend(Duration timeout) {
        return new TraceStep(Kind.AWAIT_SEND, null, null, timeout, null);
    }

    public static TraceStep awaitAction(Duration timeout) {
        return new TraceStep(Kind.AWAIT_ACTION, null, null, timeout, null);
    }

    public static TraceStep visibility(Visibility v) {
        return new TraceStep(Kind.VISIBILITY, null, null, null, Objects.requireNonNull(v));
    }
}
