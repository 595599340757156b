package com.alterante.nearby.coordinator;

import java.util.concurrent.Future;

/**
 * A running supervised loop.
 */
public record TaskHandle(String name, Scheduler owner, Future<?> future) {

    /** Request cancellation without waiting for the task to wind down. */
    public void cancel() {
        future.cancel(true);
    }

    public boolean isDone() {
        return future.isDone();
    }
}
