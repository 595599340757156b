package com.alterante.nearby.transfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Race between a consent timeout and its cancellation. Whichever settles first wins;
 * the loser is a no-op. Both sides are idempotent.
 */
public final class AutoDecline {

    private static final Logger log = LoggerFactory.getLogger(AutoDecline.class);

    private final AtomicBoolean settled = new AtomicBoolean();
    private volatile boolean fired;
    private volatile ScheduledFuture<?> timer;

    private AutoDecline() {
    }

    /**
     * Arm the timer. {@code onTimeout} runs on the scheduler at most once, and only if
     * {@link #cancel()} has not been called before the deadline.
     */
    public static AutoDecline start(ScheduledExecutorService scheduler, Duration timeout, Runnable onTimeout) {
        AutoDecline race = new AutoDecline();
        race.timer = scheduler.schedule(() -> {
            if (race.settled.compareAndSet(false, true)) {
                race.fired = true;
                log.debug("Consent timeout of {} elapsed", timeout);
                onTimeout.run();
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        return race;
    }

    /** A race that has already been settled, for sessions that never arm a timer. */
    public static AutoDecline settled() {
        AutoDecline race = new AutoDecline();
        race.settled.set(true);
        return race;
    }

    /**
     * Cancel the timeout. Never waits for a timeout callback that is already running.
     *
     * @return true if this call stopped the timer, false if it was already settled
     */
    public boolean cancel() {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        ScheduledFuture<?> t = timer;
        if (t != null) {
            t.cancel(false);
        }
        return true;
    }

    public boolean isSettled() {
        return settled.get();
    }

    /** True if the timeout won the race. */
    public boolean hasFired() {
        return fired;
    }
}
