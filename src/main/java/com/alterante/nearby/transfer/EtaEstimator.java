package com.alterante.nearby.transfer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.OptionalLong;
import java.util.function.LongSupplier;

/**
 * Throughput and remaining-time estimate for one transfer.
 *
 * <pre>
 * Bytes are bucketed per wall-clock second:
 *   step_with(total) adds total - previous to the current bucket
 *   once >= 1s passed since the bucket opened, the bucket is pushed to history
 *   history keeps the last 5 buckets, newest first
 *
 *   speed     = mean(history)         (0 if empty)
 *   remaining = totalLen - transferred
 *   eta       = remaining / speed     (+inf if speed == 0)
 * </pre>
 *
 * Not thread-safe; owned by the session loop.
 */
public class EtaEstimator {

    public static final int HISTORY_SIZE = 5;
    public static final String UNKNOWN = "Unknown";

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final LongSupplier nanoClock;

    private long totalLen;
    private long totalTransferred;
    private long transferredThisSecond;
    private final Deque<Long> history = new ArrayDeque<>(HISTORY_SIZE);
    private long secondsElapsed;
    private boolean anchored;
    private long lastSecondNanos;

    public EtaEstimator(long totalLen) {
        this(totalLen, System::nanoTime);
    }

    EtaEstimator(long totalLen, LongSupplier nanoClock) {
        if (totalLen < 0) throw new IllegalArgumentException("totalLen must be >= 0");
        this.totalLen = totalLen;
        this.nanoClock = nanoClock;
    }

    /**
     * Record the cumulative byte count reported by the engine.
     *
     * @throws IllegalArgumentException if the count went backwards
     */
    public void stepWith(long transferred) {
        if (transferred < totalTransferred) {
            throw new IllegalArgumentException(
                    "Transferred count went backwards: " + transferred + " < " + totalTransferred);
        }
        transferredThisSecond += transferred - totalTransferred;
        totalTransferred = transferred;

        long now = nanoClock.getAsLong();
        if (!anchored) {
            anchored = true;
            lastSecondNanos = now;
            return;
        }
        if (now - lastSecondNanos >= NANOS_PER_SECOND) {
            secondsElapsed++;
            lastSecondNanos = now;
            if (history.size() == HISTORY_SIZE) {
                history.removeLast();
            }
            history.addFirst(transferredThisSecond);
            transferredThisSecond = 0;
        }
    }

    /**
     * Reset all progress for a new attempt.
     *
     * @param newTotalLen replaces the total length when present
     */
    public void prepareForNewTransfer(OptionalLong newTotalLen) {
        newTotalLen.ifPresent(len -> {
            if (len < 0) throw new IllegalArgumentException("totalLen must be >= 0");
            totalLen = len;
        });
        totalTransferred = 0;
        transferredThisSecond = 0;
        history.clear();
        secondsElapsed = 0;
        anchored = false;
    }

    /** Bytes per second, averaged over the recorded history. */
    public double speed() {
        if (history.isEmpty()) return 0;
        long sum = 0;
        for (long v : history) sum += v;
        return (double) sum / history.size();
    }

    /** Remaining seconds; positive infinity while the speed is unknown. */
    public double etaSeconds() {
        double speed = speed();
        if (speed == 0) return Double.POSITIVE_INFINITY;
        return (totalLen - totalTransferred) / speed;
    }

    /** Human-readable remaining time, e.g. "4 minutes 32 seconds". */
    public String estimate() {
        return format(etaSeconds());
    }

    static String format(double seconds) {
        if (Double.isInfinite(seconds) || Double.isNaN(seconds)) {
            return UNKNOWN;
        }
        long sec = Math.max(0, (long) seconds);
        if (sec > 6_000) {
            long h = sec / 3600;
            long min = (sec % 3600) / 60;
            return plural(h, "hour", "hours") + " " + plural(min, "minute", "minutes");
        } else if (sec > 100) {
            long min = sec / 60;
            return plural(min, "minute", "minutes") + " " + plural(sec % 60, "second", "seconds");
        }
        return plural(sec, "second", "seconds");
    }

    private static String plural(long n, String one, String many) {
        return n + " " + (n == 1 ? one : many);
    }

    public long totalLen() { return totalLen; }
    public long totalTransferred() { return totalTransferred; }
    public long secondsElapsed() { return secondsElapsed; }

    /** Per-second deltas, newest first. */
    public List<Long> history() {
        return List.copyOf(history);
    }

    /** True until the first progress step of the current attempt. */
    public boolean isIdle() {
        return !anchored && totalTransferred == 0;
    }
}
