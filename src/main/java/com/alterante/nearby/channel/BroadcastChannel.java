package com.alterante.nearby.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Multi-producer, multi-subscriber channel. Every subscriber sees every message
 * published after it subscribed.
 *
 * Each subscriber owns a bounded buffer. Publishing never blocks: when a buffer is
 * full its oldest message is evicted and the subscriber is told how many it missed
 * through {@link ChannelLaggedException} on its next receive.
 */
public class BroadcastChannel<T> {

    private static final Logger log = LoggerFactory.getLogger(BroadcastChannel.class);

    private final String name;
    private final int capacity;
    private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public BroadcastChannel(String name, int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.name = name;
        this.capacity = capacity;
    }

    /**
     * Publish to all current subscribers.
     *
     * @return number of subscribers the message was delivered to
     */
    public int publish(T message) throws ChannelClosedException {
        if (closed) throw new ChannelClosedException("Channel '" + name + "' is closed");
        int delivered = 0;
        for (Subscription s : subscribers) {
            if (s.offer(message)) delivered++;
        }
        return delivered;
    }

    public Subscription subscribe() {
        Subscription s = new Subscription();
        if (closed) {
            s.close();
        } else {
            subscribers.add(s);
        }
        return s;
    }

    /** Close the channel. Subscribers drain what they hold, then see {@link ChannelClosedException}. */
    public void close() {
        if (closed) return;
        closed = true;
        for (Subscription s : subscribers) {
            s.close();
        }
        subscribers.clear();
        log.debug("Channel '{}' closed", name);
    }

    public boolean isClosed() {
        return closed;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public String name() {
        return name;
    }

    /**
     * One subscriber's view of the channel.
     */
    public final class Subscription implements AutoCloseable {

        private final ReentrantLock lock = new ReentrantLock();
        private final Condition notEmpty = lock.newCondition();
        private final ArrayDeque<T> buffer = new ArrayDeque<>();
        private long skipped;
        private boolean done;

        private Subscription() {
        }

        private boolean offer(T message) {
            lock.lock();
            try {
                if (done) return false;
                if (buffer.size() == capacity) {
                    buffer.pollFirst();
                    skipped++;
                }
                buffer.addLast(message);
                notEmpty.signal();
                return true;
            } finally {
                lock.unlock();
            }
        }

        /**
         * Block until a message is available.
         */
        public T receive() throws InterruptedException, ChannelLaggedException, ChannelClosedException {
            lock.lock();
            try {
                while (true) {
                    T next = takeLocked();
                    if (next != null) return next;
                    notEmpty.await();
                }
            } finally {
                lock.unlock();
            }
        }

        /**
         * Like {@link #receive()} but gives up after the timeout.
         *
         * @return the message, or null on timeout
         */
        public T receive(long timeout, TimeUnit unit)
                throws InterruptedException, ChannelLaggedException, ChannelClosedException {
            long remainingNanos = unit.toNanos(timeout);
            lock.lock();
            try {
                while (true) {
                    T next = takeLocked();
                    if (next != null) return next;
                    if (remainingNanos <= 0) return null;
                    remainingNanos = notEmpty.awaitNanos(remainingNanos);
                }
            } finally {
                lock.unlock();
            }
        }

        private T takeLocked() throws ChannelLaggedException, ChannelClosedException {
            if (skipped > 0) {
                long n = skipped;
                skipped = 0;
                throw new ChannelLaggedException(n);
            }
            T next = buffer.pollFirst();
            if (next == null && done) {
                throw new ChannelClosedException("Channel '" + name + "' is closed");
            }
            return next;
        }

        /** Stop receiving. Buffered messages are still returned before the close is reported. */
        @Override
        public void close() {
            lock.lock();
            try {
                done = true;
                notEmpty.signalAll();
            } finally {
                lock.unlock();
            }
            subscribers.remove(this);
        }
    }
}
