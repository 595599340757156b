package com.alterante.nearby.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Keeps the handles of every long-running loop so they can be torn down together
 * on stop, restart and shutdown.
 */
public class TaskSupervisor {

    private static final Logger log = LoggerFactory.getLogger(TaskSupervisor.class);

    private final ExecutorService runtime;
    private final ExecutorService session;
    private final Deque<TaskHandle> handles = new ArrayDeque<>();

    /**
     * @param runtime executor for {@link Scheduler#RUNTIME} loops
     * @param session executor for {@link Scheduler#SESSION} loops
     */
    public TaskSupervisor(ExecutorService runtime, ExecutorService session) {
        this.runtime = runtime;
        this.session = session;
    }

    /**
     * Start a loop on the executor of {@code owner} and track it.
     */
    public TaskHandle spawn(Scheduler owner, String name, Runnable loop) {
        ExecutorService executor = owner == Scheduler.RUNTIME ? runtime : session;
        Future<?> future = executor.submit(() -> {
            log.debug("Task '{}' started on {}", name, Thread.currentThread().getName());
            try {
                loop.run();
            } catch (RuntimeException e) {
                log.error("Task '{}' failed: {}", name, e.getMessage(), e);
            } finally {
                log.debug("Task '{}' exited", name);
            }
        });
        return track(new TaskHandle(name, owner, future));
    }

    /** Track a handle created elsewhere. */
    public synchronized TaskHandle track(TaskHandle handle) {
        handles.addLast(handle);
        return handle;
    }

    /**
     * Cancel every tracked task, newest first. Does not wait for them to exit.
     * Safe to call repeatedly and on already finished tasks.
     *
     * @return number of handles cancelled
     */
    public int stopAll() {
        int count = 0;
        synchronized (this) {
            log.info("Cancelling {} looping tasks", handles.size());
            TaskHandle h;
            while ((h = handles.pollLast()) != null) {
                h.cancel();
                count++;
            }
        }
        return count;
    }

    public synchronized int size() {
        return handles.size();
    }

    /** Tracked handles in spawn order. */
    public synchronized List<TaskHandle> handles() {
        return List.copyOf(handles);
    }
}
