package com.alterante.nearby.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * The single thread that owns every session mutation visible to the presentation
 * layer. Work from any other thread is handed over with {@link #execute},
 * {@link #submit} or {@link #runAndWait}.
 */
public class SessionLoop implements Executor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionLoop.class);

    private final ExecutorService executor;
    private volatile Thread thread;

    public SessionLoop(String name) {
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            thread = t;
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Session task failed: {}", e.getMessage(), e);
            }
        });
    }

    /**
     * Run on the loop; the future fails with whatever the task threw.
     */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                result.complete(task.call());
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Run on the loop and block until the task is done. Runs inline when already on the loop.
     */
    public void runAndWait(Runnable task) throws InterruptedException {
        if (inLoop()) {
            task.run();
            return;
        }
        Future<?> f = executor.submit(task);
        try {
            f.get();
        } catch (ExecutionException e) {
            log.error("Session task failed: {}", e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            f.cancel(false);
            throw e;
        }
    }

    public boolean inLoop() {
        return Thread.currentThread() == thread;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
