package com.watcherbridge.gateway.runtime;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * The gateway's main scheduling context: one thread that owns the device
 * session slot, the outbox, perception state and runtime config changes.
 * <p>
 * Other threads (WebSocket container, MQTT callbacks, HTTP) hand work in
 * through {@link #execute}. A task that throws is logged and does not stop
 * the lane. Tasks submitted after {@link #shutdown()} are dropped.
 */
@Slf4j
public class GatewayLane implements Executor {

    private final ScheduledExecutorService executor;
    private volatile Thread laneThread;

    public GatewayLane() {
        this("gateway-lane");
    }

    public GatewayLane(String threadName) {
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            laneThread = t;
            return t;
        });
        // pending delays (flush pacing, monitoring ticks) are dropped on shutdown
        pool.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        pool.setRemoveOnCancelPolicy(true);
        this.executor = pool;
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("lane stopped, dropping task");
        }
    }

    /**
     * Run {@code task} on the lane after {@code delay}; never blocks the caller.
     *
     * @return the scheduled handle, or {@code null} when the lane is stopped
     */
    public ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        try {
            return executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("lane stopped, dropping scheduled task");
            return null;
        }
    }

    /**
     * Run {@code task} on the lane and expose its result to the caller.
     */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    result.complete(task.call());
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    public boolean isLaneThread() {
        return Thread.currentThread() == laneThread;
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Stop accepting work and wait briefly for queued tasks to finish.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("lane task failed: {}", e.getMessage(), e);
            }
        };
    }
}
