package fr.lapetina.clusterclient.pending;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Shared scheduler for deadlines and retry delays.
 *
 * One daemon thread serves every operation. Cancelled tasks are removed from the
 * queue immediately, so {@link #scheduledTaskCount()} drops back to its baseline
 * as soon as the operations owning them settle.
 */
public final class OperationTimer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OperationTimer.class);

    private final ScheduledThreadPoolExecutor executor;

    public OperationTimer(String threadName) {
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    public OperationTimer() {
        this("operation-timer");
    }

    public ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        long delayNanos = Math.max(0, delay.toNanos());
        return executor.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Timer task failed", e);
            }
        }, delayNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Number of timers currently armed.
     */
    public int scheduledTaskCount() {
        return executor.getQueue().size();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Operation timer did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
