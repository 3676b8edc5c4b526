package com.plotline.module;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one item at a time on a daemon worker thread and waits at most the configured bound.
 * Calls stay sequential: the caller blocks until the item finishes or times out. A timed-out
 * worker is interrupted and abandoned, and the next call gets a fresh thread so a hung item
 * cannot block the rest of the batch.
 */
public final class BoundedCall implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BoundedCall.class);
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final Duration timeout;
    private ExecutorService executor;

    public BoundedCall(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
    }

    /**
     * Runs {@code task} for {@code itemId}.
     *
     * @throws ItemTimeoutException when the bound elapses
     * @throws RuntimeException     the task's own unchecked failure, unwrapped
     */
    public <T> T call(String itemId, Callable<T> task) {
        if (executor == null) {
            executor = newExecutor();
        }
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            executor.shutdownNow();
            executor = null;
            log.warn("Item {} exceeded {} ms; worker abandoned", itemId, timeout.toMillis());
            throw new ItemTimeoutException(itemId, timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for item " + itemId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException(cause.getMessage(), cause);
        }
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    private static ExecutorService newExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "plot-item-" + THREAD_SEQ.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
