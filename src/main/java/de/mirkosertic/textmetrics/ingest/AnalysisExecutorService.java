package de.mirkosertic.textmetrics.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size worker pool for per-document extraction and analysis.
 * A full queue makes the submitting thread run the task itself.
 */
public class AnalysisExecutorService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisExecutorService.class);

    private static final int QUEUE_CAPACITY = 10000;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final ThreadPoolExecutor executor;

    public AnalysisExecutorService(final int threadPoolSize) {
        if (threadPoolSize < 1) {
            throw new IllegalArgumentException("threadPoolSize must be positive, was " + threadPoolSize);
        }
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "analysis-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threadPoolSize,
                threadPoolSize,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(QUEUE_CAPACITY),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.debug("AnalysisExecutorService initialized with {} threads", threadPoolSize);
    }

    public <T> Future<T> submit(final Callable<T> task) {
        return executor.submit(task);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Waits up to ten seconds for running tasks, then interrupts them.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("AnalysisExecutorService did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for AnalysisExecutorService to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
