package com.contact.resolution.task;

import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs fire-and-forget work (hit counting, write-back to faster tiers) off the request path.
 *
 * <p>Backed by a fixed-size {@link ThreadPoolExecutor} with a bounded queue. A task that
 * cannot be queued is dropped, logged and counted; a task that throws is logged and
 * counted. Neither ever reaches the caller that submitted it.</p>
 */
public class BackgroundTaskSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BackgroundTaskSupervisor.class);

    private final ThreadPoolExecutor executor;
    private final MetricsService metrics;
    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong active = new AtomicLong();

    public BackgroundTaskSupervisor(int threads, int queueCapacity) {
        this(threads, queueCapacity, new NoOpMetricsService());
    }

    public BackgroundTaskSupervisor(int threads, int queueCapacity, MetricsService metrics) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1");
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        this.metrics = metrics;
        this.executor = new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity), namedThreads("contact-bg"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Submits a named task.
     *
     * @return false if the task was rejected
     */
    public boolean submit(String name, Runnable task) {
        active.incrementAndGet();
        try {
            executor.execute(() -> run(name, task));
            submitted.incrementAndGet();
            return true;
        } catch (RejectedExecutionException e) {
            active.decrementAndGet();
            rejected.incrementAndGet();
            metrics.incrementBackgroundTaskRejected(name);
            log.warn("task.rejected name={} queued={}", name, executor.getQueue().size());
            return false;
        }
    }

    private void run(String name, Runnable task) {
        try {
            task.run();
            completed.incrementAndGet();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            metrics.incrementBackgroundTaskFailure(name);
            log.warn("task.failed name={} error={}", name, e.getMessage(), e);
        } finally {
            active.decrementAndGet();
        }
    }

    /**
     * Waits until no task is queued or running.
     *
     * @return true if idle before the timeout elapsed
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (active.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }

    public TaskStats stats() {
        return new TaskStats(submitted.get(), completed.get(), failed.get(), rejected.get(), active.get());
    }

    /**
     * Stops accepting tasks and waits for queued ones to finish.
     */
    public void shutdown(Duration timeout) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                int dropped = executor.shutdownNow().size();
                log.warn("task.shutdown.timeout dropped={}", dropped);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(10));
    }

    /**
     * Daemon threads named {@code prefix-N}.
     */
    public static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
