package com.contact.resolution.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs periodic jobs (replication, drift checks) at a fixed delay.
 * A job that throws is logged and still runs on its next tick.
 */
public class JobScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final ScheduledExecutorService scheduler;

    public JobScheduler() {
        this(2);
    }

    public JobScheduler(int threads) {
        this.scheduler = Executors.newScheduledThreadPool(threads,
                BackgroundTaskSupervisor.namedThreads("contact-job"));
    }

    public ScheduledFuture<?> schedule(String name, Duration initialDelay, Duration interval, Runnable job) {
        log.info("job.scheduled name={} interval={}", name, interval);
        return scheduler.scheduleWithFixedDelay(() -> {
            try {
                job.run();
            } catch (RuntimeException e) {
                log.error("job.failed name={} error={}", name, e.getMessage(), e);
            }
        }, initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("job.scheduler.shutdown.timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
