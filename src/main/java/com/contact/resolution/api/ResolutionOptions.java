package com.contact.resolution.api;

import java.time.Duration;

/**
 * Tunables for the tiered resolver and the executors behind it.
 */
public class ResolutionOptions {

    private static final Duration DEFAULT_SOR_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_DISTRIBUTED_TTL = Duration.ofHours(6);
    private static final int DEFAULT_SOR_THREADS = 8;
    private static final int DEFAULT_BACKGROUND_THREADS = 4;
    private static final int DEFAULT_BACKGROUND_QUEUE_CAPACITY = 1_000;
    private static final int DEFAULT_VERSION_WATERMARK_SIZE = 100_000;

    private final Duration sorTimeout;
    private final Duration distributedTtl;
    private final int sorThreads;
    private final int backgroundThreads;
    private final int backgroundQueueCapacity;
    private final int versionWatermarkSize;

    private ResolutionOptions(Builder builder) {
        this.sorTimeout = builder.sorTimeout;
        this.distributedTtl = builder.distributedTtl;
        this.sorThreads = builder.sorThreads;
        this.backgroundThreads = builder.backgroundThreads;
        this.backgroundQueueCapacity = builder.backgroundQueueCapacity;
        this.versionWatermarkSize = builder.versionWatermarkSize;
    }

    /**
     * Upper bound on a single system of record call. A call that takes longer is a miss.
     */
    public Duration getSorTimeout() {
        return sorTimeout;
    }

    /**
     * TTL for entries written to the distributed cache on the lookup path.
     */
    public Duration getDistributedTtl() {
        return distributedTtl;
    }

    public int getSorThreads() {
        return sorThreads;
    }

    public int getBackgroundThreads() {
        return backgroundThreads;
    }

    public int getBackgroundQueueCapacity() {
        return backgroundQueueCapacity;
    }

    /**
     * Number of keys whose highest surfaced version is remembered.
     */
    public int getVersionWatermarkSize() {
        return versionWatermarkSize;
    }

    public static ResolutionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration sorTimeout = DEFAULT_SOR_TIMEOUT;
        private Duration distributedTtl = DEFAULT_DISTRIBUTED_TTL;
        private int sorThreads = DEFAULT_SOR_THREADS;
        private int backgroundThreads = DEFAULT_BACKGROUND_THREADS;
        private int backgroundQueueCapacity = DEFAULT_BACKGROUND_QUEUE_CAPACITY;
        private int versionWatermarkSize = DEFAULT_VERSION_WATERMARK_SIZE;

        public Builder sorTimeout(Duration sorTimeout) {
            validatePositive(sorTimeout, "sorTimeout");
            this.sorTimeout = sorTimeout;
            return this;
        }

        public Builder distributedTtl(Duration distributedTtl) {
            validatePositive(distributedTtl, "distributedTtl");
            this.distributedTtl = distributedTtl;
            return this;
        }

        public Builder sorThreads(int sorThreads) {
            validatePositive(sorThreads, "sorThreads");
            this.sorThreads = sorThreads;
            return this;
        }

        public Builder backgroundThreads(int backgroundThreads) {
            validatePositive(backgroundThreads, "backgroundThreads");
            this.backgroundThreads = backgroundThreads;
            return this;
        }

        public Builder backgroundQueueCapacity(int backgroundQueueCapacity) {
            validatePositive(backgroundQueueCapacity, "backgroundQueueCapacity");
            this.backgroundQueueCapacity = backgroundQueueCapacity;
            return this;
        }

        public Builder versionWatermarkSize(int versionWatermarkSize) {
            validatePositive(versionWatermarkSize, "versionWatermarkSize");
            this.versionWatermarkSize = versionWatermarkSize;
            return this;
        }

        public ResolutionOptions build() {
            return new ResolutionOptions(this);
        }

        private static void validatePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }

        private static void validatePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }

    @Override
    public String toString() {
        return "ResolutionOptions{" +
                "sorTimeout=" + sorTimeout +
                ", distributedTtl=" + distributedTtl +
                ", sorThreads=" + sorThreads +
                ", backgroundThreads=" + backgroundThreads +
                ", backgroundQueueCapacity=" + backgroundQueueCapacity +
                ", versionWatermarkSize=" + versionWatermarkSize +
                '}';
    }
}
