package org.netpreserve.sitemirror.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.sitemirror.util.jackson.DurationDeserializer;

import java.time.Duration;

/**
 * Worker pool settings.
 *
 * @param workers       number of worker processes, or 0 for min(available processors, 4)
 * @param retryLimit    how many times a task lost to a crash or timeout is requeued
 * @param retryDelay    delay before the first retry, doubled for each further attempt
 * @param respawn       whether crashed workers are replaced with fresh processes
 * @param taskTimeout   a worker busy for longer than this is treated as crashed
 * @param shutdownGrace how long workers get to exit after SHUTDOWN before being killed
 * @param readyTimeout  how long a new worker may take to report READY
 */
public record PoolConfig(
        int workers,
        int retryLimit,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration retryDelay,
        boolean respawn,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration taskTimeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration shutdownGrace,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration readyTimeout
) {
    public PoolConfig {
        if (workers < 0) throw new IllegalArgumentException("pool.workers must not be negative");
        if (retryLimit < 0) throw new IllegalArgumentException("pool.retryLimit must not be negative");
        if (retryDelay == null) retryDelay = Duration.ofMillis(1500);
        if (taskTimeout == null) taskTimeout = Duration.ofSeconds(90);
        if (shutdownGrace == null) shutdownGrace = Duration.ofSeconds(1);
        if (readyTimeout == null) readyTimeout = Duration.ofSeconds(60);
    }

    public int workersOrDefault() {
        if (workers > 0) return workers;
        return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), 4));
    }

    /**
     * Backoff before retry number {@code attempt} (1-based).
     */
    public Duration retryDelay(int attempt) {
        return retryDelay.multipliedBy(1L << Math.min(Math.max(attempt - 1, 0), 20));
    }

    public PoolConfig withWorkers(int workers) {
        return new PoolConfig(workers, retryLimit, retryDelay, respawn, taskTimeout, shutdownGrace, readyTimeout);
    }
}
