package org.tuscan.pipeline;

import java.util.Map;
import java.util.OptionalDouble;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Tuning of a scan.
 *
 * @param threads                number of scoring workers; always at least 1.
 * @param batchSize              candidates per model call.
 * @param queueCapacityPerWorker candidate and result queue slots per worker.
 * @param minScore               sites scoring below this value are not reported.
 */
public record PipelineSettings(int threads, int batchSize, int queueCapacityPerWorker, OptionalDouble minScore) {

    /** Default number of candidates per model call. */
    public static final int DEFAULT_BATCH_SIZE = 10_000;

    /** Worker count used when the JVM reports no usable processor count. */
    public static final int FALLBACK_THREADS = 4;

    public PipelineSettings {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batch-size must be >= 1, got " + batchSize);
        }
        if (queueCapacityPerWorker < 1) {
            throw new IllegalArgumentException("queue-capacity-per-worker must be >= 1, got " + queueCapacityPerWorker);
        }
    }

    /**
     * @return settings with {@code threads} workers and all other values at their defaults.
     */
    public static PipelineSettings withThreads(int threads) {
        return new PipelineSettings(threads, DEFAULT_BATCH_SIZE, 2, OptionalDouble.empty());
    }

    /**
     * Reads settings from the {@code pipeline} block of the application configuration.
     * <p>
     * Recognized options:
     * <ul>
     *   <li>{@code threads} - worker count, 0 selects the available processor count (default: 0)</li>
     *   <li>{@code batch-size} - candidates per model call (default: 10000)</li>
     *   <li>{@code queue-capacity-per-worker} - bounded queue slots per worker (default: 2)</li>
     *   <li>{@code output.min-score} - optional reporting threshold</li>
     * </ul>
     *
     * @param pipeline the {@code pipeline} config block.
     * @return the validated settings.
     * @throws IllegalArgumentException if a value is missing its type or out of range.
     */
    public static PipelineSettings fromConfig(Config pipeline) {
        Config defaults = ConfigFactory.parseMap(Map.of(
            "threads", 0,
            "batch-size", DEFAULT_BATCH_SIZE,
            "queue-capacity-per-worker", 2
        ));
        Config finalConfig = pipeline.withFallback(defaults);

        try {
            int configuredThreads = finalConfig.getInt("threads");
            if (configuredThreads < 0) {
                throw new IllegalArgumentException("threads cannot be negative, got " + configuredThreads);
            }
            OptionalDouble minScore = finalConfig.hasPath("output.min-score")
                ? OptionalDouble.of(finalConfig.getDouble("output.min-score"))
                : OptionalDouble.empty();
            return new PipelineSettings(
                configuredThreads == 0 ? defaultThreads() : configuredThreads,
                finalConfig.getInt("batch-size"),
                finalConfig.getInt("queue-capacity-per-worker"),
                minScore);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid pipeline configuration: " + e.getMessage(), e);
        }
    }

    /**
     * @return the available processor count, or {@link #FALLBACK_THREADS}.
     */
    public static int defaultThreads() {
        int processors = Runtime.getRuntime().availableProcessors();
        return processors >= 1 ? processors : FALLBACK_THREADS;
    }

    /**
     * @return a copy with a different worker count.
     */
    public PipelineSettings withThreadCount(int count) {
        return new PipelineSettings(count, batchSize, queueCapacityPerWorker, minScore);
    }

    /**
     * @return a copy with a reporting threshold.
     */
    public PipelineSettings withMinScore(double threshold) {
        return new PipelineSettings(threads, batchSize, queueCapacityPerWorker, OptionalDouble.of(threshold));
    }

    /** @return the capacity of the candidate and result queues. */
    public int queueCapacity() {
        return threads * queueCapacityPerWorker;
    }
}
