package com.qqsuccubus.delivery.core.metrics;

/**
 * Micrometer metric names used by producers and consumers.
 * <p>
 * <b>Naming convention:</b> {@code kafka.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Messages acknowledged by the broker (or handed off, for at-most-once).
     * <p>
     * Tags: client_id, semantics
     * </p>
     */
    public static final String PRODUCER_MESSAGES_TOTAL = "kafka.producer.messages.total";

    /**
     * Counter: Failed publish attempts.
     * <p>
     * Tags: client_id, semantics
     * </p>
     */
    public static final String PRODUCER_ERRORS_TOTAL = "kafka.producer.errors.total";

    /**
     * Timer: Publish latency, from record creation to broker acknowledgment.
     * <p>
     * Tags: client_id
     * </p>
     */
    public static final String PRODUCER_LATENCY = "kafka.producer.latency";

    /**
     * Counter: Messages written to a dead-letter topic.
     * <p>
     * Tags: client_id
     * </p>
     */
    public static final String PRODUCER_DEAD_LETTERS_TOTAL = "kafka.producer.dead.letters.total";

    /**
     * Counter: Records handled successfully by the consumer pipeline.
     * <p>
     * Tags: client_id, semantics
     * </p>
     */
    public static final String CONSUMER_MESSAGES_TOTAL = "kafka.consumer.messages.total";

    /**
     * Counter: Handler retries performed by workers.
     * <p>
     * Tags: client_id
     * </p>
     */
    public static final String CONSUMER_RETRIES_TOTAL = "kafka.consumer.retries.total";

    /**
     * Counter: Records escalated to permanent-failure handling.
     * <p>
     * Tags: client_id, reason (retries_exhausted/non_retryable)
     * </p>
     */
    public static final String CONSUMER_FAILURES_TOTAL = "kafka.consumer.failures.total";

    /**
     * Counter: Transport errors seen by the ingestion loop.
     * <p>
     * Tags: client_id
     * </p>
     */
    public static final String CONSUMER_POLL_ERRORS_TOTAL = "kafka.consumer.poll.errors.total";

    /**
     * Timer: Handler processing latency.
     * <p>
     * Tags: client_id
     * </p>
     */
    public static final String CONSUMER_LATENCY = "kafka.consumer.latency";

    /**
     * Gauge: Records waiting in the bounded processing queue.
     * <p>
     * Tags: client_id
     * </p>
     */
    public static final String CONSUMER_QUEUE_PENDING = "kafka.consumer.queue.pending";

    /**
     * Counter: Instances evicted from the client pool.
     * <p>
     * Tags: type (producer/consumer)
     * </p>
     */
    public static final String POOL_EVICTIONS_TOTAL = "kafka.pool.evictions.total";
}
