package com.qqsuccubus.delivery.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 * <p>
 * Consistent tagging enables aggregation and filtering in Prometheus/Grafana.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for the producer or consumer client id.
     */
    public static final String CLIENT_ID = "client_id";

    /**
     * Tag key for Kafka topic.
     */
    public static final String TOPIC = "topic";

    /**
     * Tag key for delivery semantics.
     */
    public static final String SEMANTICS = "semantics";

    /**
     * Tag key for failure reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for pooled instance type (producer/consumer).
     */
    public static final String TYPE = "type";

}
