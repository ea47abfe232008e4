package com.qqsuccubus.delivery.core.msg;

/**
 * Header keys written on the wire by producers and by permanent-failure handling.
 */
public final class HeaderNames {
    private HeaderNames() {
    }

    public static final String TRACE_ID = "trace-id";

    /**
     * Shared by every message of one batch publish.
     */
    public static final String CORRELATION_ID = "correlation-id";

    /**
     * Epoch millis at publish time.
     */
    public static final String PRODUCED_AT = "produced-at";

    /**
     * Only written when duplicate detection is enabled on the producer.
     */
    public static final String IDEMPOTENCE_KEY = "idempotence-key";

    public static final String MESSAGE_ID = "message-id";

    // Attached to a consumed message on permanent failure
    public static final String TOPIC_SOURCE = "TopicSource";
    public static final String PARTITION_SOURCE = "PartitionSource";
    public static final String OFFSET_SOURCE = "OffsetSource";
    public static final String EXCEPTION = "Exception";

    /**
     * Prefix applied to copies of the original headers on a dead-letter message.
     * <p>
     * Example: {@code correlation-id} becomes {@code dlq-original-correlation-id}
     * </p>
     */
    public static final String DLQ_ORIGINAL_PREFIX = "dlq-original-";

    public static final String DLQ_ORIGINAL_TOPIC = "dlq-original-topic";
    public static final String DLQ_ORIGINAL_PARTITION = "dlq-original-partition";
    public static final String DLQ_ORIGINAL_OFFSET = "dlq-original-offset";
    public static final String DLQ_ERROR_TYPE = "dlq-error-type";
    public static final String DLQ_ERROR_MESSAGE = "dlq-error-message";
    public static final String DLQ_ATTEMPT_COUNT = "dlq-attempt-count";
    public static final String DLQ_FAILED_AT = "dlq-failed-at";
    public static final String DLQ_STACK_TRACE = "dlq-stack-trace";

    public static String dlqOriginal(String headerName) {
        return DLQ_ORIGINAL_PREFIX + headerName;
    }
}
