package com.qqsuccubus.delivery.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.apache.kafka.clients.consumer.ConsumerRecord;

import java.nio.charset.StandardCharsets;

/**
 * Broker message as seen by application handlers.
 * <p>
 * Immutable once read from the broker. Diagnostic headers are attached by creating a copy
 * with {@link #withHeaders(MessageHeaders)}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class KafkaMessage {
    String topic;

    int partition;

    /**
     * Offset within the partition, -1 for messages that were never written.
     */
    long offset;

    /**
     * Routing key, drives partition selection.
     */
    String key;

    byte[] value;

    @Builder.Default
    MessageHeaders headers = MessageHeaders.empty();

    /**
     * Broker or producer timestamp (epoch millis).
     */
    long timestamp;

    public static KafkaMessage from(ConsumerRecord<String, byte[]> record) {
        return KafkaMessage.builder()
            .topic(record.topic())
            .partition(record.partition())
            .offset(record.offset())
            .key(record.key())
            .value(record.value())
            .headers(MessageHeaders.from(record.headers()))
            .timestamp(record.timestamp())
            .build();
    }

    public String valueAsString() {
        return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }

    /**
     * @return {@code topic:partition:offset}, used in log lines
     */
    public String coordinates() {
        return topic + ":" + partition + ":" + offset;
    }
}
