package com.qqsuccubus.delivery.core.model;

import org.apache.kafka.clients.producer.RecordMetadata;

/**
 * Broker acknowledgment of a published message.
 *
 * @param topic     destination topic
 * @param partition partition the message landed in, -1 when unknown
 * @param offset    offset assigned by the broker, -1 when unknown
 */
public record DeliveryReceipt(String topic, int partition, long offset) {

    public static DeliveryReceipt from(RecordMetadata metadata) {
        return new DeliveryReceipt(metadata.topic(), metadata.partition(), metadata.offset());
    }

    /**
     * Receipt for a fire-and-forget publish where no acknowledgment is awaited.
     */
    public static DeliveryReceipt unacknowledged(String topic) {
        return new DeliveryReceipt(topic, -1, -1L);
    }

    public boolean acknowledged() {
        return partition >= 0 && offset >= 0;
    }
}
