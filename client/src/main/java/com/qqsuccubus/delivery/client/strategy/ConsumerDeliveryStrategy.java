package com.qqsuccubus.delivery.client.strategy;

import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import com.qqsuccubus.delivery.core.model.KafkaMessage;

import java.util.Map;

/**
 * Consumer half of a delivery guarantee: commit mode plus what happens after a record is handled.
 */
public sealed interface ConsumerDeliveryStrategy
    permits AtMostOnceConsumerStrategy, AtLeastOnceConsumerStrategy, ExactlyOnceConsumerStrategy {

    DeliverySemantics semantics();

    void configure(Map<String, Object> config);

    /**
     * Runs after the handler finished with {@code message}, whether it succeeded or failed permanently.
     *
     * @param committer offset sink of the pipeline
     * @param message   processed message
     */
    void afterProcess(OffsetCommitter committer, KafkaMessage message);
}
