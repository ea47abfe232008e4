package com.qqsuccubus.delivery.client.producer;

import com.qqsuccubus.delivery.core.model.DeliveryReceipt;
import com.qqsuccubus.delivery.core.model.KafkaMessage;
import reactor.core.publisher.Mono;

/**
 * Writes permanently failed messages to a dead-letter topic.
 */
public interface IDeadLetterPublisher {

    /**
     * Publishes {@code message} with its original key and value plus failure headers.
     * Never signals an error: a failed dead-letter write is logged and completes empty.
     *
     * @param topic        dead-letter topic
     * @param message      failed message
     * @param error        last handler error
     * @param attemptCount handler attempts made
     * @return Mono emitting the receipt, or empty when the write failed
     */
    Mono<DeliveryReceipt> publishToDeadLetter(String topic, KafkaMessage message, Throwable error, int attemptCount);
}
