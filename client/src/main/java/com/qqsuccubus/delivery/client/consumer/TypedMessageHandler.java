package com.qqsuccubus.delivery.client.consumer;

import com.qqsuccubus.delivery.core.model.KafkaMessage;

/**
 * Callback receiving the JSON-decoded payload next to the raw message.
 *
 * @param <T> payload type
 */
@FunctionalInterface
public interface TypedMessageHandler<T> {

    void handle(T payload, KafkaMessage message) throws Exception;
}
