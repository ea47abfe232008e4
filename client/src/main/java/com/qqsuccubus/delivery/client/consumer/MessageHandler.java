package com.qqsuccubus.delivery.client.consumer;

import com.qqsuccubus.delivery.core.model.KafkaMessage;

/**
 * Application callback run on a pipeline worker thread for every consumed message.
 * Throwing marks the attempt as failed.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(KafkaMessage message) throws Exception;
}
