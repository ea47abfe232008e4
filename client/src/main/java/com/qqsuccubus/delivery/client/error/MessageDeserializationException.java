package com.qqsuccubus.delivery.client.error;

/**
 * Payload could not be turned into the handler's message type. Never retried.
 */
public class MessageDeserializationException extends KafkaDeliveryException {

    public MessageDeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
