package com.qqsuccubus.delivery.client.error;

/**
 * Base type for errors raised by producers, consumers and the client pool.
 */
public class KafkaDeliveryException extends RuntimeException {

    public KafkaDeliveryException(String message) {
        super(message);
    }

    public KafkaDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
