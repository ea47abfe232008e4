package com.qqsuccubus.delivery.client.error;

/**
 * No producer or consumer settings exist for a requested name. Fatal, never retried.
 */
public class MissingConfigurationException extends KafkaDeliveryException {

    public MissingConfigurationException(String kind, String name) {
        super(kind + " not defined for " + name);
    }
}
