package com.qqsuccubus.delivery.client.strategy;

import com.qqsuccubus.delivery.client.config.ConsumerSettings;
import com.qqsuccubus.delivery.client.config.ProducerSettings;

/**
 * Maps configured {@link com.qqsuccubus.delivery.core.model.DeliverySemantics} to strategies.
 * {@code DEAD_LETTER} resolves to the at-least-once strategies.
 */
public final class DeliveryStrategies {
    private DeliveryStrategies() {
    }

    public static ProducerDeliveryStrategy forProducer(ProducerSettings settings, String clientId) {
        return switch (settings.getDeliverySemantics()) {
            case AT_MOST_ONCE -> new AtMostOnceProducerStrategy();
            case AT_LEAST_ONCE, DEAD_LETTER ->
                new AtLeastOnceProducerStrategy(settings.getMaxRetries(), settings.isEnableIdempotence());
            case EXACTLY_ONCE -> new ExactlyOnceProducerStrategy(clientId, settings.getTransactionTimeout());
        };
    }

    public static ConsumerDeliveryStrategy forConsumer(ConsumerSettings settings) {
        return switch (settings.getDeliverySemantics()) {
            case AT_MOST_ONCE -> new AtMostOnceConsumerStrategy(settings.getAutoCommitInterval());
            case AT_LEAST_ONCE, DEAD_LETTER -> new AtLeastOnceConsumerStrategy();
            case EXACTLY_ONCE -> new ExactlyOnceConsumerStrategy();
        };
    }
}
