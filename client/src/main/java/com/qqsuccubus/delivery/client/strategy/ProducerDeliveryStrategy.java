package com.qqsuccubus.delivery.client.strategy;

import com.qqsuccubus.delivery.client.transaction.TransactionCoordinator;
import com.qqsuccubus.delivery.core.model.DeliveryReceipt;
import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * Producer half of a delivery guarantee: transport settings plus how one record is sent.
 */
public sealed interface ProducerDeliveryStrategy
    permits AtMostOnceProducerStrategy, AtLeastOnceProducerStrategy, ExactlyOnceProducerStrategy {

    DeliverySemantics semantics();

    /**
     * Applies this guarantee's settings to a producer configuration.
     *
     * @param config mutable producer configuration
     */
    void configure(Map<String, Object> config);

    default boolean requiresTransactionalProducer() {
        return false;
    }

    /**
     * Sends one record.
     *
     * @param record      record to send
     * @param producer    transport producer configured by {@link #configure}
     * @param coordinator transaction coordinator, required only by transactional strategies
     * @return Mono emitting the receipt once the guarantee is satisfied
     */
    Mono<DeliveryReceipt> publish(ProducerRecord<String, byte[]> record,
                                  Producer<String, byte[]> producer,
                                  @Nullable TransactionCoordinator coordinator);
}
