package com.qqsuccubus.delivery.client.strategy;

import com.qqsuccubus.delivery.client.transaction.TransactionCoordinator;
import com.qqsuccubus.delivery.core.model.DeliveryReceipt;
import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * Fire-and-forget: no acks, no retries. Send failures are logged and dropped.
 */
public final class AtMostOnceProducerStrategy implements ProducerDeliveryStrategy {
    private static final Logger log = LoggerFactory.getLogger(AtMostOnceProducerStrategy.class);

    @Override
    public DeliverySemantics semantics() {
        return DeliverySemantics.AT_MOST_ONCE;
    }

    @Override
    public void configure(Map<String, Object> config) {
        config.put(ProducerConfig.ACKS_CONFIG, "0");
        config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, false);
        config.put(ProducerConfig.RETRIES_CONFIG, 0);
    }

    @Override
    public Mono<DeliveryReceipt> publish(ProducerRecord<String, byte[]> record,
                                         Producer<String, byte[]> producer,
                                         @Nullable TransactionCoordinator coordinator) {
        return Mono.fromSupplier(() -> {
            try {
                producer.send(record, (metadata, error) -> {
                    if (error != null) {
                        log.warn("At-most-once record to {} lost: {}", record.topic(), error.toString());
                    }
                });
            } catch (RuntimeException e) {
                log.warn("At-most-once record to {} dropped: {}", record.topic(), e.toString());
            }
            return DeliveryReceipt.unacknowledged(record.topic());
        });
    }
}
