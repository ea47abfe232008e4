package com.qqsuccubus.delivery.client.strategy;

import com.qqsuccubus.delivery.client.transaction.TransactionCoordinator;
import com.qqsuccubus.delivery.core.model.DeliveryReceipt;
import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * Waits for all in-sync replicas; the transport retries with idempotence so retries
 * do not reorder or duplicate within a partition.
 */
public final class AtLeastOnceProducerStrategy implements ProducerDeliveryStrategy {

    private final int maxRetries;
    private final boolean idempotence;

    public AtLeastOnceProducerStrategy(int maxRetries, boolean idempotence) {
        this.maxRetries = maxRetries;
        this.idempotence = idempotence;
    }

    @Override
    public DeliverySemantics semantics() {
        return DeliverySemantics.AT_LEAST_ONCE;
    }

    @Override
    public void configure(Map<String, Object> config) {
        config.put(ProducerConfig.ACKS_CONFIG, "all");
        config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, idempotence);
        config.put(ProducerConfig.RETRIES_CONFIG, maxRetries);
        config.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);
    }

    @Override
    public Mono<DeliveryReceipt> publish(ProducerRecord<String, byte[]> record,
                                         Producer<String, byte[]> producer,
                                         @Nullable TransactionCoordinator coordinator) {
        return Mono.create(sink -> {
            try {
                producer.send(record, (metadata, error) -> {
                    if (error != null) {
                        sink.error(error);
                    } else {
                        sink.success(DeliveryReceipt.from(metadata));
                    }
                });
            } catch (RuntimeException e) {
                sink.error(e);
            }
        });
    }
}
