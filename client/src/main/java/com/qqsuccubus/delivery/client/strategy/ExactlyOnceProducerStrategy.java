package com.qqsuccubus.delivery.client.strategy;

import com.qqsuccubus.delivery.client.transaction.TransactionCoordinator;
import com.qqsuccubus.delivery.core.model.DeliveryReceipt;
import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Each record is sent in its own broker transaction through a {@link TransactionCoordinator}.
 * <p>
 * The transactional id is unique per instance ({@code <clientId>-<uuid>}), so two
 * instances never fence each other.
 * </p>
 */
public final class ExactlyOnceProducerStrategy implements ProducerDeliveryStrategy {

    private final String transactionalId;
    private final Duration transactionTimeout;

    public ExactlyOnceProducerStrategy(String clientId, Duration transactionTimeout) {
        this.transactionalId = clientId + "-" + UUID.randomUUID();
        this.transactionTimeout = transactionTimeout;
    }

    public String transactionalId() {
        return transactionalId;
    }

    @Override
    public DeliverySemantics semantics() {
        return DeliverySemantics.EXACTLY_ONCE;
    }

    @Override
    public void configure(Map<String, Object> config) {
        config.put(ProducerConfig.ACKS_CONFIG, "all");
        config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        config.put(ProducerConfig.TRANSACTIONAL_ID_CONFIG, transactionalId);
        config.put(ProducerConfig.TRANSACTION_TIMEOUT_CONFIG, (int) transactionTimeout.toMillis());
        // bounds initTransactions, commit and abort on the transport
        config.putIfAbsent(ProducerConfig.MAX_BLOCK_MS_CONFIG, transactionTimeout.toMillis());
    }

    @Override
    public boolean requiresTransactionalProducer() {
        return true;
    }

    @Override
    public Mono<DeliveryReceipt> publish(ProducerRecord<String, byte[]> record,
                                         Producer<String, byte[]> producer,
                                         @Nullable TransactionCoordinator coordinator) {
        if (coordinator == null) {
            return Mono.error(new IllegalStateException(
                "Exactly-once publish to " + record.topic() + " requires a transaction coordinator"));
        }
        return Mono.fromCallable(() -> coordinator.executeInTransaction(tx -> tx.send(record)))
            .subscribeOn(Schedulers.boundedElastic());
    }
}
