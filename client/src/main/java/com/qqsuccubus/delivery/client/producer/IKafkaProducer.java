package com.qqsuccubus.delivery.client.producer;

import com.qqsuccubus.delivery.client.pool.PooledClient;
import com.qqsuccubus.delivery.core.model.DeliveryReceipt;
import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import com.qqsuccubus.delivery.core.model.PublishOutcome;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;

/**
 * Publishes application payloads with the producer's configured delivery guarantee.
 * <p>
 * Payloads are encoded as: {@code byte[]} unchanged, {@link String} as UTF-8,
 * anything else as JSON.
 * </p>
 */
public interface IKafkaProducer extends IDeadLetterPublisher, PooledClient {

    DeliverySemantics semantics();

    /**
     * Publishes with a random UUID key.
     *
     * @param topic   target topic
     * @param payload payload
     * @return Mono emitting the delivery receipt
     */
    Mono<DeliveryReceipt> publish(String topic, Object payload);

    /**
     * Publishes with an explicit key. Records with the same key land in the same partition.
     *
     * @param topic   target topic
     * @param key     record key, may be null
     * @param payload payload
     * @return Mono emitting the delivery receipt, or an error when the guarantee could not be met
     */
    Mono<DeliveryReceipt> publish(String topic, @Nullable String key, Object payload);

    /**
     * Publishes every payload independently. One failure does not affect the others.
     *
     * @param topic    target topic
     * @param payloads payloads in order
     * @return Mono emitting one outcome per payload, in input order
     */
    Mono<List<PublishOutcome>> publishBatch(String topic, List<?> payloads);

    /**
     * Waits until all buffered records are sent.
     *
     * @param timeout maximum wait
     * @return Mono completing when flushed
     */
    Mono<Void> flush(Duration timeout);
}
