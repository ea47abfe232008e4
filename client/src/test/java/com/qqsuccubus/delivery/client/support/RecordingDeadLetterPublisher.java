package com.qqsuccubus.delivery.client.support;

import com.qqsuccubus.delivery.client.producer.IDeadLetterPublisher;
import com.qqsuccubus.delivery.core.model.DeliveryReceipt;
import com.qqsuccubus.delivery.core.model.KafkaMessage;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Captures dead-letter requests instead of writing them.
 */
public class RecordingDeadLetterPublisher implements IDeadLetterPublisher {

    public final List<DeadLetter> published = new CopyOnWriteArrayList<>();

    @Override
    public Mono<DeliveryReceipt> publishToDeadLetter(String topic, KafkaMessage message, Throwable error,
                                                     int attemptCount) {
        published.add(new DeadLetter(topic, message, error, attemptCount));
        return Mono.just(new DeliveryReceipt(topic, 0, published.size() - 1L));
    }

    public record DeadLetter(String topic, KafkaMessage message, Throwable error, int attemptCount) {
    }
}
