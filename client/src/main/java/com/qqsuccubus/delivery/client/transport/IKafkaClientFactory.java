package com.qqsuccubus.delivery.client.transport;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.producer.Producer;

import java.util.Map;

/**
 * Creates transport clients from fully resolved configuration maps.
 * <p>
 * The configuration already carries bootstrap servers, client id and the delivery
 * strategy's settings. Tests substitute {@code MockProducer}/{@code MockConsumer}.
 * </p>
 */
public interface IKafkaClientFactory {

    Producer<String, byte[]> createProducer(Map<String, Object> config);

    Consumer<String, byte[]> createConsumer(Map<String, Object> config);
}
