package com.qqsuccubus.delivery.client.transport;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Creates real {@link KafkaProducer}/{@link KafkaConsumer} instances with
 * String keys and raw byte values.
 */
public class KafkaClientFactory implements IKafkaClientFactory {
    private static final Logger log = LoggerFactory.getLogger(KafkaClientFactory.class);

    @Override
    public Producer<String, byte[]> createProducer(Map<String, Object> config) {
        Map<String, Object> props = new HashMap<>(config);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        log.info("Creating Kafka producer {} (bootstrap={})",
            props.get(ProducerConfig.CLIENT_ID_CONFIG), props.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
        return new KafkaProducer<>(props);
    }

    @Override
    public Consumer<String, byte[]> createConsumer(Map<String, Object> config) {
        Map<String, Object> props = new HashMap<>(config);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        log.info("Creating Kafka consumer {} (group={}, bootstrap={})",
            props.get(ConsumerConfig.CLIENT_ID_CONFIG), props.get(ConsumerConfig.GROUP_ID_CONFIG),
            props.get(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG));
        return new KafkaConsumer<>(props);
    }
}
