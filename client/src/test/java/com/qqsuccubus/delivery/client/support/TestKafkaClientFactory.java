package com.qqsuccubus.delivery.client.support;

import com.qqsuccubus.delivery.client.transport.IKafkaClientFactory;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Hands out Kafka mock clients and remembers the configuration they were created with.
 */
public class TestKafkaClientFactory implements IKafkaClientFactory {

    private final Supplier<MockProducer<String, byte[]>> producerSupplier;
    private final Supplier<MockConsumer<String, byte[]>> consumerSupplier;

    public final List<MockProducer<String, byte[]>> producers = new CopyOnWriteArrayList<>();
    public final List<MockConsumer<String, byte[]>> consumers = new CopyOnWriteArrayList<>();
    public final List<Map<String, Object>> producerConfigs = new CopyOnWriteArrayList<>();
    public final List<Map<String, Object>> consumerConfigs = new CopyOnWriteArrayList<>();

    public TestKafkaClientFactory() {
        this(TestKafkaClientFactory::autoCompletingProducer,
            () -> new MockConsumer<>(OffsetResetStrategy.EARLIEST));
    }

    public TestKafkaClientFactory(Supplier<MockProducer<String, byte[]>> producerSupplier,
                                  Supplier<MockConsumer<String, byte[]>> consumerSupplier) {
        this.producerSupplier = producerSupplier;
        this.consumerSupplier = consumerSupplier;
    }

    public static MockProducer<String, byte[]> autoCompletingProducer() {
        return new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    }

    @Override
    public Producer<String, byte[]> createProducer(Map<String, Object> config) {
        MockProducer<String, byte[]> producer = producerSupplier.get();
        producers.add(producer);
        producerConfigs.add(config);
        return producer;
    }

    @Override
    public Consumer<String, byte[]> createConsumer(Map<String, Object> config) {
        MockConsumer<String, byte[]> consumer = consumerSupplier.get();
        consumers.add(consumer);
        consumerConfigs.add(config);
        return consumer;
    }

    public MockProducer<String, byte[]> lastProducer() {
        return producers.get(producers.size() - 1);
    }

    public MockConsumer<String, byte[]> lastConsumer() {
        return consumers.get(consumers.size() - 1);
    }
}
