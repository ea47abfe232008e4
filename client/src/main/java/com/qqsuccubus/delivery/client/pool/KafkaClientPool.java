package com.qqsuccubus.delivery.client.pool;

import com.qqsuccubus.delivery.client.config.ConsumerSettings;
import com.qqsuccubus.delivery.client.config.KafkaOptions;
import com.qqsuccubus.delivery.client.config.ProducerSettings;
import com.qqsuccubus.delivery.client.consumer.IKafkaConsumer;
import com.qqsuccubus.delivery.client.consumer.KafkaConsumerClient;
import com.qqsuccubus.delivery.client.error.MissingConfigurationException;
import com.qqsuccubus.delivery.client.producer.IDeadLetterPublisher;
import com.qqsuccubus.delivery.client.producer.IKafkaProducer;
import com.qqsuccubus.delivery.client.producer.KafkaProducerClient;
import com.qqsuccubus.delivery.client.transport.IKafkaClientFactory;
import com.qqsuccubus.delivery.client.transport.KafkaClientFactory;
import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Registry of named producers and consumers built from {@link KafkaOptions}.
 * <p>
 * Producers and consumers live in separate {@link InstancePool}s sharing the same
 * maximum size. Closing the pool closes every instance.
 * </p>
 */
public class KafkaClientPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KafkaClientPool.class);

    private final KafkaOptions options;
    private final IKafkaClientFactory clientFactory;
    private final MeterRegistry registry;
    private final InstancePool<IKafkaProducer> producers;
    private final InstancePool<IKafkaConsumer> consumers;

    public KafkaClientPool(KafkaOptions options) {
        this(options, new KafkaClientFactory(), Metrics.globalRegistry, Clock.systemUTC());
    }

    public KafkaClientPool(KafkaOptions options, IKafkaClientFactory clientFactory, MeterRegistry registry,
                           Clock clock) {
        this.options = options;
        this.clientFactory = clientFactory;
        this.registry = registry;
        this.producers = new InstancePool<>("producer", options.getMaxPoolSize(), clock, registry);
        this.consumers = new InstancePool<>("consumer", options.getMaxPoolSize(), clock, registry);
        log.info("Kafka client pool created (bootstrap={}, producers={}, consumers={}, maxPoolSize={})",
            options.getBootstrapServers(), options.getProducers().keySet(), options.getConsumers().keySet(),
            options.getMaxPoolSize());
    }

    /**
     * @throws MissingConfigurationException when no producer settings exist for {@code name}
     */
    public IKafkaProducer getOrCreateProducer(String name) {
        return producers.getOrCreate(name, this::createProducer);
    }

    /**
     * @throws MissingConfigurationException when no consumer settings exist for {@code name},
     *                                       or for its dead-letter producer
     */
    public IKafkaConsumer getOrCreateConsumer(String name) {
        return consumers.getOrCreate(name, this::createConsumer);
    }

    public boolean removeProducer(String name) {
        return producers.remove(name);
    }

    public boolean removeConsumer(String name) {
        return consumers.remove(name);
    }

    public int producerCount() {
        return producers.size();
    }

    public int consumerCount() {
        return consumers.size();
    }

    public List<IKafkaConsumer> consumersInGroup(String groupId) {
        return consumers.instances().stream()
            .filter(consumer -> groupId.equals(consumer.groupId()))
            .collect(Collectors.toList());
    }

    InstancePool<IKafkaProducer> producerPool() {
        return producers;
    }

    InstancePool<IKafkaConsumer> consumerPool() {
        return consumers;
    }

    @Override
    public void close() {
        log.info("Closing Kafka client pool ({} consumers, {} producers)", consumers.size(), producers.size());
        // consumers first, they may still route dead letters through pooled producers
        consumers.close();
        producers.close();
    }

    private IKafkaProducer createProducer(String name) {
        ProducerSettings settings = options.producer(name)
            .orElseThrow(() -> new MissingConfigurationException("Producer", name));
        if (settings.getName() == null) {
            settings = settings.toBuilder().name(name).build();
        }
        return new KafkaProducerClient(settings, options.getBootstrapServers(), options.clientId(name),
            clientFactory, registry);
    }

    private IKafkaConsumer createConsumer(String name) {
        ConsumerSettings settings = options.consumer(name)
            .orElseThrow(() -> new MissingConfigurationException("Consumer", name));
        if (settings.getName() == null) {
            settings = settings.toBuilder().name(name).build();
        }
        IDeadLetterPublisher deadLetterPublisher = null;
        if (settings.getDeliverySemantics() == DeliverySemantics.DEAD_LETTER
            && settings.getDeadLetterProducer() != null) {
            String producerName = settings.getDeadLetterProducer();
            // fail fast on a missing producer definition
            getOrCreateProducer(producerName);
            // resolved per write, the pooled producer may have been removed or evicted
            deadLetterPublisher = (topic, message, error, attemptCount) -> Mono.defer(() ->
                getOrCreateProducer(producerName).publishToDeadLetter(topic, message, error, attemptCount));
        }
        return new KafkaConsumerClient(settings, options.getBootstrapServers(), options.clientId(name),
            clientFactory, registry, deadLetterPublisher);
    }
}
