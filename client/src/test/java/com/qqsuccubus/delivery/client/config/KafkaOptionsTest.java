package com.qqsuccubus.delivery.client.config;

import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KafkaOptionsTest {

    @Test
    void testFromEnv_Defaults() {
        KafkaOptions options = KafkaOptions.fromEnv(Map.of());

        assertEquals("localhost:9092", options.getBootstrapServers());
        assertEquals("kafka-delivery", options.getClientIdPrefix());
        assertEquals(100, options.getMaxPoolSize());
        assertTrue(options.getProducers().isEmpty());
        assertTrue(options.getConsumers().isEmpty());
    }

    @Test
    void testFromEnv_NamedClients() {
        Map<String, String> env = Map.ofEntries(
            Map.entry("KAFKA_BOOTSTRAP", "kafka-1:9092,kafka-2:9092"),
            Map.entry("KAFKA_CLIENT_ID", "billing"),
            Map.entry("KAFKA_POOL_MAX_SIZE", "20"),
            Map.entry("KAFKA_PRODUCERS", "orders, audit-log"),
            Map.entry("KAFKA_PRODUCER_ORDERS_SEMANTICS", "ExactlyOnce"),
            Map.entry("KAFKA_PRODUCER_ORDERS_TRANSACTION_TIMEOUT_MS", "15000"),
            Map.entry("KAFKA_PRODUCER_AUDIT_LOG_SEMANTICS", "at-most-once"),
            Map.entry("KAFKA_PRODUCER_AUDIT_LOG_DUPLICATE_DETECTION", "true"),
            Map.entry("KAFKA_CONSUMERS", "orders-reader"),
            Map.entry("KAFKA_CONSUMER_ORDERS_READER_TOPICS", "orders,orders-retry"),
            Map.entry("KAFKA_CONSUMER_ORDERS_READER_SEMANTICS", "dead_letter"),
            Map.entry("KAFKA_CONSUMER_ORDERS_READER_DLQ_PRODUCER", "audit-log"),
            Map.entry("KAFKA_CONSUMER_ORDERS_READER_CHANNEL_CAPACITY", "50"),
            Map.entry("KAFKA_CONSUMER_ORDERS_READER_GRACEFUL_STOP_TIMEOUT_MS", "2000"));

        KafkaOptions options = KafkaOptions.fromEnv(env);

        assertEquals("kafka-1:9092,kafka-2:9092", options.getBootstrapServers());
        assertEquals("billing-orders", options.clientId("orders"));
        assertEquals(20, options.getMaxPoolSize());

        ProducerSettings orders = options.producer("orders").orElseThrow();
        assertEquals(DeliverySemantics.EXACTLY_ONCE, orders.getDeliverySemantics());
        assertEquals(Duration.ofSeconds(15), orders.getTransactionTimeout());
        assertEquals(3, orders.getMaxRetries());

        ProducerSettings audit = options.producer("audit-log").orElseThrow();
        assertEquals(DeliverySemantics.AT_MOST_ONCE, audit.getDeliverySemantics());
        assertTrue(audit.isEnableDuplicateDetection());

        ConsumerSettings reader = options.consumer("orders-reader").orElseThrow();
        assertEquals(List.of("orders", "orders-retry"), reader.getTopics());
        assertEquals("orders-reader", reader.getGroupId());
        assertEquals(DeliverySemantics.DEAD_LETTER, reader.getDeliverySemantics());
        assertEquals("audit-log", reader.getDeadLetterProducer());
        assertEquals(50, reader.getChannelCapacity());
        assertEquals(Duration.ofSeconds(2), reader.getGracefulStopTimeout());
        assertFalse(options.consumer("missing").isPresent());
    }

    @Test
    void testFromEnv_InvalidNumberNamesTheVariable() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> KafkaOptions.fromEnv(Map.of("KAFKA_POOL_MAX_SIZE", "lots")));

        assertTrue(error.getMessage().contains("KAFKA_POOL_MAX_SIZE"));
    }

    @Test
    void testConsumerSettings_DefaultsAndValidation() {
        ConsumerSettings settings = ConsumerSettings.builder().name("reader").build();

        assertEquals(1000, settings.getChannelCapacity());
        assertEquals(Duration.ofSeconds(10), settings.getGracefulStopTimeout());
        assertEquals(Duration.ofSeconds(5), settings.getAutoCommitInterval());
        assertEquals(".DLQ", settings.getDeadLetterTopicSuffix());
        assertEquals("orders.DLQ", settings.deadLetterTopicFor("orders"));
        assertTrue(settings.getMaxConcurrency() >= 1);
        assertNull(settings.getDeadLetterProducer());
        assertTrue(settings.isDeadLetterEnabled());
        assertFalse(settings.toBuilder().deadLetterTopicSuffix("").build().isDeadLetterEnabled());

        assertThrows(IllegalArgumentException.class,
            () -> settings.toBuilder().channelCapacity(0).build().validate());
    }

    @Test
    void testProducerSettings_Defaults() {
        ProducerSettings settings = ProducerSettings.builder().name("writer").build();

        assertEquals(DeliverySemantics.AT_LEAST_ONCE, settings.getDeliverySemantics());
        assertEquals(Duration.ofMillis(100), settings.getRetryBackoff());
        assertEquals(Duration.ofSeconds(60), settings.getTransactionTimeout());
        assertEquals(5, settings.getLingerMs());
        assertEquals("gzip", settings.getCompressionType());
        assertTrue(settings.isEnableIdempotence());
        assertFalse(settings.isEnableDuplicateDetection());
    }
}
