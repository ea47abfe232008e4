package com.qqsuccubus.delivery.client.config;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration of the client pool, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class KafkaOptions {

    @Builder.Default
    String bootstrapServers = "localhost:9092";

    @Builder.Default
    String clientIdPrefix = "kafka-delivery";

    @Builder.Default
    int maxPoolSize = 100;

    @Builder.Default
    Map<String, ProducerSettings> producers = Map.of();

    @Builder.Default
    Map<String, ConsumerSettings> consumers = Map.of();

    public Optional<ProducerSettings> producer(String name) {
        return Optional.ofNullable(producers.get(name));
    }

    public Optional<ConsumerSettings> consumer(String name) {
        return Optional.ofNullable(consumers.get(name));
    }

    public String clientId(String name) {
        return clientIdPrefix + "-" + name;
    }

    public static KafkaOptions fromEnv() {
        return fromEnv(System.getenv());
    }

    public static KafkaOptions fromEnv(Map<String, String> env) {
        EnvReader reader = new EnvReader(env);

        Map<String, ProducerSettings> producers = new LinkedHashMap<>();
        for (String name : reader.getList("KAFKA_PRODUCERS")) {
            producers.put(name, ProducerSettings.fromEnv(name, env));
        }
        Map<String, ConsumerSettings> consumers = new LinkedHashMap<>();
        for (String name : reader.getList("KAFKA_CONSUMERS")) {
            consumers.put(name, ConsumerSettings.fromEnv(name, env));
        }

        return KafkaOptions.builder()
            .bootstrapServers(reader.get("KAFKA_BOOTSTRAP", "localhost:9092"))
            .clientIdPrefix(reader.get("KAFKA_CLIENT_ID", "kafka-delivery"))
            .maxPoolSize(reader.getInt("KAFKA_POOL_MAX_SIZE", 100))
            .producers(Map.copyOf(producers))
            .consumers(Map.copyOf(consumers))
            .build();
    }
}
