package com.qqsuccubus.delivery.client.config;

import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Settings of one named consumer.
 */
@Value
@Builder(toBuilder = true)
public class ConsumerSettings {

    String name;

    @Builder.Default
    List<String> topics = List.of();

    String groupId;

    @Builder.Default
    DeliverySemantics deliverySemantics = DeliverySemantics.AT_LEAST_ONCE;

    // Bound of the queue between the ingestion loop and the workers
    @Builder.Default
    int channelCapacity = 1000;

    @Builder.Default
    Duration retryBackoff = Duration.ofMillis(100);

    // Empty or null disables dead-letter routing
    @Builder.Default
    String deadLetterTopicSuffix = ".DLQ";

    // Name of the pooled producer used for dead letters
    @Nullable
    String deadLetterProducer;

    @Builder.Default
    Duration autoCommitInterval = Duration.ofSeconds(5);

    @Builder.Default
    Duration gracefulStopTimeout = Duration.ofSeconds(10);

    @Builder.Default
    Duration pollTimeout = Duration.ofMillis(100);

    @Builder.Default
    int maxConcurrency = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);

    @Builder.Default
    Map<String, Object> extraConfig = Map.of();

    /**
     * Checks value ranges the builder cannot express.
     *
     * @return this instance
     * @throws IllegalArgumentException when capacity or concurrency is below 1
     */
    public ConsumerSettings validate() {
        if (channelCapacity < 1) {
            throw new IllegalArgumentException("channelCapacity must be at least 1, was " + channelCapacity);
        }
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, was " + maxConcurrency);
        }
        return this;
    }

    public boolean isDeadLetterEnabled() {
        return deadLetterTopicSuffix != null && !deadLetterTopicSuffix.isEmpty();
    }

    public String deadLetterTopicFor(String topic) {
        return topic + deadLetterTopicSuffix;
    }

    /**
     * Reads the settings of consumer {@code name} from {@code KAFKA_CONSUMER_<NAME>_*} variables.
     * The group id defaults to the consumer name.
     *
     * @param name consumer name
     * @param env  environment map
     * @return settings with defaults for absent variables
     */
    public static ConsumerSettings fromEnv(String name, Map<String, String> env) {
        EnvReader reader = new EnvReader(env);
        ConsumerSettings defaults = ConsumerSettings.builder().name(name).groupId(name).build();
        String prefix = "KAFKA_CONSUMER";
        return defaults.toBuilder()
            .topics(reader.getList(EnvReader.key(prefix, name, "TOPICS")))
            .groupId(reader.get(EnvReader.key(prefix, name, "GROUP_ID"), defaults.getGroupId()))
            .deliverySemantics(DeliverySemantics.parse(reader.get(EnvReader.key(prefix, name, "SEMANTICS"),
                defaults.getDeliverySemantics().name())))
            .channelCapacity(reader.getInt(EnvReader.key(prefix, name, "CHANNEL_CAPACITY"),
                defaults.getChannelCapacity()))
            .retryBackoff(reader.getMillis(EnvReader.key(prefix, name, "RETRY_BACKOFF_MS"), defaults.getRetryBackoff()))
            .deadLetterTopicSuffix(reader.get(EnvReader.key(prefix, name, "DLQ_SUFFIX"),
                defaults.getDeadLetterTopicSuffix()))
            .deadLetterProducer(reader.get(EnvReader.key(prefix, name, "DLQ_PRODUCER"), null))
            .autoCommitInterval(reader.getMillis(EnvReader.key(prefix, name, "AUTO_COMMIT_INTERVAL_MS"),
                defaults.getAutoCommitInterval()))
            .gracefulStopTimeout(reader.getMillis(EnvReader.key(prefix, name, "GRACEFUL_STOP_TIMEOUT_MS"),
                defaults.getGracefulStopTimeout()))
            .pollTimeout(reader.getMillis(EnvReader.key(prefix, name, "POLL_TIMEOUT_MS"), defaults.getPollTimeout()))
            .maxConcurrency(reader.getInt(EnvReader.key(prefix, name, "MAX_CONCURRENCY"),
                defaults.getMaxConcurrency()))
            .build()
            .validate();
    }
}
