package com.qqsuccubus.delivery.client.config;

import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Settings of one named producer.
 */
@Value
@Builder(toBuilder = true)
public class ProducerSettings {

    String name;

    @Builder.Default
    List<String> topics = List.of();

    @Builder.Default
    DeliverySemantics deliverySemantics = DeliverySemantics.AT_LEAST_ONCE;

    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    Duration retryBackoff = Duration.ofMillis(100);

    @Builder.Default
    boolean enableIdempotence = true;

    // Adds idempotence-key and message-id headers to every record
    @Builder.Default
    boolean enableDuplicateDetection = false;

    @Builder.Default
    Duration transactionTimeout = Duration.ofSeconds(60);

    @Builder.Default
    String deadLetterTopicSuffix = ".DLQ";

    @Builder.Default
    int lingerMs = 5;

    @Builder.Default
    int batchSize = 32 * 1024;

    @Builder.Default
    String compressionType = "gzip";

    // Raw transport properties applied last, overriding anything above
    @Builder.Default
    Map<String, Object> extraConfig = Map.of();

    /**
     * Reads the settings of producer {@code name} from {@code KAFKA_PRODUCER_<NAME>_*} variables.
     *
     * @param name producer name
     * @param env  environment map
     * @return settings with defaults for absent variables
     */
    public static ProducerSettings fromEnv(String name, Map<String, String> env) {
        EnvReader reader = new EnvReader(env);
        ProducerSettings defaults = ProducerSettings.builder().name(name).build();
        String prefix = "KAFKA_PRODUCER";
        return defaults.toBuilder()
            .topics(reader.getList(EnvReader.key(prefix, name, "TOPICS")))
            .deliverySemantics(DeliverySemantics.parse(reader.get(EnvReader.key(prefix, name, "SEMANTICS"),
                defaults.getDeliverySemantics().name())))
            .maxRetries(reader.getInt(EnvReader.key(prefix, name, "MAX_RETRIES"), defaults.getMaxRetries()))
            .retryBackoff(reader.getMillis(EnvReader.key(prefix, name, "RETRY_BACKOFF_MS"), defaults.getRetryBackoff()))
            .enableIdempotence(reader.getBoolean(EnvReader.key(prefix, name, "IDEMPOTENCE"),
                defaults.isEnableIdempotence()))
            .enableDuplicateDetection(reader.getBoolean(EnvReader.key(prefix, name, "DUPLICATE_DETECTION"),
                defaults.isEnableDuplicateDetection()))
            .transactionTimeout(reader.getMillis(EnvReader.key(prefix, name, "TRANSACTION_TIMEOUT_MS"),
                defaults.getTransactionTimeout()))
            .deadLetterTopicSuffix(reader.get(EnvReader.key(prefix, name, "DLQ_SUFFIX"),
                defaults.getDeadLetterTopicSuffix()))
            .lingerMs(reader.getInt(EnvReader.key(prefix, name, "LINGER_MS"), defaults.getLingerMs()))
            .batchSize(reader.getInt(EnvReader.key(prefix, name, "BATCH_SIZE"), defaults.getBatchSize()))
            .compressionType(reader.get(EnvReader.key(prefix, name, "COMPRESSION"), defaults.getCompressionType()))
            .build();
    }
}
