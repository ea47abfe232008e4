package com.qqsuccubus.delivery.client.strategy;

import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import com.qqsuccubus.delivery.core.model.KafkaMessage;
import org.apache.kafka.clients.consumer.ConsumerConfig;

import java.time.Duration;
import java.util.Map;

/**
 * Offsets are auto-committed on a timer, possibly before the handler runs.
 */
public final class AtMostOnceConsumerStrategy implements ConsumerDeliveryStrategy {

    private final Duration autoCommitInterval;

    public AtMostOnceConsumerStrategy(Duration autoCommitInterval) {
        this.autoCommitInterval = autoCommitInterval;
    }

    @Override
    public DeliverySemantics semantics() {
        return DeliverySemantics.AT_MOST_ONCE;
    }

    @Override
    public void configure(Map<String, Object> config) {
        config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, true);
        config.put(ConsumerConfig.AUTO_COMMIT_INTERVAL_MS_CONFIG, (int) autoCommitInterval.toMillis());
    }

    @Override
    public void afterProcess(OffsetCommitter committer, KafkaMessage message) {
        // auto commit
    }
}
