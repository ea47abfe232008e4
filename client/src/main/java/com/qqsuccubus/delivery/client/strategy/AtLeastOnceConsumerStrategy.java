package com.qqsuccubus.delivery.client.strategy;

import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import com.qqsuccubus.delivery.core.model.KafkaMessage;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.TopicPartition;

import java.util.Map;

/**
 * Commits a record's offset only after the handler is done with it.
 */
public final class AtLeastOnceConsumerStrategy implements ConsumerDeliveryStrategy {

    @Override
    public DeliverySemantics semantics() {
        return DeliverySemantics.AT_LEAST_ONCE;
    }

    @Override
    public void configure(Map<String, Object> config) {
        config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    }

    @Override
    public void afterProcess(OffsetCommitter committer, KafkaMessage message) {
        committer.commit(new TopicPartition(message.getTopic(), message.getPartition()), message.getOffset() + 1);
    }
}
