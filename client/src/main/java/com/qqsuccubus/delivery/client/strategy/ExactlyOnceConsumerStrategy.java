package com.qqsuccubus.delivery.client.strategy;

import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import com.qqsuccubus.delivery.core.model.KafkaMessage;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.TopicPartition;

import java.util.Map;

/**
 * Reads only committed transactional data and commits after processing.
 * <p>
 * The offset commit is a plain consumer commit. It is not part of a transaction with the
 * handler's side effects, so a crash between handling and commit redelivers the record.
 * </p>
 */
public final class ExactlyOnceConsumerStrategy implements ConsumerDeliveryStrategy {

    @Override
    public DeliverySemantics semantics() {
        return DeliverySemantics.EXACTLY_ONCE;
    }

    @Override
    public void configure(Map<String, Object> config) {
        config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        config.put(ConsumerConfig.ISOLATION_LEVEL_CONFIG, "read_committed");
    }

    @Override
    public void afterProcess(OffsetCommitter committer, KafkaMessage message) {
        committer.commit(new TopicPartition(message.getTopic(), message.getPartition()), message.getOffset() + 1);
    }
}
