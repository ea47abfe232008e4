package com.qqsuccubus.delivery.client.strategy;

import org.apache.kafka.common.TopicPartition;

/**
 * Accepts offsets of fully processed records for commit.
 */
@FunctionalInterface
public interface OffsetCommitter {

    /**
     * @param partition  partition of the processed record
     * @param nextOffset offset of the next record to consume (processed offset + 1)
     */
    void commit(TopicPartition partition, long nextOffset);
}
