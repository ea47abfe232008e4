package com.qqsuccubus.delivery.client.consumer;

import com.qqsuccubus.delivery.client.support.RecordingMockConsumer;
import org.apache.kafka.clients.consumer.CommitFailedException;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PendingOffsetCommitterTest {

    private static final TopicPartition ORDERS_0 = new TopicPartition("orders", 0);
    private static final TopicPartition ORDERS_1 = new TopicPartition("orders", 1);

    private final PendingOffsetCommitter committer = new PendingOffsetCommitter();
    private final RecordingMockConsumer consumer = new RecordingMockConsumer();

    @Test
    void testCommitPending_KeepsHighestOffsetPerPartition() {
        committer.commit(ORDERS_0, 5);
        committer.commit(ORDERS_0, 3);
        committer.commit(ORDERS_1, 1);
        assertEquals(2, committer.pendingPartitions());

        assertEquals(2, committer.commitPending(consumer));

        assertEquals(0, committer.pendingPartitions());
        assertEquals(5, consumer.lastCommitted(ORDERS_0));
        assertEquals(1, consumer.lastCommitted(ORDERS_1));
        assertEquals(0, committer.commitPending(consumer));
        assertEquals(1, consumer.commits.size());
    }

    @Test
    void testCommitPending_NeverMovesBackwards() {
        committer.commit(ORDERS_0, 10);
        committer.commitPending(consumer);

        committer.commit(ORDERS_0, 7);
        assertEquals(0, committer.commitPending(consumer));

        committer.forget(ORDERS_0);
        committer.commit(ORDERS_0, 7);
        assertEquals(1, committer.commitPending(consumer));
        assertEquals(7, consumer.lastCommitted(ORDERS_0));
    }

    @Test
    void testCommitPending_FailureContained() {
        RecordingMockConsumer rejecting = new RecordingMockConsumer() {
            @Override
            public synchronized void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
                throw new CommitFailedException();
            }
        };
        committer.commit(ORDERS_0, 4);

        assertEquals(0, committer.commitPending(rejecting));

        assertEquals(0, committer.pendingPartitions());
        committer.commit(ORDERS_0, 4);
        assertEquals(1, committer.commitPending(consumer));
    }
}
