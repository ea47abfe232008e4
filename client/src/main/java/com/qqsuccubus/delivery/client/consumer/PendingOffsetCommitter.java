package com.qqsuccubus.delivery.client.consumer;

import com.qqsuccubus.delivery.client.strategy.OffsetCommitter;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collects offsets from worker threads and commits them from the polling thread.
 * <p>
 * Per partition only the highest completed offset is kept. Workers may finish records
 * out of order; a committed offset never moves backwards.
 * </p>
 */
class PendingOffsetCommitter implements OffsetCommitter {
    private static final Logger log = LoggerFactory.getLogger(PendingOffsetCommitter.class);

    private final ConcurrentHashMap<TopicPartition, Long> pending = new ConcurrentHashMap<>();

    // Touched by the polling thread only
    private final Map<TopicPartition, Long> committed = new HashMap<>();

    @Override
    public void commit(TopicPartition partition, long nextOffset) {
        pending.merge(partition, nextOffset, Math::max);
    }

    int pendingPartitions() {
        return pending.size();
    }

    /**
     * Commits everything collected so far. Must run on the thread that owns {@code consumer}.
     *
     * @param consumer transport consumer
     * @return number of partitions committed
     */
    int commitPending(Consumer<String, byte[]> consumer) {
        if (pending.isEmpty()) {
            return 0;
        }
        Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
        for (TopicPartition partition : pending.keySet()) {
            Long offset = pending.remove(partition);
            Long last = committed.get(partition);
            if (offset != null && (last == null || offset > last)) {
                offsets.put(partition, new OffsetAndMetadata(offset));
            }
        }
        if (offsets.isEmpty()) {
            return 0;
        }
        try {
            consumer.commitSync(offsets);
            offsets.forEach((partition, offset) -> committed.put(partition, offset.offset()));
            log.debug("Committed offsets {}", offsets);
            return offsets.size();
        } catch (RuntimeException e) {
            log.warn("Offset commit failed for {}, records will be redelivered: {}", offsets.keySet(), e.toString());
            return 0;
        }
    }

    void forget(TopicPartition partition) {
        committed.remove(partition);
    }
}
