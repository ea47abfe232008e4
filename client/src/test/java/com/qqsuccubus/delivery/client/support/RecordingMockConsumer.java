package com.qqsuccubus.delivery.client.support;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mock consumer that keeps every synchronous commit, even after unsubscribe or close.
 */
public class RecordingMockConsumer extends MockConsumer<String, byte[]> {

    public final List<Map<TopicPartition, OffsetAndMetadata>> commits = new CopyOnWriteArrayList<>();

    public RecordingMockConsumer() {
        super(OffsetResetStrategy.EARLIEST);
    }

    @Override
    public synchronized void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
        commits.add(Map.copyOf(offsets));
        super.commitSync(offsets);
    }

    /**
     * @return last committed next-offset for {@code partition}, or -1 when never committed
     */
    public long lastCommitted(TopicPartition partition) {
        long last = -1;
        for (Map<TopicPartition, OffsetAndMetadata> commit : commits) {
            OffsetAndMetadata offset = commit.get(partition);
            if (offset != null) {
                last = offset.offset();
            }
        }
        return last;
    }

    public long commitsFor(TopicPartition partition) {
        return commits.stream().filter(commit -> commit.containsKey(partition)).count();
    }

    /**
     * Assigns {@code partition} on the next poll and makes {@code values} available from offset 0.
     */
    public void deliverOnNextPoll(TopicPartition partition, List<String> values) {
        schedulePollTask(() -> {
            rebalance(List.of(partition));
            updateBeginningOffsets(Map.of(partition, 0L));
            updateEndOffsets(Map.of(partition, (long) values.size()));
            for (int i = 0; i < values.size(); i++) {
                addRecord(new ConsumerRecord<>(partition.topic(), partition.partition(), i, "k" + i,
                    values.get(i).getBytes(StandardCharsets.UTF_8)));
            }
        });
    }
}
