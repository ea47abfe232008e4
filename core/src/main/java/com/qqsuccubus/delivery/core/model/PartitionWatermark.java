package com.qqsuccubus.delivery.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time snapshot of a partition, queried from the broker on demand and never cached.
 */
@Value
@Builder
public class PartitionWatermark {
    String topic;

    int partition;

    /**
     * Earliest offset still available; older messages were removed by retention.
     */
    long lowOffset;

    /**
     * Offset of the next message to be written. Approximates the total number of messages.
     */
    long highOffset;

    /**
     * Offset this consumer reads next.
     */
    long consumedPosition;

    /**
     * Messages available on the broker but not yet consumed.
     */
    public long lag() {
        return Math.max(0, highOffset - consumedPosition);
    }

    public double consumedPercentage() {
        return highOffset > 0 ? (consumedPosition / (double) highOffset) * 100 : 0;
    }

    public String key() {
        return topic + ":" + partition;
    }

    @Override
    public String toString() {
        return String.format("%s - Total: %d, Consumed: %d (%.1f%%), Remaining: %d",
            key(), highOffset, consumedPosition, consumedPercentage(), lag());
    }
}
