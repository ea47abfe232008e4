package com.qqsuccubus.delivery.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Backlog snapshot of a consumer: records buffered locally plus broker-side lag.
 */
@Value
@Builder
public class ConsumerStats {
    /**
     * Records pulled from the broker and waiting in the processing queue.
     */
    int pendingInQueue;

    int channelCapacity;

    int maxConcurrency;

    /**
     * Broker lag per partition, keyed {@code topic:partition}.
     */
    Map<String, Long> lagByPartition;

    long totalLag;

    public double channelUtilizationPercent() {
        return channelCapacity > 0 ? (pendingInQueue / (double) channelCapacity) * 100 : 0;
    }

    public boolean isChannelNearCapacity() {
        return channelUtilizationPercent() > 80;
    }

    public long totalBacklog() {
        return pendingInQueue + totalLag;
    }
}
