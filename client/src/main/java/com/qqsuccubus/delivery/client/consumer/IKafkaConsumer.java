package com.qqsuccubus.delivery.client.consumer;

import com.qqsuccubus.delivery.client.pool.PooledClient;
import com.qqsuccubus.delivery.core.model.ConsumerStats;
import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import com.qqsuccubus.delivery.core.model.PartitionWatermark;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Consumes topics through a bounded queue and a pool of handler workers.
 */
public interface IKafkaConsumer extends PooledClient {

    String groupId();

    DeliverySemantics semantics();

    /**
     * Starts the pipeline. A second call while running is ignored.
     *
     * @param topics  topics to consume; null or empty means the configured topics
     * @param handler per-message callback
     */
    void subscribe(@Nullable Collection<String> topics, MessageHandler handler);

    /**
     * Starts the pipeline with JSON decoding of each value into {@code type}.
     * Undecodable values fail permanently without a retry.
     */
    <T> void subscribe(@Nullable Collection<String> topics, Class<T> type, TypedMessageHandler<T> handler);

    /**
     * Stops the pipeline and waits for in-flight work up to the graceful stop timeout.
     * Safe to call more than once.
     */
    void unsubscribe();

    boolean isRunning();

    /**
     * @return sum of the high watermarks of all assigned partitions
     */
    long totalMessagesInTopics();

    List<PartitionWatermark> partitionWatermarks();

    /**
     * Polls {@link #totalMessagesInTopics()} until it reaches zero or {@code timeout} passes.
     *
     * @param timeout maximum wait
     * @return Mono completing in both cases
     */
    Mono<Void> flush(Duration timeout);

    int pendingInQueue();

    ConsumerStats stats();
}
