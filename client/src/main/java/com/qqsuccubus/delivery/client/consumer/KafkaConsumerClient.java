package com.qqsuccubus.delivery.client.consumer;

import com.qqsuccubus.delivery.client.config.ConsumerSettings;
import com.qqsuccubus.delivery.client.error.KafkaDeliveryException;
import com.qqsuccubus.delivery.client.error.MessageDeserializationException;
import com.qqsuccubus.delivery.client.metrics.ConsumerMetrics;
import com.qqsuccubus.delivery.client.producer.IDeadLetterPublisher;
import com.qqsuccubus.delivery.client.strategy.ConsumerDeliveryStrategy;
import com.qqsuccubus.delivery.client.strategy.DeliveryStrategies;
import com.qqsuccubus.delivery.client.transport.IKafkaClientFactory;
import com.qqsuccubus.delivery.core.model.ConsumerStats;
import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import com.qqsuccubus.delivery.core.model.KafkaMessage;
import com.qqsuccubus.delivery.core.model.PartitionWatermark;
import com.qqsuccubus.delivery.core.msg.HeaderNames;
import com.qqsuccubus.delivery.core.util.JitterBackoff;
import com.qqsuccubus.delivery.core.util.JsonUtils;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import javax.annotation.Nullable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Consumer pipeline bound to one named {@link ConsumerSettings} entry.
 * <p>
 * Pipeline layout:
 * <pre>
 * ingestion task --(bounded queue)--&gt; N worker tasks --&gt; strategy.afterProcess
 *       ^                                                        |
 *       +---------------- pending offsets / transport tasks -----+
 * </pre>
 * The Kafka consumer is single-threaded: only the ingestion task touches it. Workers hand
 * completed offsets to a {@link PendingOffsetCommitter}; other callers (watermark queries)
 * queue tasks that the ingestion task runs between polls.
 * </p>
 * <p>
 * A full queue blocks the ingestion task, which then stops polling. That is the only
 * backpressure; partitions are not paused.
 * </p>
 */
public class KafkaConsumerClient implements IKafkaConsumer {
    private static final Logger log = LoggerFactory.getLogger(KafkaConsumerClient.class);

    static final String MDC_CLIENT_NAME = "clientName";

    private static final long QUEUE_WAIT_MS = 100;
    private static final Duration TRANSPORT_QUERY_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration FLUSH_POLL_INTERVAL = Duration.ofMillis(500);

    private final String name;
    private final ConsumerSettings settings;
    private final ConsumerDeliveryStrategy strategy;
    private final RetryClassifier retryClassifier;
    private final Map<String, Object> transportConfig;
    private final Consumer<String, byte[]> consumer;
    private final BlockingQueue<KafkaMessage> queue;
    private final PendingOffsetCommitter committer = new PendingOffsetCommitter();
    private final Queue<Runnable> transportTasks = new ConcurrentLinkedQueue<>();
    private final ConsumerMetrics metrics;
    @Nullable
    private final IDeadLetterPublisher deadLetterPublisher;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Thread pollThread;
    private Scheduler scheduler;
    private Mono<Void> completion;

    public KafkaConsumerClient(ConsumerSettings settings, String bootstrapServers, String clientId,
                               IKafkaClientFactory clientFactory, MeterRegistry registry,
                               @Nullable IDeadLetterPublisher deadLetterPublisher) {
        this(settings, bootstrapServers, clientId, clientFactory, registry, deadLetterPublisher,
            new DefaultRetryClassifier());
    }

    public KafkaConsumerClient(ConsumerSettings settings, String bootstrapServers, String clientId,
                               IKafkaClientFactory clientFactory, MeterRegistry registry,
                               @Nullable IDeadLetterPublisher deadLetterPublisher,
                               RetryClassifier retryClassifier) {
        settings.validate();
        this.name = settings.getName();
        this.settings = settings;
        this.strategy = DeliveryStrategies.forConsumer(settings);
        this.retryClassifier = retryClassifier;
        this.deadLetterPublisher = deadLetterPublisher;

        Map<String, Object> config = new HashMap<>();
        config.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        config.put(ConsumerConfig.CLIENT_ID_CONFIG, clientId);
        config.put(ConsumerConfig.GROUP_ID_CONFIG, groupIdOf(settings));
        config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        strategy.configure(config);
        config.putAll(settings.getExtraConfig());
        this.transportConfig = Collections.unmodifiableMap(config);

        this.consumer = clientFactory.createConsumer(transportConfig);
        this.queue = new ArrayBlockingQueue<>(settings.getChannelCapacity());
        this.metrics = new ConsumerMetrics(registry, clientId, strategy.semantics(), queue);

        log.info("Consumer {} created (clientId={}, group={}, semantics={}, capacity={}, workers={})",
            name, clientId, groupId(), settings.getDeliverySemantics(), settings.getChannelCapacity(),
            settings.getMaxConcurrency());
    }

    private static String groupIdOf(ConsumerSettings settings) {
        return settings.getGroupId() != null ? settings.getGroupId() : settings.getName();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String groupId() {
        return groupIdOf(settings);
    }

    @Override
    public DeliverySemantics semantics() {
        return settings.getDeliverySemantics();
    }

    public Map<String, Object> transportConfig() {
        return transportConfig;
    }

    public ConsumerMetrics metrics() {
        return metrics;
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    // --- lifecycle -------------------------------------------------------------------------

    @Override
    public void subscribe(@Nullable Collection<String> topics, MessageHandler handler) {
        lifecycleLock.lock();
        try {
            if (closed.get()) {
                throw new KafkaDeliveryException("Consumer " + name + " is closed");
            }
            if (running.get()) {
                log.warn("Consumer {} is already subscribed, ignoring subscribe({})", name, topics);
                return;
            }
            List<String> resolved = topics == null || topics.isEmpty()
                ? settings.getTopics()
                : List.copyOf(topics);
            if (resolved.isEmpty()) {
                throw new IllegalArgumentException("No topics given or configured for consumer " + name);
            }

            cancelled.set(false);
            int workers = settings.getMaxConcurrency();
            scheduler = Schedulers.newBoundedElastic(workers + 1, Integer.MAX_VALUE, "kafka-consumer-" + name);

            List<Mono<Void>> tasks = new ArrayList<>(workers + 1);
            tasks.add(Mono.<Void>fromRunnable(() -> ingestionLoop(resolved)).subscribeOn(scheduler));
            for (int i = 0; i < workers; i++) {
                tasks.add(Mono.<Void>fromRunnable(() -> workerLoop(handler)).subscribeOn(scheduler));
            }
            completion = Mono.when(tasks)
                .doOnError(e -> log.error("Consumer pipeline {} failed", name, e))
                .onErrorResume(e -> Mono.empty())
                .cache();
            completion.subscribe();
            running.set(true);

            log.info("Consumer {} subscribed to {} with {} workers", name, resolved, workers);
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public <T> void subscribe(@Nullable Collection<String> topics, Class<T> type, TypedMessageHandler<T> handler) {
        subscribe(topics, message -> handler.handle(decode(message, type), message));
    }

    private static <T> T decode(KafkaMessage message, Class<T> type) {
        if (message.getValue() == null) {
            throw new MessageDeserializationException(
                "Empty value at " + message.coordinates() + ", expected " + type.getSimpleName(), null);
        }
        try {
            return JsonUtils.readValue(message.getValue(), type);
        } catch (IOException e) {
            throw new MessageDeserializationException(
                "Cannot decode " + message.coordinates() + " as " + type.getSimpleName(), e);
        }
    }

    @Override
    public void unsubscribe() {
        lifecycleLock.lock();
        try {
            if (!running.get()) {
                return;
            }
            log.info("Stopping consumer {}", name);
            cancelled.set(true);

            Duration grace = settings.getGracefulStopTimeout();
            if (!awaitCompletion(grace)) {
                log.warn("Consumer {} did not stop within {}, forcing shutdown", name, grace);
                consumer.wakeup();
                scheduler.dispose();
                if (!awaitCompletion(CLOSE_TIMEOUT)) {
                    log.error("Consumer {} pipeline still running after wakeup", name);
                }
                closeTransport();
            }

            int dropped = queue.size();
            queue.clear();
            if (dropped > 0) {
                log.info("Consumer {} dropped {} queued uncommitted messages", name, dropped);
            }
            scheduler.dispose();
            running.set(false);
            log.info("Consumer {} stopped", name);
        } finally {
            lifecycleLock.unlock();
        }
    }

    private boolean awaitCompletion(Duration timeout) {
        Boolean finished = completion.thenReturn(true)
            .timeout(timeout, Mono.just(false))
            .block();
        return Boolean.TRUE.equals(finished);
    }

    @Override
    public void close() {
        unsubscribe();
        closeTransport();
    }

    private void closeTransport() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            consumer.close(CLOSE_TIMEOUT);
            log.info("Consumer {} closed", name);
        } catch (RuntimeException e) {
            log.error("Failed to close consumer {}", name, e);
        }
    }

    // --- ingestion -------------------------------------------------------------------------

    private void ingestionLoop(List<String> topics) {
        MDC.put(MDC_CLIENT_NAME, name);
        pollThread = Thread.currentThread();
        try {
            consumer.subscribe(topics, new CommitOnRevoke());
            int errorAttempt = 0;
            while (!cancelled.get()) {
                runTransportTasks();
                committer.commitPending(consumer);

                ConsumerRecords<String, byte[]> records;
                try {
                    records = consumer.poll(settings.getPollTimeout());
                    errorAttempt = 0;
                } catch (WakeupException | InterruptException e) {
                    throw e;
                } catch (RuntimeException e) {
                    metrics.recordPollError();
                    errorAttempt++;
                    Duration delay = JitterBackoff.next(errorAttempt, settings.getRetryBackoff());
                    log.warn("Poll failed for consumer {} (attempt {}), retrying in {} ms: {}",
                        name, errorAttempt, delay.toMillis(), e.toString());
                    if (!sleepUnlessCancelled(delay)) {
                        break;
                    }
                    continue;
                }

                for (ConsumerRecord<String, byte[]> record : records) {
                    if (!enqueue(KafkaMessage.from(record))) {
                        break;
                    }
                }
            }
        } catch (WakeupException e) {
            log.debug("Consumer {} woken up", name);
        } catch (InterruptException e) {
            log.debug("Consumer {} interrupted", name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Consumer {} interrupted while enqueueing", name);
        } finally {
            pollThread = null;
            finishIngestion();
            MDC.remove(MDC_CLIENT_NAME);
        }
    }

    private void finishIngestion() {
        runTransportTasks();
        if (closed.get()) {
            return;
        }
        try {
            committer.commitPending(consumer);
            consumer.unsubscribe();
        } catch (WakeupException e) {
            log.debug("Consumer {} woken up during final commit", name);
        } catch (RuntimeException e) {
            log.warn("Final commit failed for consumer {}: {}", name, e.toString());
        }
    }

    private boolean enqueue(KafkaMessage message) throws InterruptedException {
        while (!cancelled.get()) {
            if (queue.offer(message, QUEUE_WAIT_MS, TimeUnit.MILLISECONDS)) {
                return true;
            }
            runTransportTasks();
            committer.commitPending(consumer);
        }
        return false;
    }

    private boolean sleepUnlessCancelled(Duration delay) throws InterruptedException {
        long deadline = System.nanoTime() + delay.toNanos();
        while (!cancelled.get()) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return true;
            }
            Thread.sleep(Math.min(remainingMs, QUEUE_WAIT_MS));
        }
        return false;
    }

    private void runTransportTasks() {
        Runnable task;
        while ((task = transportTasks.poll()) != null) {
            task.run();
        }
    }

    private final class CommitOnRevoke implements ConsumerRebalanceListener {
        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            if (!partitions.isEmpty()) {
                committer.commitPending(consumer);
                partitions.forEach(committer::forget);
                log.info("Consumer {} partitions revoked: {}", name, partitions);
            }
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            if (!partitions.isEmpty()) {
                log.info("Consumer {} partitions assigned: {}", name, partitions);
            }
        }
    }

    // --- processing ------------------------------------------------------------------------

    private void workerLoop(MessageHandler handler) {
        MDC.put(MDC_CLIENT_NAME, name);
        try {
            while (!cancelled.get()) {
                KafkaMessage message = queue.poll(QUEUE_WAIT_MS, TimeUnit.MILLISECONDS);
                if (message != null) {
                    process(handler, message);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Worker of consumer {} interrupted", name);
        } finally {
            MDC.remove(MDC_CLIENT_NAME);
        }
    }

    private void process(MessageHandler handler, KafkaMessage message) throws InterruptedException {
        long startNanos = System.nanoTime();
        try {
            handler.handle(message);
            metrics.recordProcessed(startNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (Exception first) {
            if (!retryClassifier.isRetryable(first)) {
                failPermanently(message, first, 1);
            } else {
                metrics.recordRetry();
                Duration delay = JitterBackoff.next(1, settings.getRetryBackoff());
                log.warn("Handler failed for {}, retrying once in {} ms: {}",
                    message.coordinates(), delay.toMillis(), first.toString());
                if (!sleepUnlessCancelled(delay)) {
                    // left uncommitted, redelivered to the next subscriber
                    log.info("Consumer {} stopping, retry of {} abandoned", name, message.coordinates());
                    return;
                }
                try {
                    handler.handle(message);
                    metrics.recordProcessed(startNanos);
                } catch (Exception second) {
                    failPermanently(message, second, 2);
                }
            }
        }
        strategy.afterProcess(committer, message);
    }

    private void failPermanently(KafkaMessage message, Exception error, int attemptCount) {
        metrics.recordFailed();
        log.error("Message {} failed permanently after {} attempt(s)", message.coordinates(), attemptCount, error);

        KafkaMessage failed = message.withHeaders(message.getHeaders()
            .put(HeaderNames.TOPIC_SOURCE, message.getTopic())
            .put(HeaderNames.PARTITION_SOURCE, String.valueOf(message.getPartition()))
            .put(HeaderNames.OFFSET_SOURCE, String.valueOf(message.getOffset()))
            .put(HeaderNames.EXCEPTION, error.toString()));

        if (!settings.isDeadLetterEnabled() || deadLetterPublisher == null) {
            return;
        }
        String deadLetterTopic = settings.deadLetterTopicFor(message.getTopic());
        try {
            deadLetterPublisher.publishToDeadLetter(deadLetterTopic, failed, error, attemptCount).block();
        } catch (RuntimeException e) {
            log.error("Dead-letter routing of {} to {} failed", message.coordinates(), deadLetterTopic, e);
        }
    }

    // --- watermarks ------------------------------------------------------------------------

    @Override
    public long totalMessagesInTopics() {
        return onPollThread(transport -> {
            long total = 0;
            for (TopicPartition partition : transport.assignment()) {
                try {
                    Long end = transport.endOffsets(Set.of(partition)).get(partition);
                    if (end != null) {
                        total += end;
                    }
                } catch (RuntimeException e) {
                    log.warn("High watermark query failed for {}: {}", partition, e.toString());
                }
            }
            return total;
        });
    }

    @Override
    public List<PartitionWatermark> partitionWatermarks() {
        return onPollThread(transport -> {
            List<PartitionWatermark> watermarks = new ArrayList<>();
            for (TopicPartition partition : transport.assignment()) {
                try {
                    long low = transport.beginningOffsets(Set.of(partition)).getOrDefault(partition, 0L);
                    long high = transport.endOffsets(Set.of(partition)).getOrDefault(partition, 0L);
                    watermarks.add(PartitionWatermark.builder()
                        .topic(partition.topic())
                        .partition(partition.partition())
                        .lowOffset(low)
                        .highOffset(high)
                        .consumedPosition(positionOrDefault(transport, partition, low))
                        .build());
                } catch (RuntimeException e) {
                    log.warn("Watermark query failed for {}: {}", partition, e.toString());
                }
            }
            return watermarks;
        });
    }

    private long positionOrDefault(Consumer<String, byte[]> transport, TopicPartition partition, long fallback) {
        try {
            return transport.position(partition);
        } catch (RuntimeException e) {
            log.debug("No position for {}: {}", partition, e.toString());
            return fallback;
        }
    }

    @Override
    public Mono<Void> flush(Duration timeout) {
        return Flux.interval(Duration.ZERO, FLUSH_POLL_INTERVAL)
            .onBackpressureDrop()
            .concatMap(tick -> Mono.fromCallable(this::totalMessagesInTopics)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(KafkaDeliveryException.class, e -> {
                    log.warn("Watermark query failed during flush of {}: {}", name, e.toString());
                    return Mono.just(Long.MAX_VALUE);
                }))
            .filter(total -> total == 0)
            .next()
            .timeout(timeout)
            .doOnSuccess(total -> log.info("Consumer {} drained", name))
            .onErrorResume(TimeoutException.class, e -> {
                log.warn("Consumer {} flush timed out after {}", name, timeout);
                return Mono.empty();
            })
            .then();
    }

    @Override
    public int pendingInQueue() {
        return queue.size();
    }

    @Override
    public ConsumerStats stats() {
        Map<String, Long> lagByPartition = new LinkedHashMap<>();
        long totalLag = 0;
        for (PartitionWatermark watermark : partitionWatermarks()) {
            lagByPartition.put(watermark.key(), watermark.lag());
            totalLag += watermark.lag();
        }
        return ConsumerStats.builder()
            .pendingInQueue(queue.size())
            .channelCapacity(settings.getChannelCapacity())
            .maxConcurrency(settings.getMaxConcurrency())
            .lagByPartition(lagByPartition)
            .totalLag(totalLag)
            .build();
    }

    /**
     * Runs {@code query} on the thread that owns the transport consumer. When no ingestion
     * loop is active the caller's thread is used under the lifecycle lock.
     */
    private <T> T onPollThread(Function<Consumer<String, byte[]>, T> query) {
        Thread owner = pollThread;
        if (owner == null || owner == Thread.currentThread()) {
            lifecycleLock.lock();
            try {
                if (closed.get()) {
                    throw new KafkaDeliveryException("Consumer " + name + " is closed");
                }
                return query.apply(consumer);
            } finally {
                lifecycleLock.unlock();
            }
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        transportTasks.add(() -> {
            try {
                result.complete(query.apply(consumer));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        try {
            return result.get(TRANSPORT_QUERY_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new KafkaDeliveryException("Transport query failed for consumer " + name, e.getCause());
        } catch (TimeoutException e) {
            throw new KafkaDeliveryException("Transport query timed out for consumer " + name, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KafkaDeliveryException("Interrupted while querying consumer " + name, e);
        }
    }
}
