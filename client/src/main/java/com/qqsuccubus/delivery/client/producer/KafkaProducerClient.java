package com.qqsuccubus.delivery.client.producer;

import com.qqsuccubus.delivery.client.config.ProducerSettings;
import com.qqsuccubus.delivery.client.error.KafkaDeliveryException;
import com.qqsuccubus.delivery.client.metrics.ProducerMetrics;
import com.qqsuccubus.delivery.client.strategy.DeliveryStrategies;
import com.qqsuccubus.delivery.client.strategy.ProducerDeliveryStrategy;
import com.qqsuccubus.delivery.client.transaction.TransactionCoordinator;
import com.qqsuccubus.delivery.client.transport.IKafkaClientFactory;
import com.qqsuccubus.delivery.core.hash.Hashers;
import com.qqsuccubus.delivery.core.model.DeliveryReceipt;
import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import com.qqsuccubus.delivery.core.model.FailureInfo;
import com.qqsuccubus.delivery.core.model.KafkaMessage;
import com.qqsuccubus.delivery.core.model.MessageHeaders;
import com.qqsuccubus.delivery.core.model.PublishOutcome;
import com.qqsuccubus.delivery.core.msg.HeaderNames;
import com.qqsuccubus.delivery.core.util.BytesUtils;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Producer client bound to one named {@link ProducerSettings} entry.
 * <p>
 * Every record goes through the {@link ProducerDeliveryStrategy} chosen from the settings;
 * exactly-once producers additionally own a {@link TransactionCoordinator}.
 * </p>
 */
public class KafkaProducerClient implements IKafkaProducer {
    private static final Logger log = LoggerFactory.getLogger(KafkaProducerClient.class);

    static final String MDC_TRACE_ID = "traceId";
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final String name;
    private final ProducerSettings settings;
    private final ProducerDeliveryStrategy strategy;
    private final Map<String, Object> transportConfig;
    private final Producer<String, byte[]> producer;
    private final TransactionCoordinator coordinator;
    private final ProducerMetrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public KafkaProducerClient(ProducerSettings settings, String bootstrapServers, String clientId,
                               IKafkaClientFactory clientFactory, MeterRegistry registry) {
        this.name = settings.getName();
        this.settings = settings;
        this.strategy = DeliveryStrategies.forProducer(settings, clientId);

        Map<String, Object> config = new HashMap<>();
        config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        config.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
        config.put(ProducerConfig.LINGER_MS_CONFIG, settings.getLingerMs());
        config.put(ProducerConfig.BATCH_SIZE_CONFIG, settings.getBatchSize());
        config.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, settings.getCompressionType());
        config.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, (int) settings.getRetryBackoff().toMillis());
        strategy.configure(config);
        config.putAll(settings.getExtraConfig());
        this.transportConfig = Collections.unmodifiableMap(config);

        this.producer = clientFactory.createProducer(transportConfig);
        this.coordinator = strategy.requiresTransactionalProducer()
            ? new TransactionCoordinator(producer, (String) config.get(ProducerConfig.TRANSACTIONAL_ID_CONFIG))
            : null;
        this.metrics = new ProducerMetrics(registry, clientId, strategy.semantics());

        log.info("Producer {} created (clientId={}, semantics={}, acks={})",
            name, clientId, settings.getDeliverySemantics(), config.get(ProducerConfig.ACKS_CONFIG));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DeliverySemantics semantics() {
        return settings.getDeliverySemantics();
    }

    public Map<String, Object> transportConfig() {
        return transportConfig;
    }

    @Nullable
    public TransactionCoordinator transactionCoordinator() {
        return coordinator;
    }

    public ProducerMetrics metrics() {
        return metrics;
    }

    @Override
    public Mono<DeliveryReceipt> publish(String topic, Object payload) {
        return publish(topic, UUID.randomUUID().toString(), payload);
    }

    @Override
    public Mono<DeliveryReceipt> publish(String topic, @Nullable String key, Object payload) {
        return publish(topic, key, payload, UUID.randomUUID().toString());
    }

    private Mono<DeliveryReceipt> publish(String topic, @Nullable String key, Object payload, String correlationId) {
        return Mono.defer(() -> {
            ensureOpen();
            byte[] value = BytesUtils.toBytes(payload);
            MessageHeaders headers = outboundHeaders(key, value, correlationId);
            return send(new ProducerRecord<>(topic, null, key, value, headers.toKafkaHeaders()));
        }).doOnError(e -> log.error("Failed to publish to {} (producer={}, key={})", topic, name, key, e));
    }

    private Mono<DeliveryReceipt> send(ProducerRecord<String, byte[]> record) {
        long startNanos = System.nanoTime();
        return strategy.publish(record, producer, coordinator)
            .doOnSuccess(receipt -> metrics.recordSent(startNanos))
            .doOnError(metrics::recordError);
    }

    @Override
    public Mono<List<PublishOutcome>> publishBatch(String topic, List<?> payloads) {
        String correlationId = UUID.randomUUID().toString();
        return Flux.fromIterable(payloads)
            .flatMapSequential(payload -> publish(topic, UUID.randomUUID().toString(), payload, correlationId)
                .map(PublishOutcome::success)
                .onErrorResume(e -> Mono.just(PublishOutcome.failure(e))))
            .collectList()
            .doOnNext(outcomes -> {
                long failed = outcomes.stream().filter(outcome -> !outcome.isSuccess()).count();
                if (failed > 0) {
                    log.warn("Batch to {} finished: {} succeeded, {} failed (correlationId={})",
                        topic, outcomes.size() - failed, failed, correlationId);
                } else {
                    log.info("Batch to {} finished: {} succeeded (correlationId={})",
                        topic, outcomes.size(), correlationId);
                }
            });
    }

    @Override
    public Mono<DeliveryReceipt> publishToDeadLetter(String topic, KafkaMessage message, Throwable error,
                                                     int attemptCount) {
        return Mono.defer(() -> {
                ensureOpen();
                FailureInfo failure = FailureInfo.of(error, attemptCount, Instant.now());
                MessageHeaders headers = deadLetterHeaders(message, failure);
                return send(new ProducerRecord<>(topic, null, message.getKey(), message.getValue(),
                    headers.toKafkaHeaders()));
            })
            .doOnSuccess(receipt -> {
                metrics.recordDeadLetter();
                log.warn("Message {} moved to dead-letter topic {} after {} attempt(s): {}",
                    message.coordinates(), topic, attemptCount, error.toString());
            })
            .onErrorResume(e -> {
                log.error("Failed to write {} to dead-letter topic {}", message.coordinates(), topic, e);
                return Mono.empty();
            });
    }

    @Override
    public Mono<Void> flush(Duration timeout) {
        return Mono.<Void>fromRunnable(producer::flush)
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            producer.flush();
        } catch (RuntimeException e) {
            log.warn("Flush before close failed for producer {}", name, e);
        }
        try {
            producer.close(CLOSE_TIMEOUT);
            log.info("Producer {} closed", name);
        } catch (RuntimeException e) {
            log.error("Failed to close producer {}", name, e);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new KafkaDeliveryException("Producer " + name + " is closed");
        }
    }

    private MessageHeaders outboundHeaders(@Nullable String key, byte[] value, String correlationId) {
        String traceId = MDC.get(MDC_TRACE_ID);
        MessageHeaders headers = MessageHeaders.empty()
            .put(HeaderNames.TRACE_ID, traceId != null ? traceId : UUID.randomUUID().toString())
            .put(HeaderNames.CORRELATION_ID, correlationId)
            .put(HeaderNames.PRODUCED_AT, String.valueOf(System.currentTimeMillis()));
        if (settings.isEnableDuplicateDetection()) {
            headers = headers
                .put(HeaderNames.IDEMPOTENCE_KEY, Hashers.idempotenceKey(key, value))
                .put(HeaderNames.MESSAGE_ID, UUID.randomUUID().toString());
        }
        return headers;
    }

    private static MessageHeaders deadLetterHeaders(KafkaMessage message, FailureInfo failure) {
        MessageHeaders headers = MessageHeaders.empty();
        for (MessageHeaders.Entry entry : message.getHeaders().entries()) {
            headers = headers.add(HeaderNames.dlqOriginal(entry.name()), entry.value());
        }
        return headers
            .put(HeaderNames.DLQ_ORIGINAL_TOPIC, message.getTopic())
            .put(HeaderNames.DLQ_ORIGINAL_PARTITION, String.valueOf(message.getPartition()))
            .put(HeaderNames.DLQ_ORIGINAL_OFFSET, String.valueOf(message.getOffset()))
            .put(HeaderNames.DLQ_ERROR_TYPE, failure.getErrorType())
            .put(HeaderNames.DLQ_ERROR_MESSAGE, failure.getErrorMessage())
            .put(HeaderNames.DLQ_ATTEMPT_COUNT, String.valueOf(failure.getAttemptCount()))
            .put(HeaderNames.DLQ_FAILED_AT, failure.getFailedAt().toString())
            .put(HeaderNames.DLQ_STACK_TRACE, failure.getStackTrace());
    }
}
