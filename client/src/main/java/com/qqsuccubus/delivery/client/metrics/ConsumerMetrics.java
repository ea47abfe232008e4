package com.qqsuccubus.delivery.client.metrics;

import com.qqsuccubus.delivery.core.metrics.MetricsNames;
import com.qqsuccubus.delivery.core.metrics.MetricsTags;
import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Collection;

/**
 * Metrics of one consumer pipeline.
 */
public class ConsumerMetrics {

    private final Counter processed;
    private final Counter retries;
    private final Counter failed;
    private final Counter pollErrors;
    private final Timer latency;

    public ConsumerMetrics(MeterRegistry registry, String clientId, DeliverySemantics semantics,
                           Collection<?> queue) {
        processed = Counter.builder(MetricsNames.CONSUMER_MESSAGES_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.SEMANTICS, semantics.name())
            .description("Records handled successfully")
            .register(registry);

        retries = Counter.builder(MetricsNames.CONSUMER_RETRIES_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Handler retries after a retryable failure")
            .register(registry);

        failed = Counter.builder(MetricsNames.CONSUMER_FAILURES_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Records that failed permanently")
            .register(registry);

        pollErrors = Counter.builder(MetricsNames.CONSUMER_POLL_ERRORS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Transport errors raised by poll")
            .register(registry);

        latency = Timer.builder(MetricsNames.CONSUMER_LATENCY)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Handler latency per record")
            .register(registry);

        Gauge.builder(MetricsNames.CONSUMER_QUEUE_PENDING, queue, Collection::size)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Records waiting in the processing queue")
            .register(registry);
    }

    public void recordProcessed(long startNanos) {
        processed.increment();
        latency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordRetry() {
        retries.increment();
    }

    public void recordFailed() {
        failed.increment();
    }

    public void recordPollError() {
        pollErrors.increment();
    }

    public double processedCount() {
        return processed.count();
    }

    public double failedCount() {
        return failed.count();
    }

    public double retryCount() {
        return retries.count();
    }
}
