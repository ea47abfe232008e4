package com.qqsuccubus.delivery.client.metrics;

import com.qqsuccubus.delivery.core.metrics.MetricsNames;
import com.qqsuccubus.delivery.core.metrics.MetricsTags;
import com.qqsuccubus.delivery.core.model.DeliverySemantics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Metrics of one producer client.
 */
public class ProducerMetrics {

    private final MeterRegistry registry;
    private final String clientId;

    private final Counter sent;
    private final Counter deadLetters;
    private final Timer latency;

    public ProducerMetrics(MeterRegistry registry, String clientId, DeliverySemantics semantics) {
        this.registry = registry;
        this.clientId = clientId;

        sent = Counter.builder(MetricsNames.PRODUCER_MESSAGES_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.SEMANTICS, semantics.name())
            .description("Records handed to the broker")
            .register(registry);

        deadLetters = Counter.builder(MetricsNames.PRODUCER_DEAD_LETTERS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Records written to dead-letter topics")
            .register(registry);

        latency = Timer.builder(MetricsNames.PRODUCER_LATENCY)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.SEMANTICS, semantics.name())
            .description("Publish latency until the delivery strategy completes")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(5),
                Duration.ofMillis(20),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500)
            )
            .register(registry);
    }

    public void recordSent(long startNanos) {
        sent.increment();
        latency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordDeadLetter() {
        deadLetters.increment();
    }

    /**
     * Counts a failed publish, tagged with the error class.
     *
     * @param error cause of the failure
     */
    public void recordError(Throwable error) {
        Counter.builder(MetricsNames.PRODUCER_ERRORS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.REASON, error.getClass().getSimpleName())
            .register(registry)
            .increment();
    }

    public double sentCount() {
        return sent.count();
    }
}
