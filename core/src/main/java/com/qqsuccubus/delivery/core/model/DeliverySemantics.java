package com.qqsuccubus.delivery.core.model;

/**
 * Delivery guarantee selected once per producer or consumer instance.
 * <p>
 * {@link #DEAD_LETTER} behaves exactly like {@link #AT_LEAST_ONCE}; it only marks that
 * permanently failing messages are routed to a dead-letter topic.
 * </p>
 */
public enum DeliverySemantics {
    /**
     * Fire-and-forget. Messages may be lost, never duplicated.
     */
    AT_MOST_ONCE,

    /**
     * Acknowledged by all in-sync replicas, committed after processing. Messages may be duplicated.
     */
    AT_LEAST_ONCE,

    /**
     * Transactional production, read-committed consumption.
     */
    EXACTLY_ONCE,

    /**
     * Alias of {@link #AT_LEAST_ONCE} with dead-letter routing on permanent failure.
     */
    DEAD_LETTER;

    /**
     * Resolves aliases to the semantics that actually drive transport configuration.
     *
     * @return the effective semantics
     */
    public DeliverySemantics effective() {
        return this == DEAD_LETTER ? AT_LEAST_ONCE : this;
    }

    /**
     * Lenient parser used by environment-based configuration.
     * Accepts {@code AtLeastOnce}, {@code at_least_once}, {@code at-least-once}.
     *
     * @param value raw value
     * @return parsed semantics
     */
    public static DeliverySemantics parse(String value) {
        String normalized = value.trim()
            .replaceAll("([a-z])([A-Z])", "$1_$2")
            .replace('-', '_')
            .toUpperCase();
        return valueOf(normalized);
    }
}
