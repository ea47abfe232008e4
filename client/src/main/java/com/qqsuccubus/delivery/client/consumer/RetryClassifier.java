package com.qqsuccubus.delivery.client.consumer;

/**
 * Decides whether a failed handler attempt is worth one more try.
 */
@FunctionalInterface
public interface RetryClassifier {

    boolean isRetryable(Throwable error);
}
