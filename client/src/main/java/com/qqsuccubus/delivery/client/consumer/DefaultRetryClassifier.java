package com.qqsuccubus.delivery.client.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.qqsuccubus.delivery.client.error.MessageDeserializationException;

import java.util.List;

/**
 * Treats programming and data errors as permanent, everything else as transient.
 */
public class DefaultRetryClassifier implements RetryClassifier {

    private static final List<Class<? extends Throwable>> NON_RETRYABLE = List.of(
        IllegalArgumentException.class,
        IllegalStateException.class,
        UnsupportedOperationException.class,
        MessageDeserializationException.class,
        JsonProcessingException.class
    );

    @Override
    public boolean isRetryable(Throwable error) {
        for (Class<? extends Throwable> type : NON_RETRYABLE) {
            if (type.isInstance(error)) {
                return false;
            }
        }
        return true;
    }
}
