package com.qqsuccubus.delivery.core.model;

import lombok.Builder;
import lombok.Value;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;

/**
 * Diagnostics attached to a message escalated to permanent-failure handling. Write-once.
 */
@Value
@Builder
public class FailureInfo {
    /**
     * Longest stack trace kept, it travels in a record header.
     */
    public static final int MAX_STACK_TRACE_CHARS = 4096;

    String errorType;

    String errorMessage;

    String stackTrace;

    /**
     * Number of handler invocations, 1 when the error was not retried.
     */
    int attemptCount;

    Instant failedAt;

    public static FailureInfo of(Throwable error, int attemptCount, Instant failedAt) {
        StringWriter trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));
        return FailureInfo.builder()
            .errorType(error.getClass().getSimpleName())
            .errorMessage(error.getMessage() != null ? error.getMessage() : "")
            .stackTrace(truncate(trace.toString()))
            .attemptCount(attemptCount)
            .failedAt(failedAt)
            .build();
    }

    private static String truncate(String trace) {
        return trace.length() <= MAX_STACK_TRACE_CHARS ? trace : trace.substring(0, MAX_STACK_TRACE_CHARS);
    }
}
