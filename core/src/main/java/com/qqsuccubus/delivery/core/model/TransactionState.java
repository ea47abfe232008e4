package com.qqsuccubus.delivery.core.model;

/**
 * State of a transactional producer.
 * <pre>
 * NOT_INITIALIZED --init--> READY --begin--> IN_TRANSACTION --commit/abort--> READY
 * any failure in init/begin/commit --> ERROR (until reset or successful abort)
 * </pre>
 */
public enum TransactionState {
    NOT_INITIALIZED,
    READY,
    IN_TRANSACTION,
    ERROR
}
