package com.qqsuccubus.delivery.client.error;

import com.qqsuccubus.delivery.core.model.TransactionState;
import lombok.Getter;

/**
 * Raised when a transactional operation is not legal in the current {@link TransactionState}.
 */
@Getter
public class TransactionStateException extends KafkaDeliveryException {

    private final TransactionState state;
    private final String operation;

    public TransactionStateException(String operation, TransactionState state, String message) {
        super("Cannot " + operation + " in state " + state + ": " + message);
        this.operation = operation;
        this.state = state;
    }
}
