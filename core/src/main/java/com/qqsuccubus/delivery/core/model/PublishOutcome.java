package com.qqsuccubus.delivery.core.model;

import java.util.Objects;

/**
 * Independent result of one message in a batch publish: either a receipt or an error.
 */
public final class PublishOutcome {

    private final DeliveryReceipt receipt;
    private final Throwable error;

    private PublishOutcome(DeliveryReceipt receipt, Throwable error) {
        this.receipt = receipt;
        this.error = error;
    }

    public static PublishOutcome success(DeliveryReceipt receipt) {
        return new PublishOutcome(Objects.requireNonNull(receipt, "receipt"), null);
    }

    public static PublishOutcome failure(Throwable error) {
        return new PublishOutcome(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if this outcome is a failure
     */
    public DeliveryReceipt getReceipt() {
        if (receipt == null) {
            throw new IllegalStateException("Publish failed: " + error.getMessage(), error);
        }
        return receipt;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success(" + receipt + ")" : "Failure(" + error + ")";
    }
}
