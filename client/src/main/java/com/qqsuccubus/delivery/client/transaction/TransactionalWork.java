package com.qqsuccubus.delivery.client.transaction;

/**
 * Unit of work run inside one broker transaction.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionalWork<T> {

    T execute(TransactionCoordinator transaction) throws Exception;
}
