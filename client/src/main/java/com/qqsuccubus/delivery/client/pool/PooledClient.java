package com.qqsuccubus.delivery.client.pool;

/**
 * Client instance that can live in an {@link InstancePool}.
 */
public interface PooledClient {

    String name();

    /**
     * Releases the client: producers flush pending records, consumers stop their pipeline.
     * Safe to call more than once.
     */
    void close();
}
