package com.qqsuccubus.delivery.client.pool;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pooled instance plus the usage data eviction is based on.
 *
 * @param <T> instance type
 */
@Getter
public class PoolEntry<T extends PooledClient> {

    private final T instance;
    private final Instant createdAt;
    private volatile Instant lastAccessAt;
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicLong accessCount = new AtomicLong(1);

    PoolEntry(T instance, Instant createdAt) {
        this.instance = instance;
        this.createdAt = createdAt;
        this.lastAccessAt = createdAt;
    }

    T touch(Instant now) {
        accessCount.incrementAndGet();
        lastAccessAt = now;
        return instance;
    }

    public long getAccessCount() {
        return accessCount.get();
    }
}
