package com.qqsuccubus.delivery.client.pool;

import com.qqsuccubus.delivery.core.metrics.MetricsNames;
import com.qqsuccubus.delivery.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Name-keyed pool of long-lived clients.
 * <p>
 * Lookups are lock-free. Creation is serialized and re-checks the map, so a name is
 * created at most once. When a new instance was created for a pool that has reached 90% of
 * its maximum size, the least used entries (fewest accesses, then oldest access) are evicted
 * until half of the maximum remains, then the new instance is inserted.
 * </p>
 *
 * @param <T> client type
 */
public class InstancePool<T extends PooledClient> {
    private static final Logger log = LoggerFactory.getLogger(InstancePool.class);

    static final double EVICTION_THRESHOLD = 0.9;

    private final String type;
    private final int maxSize;
    private final Clock clock;
    private final Map<String, PoolEntry<T>> entries = new ConcurrentHashMap<>();
    private final ReentrantLock createLock = new ReentrantLock();
    private final Counter evictions;

    public InstancePool(String type, int maxSize, Clock clock, MeterRegistry registry) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1, was " + maxSize);
        }
        this.type = type;
        this.maxSize = maxSize;
        this.clock = clock;
        this.evictions = Counter.builder(MetricsNames.POOL_EVICTIONS_TOTAL)
            .tag(MetricsTags.TYPE, type)
            .description("Pooled clients evicted to make room")
            .register(registry);
    }

    /**
     * Returns the pooled instance for {@code name}, creating it on first use.
     *
     * @param name    instance name
     * @param factory creates the instance; its exceptions propagate and nothing is pooled
     * @return pooled instance
     */
    public T getOrCreate(String name, Function<String, ? extends T> factory) {
        PoolEntry<T> entry = entries.get(name);
        if (entry != null) {
            return entry.touch(clock.instant());
        }
        createLock.lock();
        try {
            entry = entries.get(name);
            if (entry != null) {
                return entry.touch(clock.instant());
            }
            T instance = factory.apply(name);
            // evict only after a successful create
            if (entries.size() >= maxSize * EVICTION_THRESHOLD) {
                evictLeastUsed();
            }
            entries.put(name, new PoolEntry<>(instance, clock.instant()));
            log.info("Pooled {} {} created ({} in pool)", type, name, entries.size());
            return instance;
        } finally {
            createLock.unlock();
        }
    }

    public Optional<T> get(String name) {
        PoolEntry<T> entry = entries.get(name);
        return entry == null ? Optional.empty() : Optional.of(entry.touch(clock.instant()));
    }

    public Optional<PoolEntry<T>> entry(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    /**
     * Removes and closes the instance for {@code name}.
     *
     * @return true if an instance was pooled under that name
     */
    public boolean remove(String name) {
        PoolEntry<T> entry = entries.remove(name);
        if (entry == null) {
            return false;
        }
        closeQuietly(name, entry.getInstance());
        return true;
    }

    public int size() {
        return entries.size();
    }

    public List<T> instances() {
        List<T> instances = new ArrayList<>(entries.size());
        entries.values().forEach(entry -> instances.add(entry.getInstance()));
        return instances;
    }

    public void close() {
        createLock.lock();
        try {
            for (String name : new ArrayList<>(entries.keySet())) {
                remove(name);
            }
        } finally {
            createLock.unlock();
        }
    }

    private void evictLeastUsed() {
        int toEvict = entries.size() - maxSize / 2;
        if (toEvict <= 0) {
            return;
        }
        List<Map.Entry<String, PoolEntry<T>>> candidates = new ArrayList<>(entries.entrySet());
        candidates.sort(Comparator
            .comparingLong((Map.Entry<String, PoolEntry<T>> e) -> e.getValue().getAccessCount())
            .thenComparing(e -> e.getValue().getLastAccessAt()));

        log.warn("{} pool at {}/{}, evicting {} least used instances", type, entries.size(), maxSize, toEvict);
        for (Map.Entry<String, PoolEntry<T>> candidate : candidates.subList(0, toEvict)) {
            if (entries.remove(candidate.getKey(), candidate.getValue())) {
                evictions.increment();
                closeQuietly(candidate.getKey(), candidate.getValue().getInstance());
            }
        }
    }

    private void closeQuietly(String name, T instance) {
        try {
            instance.close();
            log.info("Pooled {} {} closed", type, name);
        } catch (RuntimeException e) {
            log.error("Failed to close pooled {} {}", type, name, e);
        }
    }
}
