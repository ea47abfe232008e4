package com.qqsuccubus.delivery.client.pool;

import com.qqsuccubus.delivery.client.support.TestClock;
import com.qqsuccubus.delivery.core.metrics.MetricsNames;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InstancePoolTest {

    private TestClock clock;
    private SimpleMeterRegistry registry;
    private Map<String, StubClient> created;

    @BeforeEach
    void setUp() {
        clock = new TestClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = new SimpleMeterRegistry();
        created = new ConcurrentHashMap<>();
    }

    private InstancePool<StubClient> pool(int maxSize) {
        return new InstancePool<>("producer", maxSize, clock, registry);
    }

    private StubClient create(String name) {
        StubClient client = new StubClient(name);
        created.put(name, client);
        return client;
    }

    private void touch(InstancePool<StubClient> pool, String name, int times) {
        for (int i = 0; i < times; i++) {
            pool.get(name);
        }
    }

    @Test
    void testGetOrCreate_ReturnsSameInstance() {
        InstancePool<StubClient> pool = pool(10);

        StubClient first = pool.getOrCreate("a", this::create);
        StubClient second = pool.getOrCreate("a", this::create);

        assertSame(first, second);
        assertEquals(1, pool.size());
        assertEquals(2, pool.entry("a").orElseThrow().getAccessCount());
    }

    @Test
    @DisplayName("a full pool evicts half of its capacity, lowest access counts first")
    void testEviction_LowestAccessCountFirst() {
        InstancePool<StubClient> pool = pool(4);
        for (String name : List.of("a", "b", "c", "d")) {
            pool.getOrCreate(name, this::create);
        }
        touch(pool, "a", 3);
        touch(pool, "c", 2);
        touch(pool, "d", 1);
        assertEquals(4, pool.size());

        pool.getOrCreate("e", this::create);

        assertEquals(3, pool.size());
        assertTrue(created.get("b").closed);
        assertTrue(created.get("d").closed);
        assertFalse(created.get("a").closed);
        assertFalse(created.get("c").closed);
        assertTrue(pool.entry("a").isPresent());
        assertTrue(pool.entry("c").isPresent());
        assertTrue(pool.entry("e").isPresent());
        assertEquals(2.0, registry.find(MetricsNames.POOL_EVICTIONS_TOTAL).counter().count());
    }

    @Test
    void testEviction_StartsAtNinetyPercent() {
        InstancePool<StubClient> pool = pool(10);
        for (int i = 0; i < 9; i++) {
            String name = "p" + i;
            pool.getOrCreate(name, this::create);
            touch(pool, name, i);
        }
        assertEquals(9, pool.size());

        pool.getOrCreate("p9", this::create);

        // 9 - 10/2 = 4 evicted, then the new entry is added
        assertEquals(6, pool.size());
        for (int i = 0; i < 4; i++) {
            assertTrue(created.get("p" + i).closed, "p" + i + " should be evicted");
        }
        for (int i = 4; i < 10; i++) {
            assertFalse(created.get("p" + i).closed, "p" + i + " should stay");
        }
    }

    @Test
    void testEviction_TiesBrokenByOldestAccess() {
        InstancePool<StubClient> pool = pool(4);
        pool.getOrCreate("old", this::create);
        clock.advance(Duration.ofSeconds(1));
        pool.getOrCreate("mid", this::create);
        clock.advance(Duration.ofSeconds(1));
        pool.getOrCreate("new", this::create);
        clock.advance(Duration.ofSeconds(1));
        pool.getOrCreate("hot", this::create);
        touch(pool, "hot", 5);

        pool.getOrCreate("next", this::create);

        assertTrue(created.get("old").closed);
        assertTrue(created.get("mid").closed);
        assertFalse(created.get("new").closed);
        assertFalse(created.get("hot").closed);
    }

    @Test
    void testConcurrentGetOrCreate_CreatesOnce() throws Exception {
        InstancePool<StubClient> pool = pool(10);
        AtomicInteger creations = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<StubClient>> results = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return pool.getOrCreate("shared", name -> {
                        creations.incrementAndGet();
                        return create(name);
                    });
                }));
            }
            start.countDown();

            StubClient first = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<StubClient> result : results) {
                assertSame(first, result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, creations.get());
    }

    @Test
    void testFactoryFailure_NothingPooled() {
        InstancePool<StubClient> pool = pool(10);

        assertThrows(IllegalStateException.class, () -> pool.getOrCreate("broken", name -> {
            throw new IllegalStateException("cannot connect");
        }));

        assertEquals(0, pool.size());
    }

    @Test
    void testFactoryFailure_NearFullPoolKeepsLiveInstances() {
        InstancePool<StubClient> pool = pool(4);
        for (String name : List.of("a", "b", "c", "d")) {
            pool.getOrCreate(name, this::create);
        }

        assertThrows(IllegalStateException.class, () -> pool.getOrCreate("broken", name -> {
            throw new IllegalStateException("not configured");
        }));

        assertEquals(4, pool.size());
        assertTrue(created.values().stream().noneMatch(client -> client.closed));
        assertEquals(0.0, registry.get(MetricsNames.POOL_EVICTIONS_TOTAL).counter().count());

        pool.getOrCreate("e", this::create);

        assertEquals(3, pool.size());
        assertTrue(pool.entry("e").isPresent());
    }

    @Test
    void testRemoveAndClose_CloseErrorsContained() {
        InstancePool<StubClient> pool = pool(10);
        pool.getOrCreate("a", this::create);
        pool.getOrCreate("b", this::create).failOnClose = true;

        assertTrue(pool.remove("a"));
        assertFalse(pool.remove("a"));
        assertTrue(created.get("a").closed);

        pool.close();

        assertEquals(0, pool.size());
    }

    @Test
    void testInvalidMaxSize() {
        assertThrows(IllegalArgumentException.class, () -> pool(0));
    }

    static class StubClient implements PooledClient {
        private final String name;
        volatile boolean closed;
        volatile boolean failOnClose;

        StubClient(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void close() {
            if (failOnClose) {
                throw new IllegalStateException("close failed");
            }
            closed = true;
        }
    }
}
