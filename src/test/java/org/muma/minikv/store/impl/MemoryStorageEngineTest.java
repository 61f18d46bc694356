package org.muma.minikv.store.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.minikv.common.RedisData;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStorageEngineTest {

    private final AtomicLong clock = new AtomicLong(1_000_000L);
    private MemoryStorageEngine storage;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine(clock::get);
    }

    @Test
    void testSetThenGet() {
        storage.set("foo", "bar");
        assertEquals("bar", storage.get("foo"));
        assertNull(storage.get("missing"));
    }

    @Test
    void testOverwriteClearsExpiry() {
        storage.setWithExpiry("foo", "old", 100);
        storage.set("foo", "new");

        clock.addAndGet(1_000);
        assertEquals("new", storage.get("foo"));
    }

    @Test
    void testLazyExpiryOnGet() {
        storage.setWithExpiry("foo", "bar", 50);

        clock.addAndGet(50);
        // 到期时刻本身仍然可见
        assertEquals("bar", storage.get("foo"));
        assertEquals(1, storage.size());

        clock.addAndGet(1);
        assertNull(storage.get("foo"));
        assertEquals(0, storage.size());
    }

    @Test
    void testHugeTtlDoesNotWrapAround() {
        storage.setWithExpiry("foo", "bar", Long.MAX_VALUE);

        assertEquals("bar", storage.get("foo"));
        clock.addAndGet(1_000_000_000L);
        assertEquals("bar", storage.get("foo"));
    }

    @Test
    void testExpiredKeyStaysUntilTouched() {
        storage.setWithExpiry("foo", "bar", 10);
        clock.addAndGet(100);

        // 没有后台清理
        assertEquals(1, storage.size());
    }

    @Test
    void testKeysEvictsExpired() {
        storage.set("a", "1");
        storage.setWithExpiry("b", "2", 10);
        storage.set("c", "3");
        clock.addAndGet(100);

        Set<String> keys = new HashSet<>(storage.keys("*"));
        assertEquals(Set.of("a", "c"), keys);
        assertEquals(2, storage.size());
    }

    @Test
    void testKeysIgnoresPattern() {
        storage.set("foo", "1");
        storage.set("bar", "2");

        assertEquals(Set.of("foo", "bar"), new HashSet<>(storage.keys("f*")));
        assertEquals(Set.of("foo", "bar"), new HashSet<>(storage.keys("nothing-matches")));
    }

    @Test
    void testLoadAndSnapshot() {
        storage.load(Map.of(
                "x", new RedisData("1"),
                "y", new RedisData("2", clock.get() + 10)));
        assertEquals("1", storage.get("x"));

        clock.addAndGet(20);
        Map<String, RedisData> snapshot = storage.snapshot();
        assertEquals(Map.of("x", new RedisData("1")), snapshot);
    }
}
