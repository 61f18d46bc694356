package org.muma.minikv.store.impl;

import org.muma.minikv.common.RedisData;
import org.muma.minikv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    private final Map<String, RedisData> memoryDb = new HashMap<>();

    // 全局锁：每个操作持锁期间独占整个键空间
    private final ReentrantLock lock = new ReentrantLock();

    private final LongSupplier clock;

    public MemoryStorageEngine() {
        this(System::currentTimeMillis);
    }

    public MemoryStorageEngine(LongSupplier clock) {
        this.clock = clock;
    }

    @Override
    public void set(String key, String value) {
        put(key, new RedisData(value));
    }

    @Override
    public void setWithExpiry(String key, String value, long ttlMillis) {
        long now = clock.getAsLong();
        // 溢出时封顶，避免超大的 PX 变成过去的时间戳
        long expireAt = ttlMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMillis;
        put(key, new RedisData(value, expireAt));
    }

    private void put(String key, RedisData data) {
        lock.lock();
        try {
            memoryDb.put(key, data);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String get(String key) {
        lock.lock();
        try {
            RedisData data = memoryDb.get(key);
            if (data == null) return null;

            // 惰性删除 (Lazy Expiration)
            if (data.isExpired(clock.getAsLong())) {
                memoryDb.remove(key);
                log.debug("Lazy expired key: {}", key);
                return null;
            }
            return data.getPayload();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> keys(String pattern) {
        lock.lock();
        try {
            long now = clock.getAsLong();
            List<String> result = new ArrayList<>();
            int expired = 0;

            Iterator<Map.Entry<String, RedisData>> iterator = memoryDb.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<String, RedisData> entry = iterator.next();
                if (entry.getValue().isExpired(now)) {
                    iterator.remove();
                    expired++;
                } else {
                    result.add(entry.getKey());
                }
            }

            if (expired > 0) {
                log.debug("KEYS scan evicted {} expired keys", expired);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void load(Map<String, RedisData> entries) {
        lock.lock();
        try {
            memoryDb.putAll(entries);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, RedisData> snapshot() {
        lock.lock();
        try {
            long now = clock.getAsLong();
            Map<String, RedisData> copy = new HashMap<>();
            for (Map.Entry<String, RedisData> entry : memoryDb.entrySet()) {
                if (!entry.getValue().isExpired(now)) {
                    copy.put(entry.getKey(), entry.getValue());
                }
            }
            return copy;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return memoryDb.size();
        } finally {
            lock.unlock();
        }
    }
}
