package org.carball.sift.storage;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryKeyAllocator implements KeyAllocator {

    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    @Override
    public long next(String tableName) {
        return sequences.computeIfAbsent(tableName, t -> new AtomicLong()).incrementAndGet();
    }
}
