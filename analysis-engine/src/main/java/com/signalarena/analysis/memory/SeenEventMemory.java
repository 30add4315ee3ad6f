package com.signalarena.analysis.memory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded, insertion-ordered set of event identities an agent has already acted on.
 * When full, the oldest identity is evicted.
 */
public final class SeenEventMemory {

    public static final int DEFAULT_CAPACITY = 1024;

    private final int capacity;
    private final LinkedHashMap<String, Boolean> seen;

    public SeenEventMemory() {
        this(DEFAULT_CAPACITY);
    }

    public SeenEventMemory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1 but was " + capacity);
        }
        this.capacity = capacity;
        this.seen = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > SeenEventMemory.this.capacity;
            }
        };
    }

    public synchronized boolean contains(String identity) {
        return seen.containsKey(identity);
    }

    /** @return {@code true} if the identity was not seen before */
    public synchronized boolean markSeen(String identity) {
        return seen.put(identity, Boolean.TRUE) == null;
    }

    public synchronized int size() {
        return seen.size();
    }
}
