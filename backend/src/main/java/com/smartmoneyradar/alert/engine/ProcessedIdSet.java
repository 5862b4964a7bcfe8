package com.smartmoneyradar.alert.engine;

import java.util.Iterator;
import java.util.LinkedHashSet;

/**
 * Bounded insertion-ordered set of handled transaction signatures. Once it grows past capacity the oldest half is
 * evicted in one pass (approximate LRU). Not thread-safe.
 */
public class ProcessedIdSet {

    private final int capacity;
    private final LinkedHashSet<String> ids = new LinkedHashSet<>();

    public ProcessedIdSet(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("capacity must be at least 2");
        }
        this.capacity = capacity;
    }

    /**
     * @return true if the id was new
     */
    public boolean add(String id) {
        if (!ids.add(id)) {
            return false;
        }
        if (ids.size() > capacity) {
            evictOldestHalf();
        }
        return true;
    }

    private void evictOldestHalf() {
        int toRemove = ids.size() / 2;
        Iterator<String> it = ids.iterator();
        while (toRemove-- > 0 && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    public int size() {
        return ids.size();
    }

    public void clear() {
        ids.clear();
    }
}
