package com.feedreader.ingest.feed.cache;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class LruImageCache implements ImageCache {
    private final LinkedHashMap<String, byte[]> entries = new LinkedHashMap<>(16, 0.75f, true);
    private int capacity;

    public LruImageCache(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public synchronized Optional<byte[]> get(String url) {
        if (url == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(url));
    }

    @Override
    public synchronized void put(String url, byte[] image) {
        if (url == null || image == null) {
            return;
        }
        entries.put(url, image);
        evictOverflow();
    }

    @Override
    public synchronized void setCapacity(int capacity) {
        this.capacity = Math.max(1, capacity);
        evictOverflow();
    }

    @Override
    public synchronized int capacity() {
        return capacity;
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    private void evictOverflow() {
        Iterator<Map.Entry<String, byte[]>> iterator = entries.entrySet().iterator();
        while (entries.size() > capacity && iterator.hasNext()) {
            iterator.next();
            iterator.remove();
        }
    }
}
