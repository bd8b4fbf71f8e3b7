package com.feedreader.ingest.feed.cache;

import java.util.Optional;

/**
 * Bounded in-memory store of decoded preview images keyed by URL.
 *
 * <p>The ingestion pipeline only resizes it, via {@link #setCapacity}, when a fetch starts for a view.
 * Whatever renders thumbnails downloads the image bytes and owns {@link #get} and {@link #put}; ingestion
 * only delivers URLs and never reads or writes entries.
 */
public interface ImageCache {

    Optional<byte[]> get(String url);

    void put(String url, byte[] image);

    /**
     * Changes the bound, evicting least recently used entries when shrinking.
     */
    void setCapacity(int capacity);

    int capacity();

    int size();
}
