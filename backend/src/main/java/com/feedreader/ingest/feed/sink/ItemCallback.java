package com.feedreader.ingest.feed.sink;

@FunctionalInterface
public interface ItemCallback {
    void deliver(String title, String url, String thumbnail, String categoryId, String sourceName);
}
