package com.feedreader.ingest.feed.sink;

/**
 * Receives the outcome of one ingestion pass. Implementations decide which thread applies the calls.
 */
public interface ResultSink {

    void setLabel(String text);

    void clearItems();

    /**
     * Adds an item, or updates the thumbnail of the item already shown under the same URL.
     */
    void addItem(String title, String url, String thumbnail, String categoryId, String sourceName);

    default ItemCallback asCallback() {
        return this::addItem;
    }
}
