package com.feedreader.ingest.feed.model;

/**
 * Who a feed body belongs to and how its items are labelled and filtered.
 */
public record FeedContext(
    String sourceName,
    String sourceUrl,
    String categoryName,
    String categoryId,
    String searchQuery
) {
    public boolean hasSearchQuery() {
        return searchQuery != null && !searchQuery.isBlank();
    }
}
