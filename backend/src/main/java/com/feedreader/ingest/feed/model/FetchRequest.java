package com.feedreader.ingest.feed.model;

public record FetchRequest(
    String viewId,
    String provider,
    String sourceUrl,
    String displayName,
    String categoryId,
    String categoryName,
    String searchQuery
) {
    public boolean hasSearchQuery() {
        return searchQuery != null && !searchQuery.isBlank();
    }
}
