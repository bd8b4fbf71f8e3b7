package com.feedreader.ingest.feed.api;

public record FetchViewRequest(
    String provider,
    String sourceUrl,
    String displayName,
    String categoryId,
    String categoryName,
    String searchQuery
) {
}
