package com.feedreader.ingest.feed.model;

public record CatalogFeed(
    String provider,
    String sourceName,
    String url,
    String categoryName
) {
}
