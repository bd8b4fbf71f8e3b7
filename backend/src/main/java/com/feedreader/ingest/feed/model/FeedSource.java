package com.feedreader.ingest.feed.model;

import java.time.Instant;

public record FeedSource(
    long id,
    String name,
    String url,
    String faviconUrl,
    Instant createdAt,
    Instant lastFetchedAt
) {
}
