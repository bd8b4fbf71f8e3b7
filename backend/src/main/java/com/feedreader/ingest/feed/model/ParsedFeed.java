package com.feedreader.ingest.feed.model;

import java.util.List;

public record ParsedFeed(
    FeedFormat format,
    List<FeedItem> items,
    String faviconUrl,
    int skippedByCap,
    int parseErrors
) {
    public static ParsedFeed empty() {
        return new ParsedFeed(FeedFormat.UNKNOWN, List.of(), null, 0, 0);
    }

    public boolean isEmpty() {
        return items == null || items.isEmpty();
    }
}
