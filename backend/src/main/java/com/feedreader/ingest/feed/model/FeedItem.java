package com.feedreader.ingest.feed.model;

public record FeedItem(
    String title,
    String link,
    String thumbnail
) {
    public boolean hasThumbnail() {
        return thumbnail != null && !thumbnail.isBlank();
    }
}
