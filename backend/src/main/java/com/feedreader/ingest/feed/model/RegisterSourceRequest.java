package com.feedreader.ingest.feed.model;

public record RegisterSourceRequest(
    String name,
    String url
) {
}
