package com.feedreader.ingest.feed.model;

public enum FeedFormat {
    ATOM,
    RSS,
    RDF,
    UNKNOWN
}
