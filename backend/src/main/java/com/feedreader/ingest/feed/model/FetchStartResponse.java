package com.feedreader.ingest.feed.model;

import java.time.Instant;

public record FetchStartResponse(
    String viewId,
    long epochId,
    String categoryId,
    Instant startedAt
) {
}
