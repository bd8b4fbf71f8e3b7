package com.feedreader.ingest.feed.model;

import java.time.Instant;

public record FetchEpoch(
    long id,
    String viewId,
    Instant startedAt
) {
}
