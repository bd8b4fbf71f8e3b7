package com.feedreader.ingest.feed.model;

public record ImageCandidate(
    String url,
    CandidatePriority priority
) {
}
