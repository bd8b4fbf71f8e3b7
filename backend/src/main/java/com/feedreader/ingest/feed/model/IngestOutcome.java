package com.feedreader.ingest.feed.model;

public record IngestOutcome(
    String url,
    boolean success,
    int deliveredCount,
    String failureLabel,
    boolean networkFailure
) {
    public static IngestOutcome delivered(String url, int deliveredCount) {
        return new IngestOutcome(url, true, deliveredCount, null, false);
    }

    public static IngestOutcome failed(String url, String failureLabel, boolean networkFailure) {
        return new IngestOutcome(url, false, 0, failureLabel, networkFailure);
    }
}
