package com.feedreader.ingest.feed.enrich;

import com.feedreader.ingest.feed.model.ImageCandidate;

public record EnrichedImage(
    String title,
    ImageCandidate image
) {
}
