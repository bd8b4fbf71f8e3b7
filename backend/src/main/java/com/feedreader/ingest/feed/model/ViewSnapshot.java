package com.feedreader.ingest.feed.model;

import java.util.List;

public record ViewSnapshot(
    String viewId,
    ViewState state,
    long epochId,
    String label,
    String errorMessage,
    boolean revealed,
    List<ViewItem> items
) {
    public record ViewItem(
        String title,
        String url,
        String thumbnail,
        String categoryId,
        String sourceName
    ) {
    }
}
