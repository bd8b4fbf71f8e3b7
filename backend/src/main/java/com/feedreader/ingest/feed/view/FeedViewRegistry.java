package com.feedreader.ingest.feed.view;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Component
public class FeedViewRegistry {
    private final ConcurrentMap<String, InMemoryFeedView> views = new ConcurrentHashMap<>();

    public InMemoryFeedView getOrCreate(String viewId) {
        return views.computeIfAbsent(viewId, InMemoryFeedView::new);
    }

    public Optional<InMemoryFeedView> find(String viewId) {
        return Optional.ofNullable(views.get(viewId));
    }
}
