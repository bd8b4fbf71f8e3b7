package com.feedreader.ingest.feed.view;

import com.feedreader.ingest.feed.model.ViewSnapshot;
import com.feedreader.ingest.feed.model.ViewState;
import com.feedreader.ingest.feed.sink.FeedView;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * View backed by plain memory, written by the UI loop and read through snapshots by API threads.
 */
public class InMemoryFeedView implements FeedView {
    private final String viewId;
    private final Map<String, ViewSnapshot.ViewItem> items = new LinkedHashMap<>();
    private String label;
    private String errorMessage;
    private boolean revealed;
    private ViewState state = ViewState.IDLE;
    private long epochId;
    private int drainSignals;

    public InMemoryFeedView(String viewId) {
        this.viewId = viewId;
    }

    @Override
    public String viewId() {
        return viewId;
    }

    @Override
    public synchronized void setLabel(String text) {
        this.label = text;
    }

    @Override
    public synchronized void clearItems() {
        items.clear();
    }

    @Override
    public synchronized void addItem(String title, String url, String thumbnail, String categoryId, String sourceName) {
        if (url == null) {
            return;
        }
        ViewSnapshot.ViewItem existing = items.get(url);
        if (existing != null) {
            // late image upgrades arrive keyed by URL; keep the feed's own title
            String newThumbnail = thumbnail != null && !thumbnail.isBlank() ? thumbnail : existing.thumbnail();
            items.put(url, new ViewSnapshot.ViewItem(existing.title(), url, newThumbnail, existing.categoryId(), existing.sourceName()));
            return;
        }
        items.put(url, new ViewSnapshot.ViewItem(title, url, thumbnail, categoryId, sourceName));
    }

    @Override
    public synchronized void showError(String message) {
        this.errorMessage = message;
    }

    @Override
    public synchronized void reveal() {
        this.revealed = true;
    }

    @Override
    public synchronized void onItemsDrained(String categoryId) {
        drainSignals++;
    }

    @Override
    public synchronized void beginEpoch(long epochId) {
        this.epochId = epochId;
        this.state = ViewState.FETCHING;
        this.errorMessage = null;
        this.revealed = false;
    }

    @Override
    public synchronized void setState(ViewState state) {
        this.state = state;
    }

    @Override
    public synchronized int itemCount() {
        return items.size();
    }

    public synchronized int drainSignals() {
        return drainSignals;
    }

    public synchronized ViewSnapshot snapshot() {
        return new ViewSnapshot(
            viewId,
            state,
            epochId,
            label,
            errorMessage,
            revealed,
            List.copyOf(new ArrayList<>(items.values()))
        );
    }
}
