package com.feedreader.ingest.feed.sink;

import com.feedreader.ingest.feed.epoch.FetchEpochGuard;

/**
 * Forwards sink calls to a view on the UI loop, dropping every call once its epoch is no longer current.
 * The staleness check runs on the loop thread right before the mutation, so ordering between workers and
 * a newer fetch does not matter. Clearing happens at most once per epoch.
 */
public class EpochGuardedSink implements ResultSink {

    /**
     * Observes what reached the view, called on the UI loop.
     */
    public interface Listener {
        void onLabel(String text);

        void onItemAdded();
    }

    private static final Listener NO_OP = new Listener() {
        @Override
        public void onLabel(String text) {
        }

        @Override
        public void onItemAdded() {
        }
    };

    private final FeedView view;
    private final long epochId;
    private final FetchEpochGuard epochGuard;
    private final UiEventLoop loop;
    private final Listener listener;
    private boolean cleared;

    public EpochGuardedSink(FeedView view, long epochId, FetchEpochGuard epochGuard, UiEventLoop loop, Listener listener) {
        this.view = view;
        this.epochId = epochId;
        this.epochGuard = epochGuard;
        this.loop = loop;
        this.listener = listener == null ? NO_OP : listener;
    }

    public long epochId() {
        return epochId;
    }

    public boolean isCurrent() {
        return epochGuard.isCurrent(epochId);
    }

    @Override
    public void setLabel(String text) {
        loop.post(() -> {
            if (!isCurrent()) {
                return;
            }
            view.setLabel(text);
            listener.onLabel(text);
        });
    }

    @Override
    public void clearItems() {
        loop.post(() -> {
            if (!isCurrent() || cleared) {
                return;
            }
            cleared = true;
            view.clearItems();
        });
    }

    @Override
    public void addItem(String title, String url, String thumbnail, String categoryId, String sourceName) {
        loop.post(() -> addItemNow(title, url, thumbnail, categoryId, sourceName));
    }

    /**
     * Applies an add immediately. Only valid on the UI loop thread.
     */
    void addItemNow(String title, String url, String thumbnail, String categoryId, String sourceName) {
        if (!isCurrent()) {
            return;
        }
        view.addItem(title, url, thumbnail, categoryId, sourceName);
        listener.onItemAdded();
    }

    void notifyDrainedNow(String categoryId) {
        if (isCurrent()) {
            view.onItemsDrained(categoryId);
        }
    }
}
