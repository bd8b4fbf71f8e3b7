package com.feedreader.ingest.feed.service;

import com.feedreader.ingest.feed.epoch.FetchEpochGuard;
import com.feedreader.ingest.feed.model.FetchEpoch;
import com.feedreader.ingest.feed.model.ViewState;
import com.feedreader.ingest.feed.sink.EpochGuardedSink;
import com.feedreader.ingest.feed.sink.FeedView;
import com.feedreader.ingest.feed.sink.UiEventLoop;
import com.feedreader.ingest.feed.util.FetchFailureClassifier;

import java.util.concurrent.ScheduledFuture;

/**
 * Drives one view through FETCHING to DELIVERED or ERRORED for a single epoch.
 * Everything except {@link #markNetworkFailure()} and {@link #cancelSafetyTimer()} runs on the UI loop.
 */
public class FetchSession implements EpochGuardedSink.Listener {
    private final FetchEpoch epoch;
    private final FeedView view;
    private final FetchEpochGuard epochGuard;
    private volatile boolean networkFailure;
    private volatile ScheduledFuture<?> safetyTimer;
    private volatile ViewState state = ViewState.FETCHING;

    public FetchSession(FetchEpoch epoch, FeedView view, FetchEpochGuard epochGuard) {
        this.epoch = epoch;
        this.view = view;
        this.epochGuard = epochGuard;
    }

    public FetchEpoch epoch() {
        return epoch;
    }

    public ViewState state() {
        return state;
    }

    void armSafetyTimer(UiEventLoop loop, long timeoutMs) {
        safetyTimer = loop.schedule(this::onSafetyTimeout, timeoutMs);
    }

    void markNetworkFailure() {
        networkFailure = true;
    }

    void cancelSafetyTimer() {
        ScheduledFuture<?> timer = safetyTimer;
        if (timer != null) {
            timer.cancel(false);
        }
    }

    @Override
    public void onLabel(String text) {
        if (state == ViewState.DELIVERED || !FetchFailureClassifier.isErrorLabel(text)) {
            return;
        }
        fail(text);
    }

    @Override
    public void onItemAdded() {
        if (state == ViewState.DELIVERED) {
            return;
        }
        deliver();
    }

    /**
     * Every source of the epoch has finished. Settles the view unless a label or item already did.
     */
    void onFetchesComplete() {
        if (!epochGuard.isCurrent(epoch.id()) || state != ViewState.FETCHING) {
            return;
        }
        if (view.itemCount() > 0) {
            deliver();
        } else if (networkFailure) {
            fail(FetchFailureClassifier.OFFLINE_MESSAGE);
        } else {
            deliver();
        }
    }

    void onSafetyTimeout() {
        if (!epochGuard.isCurrent(epoch.id()) || state != ViewState.FETCHING) {
            return;
        }
        if (view.itemCount() > 0) {
            deliver();
        } else {
            fail(networkFailure ? FetchFailureClassifier.OFFLINE_MESSAGE : FetchFailureClassifier.NO_ITEMS_MESSAGE);
        }
    }

    private void deliver() {
        if (state == ViewState.ERRORED) {
            view.showError(null);
        }
        state = ViewState.DELIVERED;
        view.setState(ViewState.DELIVERED);
        view.reveal();
        cancelSafetyTimer();
    }

    private void fail(String message) {
        state = ViewState.ERRORED;
        view.showError(message);
        view.setState(ViewState.ERRORED);
        cancelSafetyTimer();
    }
}
