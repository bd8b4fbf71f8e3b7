package com.feedreader.ingest.feed.sink;

import com.feedreader.ingest.feed.model.ViewState;

/**
 * The presentation side of a view. Every method is called on the UI event loop only.
 */
public interface FeedView extends ResultSink {

    String viewId();

    void showError(String message);

    void reveal();

    /**
     * Batched delivery for the given category has fully drained.
     */
    void onItemsDrained(String categoryId);

    /**
     * A new fetch took over this view: enter {@link ViewState#FETCHING} and drop any previous banner.
     */
    void beginEpoch(long epochId);

    void setState(ViewState state);

    int itemCount();
}
