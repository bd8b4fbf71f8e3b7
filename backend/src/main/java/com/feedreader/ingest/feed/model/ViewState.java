package com.feedreader.ingest.feed.model;

public enum ViewState {
    IDLE,
    FETCHING,
    DELIVERED,
    ERRORED
}
