package com.feedreader.ingest.feed.epoch;

import com.feedreader.ingest.feed.model.FetchEpoch;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Generation counter for user-triggered fetches. Only the orchestrator starts epochs; background work
 * compares the id it was issued under against {@link #isCurrent(long)} before mutating anything.
 * Superseded work is never cancelled, its results are just dropped.
 */
@Component
public class FetchEpochGuard {
    private final Object lock = new Object();
    private long nextId = 1;
    private volatile FetchEpoch current;

    public FetchEpoch beginNewEpoch(String viewId) {
        synchronized (lock) {
            FetchEpoch epoch = new FetchEpoch(nextId++, viewId, Instant.now());
            current = epoch;
            return epoch;
        }
    }

    public boolean isCurrent(long epochId) {
        FetchEpoch snapshot = current;
        return snapshot != null && snapshot.id() == epochId;
    }

    public FetchEpoch current() {
        return current;
    }
}
