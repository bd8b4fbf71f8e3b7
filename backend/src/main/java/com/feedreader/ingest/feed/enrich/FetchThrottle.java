package com.feedreader.ingest.feed.enrich;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Counts active enrichment fetches. Callers that fail {@link #tryAcquire()} retry later instead of blocking.
 */
public class FetchThrottle {
    private final Object lock = new Object();
    private final int maxActive;
    private final int retryMinDelayMs;
    private final int retryMaxDelayMs;
    private int active;

    public FetchThrottle(int maxActive, int retryMinDelayMs, int retryMaxDelayMs) {
        this.maxActive = Math.max(1, maxActive);
        this.retryMinDelayMs = Math.max(1, retryMinDelayMs);
        this.retryMaxDelayMs = Math.max(this.retryMinDelayMs, retryMaxDelayMs);
    }

    public boolean tryAcquire() {
        synchronized (lock) {
            if (active >= maxActive) {
                return false;
            }
            active++;
            return true;
        }
    }

    public void release() {
        synchronized (lock) {
            if (active > 0) {
                active--;
            }
        }
    }

    public int activeCount() {
        synchronized (lock) {
            return active;
        }
    }

    public int maxActive() {
        return maxActive;
    }

    /**
     * Uniform delay in [min, max] milliseconds.
     */
    public long nextRetryDelayMs() {
        return ThreadLocalRandom.current().nextLong(retryMinDelayMs, (long) retryMaxDelayMs + 1);
    }
}
