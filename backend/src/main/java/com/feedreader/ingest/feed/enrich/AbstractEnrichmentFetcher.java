package com.feedreader.ingest.feed.enrich;

import com.feedreader.ingest.feed.http.FeedHttpClient;
import com.feedreader.ingest.feed.http.RequestOptions;
import com.feedreader.ingest.feed.model.HttpFetchResult;
import com.feedreader.ingest.feed.sink.ItemCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fetches an article page in the background and hands a better image to the caller.
 *
 * <p>A throttle slot is taken before any work is spawned. When none is free the call is re-run after a
 * random delay instead of blocking the caller. The slot is returned when the work finishes, whatever
 * the outcome. Failures are logged at debug and otherwise dropped.
 */
public abstract class AbstractEnrichmentFetcher {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final FeedHttpClient httpClient;
    private final FetchThrottle throttle;
    private final ExecutorService executor;
    private final ScheduledExecutorService retryScheduler;

    protected AbstractEnrichmentFetcher(
        FeedHttpClient httpClient,
        FetchThrottle throttle,
        ExecutorService executor,
        ScheduledExecutorService retryScheduler
    ) {
        this.httpClient = httpClient;
        this.throttle = throttle;
        this.executor = executor;
        this.retryScheduler = retryScheduler;
    }

    /**
     * @return completes with {@code true} once the callback received an item, {@code false} otherwise
     */
    public CompletableFuture<Boolean> enrich(String articleUrl, ItemCallback callback, String categoryId, String sourceName) {
        CompletableFuture<Boolean> outcome = new CompletableFuture<>();
        if (articleUrl == null || articleUrl.isBlank() || callback == null) {
            outcome.complete(false);
            return outcome;
        }
        attempt(articleUrl, callback, categoryId, sourceName, outcome);
        return outcome;
    }

    private void attempt(
        String articleUrl,
        ItemCallback callback,
        String categoryId,
        String sourceName,
        CompletableFuture<Boolean> outcome
    ) {
        if (!throttle.tryAcquire()) {
            long delayMs = throttle.nextRetryDelayMs();
            try {
                retryScheduler.schedule(
                    () -> attempt(articleUrl, callback, categoryId, sourceName, outcome),
                    delayMs,
                    TimeUnit.MILLISECONDS
                );
            } catch (RejectedExecutionException e) {
                outcome.complete(false);
            }
            return;
        }

        CompletableFuture<Boolean> work;
        try {
            work = CompletableFuture.supplyAsync(
                () -> fetchAndDeliver(articleUrl, callback, categoryId, sourceName),
                executor
            );
        } catch (RejectedExecutionException e) {
            throttle.release();
            outcome.complete(false);
            return;
        }
        work.whenComplete((delivered, error) -> {
            throttle.release();
            if (error != null) {
                log.debug("{} enrichment failed for {}", name(), articleUrl, error);
                outcome.complete(false);
            } else {
                outcome.complete(Boolean.TRUE.equals(delivered));
            }
        });
    }

    private boolean fetchAndDeliver(String articleUrl, ItemCallback callback, String categoryId, String sourceName) {
        HttpFetchResult result = httpClient.fetchSync(articleUrl, RequestOptions.browser());
        if (!result.isSuccessful() || !result.hasBody()) {
            log.debug(
                "{} skipped {}: status={} error={}",
                name(),
                articleUrl,
                result.statusCode(),
                result.errorCode()
            );
            return false;
        }
        // relative images resolve against the page we landed on; delivery stays keyed by the item link
        Optional<EnrichedImage> found = extract(result.finalUrlOrRequested(), result.body());
        if (found.isEmpty()) {
            log.debug("{} found no image on {}", name(), articleUrl);
            return false;
        }
        EnrichedImage enriched = found.get();
        callback.deliver(enriched.title(), articleUrl, enriched.image().url(), categoryId, sourceName);
        return true;
    }

    protected abstract Optional<EnrichedImage> extract(String articleUrl, String html);

    protected abstract String name();
}
