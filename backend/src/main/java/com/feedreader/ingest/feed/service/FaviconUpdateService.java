package com.feedreader.ingest.feed.service;

import com.feedreader.ingest.feed.model.FeedSource;
import com.feedreader.ingest.feed.persistence.FeedSourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Keeps the stored favicon of a feed source in line with what the feed itself advertises.
 * Runs off the ingestion path and never fails it.
 */
@Service
public class FaviconUpdateService {
    private static final Logger log = LoggerFactory.getLogger(FaviconUpdateService.class);

    private final FeedSourceRepository repository;
    private final ExecutorService backgroundExecutor;

    public FaviconUpdateService(
        FeedSourceRepository repository,
        @Qualifier("backgroundExecutor") ExecutorService backgroundExecutor
    ) {
        this.repository = repository;
        this.backgroundExecutor = backgroundExecutor;
    }

    public CompletableFuture<Boolean> updateAsync(String sourceUrl, String sourceName, String faviconUrl) {
        if (faviconUrl == null || faviconUrl.isBlank()) {
            return CompletableFuture.completedFuture(false);
        }
        try {
            return CompletableFuture
                .supplyAsync(() -> updateIfChanged(sourceUrl, sourceName, faviconUrl), backgroundExecutor)
                .exceptionally(error -> {
                    log.debug("Favicon update failed for {}", sourceUrl, error);
                    return false;
                });
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(false);
        }
    }

    public boolean updateIfChanged(String sourceUrl, String sourceName, String faviconUrl) {
        Optional<FeedSource> source = repository.findByUrl(sourceUrl);
        if (source.isEmpty()) {
            source = repository.findByName(sourceName);
        }
        if (source.isEmpty()) {
            return false;
        }
        FeedSource stored = source.get();
        if (faviconUrl.equals(stored.faviconUrl())) {
            return false;
        }
        repository.updateFaviconUrl(stored.url(), faviconUrl);
        log.debug("Favicon for {} changed to {}", stored.url(), faviconUrl);
        return true;
    }
}
