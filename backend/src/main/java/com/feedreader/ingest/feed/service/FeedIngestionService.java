package com.feedreader.ingest.feed.service;

import com.feedreader.ingest.config.IngestProperties;
import com.feedreader.ingest.feed.http.FeedHttpClient;
import com.feedreader.ingest.feed.http.RequestOptions;
import com.feedreader.ingest.feed.model.FeedContext;
import com.feedreader.ingest.feed.model.HttpFetchResult;
import com.feedreader.ingest.feed.model.IngestOutcome;
import com.feedreader.ingest.feed.model.ParsedFeed;
import com.feedreader.ingest.feed.parse.FeedProcessor;
import com.feedreader.ingest.feed.persistence.FeedSourceRepository;
import com.feedreader.ingest.feed.sink.ResultSink;
import com.feedreader.ingest.feed.util.FetchFailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fetches one feed URL (http(s) or file://) and hands the body to the {@link FeedProcessor}.
 * Every failure ends as a label on the sink; nothing is thrown to the caller.
 */
@Service
public class FeedIngestionService {
    private static final Logger log = LoggerFactory.getLogger(FeedIngestionService.class);
    private static final String FILE_SCHEME = "file://";

    private final FeedHttpClient httpClient;
    private final FeedProcessor feedProcessor;
    private final LocalFeedListStore localFeedListStore;
    private final FeedSourceRepository feedSourceRepository;
    private final IngestProperties properties;
    private final ExecutorService backgroundExecutor;

    public FeedIngestionService(
        FeedHttpClient httpClient,
        FeedProcessor feedProcessor,
        LocalFeedListStore localFeedListStore,
        FeedSourceRepository feedSourceRepository,
        IngestProperties properties,
        @Qualifier("backgroundExecutor") ExecutorService backgroundExecutor
    ) {
        this.httpClient = httpClient;
        this.feedProcessor = feedProcessor;
        this.localFeedListStore = localFeedListStore;
        this.feedSourceRepository = feedSourceRepository;
        this.properties = properties;
        this.backgroundExecutor = backgroundExecutor;
    }

    public IngestOutcome fetchRssUrl(String url, FeedContext context, ResultSink sink) {
        if (url == null || url.isBlank()) {
            sink.setLabel(FetchFailureClassifier.EMPTY_URL);
            return IngestOutcome.failed(url, FetchFailureClassifier.EMPTY_URL, false);
        }
        String target = url.trim();
        FeedContext effective = new FeedContext(
            context.sourceName(),
            target,
            context.categoryName(),
            context.categoryId(),
            context.searchQuery()
        );
        try {
            if (target.startsWith(FILE_SCHEME)) {
                return readLocalFile(target, effective, sink);
            }
            return fetchRemote(target, effective, sink);
        } catch (RuntimeException e) {
            log.warn("Loading feed {} failed", target, e);
            sink.setLabel(FetchFailureClassifier.GENERIC_ERROR);
            pruneIfLocal(target, effective);
            return IngestOutcome.failed(target, FetchFailureClassifier.GENERIC_ERROR, false);
        }
    }

    private IngestOutcome fetchRemote(String url, FeedContext context, ResultSink sink) {
        HttpFetchResult result = httpClient.fetchSync(url, RequestOptions.feed());
        if (!result.isSuccessful() || !result.hasBody()) {
            String label = FetchFailureClassifier.labelFor(result);
            log.warn("Feed {} failed: {} ({})", url, label, result.errorMessage());
            sink.setLabel(label);
            if (!"invalid_url".equals(result.errorCode())) {
                pruneIfLocal(url, context);
            }
            return IngestOutcome.failed(url, label, FetchFailureClassifier.isNetworkFailure(result));
        }
        ParsedFeed parsed = feedProcessor.parseAndDeliver(result.bodyBytes(), context, sink);
        recordFetched(url, context);
        return IngestOutcome.delivered(url, FeedProcessor.filter(parsed.items(), context.searchQuery()).size());
    }

    private IngestOutcome readLocalFile(String url, FeedContext context, ResultSink sink) {
        Path path;
        try {
            path = Path.of(url.substring(FILE_SCHEME.length()));
        } catch (InvalidPathException e) {
            sink.setLabel(FetchFailureClassifier.INVALID_URL);
            return IngestOutcome.failed(url, FetchFailureClassifier.INVALID_URL, false);
        }
        if (!Files.exists(path)) {
            log.warn("Local feed file not found: {}", path);
            sink.setLabel(FetchFailureClassifier.LOCAL_FILE_NOT_FOUND);
            return IngestOutcome.failed(url, FetchFailureClassifier.LOCAL_FILE_NOT_FOUND, false);
        }
        byte[] payload;
        try {
            payload = Files.readAllBytes(path);
        } catch (IOException e) {
            log.warn("Failed to read local feed file {}: {}", path, e.getMessage());
            payload = new byte[0];
        }
        if (payload.length == 0) {
            sink.setLabel(FetchFailureClassifier.LOCAL_FILE_UNREADABLE);
            return IngestOutcome.failed(url, FetchFailureClassifier.LOCAL_FILE_UNREADABLE, false);
        }
        ParsedFeed parsed = feedProcessor.parseAndDeliver(payload, context, sink);
        return IngestOutcome.delivered(url, FeedProcessor.filter(parsed.items(), context.searchQuery()).size());
    }

    private void recordFetched(String url, FeedContext context) {
        if (properties.getFeed().isHighVolume(context.categoryId())) {
            return;
        }
        try {
            feedSourceRepository.updateLastFetched(url, Instant.now());
        } catch (DataAccessException e) {
            log.debug("Could not record fetch time for {}: {}", url, e.getMessage());
        }
    }

    private void pruneIfLocal(String url, FeedContext context) {
        if (!properties.getFeed().isHighVolume(context.categoryId())) {
            return;
        }
        try {
            backgroundExecutor.execute(() -> localFeedListStore.prune(url));
        } catch (RejectedExecutionException e) {
            log.debug("Skipping prune of {}, executor is shut down", url);
        }
    }
}
