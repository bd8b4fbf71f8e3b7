package com.feedreader.ingest.feed.service;

import com.feedreader.ingest.config.IngestProperties;
import com.feedreader.ingest.feed.cache.ImageCache;
import com.feedreader.ingest.feed.epoch.FetchEpochGuard;
import com.feedreader.ingest.feed.model.CatalogFeed;
import com.feedreader.ingest.feed.model.FeedContext;
import com.feedreader.ingest.feed.model.FeedSource;
import com.feedreader.ingest.feed.model.FetchEpoch;
import com.feedreader.ingest.feed.model.FetchRequest;
import com.feedreader.ingest.feed.model.IngestOutcome;
import com.feedreader.ingest.feed.persistence.FeedSourceRepository;
import com.feedreader.ingest.feed.sink.BatchingSink;
import com.feedreader.ingest.feed.sink.EpochGuardedSink;
import com.feedreader.ingest.feed.sink.FeedView;
import com.feedreader.ingest.feed.sink.ResultSink;
import com.feedreader.ingest.feed.sink.UiEventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for user-triggered fetches. Each call starts a new epoch, so anything still running for an
 * earlier request keeps going but can no longer reach a view.
 */
@Service
public class FetchOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(FetchOrchestratorService.class);
    static final String LOCAL_SOURCE_NAME = "Local Feed";
    static final String LOCAL_CATEGORY_NAME = "Local News";
    static final String AGGREGATION_CATEGORY_NAME = "My Feed";
    static final String DEFAULT_SOURCE_NAME = "RSS Feed";
    static final String NO_LOCAL_FEEDS_LABEL = LOCAL_CATEGORY_NAME + " - No local feeds configured";
    static final String NO_SOURCES_LABEL = AGGREGATION_CATEGORY_NAME + " - No feed sources configured";

    private final IngestProperties properties;
    private final FetchEpochGuard epochGuard;
    private final UiEventLoop uiEventLoop;
    private final ImageCache imageCache;
    private final FeedIngestionService ingestionService;
    private final LocalFeedListStore localFeedListStore;
    private final FeedSourceRepository feedSourceRepository;
    private final SourceCatalog sourceCatalog;
    private final ExecutorService feedExecutor;
    private final Map<String, FetchSession> sessions = new ConcurrentHashMap<>();

    public FetchOrchestratorService(
        IngestProperties properties,
        FetchEpochGuard epochGuard,
        UiEventLoop uiEventLoop,
        ImageCache imageCache,
        FeedIngestionService ingestionService,
        LocalFeedListStore localFeedListStore,
        FeedSourceRepository feedSourceRepository,
        SourceCatalog sourceCatalog,
        @Qualifier("feedExecutor") ExecutorService feedExecutor
    ) {
        this.properties = properties;
        this.epochGuard = epochGuard;
        this.uiEventLoop = uiEventLoop;
        this.imageCache = imageCache;
        this.ingestionService = ingestionService;
        this.localFeedListStore = localFeedListStore;
        this.feedSourceRepository = feedSourceRepository;
        this.sourceCatalog = sourceCatalog;
        this.feedExecutor = feedExecutor;
    }

    public FetchEpoch fetch(FetchRequest request, FeedView view) {
        validate(request, view);
        IngestProperties.Feed feedSettings = properties.getFeed();
        boolean highVolume = feedSettings.isHighVolume(request.categoryId());
        imageCache.setCapacity(highVolume
            ? properties.getCache().getHighVolumeCapacity()
            : properties.getCache().getDefaultCapacity());

        FetchEpoch epoch = epochGuard.beginNewEpoch(view.viewId());
        FetchSession session = new FetchSession(epoch, view, epochGuard);
        FetchSession previous = sessions.put(view.viewId(), session);
        if (previous != null) {
            previous.cancelSafetyTimer();
        }
        uiEventLoop.post(() -> view.beginEpoch(epoch.id()));
        session.armSafetyTimer(uiEventLoop, properties.getDelivery().getSafetyTimeoutMs());

        EpochGuardedSink guarded = new EpochGuardedSink(view, epoch.id(), epochGuard, uiEventLoop, session);
        BatchingSink batching = highVolume
            ? new BatchingSink(
                guarded,
                uiEventLoop,
                properties.getDelivery().getBatchSize(),
                properties.getDelivery().getBatchTickMs(),
                request.categoryId()
            )
            : null;
        ResultSink sink = batching != null ? batching : guarded;
        guarded.clearItems();

        log.info("Fetch epoch {} started for view {} category={}", epoch.id(), view.viewId(), request.categoryId());
        CompletableFuture
            .supplyAsync(() -> resolveTargets(request, sink), feedExecutor)
            .thenCompose(targets -> runAll(targets, sink, session))
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    log.warn("Fetch epoch {} failed", epoch.id(), error);
                }
                if (batching != null) {
                    batching.whenDrained(session::onFetchesComplete);
                } else {
                    uiEventLoop.post(session::onFetchesComplete);
                }
            });
        return epoch;
    }

    public Optional<FetchSession> session(String viewId) {
        return Optional.ofNullable(sessions.get(viewId));
    }

    private void validate(FetchRequest request, FeedView view) {
        if (request == null || view == null) {
            throw new InvalidFetchRequestException("fetch request is required");
        }
        if (request.categoryId() == null || request.categoryId().isBlank()) {
            throw new InvalidFetchRequestException("categoryId is required");
        }
        IngestProperties.Feed feedSettings = properties.getFeed();
        boolean needsUrl = !feedSettings.isHighVolume(request.categoryId())
            && !feedSettings.isAggregation(request.categoryId());
        if (!needsUrl || !isBlank(request.sourceUrl())) {
            return;
        }
        if (!isBlank(request.provider())) {
            if (sourceCatalog.resolve(request.provider(), request.categoryId()).isEmpty()) {
                throw new InvalidFetchRequestException("unknown provider " + request.provider());
            }
            return;
        }
        if (request.sourceUrl() == null) {
            throw new InvalidFetchRequestException("sourceUrl or provider is required for category " + request.categoryId());
        }
    }

    private List<FeedTarget> resolveTargets(FetchRequest request, ResultSink sink) {
        IngestProperties.Feed feedSettings = properties.getFeed();
        String categoryId = request.categoryId();
        if (feedSettings.isHighVolume(categoryId)) {
            List<String> urls = localFeedListStore.readUrls();
            if (urls.isEmpty()) {
                sink.setLabel(NO_LOCAL_FEEDS_LABEL);
                return List.of();
            }
            List<FeedTarget> targets = new ArrayList<>(urls.size());
            for (String url : urls) {
                targets.add(new FeedTarget(
                    url,
                    new FeedContext(LOCAL_SOURCE_NAME, null, LOCAL_CATEGORY_NAME, categoryId, request.searchQuery())
                ));
            }
            return targets;
        }
        if (feedSettings.isAggregation(categoryId) && isBlank(request.sourceUrl())) {
            List<FeedSource> sources = loadSources();
            if (sources.isEmpty()) {
                sink.setLabel(NO_SOURCES_LABEL);
                return List.of();
            }
            List<FeedTarget> targets = new ArrayList<>(sources.size());
            for (FeedSource source : sources) {
                targets.add(new FeedTarget(
                    source.url(),
                    new FeedContext(source.name(), source.url(), AGGREGATION_CATEGORY_NAME, categoryId, request.searchQuery())
                ));
            }
            return targets;
        }
        if (isBlank(request.sourceUrl()) && !isBlank(request.provider())) {
            Optional<CatalogFeed> catalogFeed = sourceCatalog.resolve(request.provider(), categoryId);
            if (catalogFeed.isPresent()) {
                CatalogFeed feed = catalogFeed.get();
                FeedContext context = new FeedContext(
                    isBlank(request.displayName()) ? feed.sourceName() : request.displayName().trim(),
                    feed.url(),
                    isBlank(request.categoryName()) ? feed.categoryName() : request.categoryName(),
                    categoryId,
                    request.searchQuery()
                );
                return List.of(new FeedTarget(feed.url(), context));
            }
        }
        String url = request.sourceUrl() == null ? "" : request.sourceUrl().trim();
        String categoryName = isBlank(request.categoryName()) ? categoryId : request.categoryName();
        FeedContext context = new FeedContext(
            sourceNameFor(request, url),
            url,
            categoryName,
            categoryId,
            request.searchQuery()
        );
        return List.of(new FeedTarget(url, context));
    }

    private CompletableFuture<Void> runAll(List<FeedTarget> targets, ResultSink sink, FetchSession session) {
        List<CompletableFuture<IngestOutcome>> futures = new ArrayList<>(targets.size());
        for (FeedTarget target : targets) {
            futures.add(CompletableFuture
                .supplyAsync(() -> ingestionService.fetchRssUrl(target.url(), target.context(), sink), feedExecutor)
                .whenComplete((outcome, error) -> {
                    if (error != null) {
                        log.warn("Feed {} did not complete", target.url(), error);
                        return;
                    }
                    if (outcome.networkFailure()) {
                        session.markNetworkFailure();
                    }
                }));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
    }

    private List<FeedSource> loadSources() {
        try {
            return feedSourceRepository.findAll();
        } catch (DataAccessException e) {
            log.warn("Could not load feed sources: {}", e.getMessage());
            return List.of();
        }
    }

    private String sourceNameFor(FetchRequest request, String url) {
        if (!isBlank(request.displayName())) {
            return request.displayName().trim();
        }
        if (url.isEmpty()) {
            return DEFAULT_SOURCE_NAME;
        }
        try {
            return feedSourceRepository.findByUrl(url).map(FeedSource::name).orElse(DEFAULT_SOURCE_NAME);
        } catch (DataAccessException e) {
            log.debug("Source lookup for {} failed: {}", url, e.getMessage());
            return DEFAULT_SOURCE_NAME;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record FeedTarget(String url, FeedContext context) {
    }
}
