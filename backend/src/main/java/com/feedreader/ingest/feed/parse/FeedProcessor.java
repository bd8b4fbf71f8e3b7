package com.feedreader.ingest.feed.parse;

import com.feedreader.ingest.config.IngestProperties;
import com.feedreader.ingest.feed.enrich.EnrichmentScheduler;
import com.feedreader.ingest.feed.model.FeedContext;
import com.feedreader.ingest.feed.model.FeedItem;
import com.feedreader.ingest.feed.model.ParsedFeed;
import com.feedreader.ingest.feed.service.FaviconUpdateService;
import com.feedreader.ingest.feed.sink.ResultSink;
import com.feedreader.ingest.feed.util.FeedUrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a feed body and pushes the result into a sink: label, clear, then one add per item that survives
 * the search filter. Image upgrades and favicon updates are started afterwards as background work.
 */
@Service
public class FeedProcessor {
    private static final Logger log = LoggerFactory.getLogger(FeedProcessor.class);

    private final RssFeedParser parser;
    private final EnrichmentScheduler enrichmentScheduler;
    private final FaviconUpdateService faviconUpdateService;
    private final IngestProperties properties;

    public FeedProcessor(
        RssFeedParser parser,
        EnrichmentScheduler enrichmentScheduler,
        FaviconUpdateService faviconUpdateService,
        IngestProperties properties
    ) {
        this.parser = parser;
        this.enrichmentScheduler = enrichmentScheduler;
        this.faviconUpdateService = faviconUpdateService;
        this.properties = properties;
    }

    public ParsedFeed parseAndDeliver(
        String body,
        String sourceName,
        String categoryName,
        String categoryId,
        String searchQuery,
        ResultSink sink
    ) {
        return parseAndDeliver(body, new FeedContext(sourceName, null, categoryName, categoryId, searchQuery), sink);
    }

    public ParsedFeed parseAndDeliver(String body, FeedContext context, ResultSink sink) {
        ParsedFeed parsed;
        try {
            parsed = parser.parse(body, context.categoryId());
        } catch (RuntimeException e) {
            log.warn("Feed parse failed for {}: {}", context.sourceName(), e.getMessage());
            parsed = ParsedFeed.empty();
        }
        deliver(parsed, context, sink);
        return parsed;
    }

    public ParsedFeed parseAndDeliver(byte[] payload, FeedContext context, ResultSink sink) {
        ParsedFeed parsed;
        try {
            parsed = parser.parse(payload, context.categoryId());
        } catch (RuntimeException e) {
            log.warn("Feed parse failed for {}: {}", context.sourceName(), e.getMessage());
            parsed = ParsedFeed.empty();
        }
        deliver(parsed, context, sink);
        return parsed;
    }

    public static String labelFor(FeedContext context) {
        String base = context.categoryName() + " - " + context.sourceName();
        if (context.hasSearchQuery()) {
            return "Search Results: \"" + context.searchQuery() + "\" in " + base;
        }
        return base;
    }

    public static List<FeedItem> filter(List<FeedItem> items, String searchQuery) {
        if (searchQuery == null || searchQuery.isBlank()) {
            return items;
        }
        List<FeedItem> matches = new ArrayList<>();
        for (FeedItem item : items) {
            if (FeedUrlUtils.containsIgnoreCase(item.title(), searchQuery)
                || FeedUrlUtils.containsIgnoreCase(item.link(), searchQuery)) {
                matches.add(item);
            }
        }
        return matches;
    }

    private void deliver(ParsedFeed parsed, FeedContext context, ResultSink sink) {
        List<FeedItem> visible = filter(parsed.items(), context.searchQuery());
        try {
            sink.setLabel(labelFor(context));
            sink.clearItems();
            for (FeedItem item : visible) {
                sink.addItem(item.title(), item.link(), item.thumbnail(), context.categoryId(), context.sourceName());
            }
        } catch (RuntimeException e) {
            log.warn("Delivering {} failed: {}", context.sourceName(), e.getMessage());
            return;
        }

        if (parsed.faviconUrl() != null && context.sourceUrl() != null
            && !properties.getFeed().isHighVolume(context.categoryId())) {
            faviconUpdateService.updateAsync(context.sourceUrl(), context.sourceName(), parsed.faviconUrl());
        }
        // upgrades are delivered by URL, so only items that passed the filter may be enriched
        if (!visible.isEmpty()) {
            enrichmentScheduler.scheduleUpgrades(visible, sink.asCallback(), context.categoryId(), context.sourceName());
        }
    }
}
