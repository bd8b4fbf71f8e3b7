package com.feedreader.ingest.feed.enrich;

import com.feedreader.ingest.config.IngestProperties;
import com.feedreader.ingest.feed.image.CdnImageNormalizer;
import com.feedreader.ingest.feed.model.FeedItem;
import com.feedreader.ingest.feed.sink.ItemCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Picks which items of a freshly parsed feed get a background image upgrade, capped per feed.
 */
@Service("enrichmentUpgradeScheduler")
public class EnrichmentScheduler {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentScheduler.class);

    private final IngestProperties properties;
    private final CdnHighResImageFetcher cdnFetcher;
    private final OpenGraphImageFetcher openGraphFetcher;

    public EnrichmentScheduler(
        IngestProperties properties,
        CdnHighResImageFetcher cdnFetcher,
        OpenGraphImageFetcher openGraphFetcher
    ) {
        this.properties = properties;
        this.cdnFetcher = cdnFetcher;
        this.openGraphFetcher = openGraphFetcher;
    }

    public List<CompletableFuture<Boolean>> scheduleUpgrades(
        List<FeedItem> items,
        ItemCallback callback,
        String categoryId,
        String sourceName
    ) {
        List<CompletableFuture<Boolean>> scheduled = new ArrayList<>();
        if (items == null || items.isEmpty() || callback == null) {
            return scheduled;
        }
        IngestProperties.Enrichment enrichment = properties.getEnrichment();
        int budget = enrichment.getMaxUpgradesPerFeed();
        boolean cdnEnabled = properties.isCdnExtractEnabled();
        for (FeedItem item : items) {
            if (scheduled.size() >= budget) {
                break;
            }
            String link = item.link();
            if (link == null || link.isBlank()) {
                continue;
            }
            if (cdnEnabled && CdnImageNormalizer.isKnownCdnUrl(link) && needsCdnUpgrade(item, enrichment)) {
                scheduled.add(cdnFetcher.enrich(link, callback, categoryId, sourceName));
            } else if (enrichment.isOpenGraphFallback() && !item.hasThumbnail()) {
                scheduled.add(openGraphFetcher.enrich(link, callback, categoryId, sourceName));
            }
        }
        if (!scheduled.isEmpty()) {
            log.debug("Scheduled {} image upgrades for {}", scheduled.size(), sourceName);
        }
        return scheduled;
    }

    private boolean needsCdnUpgrade(FeedItem item, IngestProperties.Enrichment enrichment) {
        String thumbnail = item.thumbnail();
        return thumbnail == null || thumbnail.length() < enrichment.getMinThumbnailLength();
    }
}
