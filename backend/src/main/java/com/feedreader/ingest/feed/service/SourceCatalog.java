package com.feedreader.ingest.feed.service;

import com.feedreader.ingest.config.IngestProperties;
import com.feedreader.ingest.feed.model.CatalogFeed;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Looks up the feed a built-in provider publishes for a category. Unknown categories fall back to the
 * provider's default feed; unknown providers resolve to nothing.
 */
@Component
public class SourceCatalog {
    private final IngestProperties properties;

    public SourceCatalog(IngestProperties properties) {
        this.properties = properties;
    }

    public Optional<CatalogFeed> resolve(String provider, String categoryId) {
        if (provider == null || provider.isBlank()) {
            return Optional.empty();
        }
        String key = provider.trim().toLowerCase(Locale.ROOT);
        IngestProperties.Provider entry = properties.getCatalog().getProviders().get(key);
        if (entry == null) {
            return Optional.empty();
        }
        String category = categoryId == null ? "" : categoryId.trim().toLowerCase(Locale.ROOT);
        String url = entry.getFeeds().get(category);
        if (url == null || url.isBlank()) {
            url = entry.getDefaultUrl();
        }
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String sourceName = entry.getName() == null || entry.getName().isBlank() ? key : entry.getName().trim();
        return Optional.of(new CatalogFeed(key, sourceName, url.trim(), categoryDisplayName(category)));
    }

    public String categoryDisplayName(String categoryId) {
        IngestProperties.Catalog catalog = properties.getCatalog();
        if (categoryId != null) {
            String name = catalog.getCategoryNames().get(categoryId.trim().toLowerCase(Locale.ROOT));
            if (name != null && !name.isBlank()) {
                return name;
            }
        }
        return catalog.getDefaultCategoryName();
    }
}
