package com.feedreader.ingest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "ingest")
public class IngestProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private String userAgent;
    private int requestTimeoutSeconds = 15;
    private int requestConcurrency = 8;
    private boolean debug;
    private String cdnExtract;
    private Feed feed = new Feed();
    private Enrichment enrichment = new Enrichment();
    private Delivery delivery = new Delivery();
    private Cache cache = new Cache();
    private LocalFeeds localFeeds = new LocalFeeds();
    private Catalog catalog = new Catalog();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestConcurrency() {
        return Math.max(1, requestConcurrency);
    }

    public void setRequestConcurrency(int requestConcurrency) {
        this.requestConcurrency = Math.max(1, requestConcurrency);
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public String getCdnExtract() {
        return cdnExtract;
    }

    public void setCdnExtract(String cdnExtract) {
        this.cdnExtract = cdnExtract;
    }

    /**
     * CDN-specific extraction is on unless the flag is explicitly "0".
     */
    public boolean isCdnExtractEnabled() {
        return cdnExtract == null || !"0".equals(cdnExtract.trim());
    }

    public Feed getFeed() {
        return feed;
    }

    public void setFeed(Feed feed) {
        this.feed = feed;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public void setDelivery(Delivery delivery) {
        this.delivery = delivery;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public LocalFeeds getLocalFeeds() {
        return localFeeds;
    }

    public void setLocalFeeds(LocalFeeds localFeeds) {
        this.localFeeds = localFeeds;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Feed {
        private String highVolumeCategory = "local_news";
        private int highVolumeMaxItems = 12;
        private String aggregationCategory = "myfeed";
        private int workerThreads = 4;

        public String getHighVolumeCategory() {
            return highVolumeCategory;
        }

        public void setHighVolumeCategory(String highVolumeCategory) {
            this.highVolumeCategory = highVolumeCategory == null ? "" : highVolumeCategory.trim().toLowerCase(Locale.ROOT);
        }

        public int getHighVolumeMaxItems() {
            return Math.max(1, highVolumeMaxItems);
        }

        public void setHighVolumeMaxItems(int highVolumeMaxItems) {
            this.highVolumeMaxItems = Math.max(1, highVolumeMaxItems);
        }

        public String getAggregationCategory() {
            return aggregationCategory;
        }

        public void setAggregationCategory(String aggregationCategory) {
            this.aggregationCategory = aggregationCategory == null ? "" : aggregationCategory.trim().toLowerCase(Locale.ROOT);
        }

        public int getWorkerThreads() {
            return Math.max(1, workerThreads);
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = Math.max(1, workerThreads);
        }

        public boolean isHighVolume(String categoryId) {
            return categoryId != null && categoryId.equalsIgnoreCase(highVolumeCategory);
        }

        public boolean isAggregation(String categoryId) {
            return categoryId != null && categoryId.equalsIgnoreCase(aggregationCategory);
        }
    }

    public static class Enrichment {
        private int maxConcurrent = 6;
        private int retryMinDelayMs = 200;
        private int retryMaxDelayMs = 1000;
        private int maxUpgradesPerFeed = 8;
        private int minThumbnailLength = 50;
        private boolean openGraphFallback = true;
        private int workerThreads = 6;

        public int getMaxConcurrent() {
            return Math.max(1, maxConcurrent);
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = Math.max(1, maxConcurrent);
        }

        public int getRetryMinDelayMs() {
            return Math.max(1, retryMinDelayMs);
        }

        public void setRetryMinDelayMs(int retryMinDelayMs) {
            this.retryMinDelayMs = Math.max(1, retryMinDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(getRetryMinDelayMs(), retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(1, retryMaxDelayMs);
        }

        public int getMaxUpgradesPerFeed() {
            return Math.max(0, maxUpgradesPerFeed);
        }

        public void setMaxUpgradesPerFeed(int maxUpgradesPerFeed) {
            this.maxUpgradesPerFeed = Math.max(0, maxUpgradesPerFeed);
        }

        public int getMinThumbnailLength() {
            return Math.max(0, minThumbnailLength);
        }

        public void setMinThumbnailLength(int minThumbnailLength) {
            this.minThumbnailLength = Math.max(0, minThumbnailLength);
        }

        public boolean isOpenGraphFallback() {
            return openGraphFallback;
        }

        public void setOpenGraphFallback(boolean openGraphFallback) {
            this.openGraphFallback = openGraphFallback;
        }

        public int getWorkerThreads() {
            return Math.max(1, workerThreads);
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = Math.max(1, workerThreads);
        }
    }

    public static class Delivery {
        private int batchSize = 6;
        private int batchTickMs = 60;
        private int safetyTimeoutMs = 15000;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getBatchTickMs() {
            return Math.max(1, batchTickMs);
        }

        public void setBatchTickMs(int batchTickMs) {
            this.batchTickMs = Math.max(1, batchTickMs);
        }

        public int getSafetyTimeoutMs() {
            return Math.max(100, safetyTimeoutMs);
        }

        public void setSafetyTimeoutMs(int safetyTimeoutMs) {
            this.safetyTimeoutMs = Math.max(100, safetyTimeoutMs);
        }
    }

    public static class Cache {
        private int defaultCapacity = 12;
        private int highVolumeCapacity = 6;

        public int getDefaultCapacity() {
            return Math.max(1, defaultCapacity);
        }

        public void setDefaultCapacity(int defaultCapacity) {
            this.defaultCapacity = Math.max(1, defaultCapacity);
        }

        public int getHighVolumeCapacity() {
            return Math.max(1, highVolumeCapacity);
        }

        public void setHighVolumeCapacity(int highVolumeCapacity) {
            this.highVolumeCapacity = Math.max(1, highVolumeCapacity);
        }
    }

    public static class LocalFeeds {
        private String path = "data/local_feeds";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    /**
     * Built-in news providers, each mapping category ids to a feed URL, plus display names for category ids.
     */
    public static class Catalog {
        private Map<String, Provider> providers = new LinkedHashMap<>();
        private Map<String, String> categoryNames = new LinkedHashMap<>();
        private String defaultCategoryName = "News";

        public Map<String, Provider> getProviders() {
            return providers;
        }

        public void setProviders(Map<String, Provider> providers) {
            this.providers = providers == null ? new LinkedHashMap<>() : providers;
        }

        public Map<String, String> getCategoryNames() {
            return categoryNames;
        }

        public void setCategoryNames(Map<String, String> categoryNames) {
            this.categoryNames = categoryNames == null ? new LinkedHashMap<>() : categoryNames;
        }

        public String getDefaultCategoryName() {
            return defaultCategoryName;
        }

        public void setDefaultCategoryName(String defaultCategoryName) {
            this.defaultCategoryName = defaultCategoryName;
        }
    }

    public static class Provider {
        private String name;
        private String defaultUrl;
        private Map<String, String> feeds = new LinkedHashMap<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDefaultUrl() {
            return defaultUrl;
        }

        public void setDefaultUrl(String defaultUrl) {
            this.defaultUrl = defaultUrl;
        }

        public Map<String, String> getFeeds() {
            return feeds;
        }

        public void setFeeds(Map<String, String> feeds) {
            this.feeds = feeds == null ? new LinkedHashMap<>() : feeds;
        }
    }
}
