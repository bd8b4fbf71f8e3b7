package com.feedreader.ingest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.feedreader.ingest.feed.cache.ImageCache;
import com.feedreader.ingest.feed.cache.LruImageCache;
import com.feedreader.ingest.feed.enrich.FetchThrottle;
import com.feedreader.ingest.feed.sink.UiEventLoop;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class IngestConfig {

    @Bean(name = "feedExecutor", destroyMethod = "shutdown")
    public ExecutorService feedExecutor(IngestProperties properties) {
        return Executors.newFixedThreadPool(properties.getFeed().getWorkerThreads());
    }

    @Bean(name = "enrichmentExecutor", destroyMethod = "shutdown")
    public ExecutorService enrichmentExecutor(IngestProperties properties) {
        return Executors.newFixedThreadPool(properties.getEnrichment().getWorkerThreads());
    }

    @Bean(name = "enrichmentScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService enrichmentScheduler() {
        return Executors.newSingleThreadScheduledExecutor();
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(IngestProperties properties) {
        int size = Math.max(4, properties.getRequestConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "backgroundExecutor", destroyMethod = "shutdown")
    public ExecutorService backgroundExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean(destroyMethod = "shutdown")
    public UiEventLoop uiEventLoop() {
        return new UiEventLoop("ui-loop");
    }

    @Bean
    public FetchThrottle fetchThrottle(IngestProperties properties) {
        IngestProperties.Enrichment enrichment = properties.getEnrichment();
        return new FetchThrottle(
            enrichment.getMaxConcurrent(),
            enrichment.getRetryMinDelayMs(),
            enrichment.getRetryMaxDelayMs()
        );
    }

    @Bean
    public ImageCache imageCache(IngestProperties properties) {
        return new LruImageCache(properties.getCache().getDefaultCapacity());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
