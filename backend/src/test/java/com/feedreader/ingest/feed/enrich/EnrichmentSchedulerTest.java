package com.feedreader.ingest.feed.enrich;

import com.feedreader.ingest.config.IngestProperties;
import com.feedreader.ingest.feed.model.FeedItem;
import com.feedreader.ingest.feed.sink.ItemCallback;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class EnrichmentSchedulerTest {
    private static final String SHORT_THUMB = "https://ichef.bbci.co.uk/a.jpg";
    private static final String LONG_THUMB = "https://ichef.bbci.co.uk/news/1024/cpsprodpb/abcdef/long-image-name.jpg";

    @Mock
    private CdnHighResImageFetcher cdnFetcher;

    @Mock
    private OpenGraphImageFetcher openGraphFetcher;

    private IngestProperties properties;
    private EnrichmentScheduler scheduler;
    private final ItemCallback callback = (title, url, thumbnail, categoryId, sourceName) -> {
    };

    @BeforeEach
    void setUp() {
        properties = new IngestProperties();
        scheduler = new EnrichmentScheduler(properties, cdnFetcher, openGraphFetcher);
    }

    @Test
    void routesCdnArticlesWithWeakThumbnailsToCdnFetcher() {
        List<FeedItem> items = List.of(
            new FeedItem("No image", "https://www.bbc.co.uk/news/1", null),
            new FeedItem("Small image", "https://www.bbc.co.uk/news/2", SHORT_THUMB),
            new FeedItem("Good image", "https://www.bbc.co.uk/news/3", LONG_THUMB)
        );

        scheduler.scheduleUpgrades(items, callback, "world", "BBC");

        verify(cdnFetcher).enrich(eq("https://www.bbc.co.uk/news/1"), any(), eq("world"), eq("BBC"));
        verify(cdnFetcher).enrich(eq("https://www.bbc.co.uk/news/2"), any(), eq("world"), eq("BBC"));
        verify(cdnFetcher, never()).enrich(eq("https://www.bbc.co.uk/news/3"), any(), anyString(), anyString());
        verify(openGraphFetcher, never()).enrich(anyString(), any(), anyString(), anyString());
    }

    @Test
    void usesOpenGraphOnlyForItemsWithoutThumbnail() {
        List<FeedItem> items = List.of(
            new FeedItem("Bare", "https://example.com/bare", null),
            new FeedItem("Pictured", "https://example.com/pic", "https://example.com/pic.jpg")
        );

        scheduler.scheduleUpgrades(items, callback, "tech", "Example");

        verify(openGraphFetcher).enrich(eq("https://example.com/bare"), any(), eq("tech"), eq("Example"));
        verify(openGraphFetcher, never()).enrich(eq("https://example.com/pic"), any(), anyString(), anyString());
    }

    @Test
    void capsUpgradesPerFeed() {
        List<FeedItem> items = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            items.add(new FeedItem("Item " + i, "https://example.com/" + i, null));
        }

        assertThat(scheduler.scheduleUpgrades(items, callback, "tech", "Example")).hasSize(8);
        verify(openGraphFetcher, times(8)).enrich(anyString(), any(), anyString(), anyString());
    }

    @Test
    void disabledCdnFlagSendsCdnArticlesToOpenGraph() {
        properties.setCdnExtract("0");

        scheduler.scheduleUpgrades(List.of(new FeedItem("BBC", "https://www.bbc.co.uk/news/9", null)), callback, "world", "BBC");

        verify(cdnFetcher, never()).enrich(anyString(), any(), anyString(), anyString());
        verify(openGraphFetcher).enrich(eq("https://www.bbc.co.uk/news/9"), any(), eq("world"), eq("BBC"));
    }

    @Test
    void nothingScheduledForEmptyInput() {
        assertThat(scheduler.scheduleUpgrades(List.of(), callback, "world", "BBC")).isEmpty();
        assertThat(scheduler.scheduleUpgrades(null, callback, "world", "BBC")).isEmpty();
    }
}
