package com.feedreader.ingest.feed.enrich;

import com.feedreader.ingest.config.IngestProperties;
import com.feedreader.ingest.feed.http.FeedHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OpenGraphImageFetcherTest {
    private MockWebServer server;
    private ExecutorService httpExecutor;
    private ExecutorService workers;
    private ScheduledExecutorService scheduler;
    private FetchThrottle throttle;
    private OpenGraphImageFetcher fetcher;
    private final List<String> delivered = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        IngestProperties properties = new IngestProperties();
        properties.setRequestTimeoutSeconds(5);
        httpExecutor = Executors.newFixedThreadPool(2);
        workers = Executors.newFixedThreadPool(2);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        throttle = new FetchThrottle(1, 1, 5);
        fetcher = new OpenGraphImageFetcher(new FeedHttpClient(properties, httpExecutor), throttle, workers, scheduler);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        httpExecutor.shutdownNow();
        workers.shutdownNow();
        scheduler.shutdownNow();
    }

    @Test
    void deliversOpenGraphImageAndTitle() throws Exception {
        server.enqueue(new MockResponse().setBody("""
            <html><head>
            <meta content="//img.example.com/og.jpg" property="og:image">
            <meta property="og:title" content="Rates &amp; bonds">
            </head><body><h1>Ignored</h1></body></html>
            """));
        String url = server.url("/story").toString();

        boolean result = fetcher.enrich(url, this::record, "world", "Example").get(5, TimeUnit.SECONDS);

        assertThat(result).isTrue();
        assertThat(delivered).containsExactly("Rates & bonds|" + url + "|https://img.example.com/og.jpg|world|Example");
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getHeader("User-Agent")).contains("Mozilla");
        assertThat(throttle.activeCount()).isZero();
    }

    @Test
    void fallsBackToHeadingForTitle() throws Exception {
        server.enqueue(new MockResponse().setBody(
            "<html><head><meta property=\"og:image\" content=\"https://img.example.com/h.png\"></head>"
                + "<body><h1 class=\"t\">Big <em>news</em></h1></body></html>"
        ));
        String url = server.url("/heading").toString();

        assertThat(fetcher.enrich(url, this::record, "world", "Example").get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(delivered).containsExactly("Big news|" + url + "|https://img.example.com/h.png|world|Example");
    }

    @Test
    void dropsSilentlyWithoutImageOrOnHttpError() throws Exception {
        server.enqueue(new MockResponse().setBody("<html><head><title>none</title></head></html>"));
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        assertThat(fetcher.enrich(server.url("/a").toString(), this::record, "world", "Example").get(5, TimeUnit.SECONDS))
            .isFalse();
        assertThat(fetcher.enrich(server.url("/b").toString(), this::record, "world", "Example").get(5, TimeUnit.SECONDS))
            .isFalse();
        assertThat(delivered).isEmpty();
        assertThat(throttle.activeCount()).isZero();
    }

    @Test
    void waitsForAFreeSlotInsteadOfBlocking() throws Exception {
        server.enqueue(new MockResponse().setBody("<meta property=\"og:image\" content=\"https://img.example.com/w.jpg\">"));
        assertThat(throttle.tryAcquire()).isTrue();

        var pending = fetcher.enrich(server.url("/wait").toString(), this::record, "world", "Example");
        Thread.sleep(100);
        assertThat(pending).isNotDone();
        assertThat(server.getRequestCount()).isZero();

        throttle.release();
        assertThat(pending.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void resolvesRelativeOpenGraphImageAgainstArticle() {
        String html = "<html><head><meta property=\"og:image\" content=\"/img/lead.jpg\">"
            + "<meta property=\"og:title\" content=\"Lead\"></head></html>";

        EnrichedImage image = fetcher.extract("https://example.com/news/a", html).orElseThrow();

        assertThat(image.image().url()).isEqualTo("https://example.com/img/lead.jpg");
        assertThat(image.title()).isEqualTo("Lead");
    }

    @Test
    void fallsBackToTwitterCardImage() {
        String html = "<html><head><meta name=\"twitter:image\" content=\"https://img.example.com/card.png\"></head>"
            + "<body><h1>Card story</h1></body></html>";

        EnrichedImage image = fetcher.extract("https://example.com/news/b", html).orElseThrow();

        assertThat(image.image().url()).isEqualTo("https://img.example.com/card.png");
        assertThat(image.title()).isEqualTo("Card story");
    }

    @Test
    void rejectsImagesThatCannotBecomeHttpUrls() {
        String html = "<meta property=\"og:image\" content=\"data:image/png;base64,AAAA\">";

        assertThat(fetcher.extract("https://example.com/news/c", html)).isEmpty();
        assertThat(fetcher.extract("https://example.com/news/d", "<p>no tags</p>")).isEmpty();
    }

    private void record(String title, String url, String thumbnail, String categoryId, String sourceName) {
        delivered.add(title + "|" + url + "|" + thumbnail + "|" + categoryId + "|" + sourceName);
    }
}
