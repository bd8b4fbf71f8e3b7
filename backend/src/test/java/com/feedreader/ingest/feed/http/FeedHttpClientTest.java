package com.feedreader.ingest.feed.http;

import com.feedreader.ingest.config.IngestProperties;
import com.feedreader.ingest.feed.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import okio.Buffer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class FeedHttpClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private FeedHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        IngestProperties properties = new IngestProperties();
        properties.setRequestTimeoutSeconds(2);
        executor = Executors.newFixedThreadPool(2);
        client = new FeedHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void returnsBodyAndSendsBrowserLikeHeaders() throws Exception {
        server.enqueue(new MockResponse().setBody("<rss/>").setHeader("Content-Type", "application/rss+xml"));

        HttpFetchResult result = client.fetchSync(server.url("/feed").toString(), RequestOptions.feed());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("<rss/>");
        assertThat(result.bodyBytes()).hasSize(6);
        assertThat(result.contentType()).isEqualTo("application/rss+xml");
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getHeader("User-Agent")).startsWith("Mozilla/5.0");
        assertThat(request.getHeader("Accept")).contains("xml");
    }

    @Test
    void keepsRawBytesAndDecodesTextOnlyWhenAsked() throws Exception {
        byte[] payload = "<p>Café</p>".getBytes(StandardCharsets.UTF_8);
        server.enqueue(new MockResponse().setBody(new Buffer().write(payload)));

        HttpFetchResult result = client.fetchSync(server.url("/page").toString(), RequestOptions.browser());

        assertThat(result.hasBody()).isTrue();
        assertThat(result.bodyBytes()).isEqualTo(payload);
        assertThat(result.body()).isEqualTo("<p>Café</p>");
    }

    @Test
    void emptyResponseHasNoBody() {
        server.enqueue(new MockResponse().setResponseCode(200));

        HttpFetchResult result = client.fetchSync(server.url("/empty").toString(), RequestOptions.feed());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.hasBody()).isFalse();
        assertThat(result.body()).isEmpty();
    }

    @Test
    void nonSuccessStatusIsAResultNotAnException() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));

        HttpFetchResult result = client.fetchSync(server.url("/gone").toString(), RequestOptions.feed());

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.errorCode()).isNull();
    }

    @Test
    void rejectsUrlsThatAreNotHttp() {
        assertThat(client.fetchSync("ftp://example.com/feed", RequestOptions.feed()).errorCode()).isEqualTo("invalid_url");
        assertThat(client.fetchSync("", RequestOptions.feed()).errorCode()).isEqualTo("invalid_url");
        assertThat(client.fetchSync(null, RequestOptions.feed()).errorCode()).isEqualTo("invalid_url");
    }

    @Test
    void refusedConnectionIsReportedAsTransportError() throws Exception {
        String url = server.url("/closed").toString();
        server.shutdown();

        HttpFetchResult result = client.fetchSync(url, RequestOptions.feed());

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.errorCode()).isIn("connect_error", "io_error", "timeout");
    }
}
