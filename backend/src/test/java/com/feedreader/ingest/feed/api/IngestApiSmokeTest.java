package com.feedreader.ingest.feed.api;

import com.feedreader.ingest.feed.model.CatalogFeed;
import com.feedreader.ingest.feed.model.ViewSnapshot;
import com.feedreader.ingest.feed.model.ViewState;
import com.feedreader.ingest.feed.service.SourceCatalog;
import com.feedreader.ingest.feed.view.FeedViewRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class IngestApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private FeedViewRegistry viewRegistry;

    @Autowired
    private SourceCatalog sourceCatalog;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void fetchWithoutCategoryIsRejected() throws Exception {
        mockMvc.perform(post("/api/views/main/fetch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sourceUrl\":\"https://example.com/rss\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"))
            .andExpect(jsonPath("$.message").value("categoryId is required"));
    }

    @Test
    void fetchForUnknownProviderIsRejected() throws Exception {
        mockMvc.perform(post("/api/views/main/fetch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"provider\":\"nyt\",\"categoryId\":\"technology\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"))
            .andExpect(jsonPath("$.message").value("unknown provider nyt"));
    }

    @Test
    void configuredCatalogIsBound() {
        CatalogFeed bbcScience = sourceCatalog.resolve("bbc", "science").orElseThrow();
        assertThat(bbcScience.sourceName()).isEqualTo("BBC News");
        assertThat(bbcScience.url()).isEqualTo("https://feeds.bbci.co.uk/news/science_and_environment/rss.xml");
        assertThat(bbcScience.categoryName()).isEqualTo("Science");

        CatalogFeed nprDefault = sourceCatalog.resolve("npr", "general").orElseThrow();
        assertThat(nprDefault.url()).isEqualTo("https://feeds.npr.org/1001/rss.xml");
        assertThat(nprDefault.categoryName()).isEqualTo("World News");
    }

    @Test
    void unknownViewIsNotFound() throws Exception {
        mockMvc.perform(get("/api/views/never-fetched"))
            .andExpect(status().isNotFound());
    }

    @Test
    void registeredSourcesAreListed() throws Exception {
        String url = "https://" + UUID.randomUUID().toString().substring(0, 8) + ".example.com/rss";

        mockMvc.perform(post("/api/sources")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Smoke Source\",\"url\":\"" + url + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.url").value(url));

        mockMvc.perform(get("/api/sources"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].url").value(hasItem(url)));

        mockMvc.perform(post("/api/sources")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\" \",\"url\":\"" + url + "\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void localFileFeedIsFetchedIntoTheView() throws Exception {
        Path fixture = Path.of(getClass().getResource("/feeds/sample-rss.xml").toURI());
        String body = "{\"sourceUrl\":\"file://" + fixture.toAbsolutePath()
            + "\",\"categoryId\":\"world\",\"categoryName\":\"World\"}";

        mockMvc.perform(post("/api/views/smoke/fetch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.viewId").value("smoke"))
            .andExpect(jsonPath("$.epochId").value(greaterThan(0)));

        ViewSnapshot snapshot = awaitDelivered("smoke");
        assertThat(snapshot.revealed()).isTrue();
        assertThat(snapshot.label()).isEqualTo("World - RSS Feed");
        assertThat(snapshot.items())
            .extracting(ViewSnapshot.ViewItem::title)
            .containsExactly("Harbour bridge reopens after repairs", "Council approves new cycle lanes");

        mockMvc.perform(get("/api/views/smoke"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("DELIVERED"))
            .andExpect(jsonPath("$.items.length()").value(2));
    }

    private ViewSnapshot awaitDelivered(String viewId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            ViewSnapshot snapshot = viewRegistry.getOrCreate(viewId).snapshot();
            if (snapshot.state() == ViewState.DELIVERED && snapshot.items().size() == 2) {
                return snapshot;
            }
            Thread.sleep(20);
        }
        throw new AssertionError("view " + viewId + " was not delivered");
    }
}
