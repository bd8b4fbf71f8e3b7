package com.feedreader.ingest.feed.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FeedUrlUtilsTest {

    @Test
    void cleansImageUrls() {
        assertThat(FeedUrlUtils.cleanImageUrl("  //img.example.com/a.jpg?x=1&amp;y=2 ")).isEqualTo("https://img.example.com/a.jpg?x=1&y=2");
        assertThat(FeedUrlUtils.cleanImageUrl("   ")).isNull();
        assertThat(FeedUrlUtils.cleanImageUrl(null)).isNull();
    }

    @Test
    void resolvesImageUrlsAgainstThePage() {
        assertThat(FeedUrlUtils.resolveImageUrl("https://example.com/news/a", "../img/a.jpg")).isEqualTo("https://example.com/img/a.jpg");
        assertThat(FeedUrlUtils.resolveImageUrl("https://example.com/news/a", "//cdn.example.com/b.jpg")).isEqualTo("https://cdn.example.com/b.jpg");
        assertThat(FeedUrlUtils.resolveImageUrl("https://example.com/news/a", "ftp://example.com/c.jpg")).isNull();
        assertThat(FeedUrlUtils.resolveImageUrl("https://example.com/news/a", "data:image/gif;base64,R0")).isNull();
        assertThat(FeedUrlUtils.resolveImageUrl(null, "/img/d.jpg")).isNull();
    }

    @Test
    void prefersHttps() {
        assertThat(FeedUrlUtils.preferHttps("http://example.com/a.jpg")).isEqualTo("https://example.com/a.jpg");
        assertThat(FeedUrlUtils.preferHttps("https://example.com/a.jpg")).isEqualTo("https://example.com/a.jpg");
    }

    @Test
    void detectsImagesAndMatchesIgnoringCase() {
        assertThat(FeedUrlUtils.hasImageExtension("https://example.com/A.JPG?w=1")).isTrue();
        assertThat(FeedUrlUtils.hasImageExtension("https://example.com/page.html")).isFalse();
        assertThat(FeedUrlUtils.containsIgnoreCase("Football Results", "foot")).isTrue();
    }
}
