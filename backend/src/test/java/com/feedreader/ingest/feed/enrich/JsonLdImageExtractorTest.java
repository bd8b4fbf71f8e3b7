package com.feedreader.ingest.feed.enrich;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonLdImageExtractorTest {
    private final JsonLdImageExtractor extractor = new JsonLdImageExtractor(new ObjectMapper());

    @Test
    void readsPlainStringImage() {
        assertThat(extract("{\"@type\":\"NewsArticle\",\"image\":\"https://img.example.com/a.jpg\"}"))
            .isEqualTo("https://img.example.com/a.jpg");
    }

    @Test
    void readsNestedImageObject() {
        assertThat(extract("{\"image\":{\"@type\":\"ImageObject\",\"url\":\"https://img.example.com/b.jpg\",\"width\":1024}}"))
            .isEqualTo("https://img.example.com/b.jpg");
    }

    @Test
    void readsFirstEntryOfImageArray() {
        assertThat(extract("{\"image\":[\"https://img.example.com/c1.jpg\",\"https://img.example.com/c2.jpg\"]}"))
            .isEqualTo("https://img.example.com/c1.jpg");
        assertThat(extract("[{\"@type\":\"WebPage\"},{\"image\":[{\"url\":\"https://img.example.com/d.jpg\"}]}]"))
            .isEqualTo("https://img.example.com/d.jpg");
    }

    @Test
    void fallsBackToTextScanOnBrokenJson() {
        assertThat(extract("{\"headline\":\"x\",\n\"image\": {\"url\": \"https://img.example.com/e.jpg\",},}"))
            .isEqualTo("https://img.example.com/e.jpg");
    }

    @Test
    void returnsEmptyWithoutStructuredData() {
        assertThat(extractor.extract(Jsoup.parse("<html><body><p>no data</p></body></html>"))).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    private String extract(String json) {
        String html = "<html><head><script type=\"application/ld+json\">" + json + "</script></head><body></body></html>";
        return extractor.extract(Jsoup.parse(html)).orElse(null);
    }
}
