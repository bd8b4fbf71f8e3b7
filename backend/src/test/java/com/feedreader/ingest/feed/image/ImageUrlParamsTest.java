package com.feedreader.ingest.feed.image;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ImageUrlParamsTest {

    @Test
    void removesResizeParametersAndKeepsTheRest() {
        assertThat(ImageUrlParams.stripResizeParams("https://x.com/i.jpg?w=300&quality=80&foo=bar"))
            .isEqualTo("https://x.com/i.jpg?foo=bar");
    }

    @Test
    void matchesKeysCaseInsensitivelyAndPreservesOrder() {
        assertThat(ImageUrlParams.stripResizeParams("https://x.com/i.jpg?b=2&Width=640&a=1&CROP=1#top"))
            .isEqualTo("https://x.com/i.jpg?b=2&a=1#top");
    }

    @Test
    void dropsQueryWhenNothingRemains() {
        assertThat(ImageUrlParams.stripResizeParams("https://x.com/i.jpg?w=1&h=2"))
            .isEqualTo("https://x.com/i.jpg");
        assertThat(ImageUrlParams.stripResizeParams("https://x.com/i.jpg")).isEqualTo("https://x.com/i.jpg");
    }
}
