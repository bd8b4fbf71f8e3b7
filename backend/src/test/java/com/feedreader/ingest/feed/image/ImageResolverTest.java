package com.feedreader.ingest.feed.image;

import com.feedreader.ingest.feed.model.CandidatePriority;
import com.feedreader.ingest.feed.model.ImageCandidate;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ImageResolverTest {

    @Test
    void anchorToFullImageBeatsThumbnailSrc() {
        String html = "<a href=\"https://x.com/full.jpg\"><img src=\"https://x.com/thumb/small.jpg\"></a>";

        Optional<ImageCandidate> candidate = ImageResolver.resolve(html);

        assertThat(candidate).isPresent();
        assertThat(candidate.get().url()).isEqualTo("https://x.com/full.jpg");
        assertThat(candidate.get().priority()).isEqualTo(CandidatePriority.HREF_TO_FILE);
    }

    @Test
    void regularSrcBeatsAnchor() {
        String html = "<a href=\"https://x.com/full.jpg\">more</a>"
            + "<img src=\"https://cdn.example.com/images/story.png\">";

        assertThat(ImageResolver.extractFromHtmlSnippet(html)).contains("https://cdn.example.com/images/story.png");
    }

    @Test
    void srcsetWinsEvenAfterAnEarlierSrc() {
        String html = "<img src=\"https://cdn.example.com/images/first.jpg\">"
            + "<img srcset=\"https://cdn.example.com/a.jpg 320w, https://cdn.example.com/b.jpg 640w, "
            + "https://cdn.example.com/c.jpg 1024w\">";

        Optional<ImageCandidate> candidate = ImageResolver.resolve(html);

        assertThat(candidate).isPresent();
        assertThat(candidate.get().url()).isEqualTo("https://cdn.example.com/c.jpg");
        assertThat(candidate.get().priority()).isEqualTo(CandidatePriority.SRCSET_SELECTED);
    }

    @Test
    void skipsTrackingPixelsDataUrisAndShortUrls() {
        String html = "<img src=\"data:image/png;base64,AAAA\">"
            + "<img src=\"https://ads.example.com/tracking/pixel.gif\">"
            + "<img src=\"https://a.co/x.jpg\">";

        assertThat(ImageResolver.extractFromHtmlSnippet(html)).isEmpty();
    }

    @Test
    void decodesEntitiesAndUpgradesProtocolRelativeUrls() {
        String html = "<img data-src=\"//cdn.example.com/photo.jpg?a=1&amp;b=2\">";

        assertThat(ImageResolver.extractFromHtmlSnippet(html)).contains("https://cdn.example.com/photo.jpg?a=1&b=2");
    }

    @Test
    void emptyInputHasNoImage() {
        assertThat(ImageResolver.extractFromHtmlSnippet(null)).isEmpty();
        assertThat(ImageResolver.extractFromHtmlSnippet("<p>just text</p>")).isEmpty();
    }
}
