package com.feedreader.ingest.feed.enrich;

import com.feedreader.ingest.feed.http.FeedHttpClient;
import com.feedreader.ingest.feed.model.CandidatePriority;
import com.feedreader.ingest.feed.model.ImageCandidate;
import com.feedreader.ingest.feed.util.FeedUrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Article image from the page's Open Graph or Twitter card tags, titled by {@code og:title} or the first heading.
 */
@Component
public class OpenGraphImageFetcher extends AbstractEnrichmentFetcher {
    private static final String[] IMAGE_SELECTORS = {
        "meta[property='og:image']",
        "meta[property='og:image:secure_url']",
        "meta[name='twitter:image']",
        "meta[property='twitter:image']",
        "meta[name='twitter:image:src']"
    };

    public OpenGraphImageFetcher(
        FeedHttpClient httpClient,
        FetchThrottle throttle,
        @Qualifier("enrichmentExecutor") ExecutorService executor,
        @Qualifier("enrichmentScheduler") ScheduledExecutorService retryScheduler
    ) {
        super(httpClient, throttle, executor, retryScheduler);
    }

    @Override
    protected Optional<EnrichedImage> extract(String articleUrl, String html) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(html);
        String image = null;
        for (String selector : IMAGE_SELECTORS) {
            image = FeedUrlUtils.resolveImageUrl(articleUrl, metaContent(document, selector));
            if (image != null) {
                break;
            }
        }
        if (image == null) {
            return Optional.empty();
        }
        String title = metaContent(document, "meta[property='og:title']");
        if (title == null || title.isBlank()) {
            Element heading = document.selectFirst("h1");
            title = heading == null ? null : heading.text();
        }
        if (title == null || title.isBlank()) {
            title = articleUrl;
        }
        return Optional.of(new EnrichedImage(title.trim(), new ImageCandidate(image, CandidatePriority.OG_TAG)));
    }

    @Override
    protected String name() {
        return "open-graph";
    }

    static String metaContent(Document document, String selector) {
        Element meta = document.selectFirst(selector);
        if (meta == null) {
            return null;
        }
        String content = meta.attr("content").trim();
        return content.isEmpty() ? null : content;
    }
}
