package com.feedreader.ingest.feed.enrich;

import com.feedreader.ingest.feed.http.FeedHttpClient;
import com.feedreader.ingest.feed.image.ImageResolver;
import com.feedreader.ingest.feed.image.SrcsetParser;
import com.feedreader.ingest.feed.model.CandidatePriority;
import com.feedreader.ingest.feed.model.ImageCandidate;
import com.feedreader.ingest.feed.util.FeedUrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * High-resolution images for BBC articles, whose pages rely on JSON-LD and lazy-loaded srcsets rather
 * than Open Graph tags.
 */
@Component
public class CdnHighResImageFetcher extends AbstractEnrichmentFetcher {
    private static final Pattern SRC_FAMILY = Pattern.compile("(srcset|data-srcset|data-src|src)=[\"']([^\"']+)[\"']");
    private static final Pattern CDN_IMAGE = Pattern.compile("https?://ichef\\.bbci\\.co\\.[a-z]+/[^\"'\\s]+");

    private final JsonLdImageExtractor jsonLdImageExtractor;

    public CdnHighResImageFetcher(
        FeedHttpClient httpClient,
        FetchThrottle throttle,
        @Qualifier("enrichmentExecutor") ExecutorService executor,
        @Qualifier("enrichmentScheduler") ScheduledExecutorService retryScheduler,
        JsonLdImageExtractor jsonLdImageExtractor
    ) {
        super(httpClient, throttle, executor, retryScheduler);
        this.jsonLdImageExtractor = jsonLdImageExtractor;
    }

    @Override
    protected Optional<EnrichedImage> extract(String articleUrl, String html) {
        return findCandidate(articleUrl, html)
            .map(candidate -> new ImageCandidate(clean(candidate.url()), candidate.priority()))
            .map(candidate -> new EnrichedImage(articleUrl, candidate));
    }

    @Override
    protected String name() {
        return "cdn-high-res";
    }

    Optional<ImageCandidate> findCandidate(String articleUrl, String html) {
        Document document = Jsoup.parse(html);
        Optional<String> jsonLd = jsonLdImageExtractor.extract(document)
            .map(value -> FeedUrlUtils.resolveImageUrl(articleUrl, value));
        if (jsonLd.isPresent()) {
            return Optional.of(new ImageCandidate(jsonLd.get(), CandidatePriority.JSON_LD));
        }

        Matcher attributes = SRC_FAMILY.matcher(html);
        while (attributes.find()) {
            String attribute = attributes.group(1).toLowerCase(Locale.ROOT);
            String value = attributes.group(2);
            if (attribute.endsWith("srcset")) {
                value = SrcsetParser.selectLargest(value).orElse(null);
            }
            String resolved = resolveImage(articleUrl, value);
            if (resolved != null) {
                CandidatePriority priority = attribute.endsWith("srcset")
                    ? CandidatePriority.SRCSET_SELECTED
                    : CandidatePriority.SRC_ATTRIBUTE;
                return Optional.of(new ImageCandidate(resolved, priority));
            }
        }

        Matcher cdn = CDN_IMAGE.matcher(html);
        if (cdn.find()) {
            return Optional.of(new ImageCandidate(cdn.group(), CandidatePriority.CDN_PATTERN));
        }
        return Optional.empty();
    }

    private static String resolveImage(String articleUrl, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        if (ImageResolver.isTracking(lower) || !FeedUrlUtils.containsImageKeyword(lower)) {
            return null;
        }
        return FeedUrlUtils.resolveImageUrl(articleUrl, value);
    }

    private static String clean(String url) {
        return FeedUrlUtils.preferHttps(url.replace("&amp;", "&"));
    }
}
