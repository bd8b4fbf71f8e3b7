package com.feedreader.ingest.feed.image;

import com.feedreader.ingest.feed.model.CandidatePriority;
import com.feedreader.ingest.feed.model.ImageCandidate;
import com.feedreader.ingest.feed.util.FeedUrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the best article image in an HTML fragment such as an RSS description.
 *
 * <p>Two passes run over the fragment. The first takes the first anchor pointing straight at an image
 * file. The second walks every src-family attribute in document order; a srcset hit ends the scan.
 * A non-thumbnail src wins over the anchor; the anchor wins over a thumbnail-looking src.
 */
public final class ImageResolver {
    private static final Logger log = LoggerFactory.getLogger(ImageResolver.class);

    private static final Pattern HREF_TO_IMAGE = Pattern.compile(
        "href=[\"']([^\"']+\\.(jpg|jpeg|png|webp|gif))[\"']",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern SRC_ATTRIBUTE = Pattern.compile("(src|data-src|srcset|data-srcset)=[\"']([^\"']+)[\"']");
    private static final int MIN_URL_LENGTH = 20;

    private ImageResolver() {
    }

    public static Optional<String> extractFromHtmlSnippet(String html) {
        return resolve(html).map(ImageCandidate::url);
    }

    public static Optional<ImageCandidate> resolve(String html) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        String hrefCandidate = findHrefCandidate(html);
        String srcCandidate = null;

        Matcher matcher = SRC_ATTRIBUTE.matcher(html);
        while (matcher.find()) {
            String attribute = matcher.group(1).toLowerCase(Locale.ROOT);
            boolean srcset = attribute.endsWith("srcset");
            String value = matcher.group(2);
            if (srcset) {
                value = SrcsetParser.selectLargest(value).orElse(value);
            }
            String url = FeedUrlUtils.upgradeProtocolRelative(decodeEntities(value));
            String lower = url.toLowerCase(Locale.ROOT);
            if (lower.startsWith("data:") || url.length() < MIN_URL_LENGTH) {
                continue;
            }
            if (isTracking(lower) || !FeedUrlUtils.containsImageKeyword(lower) || !lower.startsWith("http")) {
                continue;
            }
            if (srcset) {
                log.debug("srcset image selected: {}", url);
                return Optional.of(new ImageCandidate(url, CandidatePriority.SRCSET_SELECTED));
            }
            if (srcCandidate == null && !isThumbnail(lower)) {
                srcCandidate = url;
            }
        }

        // thumbnail-looking src values never become candidates, so an anchor beats them by falling through
        if (srcCandidate != null) {
            return Optional.of(new ImageCandidate(srcCandidate, CandidatePriority.SRC_ATTRIBUTE));
        }
        if (hrefCandidate != null) {
            return Optional.of(new ImageCandidate(hrefCandidate, CandidatePriority.HREF_TO_FILE));
        }
        return Optional.empty();
    }

    public static boolean isTracking(String lowerUrl) {
        return lowerUrl.contains("tracking") || lowerUrl.contains("pixel") || lowerUrl.contains("1x1");
    }

    public static boolean isThumbnail(String lowerUrl) {
        return lowerUrl.contains("_thm.") || lowerUrl.contains("/thumb/") || lowerUrl.contains("/thumbnail/");
    }

    static String decodeEntities(String value) {
        return value
            .replace("&amp;", "&")
            .replace("&lt;", "<")
            .replace("&gt;", ">")
            .replace("&quot;", "\"")
            .replace("%3A", ":")
            .replace("%2F", "/")
            .replace("%3F", "?")
            .replace("%3D", "=")
            .replace("%26", "&");
    }

    private static String findHrefCandidate(String html) {
        Matcher matcher = HREF_TO_IMAGE.matcher(html);
        if (!matcher.find()) {
            return null;
        }
        String url = FeedUrlUtils.upgradeProtocolRelative(matcher.group(1).replace("&amp;", "&"));
        String lower = url.toLowerCase(Locale.ROOT);
        if (isTracking(lower) || isThumbnail(lower) || url.length() < MIN_URL_LENGTH || !lower.startsWith("http")) {
            return null;
        }
        return url;
    }
}
