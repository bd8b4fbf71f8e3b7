package com.feedreader.ingest.feed.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rewrites thumbnails on the BBC image CDN to their 1024px variants.
 * Every rule is a fixed point on its own output, so normalizing twice changes nothing.
 */
public final class CdnImageNormalizer {
    private static final Logger log = LoggerFactory.getLogger(CdnImageNormalizer.class);

    private static final Pattern NEWS_SIZE = Pattern.compile("/news/\\d+/");
    private static final Pattern DIMENSION_SEGMENT = Pattern.compile("/\\d+x\\d+(?=/(?!cpsprodpb))");
    private static final Pattern ACE_STANDARD = Pattern.compile("/ace/standard/\\d+/");
    private static final Pattern ACE_ANY = Pattern.compile("/ace/(?:thumbnail|thumb|standard)/\\d+/");
    private static final Pattern RESIZE_SEGMENT = Pattern.compile("/(?:resize|preview)/\\d+x\\d+(?=/(?!cpsprodpb))");
    private static final Pattern CPS_PATH = Pattern.compile("/news/(?:[^/]+/)*cpsprodpb/");
    private static final Pattern NEWS_WITHOUT_SIZE = Pattern.compile("/news/(?!1024/)");
    private static final Pattern SMALL_SEGMENT = Pattern.compile("/(?:thumb|thumbnail|small|crop)(?=/)");

    private CdnImageNormalizer() {
    }

    public static boolean isKnownCdnUrl(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.contains("bbc.") || lower.contains("bbci.co.uk");
    }

    public static String normalizeKnownCdn(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }
        try {
            String value = url.replace("&amp;", "&");
            if (value.startsWith("//")) {
                value = "https:" + value;
            }
            if (value.startsWith("http:")) {
                value = "https:" + value.substring(5);
            }
            value = NEWS_SIZE.matcher(value).replaceAll("/news/1024/");
            value = DIMENSION_SEGMENT.matcher(value).replaceAll("/1024x576");
            value = ACE_STANDARD.matcher(value).replaceAll("/ace/standard/1024/");
            value = ACE_ANY.matcher(value).replaceAll("/ace/standard/1024/");
            value = RESIZE_SEGMENT.matcher(value).replaceAll("/resize/1024x576");
            if (CPS_PATH.matcher(value).find()) {
                value = NEWS_WITHOUT_SIZE.matcher(value).replaceAll("/news/1024/");
            }
            value = SMALL_SEGMENT.matcher(value).replaceAll("/1024x576");
            int query = value.indexOf('?');
            if (query >= 0) {
                value = value.substring(0, query);
            }
            return value;
        } catch (RuntimeException e) {
            log.debug("CDN normalization failed for {}", url, e);
            return url;
        }
    }
}
