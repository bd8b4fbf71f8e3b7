package com.feedreader.ingest.feed.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class FeedUrlUtils {
    private static final String[] IMAGE_EXTENSIONS = {".jpg", ".jpeg", ".png", ".webp", ".gif"};
    private static final String[] IMAGE_KEYWORDS = {"jpg", "jpeg", "png", "webp", "gif"};

    private FeedUrlUtils() {
    }

    public static String upgradeProtocolRelative(String url) {
        if (url == null) {
            return null;
        }
        return url.startsWith("//") ? "https:" + url : url;
    }

    public static String decodeAmpersands(String url) {
        return url == null ? null : url.replace("&amp;", "&");
    }

    /**
     * Decodes {@code &amp;} and upgrades protocol-relative URLs, the cleanup every thumbnail candidate gets.
     */
    public static String cleanImageUrl(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return upgradeProtocolRelative(decodeAmpersands(trimmed));
    }

    /**
     * Cleans an image reference found in a page and resolves it against the page URL.
     * Returns {@code null} unless the result is an absolute http(s) URL.
     */
    public static String resolveImageUrl(String pageUrl, String value) {
        String candidate = cleanImageUrl(value);
        if (candidate == null || candidate.toLowerCase(Locale.ROOT).startsWith("data:")) {
            return null;
        }
        if (isHttpUrl(candidate)) {
            return candidate;
        }
        URI base = safeUri(pageUrl);
        if (base == null || !isHttpUrl(pageUrl.trim())) {
            return null;
        }
        try {
            String resolved = base.resolve(candidate).toString();
            return isHttpUrl(resolved) ? resolved : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static String preferHttps(String url) {
        if (url == null) {
            return null;
        }
        String value = upgradeProtocolRelative(url);
        if (value.startsWith("http:")) {
            return "https:" + value.substring(5);
        }
        return value;
    }

    public static boolean isHttpUrl(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    public static boolean hasImageExtension(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        int cut = lower.indexOf('?');
        if (cut < 0) {
            cut = lower.indexOf('#');
        }
        if (cut >= 0) {
            lower = lower.substring(0, cut);
        }
        for (String ext : IMAGE_EXTENSIONS) {
            if (lower.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsImageKeyword(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (String keyword : IMAGE_KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsIgnoreCase(String haystack, String needle) {
        if (haystack == null || needle == null) {
            return false;
        }
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
