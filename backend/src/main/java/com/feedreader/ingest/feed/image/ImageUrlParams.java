package com.feedreader.ingest.feed.image;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class ImageUrlParams {
    private static final Set<String> RESIZE_KEYS = Set.of(
        "resize",
        "w",
        "h",
        "width",
        "height",
        "fit",
        "crop",
        "quality",
        "zoom"
    );

    private ImageUrlParams() {
    }

    /**
     * Drops size-limiting query parameters such as {@code ?w=300} or {@code ?resize=406x232}, keeping
     * every other parameter in its original order.
     */
    public static String stripResizeParams(String url) {
        if (url == null) {
            return null;
        }
        int queryStart = url.indexOf('?');
        if (queryStart < 0) {
            return url;
        }
        int fragmentStart = url.indexOf('#', queryStart);
        String base = url.substring(0, queryStart);
        String query = fragmentStart < 0 ? url.substring(queryStart + 1) : url.substring(queryStart + 1, fragmentStart);
        String fragment = fragmentStart < 0 ? "" : url.substring(fragmentStart);

        List<String> kept = new ArrayList<>();
        for (String param : query.split("&")) {
            if (param.isEmpty()) {
                continue;
            }
            int eq = param.indexOf('=');
            String key = (eq < 0 ? param : param.substring(0, eq)).toLowerCase(Locale.ROOT);
            if (!RESIZE_KEYS.contains(key)) {
                kept.add(param);
            }
        }
        if (kept.isEmpty()) {
            return base + fragment;
        }
        return base + "?" + String.join("&", kept) + fragment;
    }
}
