package com.feedreader.ingest.feed.parse;

import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Prefixes a feed binds to the Media RSS and content modules. jsoup keeps qualified names as-is, so
 * lookups compare against {@code prefix:local}.
 */
record NamespacePrefixes(String media, String content) {
    static final String MEDIA_NS = "http://search.yahoo.com/mrss/";
    static final String CONTENT_NS = "http://purl.org/rss/1.0/modules/content/";

    private static final String DEFAULT_MEDIA = "media";
    private static final String DEFAULT_CONTENT = "content";

    static NamespacePrefixes resolve(Element root) {
        String media = null;
        String content = null;
        if (root != null) {
            for (Element scope : scopes(root)) {
                for (Attribute attribute : scope.attributes()) {
                    String key = attribute.getKey();
                    if (!key.regionMatches(true, 0, "xmlns:", 0, 6)) {
                        continue;
                    }
                    String prefix = key.substring(6).toLowerCase(Locale.ROOT);
                    String uri = attribute.getValue() == null ? "" : attribute.getValue().trim();
                    if (media == null && isMediaNamespace(uri)) {
                        media = prefix;
                    } else if (content == null && CONTENT_NS.equalsIgnoreCase(uri)) {
                        content = prefix;
                    }
                }
            }
        }
        return new NamespacePrefixes(
            media == null ? DEFAULT_MEDIA : media,
            content == null ? DEFAULT_CONTENT : content
        );
    }

    String mediaName(String local) {
        return media + ":" + local;
    }

    String contentName(String local) {
        return content + ":" + local;
    }

    private static boolean isMediaNamespace(String uri) {
        // some publishers drop the trailing slash
        return MEDIA_NS.equalsIgnoreCase(uri) || MEDIA_NS.equalsIgnoreCase(uri + "/");
    }

    private static List<Element> scopes(Element root) {
        List<Element> scopes = new ArrayList<>();
        scopes.add(root);
        for (Element child : root.children()) {
            if ("channel".equals(child.normalName()) || "feed".equals(child.normalName())) {
                scopes.add(child);
            }
        }
        return scopes;
    }
}
