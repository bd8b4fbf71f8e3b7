package com.feedreader.ingest.feed.parse;

import com.feedreader.ingest.config.IngestProperties;
import com.feedreader.ingest.feed.image.CdnImageNormalizer;
import com.feedreader.ingest.feed.image.ImageResolver;
import com.feedreader.ingest.feed.image.ImageUrlParams;
import com.feedreader.ingest.feed.model.FeedFormat;
import com.feedreader.ingest.feed.model.FeedItem;
import com.feedreader.ingest.feed.model.ParsedFeed;
import com.feedreader.ingest.feed.util.FeedUrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Turns an RSS 2.0, RSS 1.0 (RDF) or Atom document into feed items.
 *
 * <p>jsoup's XML parser never touches the network and never expands entities declared in a DTD, and it
 * repairs unbalanced markup instead of failing. Anything it still cannot make sense of ends up as an empty
 * result.
 */
@Component
public class RssFeedParser {
    private static final Logger log = LoggerFactory.getLogger(RssFeedParser.class);
    private static final int MAX_TRACKED_ERRORS = 50;
    private static final String NO_TITLE = "No title";

    private final IngestProperties properties;

    public RssFeedParser(IngestProperties properties) {
        this.properties = properties;
    }

    public ParsedFeed parse(byte[] payload, String categoryId) {
        return parseSanitized(XmlSanitizer.sanitize(payload), categoryId);
    }

    public ParsedFeed parse(String body, String categoryId) {
        return parseSanitized(XmlSanitizer.sanitize(body), categoryId);
    }

    private ParsedFeed parseSanitized(String xml, String categoryId) {
        if (xml.isBlank()) {
            return ParsedFeed.empty();
        }
        try {
            Parser parser = Parser.xmlParser().setTrackErrors(MAX_TRACKED_ERRORS);
            Document document = Jsoup.parse(xml, "", parser);
            int parseErrors = parser.getErrors().size();
            if (parseErrors > 0) {
                log.debug("Recovered from {} XML errors, first: {}", parseErrors, parser.getErrors().get(0));
            }
            Element root = document.children().first();
            if (root == null) {
                return new ParsedFeed(FeedFormat.UNKNOWN, List.of(), null, 0, parseErrors);
            }
            return readDocument(root, categoryId, parseErrors);
        } catch (RuntimeException e) {
            log.warn("Feed parse failed: {}", e.getMessage());
            return ParsedFeed.empty();
        }
    }

    private ParsedFeed readDocument(Element root, String categoryId, int parseErrors) {
        NamespacePrefixes prefixes = NamespacePrefixes.resolve(root);
        int cap = properties.getFeed().isHighVolume(categoryId)
            ? properties.getFeed().getHighVolumeMaxItems()
            : Integer.MAX_VALUE;
        ItemAccumulator accumulator = new ItemAccumulator(cap);
        String rootName = root.normalName();
        FeedFormat format;
        String favicon;

        if ("feed".equals(rootName)) {
            format = FeedFormat.ATOM;
            favicon = readFavicon(root);
            collectItems(root, prefixes, accumulator);
        } else {
            format = rootName.endsWith("rdf") ? FeedFormat.RDF : FeedFormat.RSS;
            favicon = null;
            for (Element container : root.children()) {
                String name = container.normalName();
                if ("channel".equals(name) || "feed".equals(name)) {
                    if (favicon == null) {
                        favicon = readFavicon(container);
                    }
                    collectItems(container, prefixes, accumulator);
                }
            }
            if (format == FeedFormat.RDF) {
                collectItems(root, prefixes, accumulator);
            }
        }

        if (accumulator.skipped > 0) {
            log.debug("Item cap of {} reached for category {}, skipped {}", cap, categoryId, accumulator.skipped);
        }
        return new ParsedFeed(format, List.copyOf(accumulator.items), favicon, accumulator.skipped, parseErrors);
    }

    private void collectItems(Element container, NamespacePrefixes prefixes, ItemAccumulator accumulator) {
        for (Element child : container.children()) {
            String name = child.normalName();
            if (!"item".equals(name) && !"entry".equals(name)) {
                continue;
            }
            FeedItem item = readItem(child, prefixes);
            if (item != null) {
                accumulator.offer(item);
            }
        }
    }

    FeedItem readItem(Element item, NamespacePrefixes prefixes) {
        String title = null;
        String link = null;
        boolean alternateLink = false;
        String guid = null;
        List<Element> enclosures = new ArrayList<>();
        List<Element> mediaThumbnails = new ArrayList<>();
        List<Element> mediaContents = new ArrayList<>();
        Element description = null;
        Element atomContent = null;
        Element summary = null;
        Element encoded = null;

        String mediaThumbnailName = prefixes.mediaName("thumbnail");
        String mediaContentName = prefixes.mediaName("content");
        String mediaGroupName = prefixes.mediaName("group");
        String encodedName = prefixes.contentName("encoded");

        for (Element child : item.children()) {
            String name = child.normalName();
            if ("title".equals(name)) {
                if (title == null) {
                    title = child.text().trim();
                }
            } else if ("link".equals(name)) {
                String href = child.attr("href").trim();
                String rel = child.attr("rel").trim().toLowerCase(Locale.ROOT);
                if (!href.isEmpty()) {
                    boolean alternate = rel.isEmpty() || "alternate".equals(rel);
                    if (link == null || (alternate && !alternateLink)) {
                        link = href;
                        alternateLink = alternate;
                    }
                } else if (link == null) {
                    String text = child.text().trim();
                    if (!text.isEmpty()) {
                        link = text;
                        alternateLink = true;
                    }
                }
            } else if ("guid".equals(name) || "id".equals(name)) {
                guid = child.text().trim();
            } else if ("enclosure".equals(name)) {
                enclosures.add(child);
            } else if (mediaThumbnailName.equals(name)) {
                mediaThumbnails.add(child);
            } else if (mediaContentName.equals(name)) {
                mediaContents.add(child);
            } else if (mediaGroupName.equals(name)) {
                for (Element grouped : child.children()) {
                    if (mediaThumbnailName.equals(grouped.normalName())) {
                        mediaThumbnails.add(grouped);
                    } else if (mediaContentName.equals(grouped.normalName())) {
                        mediaContents.add(grouped);
                    }
                }
            } else if ("description".equals(name)) {
                description = child;
            } else if ("content".equals(name)) {
                atomContent = child;
            } else if ("summary".equals(name)) {
                summary = child;
            } else if (encodedName.equals(name)) {
                encoded = child;
            }
        }

        if ((link == null || link.isEmpty()) && FeedUrlUtils.isHttpUrl(guid)) {
            link = guid;
        }
        if (link == null || link.isEmpty()) {
            return null;
        }

        Element descriptionRef = description;
        Element atomContentRef = atomContent;
        Element summaryRef = summary;
        Element encodedRef = encoded;
        List<Supplier<String>> structured = List.of(
            () -> enclosureImage(enclosures),
            () -> firstUrlAttribute(mediaThumbnails),
            () -> mediaContentImage(mediaContents)
        );
        List<Supplier<String>> snippets = List.of(
            () -> snippetImage(descriptionRef),
            () -> snippetImage(atomContentRef),
            () -> snippetImage(summaryRef),
            () -> snippetImage(encodedRef)
        );

        String thumbnail = firstPresent(structured);
        boolean fromSnippet = false;
        if (thumbnail == null) {
            thumbnail = firstPresent(snippets);
            fromSnippet = thumbnail != null;
        }
        thumbnail = finishThumbnail(thumbnail, fromSnippet);

        String safeTitle = (title == null || title.isEmpty()) ? NO_TITLE : title;
        return new FeedItem(safeTitle, link, thumbnail);
    }

    private String finishThumbnail(String thumbnail, boolean fromSnippet) {
        if (thumbnail == null) {
            return null;
        }
        if (CdnImageNormalizer.isKnownCdnUrl(thumbnail)) {
            if (!properties.isCdnExtractEnabled()) {
                return thumbnail;
            }
            String normalized = CdnImageNormalizer.normalizeKnownCdn(thumbnail);
            if (properties.isDebug() && !normalized.equals(thumbnail)) {
                log.info("Normalized CDN thumbnail {} -> {}", thumbnail, normalized);
            }
            return normalized;
        }
        return fromSnippet ? ImageUrlParams.stripResizeParams(thumbnail) : thumbnail;
    }

    private static String firstPresent(List<Supplier<String>> sources) {
        for (Supplier<String> source : sources) {
            String value = source.get();
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private static String enclosureImage(List<Element> enclosures) {
        for (Element enclosure : enclosures) {
            String type = enclosure.attr("type").trim().toLowerCase(Locale.ROOT);
            if (type.startsWith("audio") || type.startsWith("video")) {
                continue;
            }
            String url = FeedUrlUtils.cleanImageUrl(enclosure.attr("url"));
            if (url != null) {
                return url;
            }
        }
        return null;
    }

    private static String firstUrlAttribute(List<Element> elements) {
        for (Element element : elements) {
            String url = FeedUrlUtils.cleanImageUrl(element.attr("url"));
            if (url != null) {
                return url;
            }
        }
        return null;
    }

    private static String mediaContentImage(List<Element> mediaContents) {
        for (Element media : mediaContents) {
            String url = FeedUrlUtils.cleanImageUrl(media.attr("url"));
            if (url == null) {
                continue;
            }
            String type = media.attr("type").trim().toLowerCase(Locale.ROOT);
            String medium = media.attr("medium").trim().toLowerCase(Locale.ROOT);
            boolean image = type.startsWith("image")
                || "image".equals(medium)
                || FeedUrlUtils.hasImageExtension(url)
                || url.contains("images.wsj.net/im-");
            if (image) {
                return url;
            }
        }
        return null;
    }

    private static String snippetImage(Element element) {
        if (element == null) {
            return null;
        }
        return ImageResolver.extractFromHtmlSnippet(rawContent(element)).orElse(null);
    }

    /**
     * Escaped and CDATA-wrapped HTML both arrive as text; markup left unescaped was parsed into child
     * elements and has to be serialized back.
     */
    static String rawContent(Element element) {
        if (element.children().isEmpty()) {
            return element.wholeText();
        }
        return element.html();
    }

    private static String readFavicon(Element container) {
        String imageUrl = null;
        String atomIcon = null;
        for (Element child : container.children()) {
            String name = child.normalName();
            if ("link".equals(name)) {
                String rel = child.attr("rel").trim().toLowerCase(Locale.ROOT);
                String href = child.attr("href").trim();
                if (("icon".equals(rel) || "shortcut icon".equals(rel)) && !href.isEmpty()) {
                    return FeedUrlUtils.cleanImageUrl(href);
                }
            } else if ("image".equals(name) && imageUrl == null) {
                for (Element imageChild : child.children()) {
                    if ("url".equals(imageChild.normalName())) {
                        imageUrl = FeedUrlUtils.cleanImageUrl(imageChild.text());
                        break;
                    }
                }
            } else if (("icon".equals(name) || "logo".equals(name)) && atomIcon == null) {
                atomIcon = FeedUrlUtils.cleanImageUrl(child.text());
            }
        }
        return imageUrl != null ? imageUrl : atomIcon;
    }

    private static final class ItemAccumulator {
        private final int cap;
        private final List<FeedItem> items = new ArrayList<>();
        private int skipped;

        private ItemAccumulator(int cap) {
            this.cap = cap;
        }

        private void offer(FeedItem item) {
            if (items.size() >= cap) {
                skipped++;
                return;
            }
            items.add(item);
        }
    }
}
