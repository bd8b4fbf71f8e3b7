package com.feedreader.ingest.feed.http;

public record RequestOptions(
    String accept,
    String acceptLanguage
) {
    private static final String FEED_ACCEPT =
        "application/rss+xml, application/atom+xml, application/xml;q=0.9, text/xml;q=0.8, */*;q=0.5";
    private static final String BROWSER_ACCEPT =
        "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8";
    private static final String BROWSER_ACCEPT_LANGUAGE = "en-US,en;q=0.5";

    public static RequestOptions feed() {
        return new RequestOptions(FEED_ACCEPT, BROWSER_ACCEPT_LANGUAGE);
    }

    /**
     * Minimal browser-like headers; article pages often refuse bare clients.
     */
    public static RequestOptions browser() {
        return new RequestOptions(BROWSER_ACCEPT, BROWSER_ACCEPT_LANGUAGE);
    }
}
