package com.feedreader.ingest.feed.model;

/**
 * Where an image URL was found. Declaration order is strongest first.
 */
public enum CandidatePriority {
    SRCSET_SELECTED,
    HREF_TO_FILE,
    SRC_ATTRIBUTE,
    JSON_LD,
    OG_TAG,
    CDN_PATTERN
}
