package com.feedreader.ingest.feed.image;

import java.util.Locale;
import java.util.Optional;

public final class SrcsetParser {

    private SrcsetParser() {
    }

    /**
     * Picks the entry with the largest {@code w} descriptor. When no descriptor parses, the first entry is used.
     */
    public static Optional<String> selectLargest(String srcset) {
        if (srcset == null || srcset.isBlank()) {
            return Optional.empty();
        }
        String firstUrl = null;
        String bestUrl = null;
        long bestWidth = -1;
        for (String part : srcset.split(",")) {
            String entry = part.trim();
            if (entry.isEmpty()) {
                continue;
            }
            String[] tokens = entry.split("\\s+", 2);
            String url = tokens[0];
            if (firstUrl == null) {
                firstUrl = url;
            }
            long width = tokens.length > 1 ? parseWidth(tokens[1].trim()) : -1;
            if (width > bestWidth) {
                bestWidth = width;
                bestUrl = url;
            }
        }
        String chosen = bestWidth >= 0 ? bestUrl : firstUrl;
        if (chosen == null || chosen.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(chosen.replace("&amp;", "&"));
    }

    private static long parseWidth(String descriptor) {
        String lower = descriptor.toLowerCase(Locale.ROOT);
        if (!lower.endsWith("w") || lower.length() < 2) {
            return -1;
        }
        try {
            return Long.parseLong(lower.substring(0, lower.length() - 1).trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
