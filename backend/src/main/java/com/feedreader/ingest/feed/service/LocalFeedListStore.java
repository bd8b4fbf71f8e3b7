package com.feedreader.ingest.feed.service;

import com.feedreader.ingest.config.IngestProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text list of locally registered feed URLs, one per line.
 */
@Component
public class LocalFeedListStore {
    private static final Logger log = LoggerFactory.getLogger(LocalFeedListStore.class);

    private final Path path;
    private final Object lock = new Object();

    public LocalFeedListStore(IngestProperties properties) {
        this.path = Path.of(properties.getLocalFeeds().getPath());
    }

    public Path path() {
        return path;
    }

    public List<String> readUrls() {
        synchronized (lock) {
            if (!Files.isRegularFile(path)) {
                return List.of();
            }
            try {
                List<String> urls = new ArrayList<>();
                for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                    String trimmed = line.trim();
                    if (!trimmed.isEmpty()) {
                        urls.add(trimmed);
                    }
                }
                return urls;
            } catch (IOException e) {
                log.warn("Could not read local feed list {}: {}", path, e.getMessage());
                return List.of();
            }
        }
    }

    /**
     * Removes every line equal to the URL. Best effort: returns false when nothing changed or the
     * rewrite failed.
     */
    public boolean prune(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        String target = url.trim();
        synchronized (lock) {
            if (!Files.isRegularFile(path)) {
                return false;
            }
            try {
                List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
                List<String> kept = new ArrayList<>(lines.size());
                for (String line : lines) {
                    if (!line.trim().equals(target)) {
                        kept.add(line);
                    }
                }
                if (kept.size() == lines.size()) {
                    return false;
                }
                Path parent = path.toAbsolutePath().getParent();
                Path temp = Files.createTempFile(parent, "local_feeds", ".tmp");
                Files.write(temp, kept, StandardCharsets.UTF_8);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                log.info("Pruned unreachable local feed {}", target);
                return true;
            } catch (IOException e) {
                log.warn("Could not prune {} from {}: {}", target, path, e.getMessage());
                return false;
            }
        }
    }
}
