package com.feedreader.ingest.feed.persistence;

import com.feedreader.ingest.feed.model.FeedSource;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class FeedSourceRepository {
    private static final RowMapper<FeedSource> FEED_SOURCE_MAPPER = (rs, rowNum) -> new FeedSource(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("url"),
        rs.getString("favicon_url"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("last_fetched_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public FeedSourceRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<FeedSource> findAll() {
        return jdbc.query(
            """
                SELECT id, name, url, favicon_url, created_at, last_fetched_at
                FROM feed_sources
                ORDER BY name, id
                """,
            new MapSqlParameterSource(),
            FEED_SOURCE_MAPPER
        );
    }

    public Optional<FeedSource> findByUrl(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        List<FeedSource> rows = jdbc.query(
            """
                SELECT id, name, url, favicon_url, created_at, last_fetched_at
                FROM feed_sources
                WHERE url = :url
                """,
            new MapSqlParameterSource("url", url.trim()),
            FEED_SOURCE_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<FeedSource> findByName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        List<FeedSource> rows = jdbc.query(
            """
                SELECT id, name, url, favicon_url, created_at, last_fetched_at
                FROM feed_sources
                WHERE name = :name
                ORDER BY id
                """,
            new MapSqlParameterSource("name", name.trim()),
            FEED_SOURCE_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Inserts a source, returning the existing row when the URL is already registered.
     */
    public FeedSource insert(String name, String url) {
        Optional<FeedSource> existing = findByUrl(url);
        if (existing.isPresent()) {
            return existing.get();
        }
        Instant now = Instant.now();
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbc.update(
                """
                    INSERT INTO feed_sources (name, url, created_at)
                    VALUES (:name, :url, :createdAt)
                    """,
                new MapSqlParameterSource()
                    .addValue("name", name.trim())
                    .addValue("url", url.trim())
                    .addValue("createdAt", toTimestamp(now)),
                keyHolder,
                new String[] {"id"}
            );
        } catch (DuplicateKeyException e) {
            return findByUrl(url).orElseThrow(() -> e);
        }
        Number key = keyHolder.getKey();
        long id = key == null ? 0L : key.longValue();
        return new FeedSource(id, name.trim(), url.trim(), null, now, null);
    }

    public int updateFaviconUrl(String url, String faviconUrl) {
        return jdbc.update(
            """
                UPDATE feed_sources
                SET favicon_url = :faviconUrl
                WHERE url = :url
                """,
            new MapSqlParameterSource()
                .addValue("url", url)
                .addValue("faviconUrl", faviconUrl)
        );
    }

    public int updateLastFetched(String url, Instant fetchedAt) {
        return jdbc.update(
            """
                UPDATE feed_sources
                SET last_fetched_at = :fetchedAt
                WHERE url = :url
                """,
            new MapSqlParameterSource()
                .addValue("url", url)
                .addValue("fetchedAt", toTimestamp(fetchedAt))
        );
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
