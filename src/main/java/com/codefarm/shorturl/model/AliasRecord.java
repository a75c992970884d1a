package com.codefarm.shorturl.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view of a short code and its click history. The store hands out fresh snapshots,
 * so a record never changes after a caller receives it.
 */
public final class AliasRecord {

    private final String id;
    private final String originalUrl;
    private final String shortcode;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final List<ClickEvent> clicks;

    public AliasRecord(String id, String originalUrl, String shortcode, Instant createdAt, Instant expiresAt) {
        this(id, originalUrl, shortcode, createdAt, expiresAt, List.of());
    }

    public AliasRecord(String id, String originalUrl, String shortcode, Instant createdAt, Instant expiresAt,
                       List<ClickEvent> clicks) {
        this.id = Objects.requireNonNull(id, "id");
        this.originalUrl = Objects.requireNonNull(originalUrl, "originalUrl");
        this.shortcode = Objects.requireNonNull(shortcode, "shortcode");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("expiresAt must be after createdAt");
        }
        this.clicks = List.copyOf(clicks);
    }

    public String getId() {
        return id;
    }

    public String getOriginalUrl() {
        return originalUrl;
    }

    public String getShortcode() {
        return shortcode;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public int getClickCount() {
        return clicks.size();
    }

    public List<ClickEvent> getClicks() {
        return clicks;
    }
}
