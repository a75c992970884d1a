package com.codefarm.shorturl.model;

import java.time.Instant;

/**
 * One successful resolution of a short code. {@code requesterAddress} is kept for debugging
 * and never rendered to API clients.
 */
public record ClickEvent(Instant timestamp,
                         String referer,
                         String userAgent,
                         String requesterAddress,
                         Location location) {
}
