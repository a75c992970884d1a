package com.codefarm.shorturl.model;

import java.time.Instant;

/**
 * What a redirect needs from an alias: where it points and when it stops working.
 */
public record AliasTarget(String shortcode, String originalUrl, Instant expiresAt) {
}
