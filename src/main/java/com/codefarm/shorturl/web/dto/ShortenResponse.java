package com.codefarm.shorturl.web.dto;

import java.time.Instant;

public record ShortenResponse(String shortLink, Instant expiry) {
}
