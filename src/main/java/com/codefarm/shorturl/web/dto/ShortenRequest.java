package com.codefarm.shorturl.web.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * {@code validity} is bound as a plain {@link Number} so that fractional values reach the
 * service and are rejected there instead of being truncated by the JSON mapper.
 */
public record ShortenRequest(String url,
                             @JsonDeserialize(using = ValidityDeserializer.class) Number validity,
                             String shortcode) {
}
