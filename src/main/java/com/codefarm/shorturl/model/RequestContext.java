package com.codefarm.shorturl.model;

/**
 * Raw requester data captured by the web layer for a redirect. Any field may be null.
 */
public record RequestContext(String userAgent, String referer, String remoteAddress) {
}
