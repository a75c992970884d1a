package com.codefarm.shorturl.exception;

public class ShortcodeExpiredException extends ShortUrlException {

    private final String shortcode;

    public ShortcodeExpiredException(String shortcode) {
        super("Short URL expired", "This short URL has expired and is no longer valid");
        this.shortcode = shortcode;
    }

    public String getShortcode() {
        return shortcode;
    }
}
