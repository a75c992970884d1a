package com.codefarm.shorturl.exception;

public class ShortcodeNotFoundException extends ShortUrlException {

    private final String shortcode;

    public ShortcodeNotFoundException(String shortcode) {
        super("Short URL not found", "The requested short URL does not exist");
        this.shortcode = shortcode;
    }

    public String getShortcode() {
        return shortcode;
    }
}
