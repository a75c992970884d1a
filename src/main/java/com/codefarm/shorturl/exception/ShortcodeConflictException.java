package com.codefarm.shorturl.exception;

public class ShortcodeConflictException extends ShortUrlException {

    private final String shortcode;

    public ShortcodeConflictException(String shortcode) {
        super("Shortcode already exists",
                "The provided shortcode is already in use. Please choose a different one.");
        this.shortcode = shortcode;
    }

    public String getShortcode() {
        return shortcode;
    }
}
