package com.codefarm.shorturl.exception;

/**
 * Base for failures that are reported to API clients. {@link #getError()} is the short title
 * rendered in the {@code error} field of the response body.
 */
public abstract class ShortUrlException extends RuntimeException {

    private final String error;

    protected ShortUrlException(String error, String message) {
        super(message);
        this.error = error;
    }

    public String getError() {
        return error;
    }
}
