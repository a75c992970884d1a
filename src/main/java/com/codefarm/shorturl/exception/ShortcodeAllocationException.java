package com.codefarm.shorturl.exception;

/**
 * Random allocation ran out of attempts. Rendered as a generic 500, the detail only goes to the
 * server log.
 */
public class ShortcodeAllocationException extends ShortUrlException {

    public ShortcodeAllocationException(int attempts) {
        super("Internal server error", "Failed to generate unique short code after " + attempts + " attempts");
    }
}
