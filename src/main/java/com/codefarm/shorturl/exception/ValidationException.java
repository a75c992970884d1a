package com.codefarm.shorturl.exception;

public class ValidationException extends ShortUrlException {

    public ValidationException(String error, String message) {
        super(error, message);
    }

    public static ValidationException missingUrl() {
        return new ValidationException("URL is required", "Please provide a valid URL to shorten");
    }

    public static ValidationException invalidUrl() {
        return new ValidationException("Invalid URL format",
                "Please provide a valid URL with protocol (http:// or https://)");
    }

    public static ValidationException invalidValidity() {
        return new ValidationException("Invalid validity period",
                "Validity must be a positive integer representing minutes");
    }

    public static ValidationException invalidShortcodeFormat() {
        return new ValidationException("Invalid shortcode format",
                "Shortcode must be alphanumeric and 3-20 characters long");
    }
}
