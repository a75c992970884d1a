package com.codefarm.shorturl.util;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.regex.Pattern;

@Component
public class ShortcodeGenerator {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final Pattern VALID_FORMAT = Pattern.compile("^[a-zA-Z0-9]{3,20}$");

    public static final int GENERATED_LENGTH = 6;

    private final SecureRandom random = new SecureRandom();

    /**
     * Draws {@value #GENERATED_LENGTH} characters uniformly from the 62-symbol alphabet.
     * Uniqueness is not checked here; callers retry against the store.
     */
    public String generate() {
        StringBuilder builder = new StringBuilder(GENERATED_LENGTH);
        for (int i = 0; i < GENERATED_LENGTH; i++) {
            builder.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return builder.toString();
    }

    public boolean isValidFormat(String code) {
        return code != null && VALID_FORMAT.matcher(code).matches();
    }
}
