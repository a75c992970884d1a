package com.codefarm.shorturl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Checks that a target URL is absolute, names an allowed scheme explicitly and has a usable host.
 * Syntax only: reachability and DNS are never checked.
 */
public final class UrlValidator {

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https", "ftp");
    private static final int MAX_LENGTH = 2048;

    private UrlValidator() {
    }

    public static boolean isValidAbsoluteUrl(String url) {
        if (url == null || url.isEmpty() || url.length() > MAX_LENGTH) {
            return false;
        }
        for (int i = 0; i < url.length(); i++) {
            if (Character.isWhitespace(url.charAt(i))) {
                return false;
            }
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || !ALLOWED_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
                return false;
            }
            return isUsableHost(uri.getHost());
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isUsableHost(String host) {
        if (host == null || host.isBlank()) {
            return false;
        }
        if (host.startsWith("[")) {
            return true;
        }
        int dot = host.lastIndexOf('.');
        return dot > 0 && dot < host.length() - 1;
    }
}
