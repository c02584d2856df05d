package com.talent.sourcing.rules;

import java.util.Locale;
import java.util.Optional;

/**
 * Reduces a website to its bare domain: scheme, {@code www.}, credentials, port,
 * path, query, fragment and trailing dot are removed and the result lowercased.
 */
public final class WebsiteNormalizer {

    private WebsiteNormalizer() {
        // Utility class
    }

    /**
     * @return the bare domain, or empty when the input is blank or has no host part
     */
    public static Optional<String> normalize(String website) {
        if (website == null || website.isBlank()) {
            return Optional.empty();
        }
        String value = website.trim().toLowerCase(Locale.ROOT);

        int scheme = value.indexOf("://");
        if (scheme >= 0) {
            value = value.substring(scheme + 3);
        }
        value = cutAt(value, '/');
        value = cutAt(value, '?');
        value = cutAt(value, '#');

        int at = value.lastIndexOf('@');
        if (at >= 0) {
            value = value.substring(at + 1);
        }
        value = cutAt(value, ':');

        if (value.startsWith("www.")) {
            value = value.substring(4);
        }
        while (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1);
        }
        return value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    private static String cutAt(String value, char delimiter) {
        int index = value.indexOf(delimiter);
        return index >= 0 ? value.substring(0, index) : value;
    }
}
