package com.envbind.core.display;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a field name looks like it holds a secret.
 *
 * <p>
 * A name is sensitive when, ignoring case, it contains any of
 * {@link #KEYWORDS}. Matching is by substring, so {@code apiKey},
 * {@code DB_PASSWORD} and {@code accessLog} all match.
 * </p>
 *
 * @since 1.0.0
 */
public final class SensitiveFieldMatcher {

    public static final List<String> KEYWORDS = List.of(
            "password", "secret", "key", "token", "credential",
            "auth", "pass", "pwd", "access", "private");

    private SensitiveFieldMatcher() {
        // utility class, not instantiable
    }

    /**
     * @param name field or variable name; {@code null} is never sensitive
     * @return {@code true} if the name contains a sensitive keyword
     */
    public static boolean isSensitive(String name) {
        if (name == null) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (String keyword : KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
