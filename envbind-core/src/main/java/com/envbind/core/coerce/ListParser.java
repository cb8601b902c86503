package com.envbind.core.coerce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Comma-separated string lists.
 *
 * @since 1.0.0
 */
public final class ListParser {

    private static final String SEPARATOR = ",";

    private ListParser() {
        // utility class, not instantiable
    }

    /**
     * Split on commas, trim every piece and drop the ones left empty.
     *
     * @param value the text to split; must not be {@code null}
     * @return unmodifiable list, empty for an empty or blank input
     */
    public static List<String> parse(String value) {
        Objects.requireNonNull(value, "List value must not be null");
        if (value.isEmpty()) {
            return List.of();
        }

        String[] parts = value.split(SEPARATOR, -1);
        List<String> result = new ArrayList<>(parts.length);
        for (String part : parts) {
            String cleaned = part.trim();
            if (!cleaned.isEmpty()) {
                result.add(cleaned);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Inverse of {@link #parse(String)} for lists whose elements are trimmed,
     * non-empty and comma-free.
     *
     * @param values the elements; must not be {@code null}
     * @return comma-joined text
     */
    public static String join(List<String> values) {
        Objects.requireNonNull(values, "List must not be null");
        return String.join(SEPARATOR, values);
    }
}
