package com.envbind.core.coerce;

import java.util.Locale;
import java.util.Objects;

/**
 * Lenient boolean parsing.
 *
 * <p>
 * Case-insensitive. {@code true, 1, yes, on, t} are true;
 * {@code false, 0, no, off, f} and the empty string are false.
 * </p>
 *
 * @since 1.0.0
 */
public final class BoolParser {

    private BoolParser() {
        // utility class, not instantiable
    }

    /**
     * @param value the text to parse; must not be {@code null}
     * @return the parsed value
     * @throws IllegalArgumentException if {@code value} is in neither set
     */
    public static boolean parse(String value) {
        Objects.requireNonNull(value, "Boolean value must not be null");
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on", "t" -> true;
            case "false", "0", "no", "off", "f", "" -> false;
            default -> throw new IllegalArgumentException("invalid boolean value: " + value);
        };
    }
}
