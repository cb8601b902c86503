package com.envbind.core.tag;

import java.util.List;
import java.util.Objects;

/**
 * Splits declaration tags into a variable name and an optional tail.
 *
 * <p>
 * Only the first comma separates; the tail is kept verbatim so that list
 * defaults survive:
 * </p>
 *
 * <pre>
 * "PORT,8080"                  → ["PORT", "8080"]
 * "PASSWORD,required"          → ["PASSWORD", "required"]
 * "HOSTS,localhost,127.0.0.1"  → ["HOSTS", "localhost,127.0.0.1"]
 * "DEBUG"                      → ["DEBUG"]
 * ""                           → [""]
 * </pre>
 *
 * @since 1.0.0
 */
public final class TagParser {

    private TagParser() {
        // utility class, not instantiable
    }

    /**
     * Parse a declaration tag.
     *
     * @param tag the tag text; must not be {@code null}
     * @return the parsed tag
     * @throws NullPointerException if {@code tag} is {@code null}
     */
    public static EnvTag parse(String tag) {
        List<String> parts = split(tag);
        return new EnvTag(parts.get(0), parts.size() > 1 ? parts.get(1) : null);
    }

    /**
     * Split a tag at its first comma.
     *
     * @param tag the tag text; must not be {@code null}
     * @return one element if there is no comma, otherwise two
     * @throws NullPointerException if {@code tag} is {@code null}
     */
    public static List<String> split(String tag) {
        Objects.requireNonNull(tag, "Tag must not be null");
        int comma = tag.indexOf(',');
        if (comma < 0) {
            return List.of(tag);
        }
        return List.of(tag.substring(0, comma), tag.substring(comma + 1));
    }
}
