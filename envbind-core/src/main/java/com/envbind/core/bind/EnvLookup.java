package com.envbind.core.bind;

import java.util.Map;
import java.util.Objects;

/**
 * Source of environment values.
 *
 * <p>
 * A lookup returns {@code null} for an unset variable. The binder treats
 * {@code null} and the empty string alike, and so does {@link #orElse}: an
 * empty value in the first layer falls through to the next.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface EnvLookup {

    /**
     * @param name variable name
     * @return the value, or {@code null} if unset
     */
    String lookup(String name);

    /**
     * Layer another lookup underneath this one.
     *
     * @param fallback consulted when this lookup has no non-empty value
     * @return combined lookup
     */
    default EnvLookup orElse(EnvLookup fallback) {
        Objects.requireNonNull(fallback, "Fallback lookup must not be null");
        return name -> {
            String value = lookup(name);
            return value != null && !value.isEmpty() ? value : fallback.lookup(name);
        };
    }

    /**
     * @return lookup backed by {@link System#getenv(String)}
     */
    static EnvLookup system() {
        return System::getenv;
    }

    /**
     * @return lookup that never finds a value
     */
    static EnvLookup none() {
        return name -> null;
    }

    /**
     * @param values variables to expose; copied
     * @return lookup backed by a snapshot of {@code values}
     */
    static EnvLookup of(Map<String, String> values) {
        Map<String, String> snapshot = Map.copyOf(values);
        return snapshot::get;
    }
}
