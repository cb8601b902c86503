package com.envbind.core.tag;

import java.util.Objects;
import java.util.Optional;

/**
 * A parsed declaration tag: the variable name and the raw text that followed
 * the first comma, if any.
 *
 * <p>
 * Instances are produced by {@link TagParser#parse(String)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnvTag {

    /** Tag tail that marks a field as mandatory. */
    public static final String REQUIRED_MARKER = "required";

    private final String variableName;
    private final String rawDefault;

    EnvTag(String variableName, String rawDefault) {
        this.variableName = Objects.requireNonNull(variableName, "variableName must not be null");
        this.rawDefault = rawDefault;
    }

    public String getVariableName() {
        return variableName;
    }

    /**
     * Return the tag tail exactly as written, including the
     * {@value #REQUIRED_MARKER} marker.
     *
     * @return raw tail, empty when the tag had no comma
     */
    public Optional<String> getRawDefault() {
        return Optional.ofNullable(rawDefault);
    }

    /**
     * @return {@code true} if the tail is exactly {@value #REQUIRED_MARKER}
     */
    public boolean isRequired() {
        return REQUIRED_MARKER.equals(rawDefault);
    }

    /**
     * Return the usable default value. The required marker and an empty tail
     * both count as "no default".
     *
     * @return default value, or empty
     */
    public Optional<String> getDefaultValue() {
        if (rawDefault == null || rawDefault.isEmpty() || isRequired()) {
            return Optional.empty();
        }
        return Optional.of(rawDefault);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EnvTag that))
            return false;
        return variableName.equals(that.variableName) && Objects.equals(rawDefault, that.rawDefault);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variableName, rawDefault);
    }

    @Override
    public String toString() {
        return rawDefault == null ? variableName : variableName + ',' + rawDefault;
    }
}
