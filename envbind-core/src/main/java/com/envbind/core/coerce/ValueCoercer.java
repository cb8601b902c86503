package com.envbind.core.coerce;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Converts resolved strings to field values.
 *
 * <p>
 * The type set is closed: see {@link FieldKind}. Integers are range checked
 * against the target width, so {@code 300} fails for a {@code byte} field.
 * Floats accept {@code inf}, {@code infinity} (optionally signed) and
 * {@code nan} in any letter case.
 * </p>
 *
 * @since 1.0.0
 */
public final class ValueCoercer {

    /** Java accepts {@code 1.5f} and {@code 2d}; plain decimal text does not. */
    private static final Pattern FLOAT_TYPE_SUFFIX = Pattern.compile(".*[0-9.][dDfF]$");

    private ValueCoercer() {
        // utility class, not instantiable
    }

    /**
     * Convert {@code raw} for a field of the given kind and type.
     *
     * @param kind the field kind; must not be {@code null}
     * @param type the field's declared class, used for numeric width
     * @param raw  the resolved value; must not be {@code null}
     * @return the converted value, boxed for primitive types
     * @throws IllegalArgumentException if {@code raw} is not valid for the
     *                                  type
     */
    public static Object coerce(FieldKind kind, Class<?> type, String raw) {
        Objects.requireNonNull(kind, "FieldKind must not be null");
        Objects.requireNonNull(raw, "Raw value must not be null");

        return switch (kind) {
            case DURATION -> DurationParser.parse(raw);
            case STRING -> raw;
            case INTEGER -> parseInteger(type, raw);
            case BOOLEAN -> BoolParser.parse(raw);
            case FLOAT -> parseFloat(type, raw);
            case STRING_LIST -> ListParser.parse(raw);
        };
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Object parseInteger(Class<?> type, String raw) {
        try {
            if (type == byte.class || type == Byte.class) {
                return Byte.parseByte(raw);
            }
            if (type == short.class || type == Short.class) {
                return Short.parseShort(raw);
            }
            if (type == int.class || type == Integer.class) {
                return Integer.parseInt(raw);
            }
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "invalid integer value '" + raw + "' for " + type.getSimpleName(), e);
        }
    }

    private static Object parseFloat(Class<?> type, String raw) {
        if (!raw.equals(raw.strip()) || FLOAT_TYPE_SUFFIX.matcher(raw).matches()) {
            throw new IllegalArgumentException("invalid float value '" + raw + "'");
        }
        String text = special(raw);
        try {
            if (type == float.class || type == Float.class) {
                return Float.parseFloat(text);
            }
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid float value '" + raw + "'", e);
        }
    }

    /**
     * Lower-case and signed spellings of infinity and NaN, mapped onto the
     * forms the JDK parsers accept. A signed NaN is rejected.
     */
    private static String special(String raw) {
        boolean signed = raw.startsWith("+") || raw.startsWith("-");
        String unsigned = (signed ? raw.substring(1) : raw).toLowerCase(Locale.ROOT);
        return switch (unsigned) {
            case "inf", "infinity" -> raw.startsWith("-") ? "-Infinity" : "Infinity";
            case "nan" -> {
                if (signed) {
                    throw new IllegalArgumentException("invalid float value '" + raw + "'");
                }
                yield "NaN";
            }
            default -> raw;
        };
    }
}
