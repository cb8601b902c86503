package com.envbind.core.coerce;

import java.lang.reflect.Field;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * The closed set of field types the coercer can populate.
 *
 * @since 1.0.0
 */
public enum FieldKind {

    /** {@link String}, assigned verbatim. */
    STRING,

    /** {@code byte}, {@code short}, {@code int}, {@code long} and their boxes. */
    INTEGER,

    /** {@code boolean} and {@link Boolean}. */
    BOOLEAN,

    /** {@code float}, {@code double} and their boxes. */
    FLOAT,

    /** {@code List<String>}. */
    STRING_LIST,

    /** {@link Duration}. */
    DURATION;

    /**
     * Classify a field by its declared type.
     *
     * @param field the field; must not be {@code null}
     * @return the kind, or empty if the type is not supported
     */
    public static Optional<FieldKind> of(Field field) {
        return of(field.getType(), field.getGenericType());
    }

    /**
     * Classify a declared type.
     *
     * @param type        the raw type
     * @param genericType the generic type, used to check list element types
     * @return the kind, or empty if the type is not supported
     */
    public static Optional<FieldKind> of(Class<?> type, Type genericType) {
        if (type == Duration.class) {
            return Optional.of(DURATION);
        }
        if (type == String.class) {
            return Optional.of(STRING);
        }
        if (type == int.class || type == Integer.class
                || type == long.class || type == Long.class
                || type == short.class || type == Short.class
                || type == byte.class || type == Byte.class) {
            return Optional.of(INTEGER);
        }
        if (type == boolean.class || type == Boolean.class) {
            return Optional.of(BOOLEAN);
        }
        if (type == double.class || type == Double.class
                || type == float.class || type == Float.class) {
            return Optional.of(FLOAT);
        }
        if (type == List.class && isStringElement(genericType)) {
            return Optional.of(STRING_LIST);
        }
        return Optional.empty();
    }

    /**
     * Explain why a type was rejected by {@link #of(Class, Type)}.
     *
     * @param type the rejected raw type
     * @return short reason used in error messages
     */
    public static String unsupportedReason(Class<?> type) {
        return type == List.class ? "unsupported list element type" : "unsupported field type";
    }

    private static boolean isStringElement(Type genericType) {
        if (!(genericType instanceof ParameterizedType parameterized)) {
            return false;
        }
        Type[] args = parameterized.getActualTypeArguments();
        return args.length == 1 && args[0] == String.class;
    }
}
