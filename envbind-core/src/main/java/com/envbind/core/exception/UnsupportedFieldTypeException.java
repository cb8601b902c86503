package com.envbind.core.exception;

import java.lang.reflect.Type;

/**
 * Thrown when an {@code @Env} field is declared with a type outside the fixed
 * set the coercer understands. Raised whether or not a value was supplied.
 *
 * @since 1.0.0
 */
public class UnsupportedFieldTypeException extends CoercionException {

    private static final long serialVersionUID = 1L;

    public UnsupportedFieldTypeException(String fieldName, Type fieldType, String reason) {
        super(fieldName, null, reason + ": " + fieldType.getTypeName());
    }
}
