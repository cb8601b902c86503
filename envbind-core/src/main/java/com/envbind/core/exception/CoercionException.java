package com.envbind.core.exception;

/**
 * Thrown when a resolved value cannot be converted to its field's type.
 * Coercion failures stop the binding pass immediately.
 *
 * @since 1.0.0
 */
public class CoercionException extends EnvBindException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;
    private final String rawValue;

    public CoercionException(String fieldName, String rawValue, Throwable cause) {
        super("error setting field " + fieldName + ": " + cause.getMessage(), cause);
        this.fieldName = fieldName;
        this.rawValue = rawValue;
    }

    protected CoercionException(String fieldName, String rawValue, String reason) {
        super("error setting field " + fieldName + ": " + reason);
        this.fieldName = fieldName;
        this.rawValue = rawValue;
    }

    /**
     * @return Java name of the field that failed
     */
    public String getFieldName() {
        return fieldName;
    }

    /**
     * @return the raw string that could not be converted, or {@code null} when
     *         the failure did not depend on a value
     */
    public String getRawValue() {
        return rawValue;
    }
}
