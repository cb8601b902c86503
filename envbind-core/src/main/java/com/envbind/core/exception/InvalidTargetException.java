package com.envbind.core.exception;

/**
 * Thrown when the object handed to the binder cannot hold configuration
 * fields (null, an array, an enum, a record or a JDK value type). Raised
 * before any field is read.
 *
 * @since 1.0.0
 */
public class InvalidTargetException extends EnvBindException {

    private static final long serialVersionUID = 1L;

    public InvalidTargetException(String message) {
        super(message);
    }

    public InvalidTargetException(String message, Throwable cause) {
        super(message, cause);
    }
}
