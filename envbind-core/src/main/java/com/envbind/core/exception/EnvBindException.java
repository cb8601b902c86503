package com.envbind.core.exception;

/**
 * Base class for every failure raised while binding configuration.
 *
 * <p>
 * Binding failures are checked: callers decide whether a broken
 * configuration is recoverable. Code that wants to fail fast can use the
 * loader's {@code mustLoad} convention instead.
 * </p>
 *
 * @since 1.0.0
 */
public class EnvBindException extends Exception {

    private static final long serialVersionUID = 1L;

    public EnvBindException(String message) {
        super(message);
    }

    public EnvBindException(String message, Throwable cause) {
        super(message, cause);
    }
}
