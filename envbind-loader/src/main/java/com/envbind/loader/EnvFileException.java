package com.envbind.loader;

import com.envbind.core.exception.EnvBindException;

/**
 * Thrown when an explicitly requested {@code .env} file cannot be found,
 * read or parsed.
 *
 * @since 1.0.0
 */
public class EnvFileException extends EnvBindException {

    private static final long serialVersionUID = 1L;

    public EnvFileException(String message) {
        super(message);
    }

    public EnvFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
