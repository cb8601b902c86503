package com.envbind.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the environment variable a configuration field is bound from.
 *
 * <p>
 * The value is a declaration tag in one of three forms:
 * </p>
 * <ul>
 * <li>{@code NAME} - bind from {@code NAME}, no default</li>
 * <li>{@code NAME,default} - bind from {@code NAME}, fall back to
 * {@code default}. Everything after the first comma is the default, so list
 * defaults such as {@code HOSTS,localhost,127.0.0.1} keep all elements.</li>
 * <li>{@code NAME,required} - binding fails when {@code NAME} has no
 * value</li>
 * </ul>
 *
 * <pre>
 * public class ServerConfig {
 *     &#64;Env("SERVER_PORT,8080")
 *     private int port;
 *
 *     &#64;Env("DB_PASSWORD,required")
 *     private String dbPassword;
 * }
 * </pre>
 *
 * @since 1.0.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Env {

    /**
     * The declaration tag.
     *
     * @return variable name, optionally followed by a comma and a default
     *         value or the {@code required} marker
     */
    String value();
}
