/**
 * {@code .env} file loading and the entry points applications call.
 *
 * <p>
 * {@link com.envbind.loader.EnvLoader} reads files through
 * {@link com.envbind.loader.EnvFileReader} into an overlay map, layers the
 * process environment on top and hands the result to the core
 * {@link com.envbind.core.bind.FieldBinder}.
 * </p>
 *
 * @since 1.0.0
 */
package com.envbind.loader;
