/**
 * Checked exception hierarchy for binding failures.
 *
 * <ul>
 * <li>{@link com.envbind.core.exception.InvalidTargetException} - structural,
 * nothing was bound</li>
 * <li>{@link com.envbind.core.exception.MissingRequiredException} - aggregated
 * required violations</li>
 * <li>{@link com.envbind.core.exception.CoercionException} - a value could not
 * be converted; binding stopped at that field</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.envbind.core.exception;
