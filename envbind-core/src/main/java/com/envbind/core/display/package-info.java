/**
 * Masked rendering of bound configuration objects.
 *
 * @since 1.0.0
 */
package com.envbind.core.display;
