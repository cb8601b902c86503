/**
 * Field annotations that declare how configuration fields are bound.
 *
 * @since 1.0.0
 */
package com.envbind.core.annotation;
