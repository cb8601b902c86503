/**
 * The binding engine.
 *
 * <p>
 * {@link com.envbind.core.bind.FieldDeclaration} extracts the tagged fields
 * of a class, {@link com.envbind.core.bind.FieldBinder} resolves each one
 * against an {@link com.envbind.core.bind.EnvLookup} and its tag default and
 * assigns the coerced value.
 * </p>
 *
 * @since 1.0.0
 */
package com.envbind.core.bind;
