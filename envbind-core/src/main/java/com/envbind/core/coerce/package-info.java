/**
 * String-to-value conversion for the supported field types.
 *
 * <p>
 * {@link com.envbind.core.coerce.ValueCoercer} dispatches on
 * {@link com.envbind.core.coerce.FieldKind}; booleans, lists and durations
 * have their own lexical rules in
 * {@link com.envbind.core.coerce.BoolParser},
 * {@link com.envbind.core.coerce.ListParser} and
 * {@link com.envbind.core.coerce.DurationParser}.
 * </p>
 *
 * @since 1.0.0
 */
package com.envbind.core.coerce;
