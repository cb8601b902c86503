package com.envbind.core.bind;

import com.envbind.core.coerce.FieldKind;
import com.envbind.core.coerce.ValueCoercer;
import com.envbind.core.exception.CoercionException;
import com.envbind.core.exception.EnvBindException;
import com.envbind.core.exception.InvalidTargetException;
import com.envbind.core.exception.MissingRequiredException;
import com.envbind.core.exception.UnsupportedFieldTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Binds {@code @Env} fields of a configuration object from an
 * {@link EnvLookup}.
 *
 * <h3>Resolution Order</h3>
 * <p>
 * Each field is resolved on its own:
 * </p>
 * <ol>
 * <li>the variable's value, if non-empty</li>
 * <li>otherwise the tag's default, if there is one</li>
 * <li>otherwise, for {@code NAME,required} tags, a violation is recorded</li>
 * </ol>
 * <p>
 * A field with none of these keeps its current value.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Required violations are collected across all fields and reported together
 * as a {@link MissingRequiredException}. Coercion failures and unsupported
 * field types stop the pass at the offending field; fields before it have
 * already been assigned.
 * </p>
 *
 * <p>
 * Instances are immutable and thread-safe; do not bind the same target from
 * several threads at once.
 * </p>
 *
 * @since 1.0.0
 */
public final class FieldBinder {

    private static final Logger LOG = LoggerFactory.getLogger(FieldBinder.class);

    private final EnvLookup environment;

    /**
     * @param environment where variable values come from; must not be
     *                    {@code null}
     */
    public FieldBinder(EnvLookup environment) {
        this.environment = Objects.requireNonNull(environment, "EnvLookup must not be null");
    }

    /**
     * @return binder reading the process environment
     */
    public static FieldBinder system() {
        return new FieldBinder(EnvLookup.system());
    }

    /**
     * @return binder that only applies tag defaults
     */
    public static FieldBinder defaultsOnly() {
        return new FieldBinder(EnvLookup.none());
    }

    /**
     * Bind every {@code @Env} field of {@code target} in place.
     *
     * @param target the configuration object
     * @param <T>    configuration type
     * @return {@code target}, for chaining
     * @throws InvalidTargetException    if {@code target} cannot hold fields
     * @throws CoercionException         if a value cannot be converted or a
     *                                   field type is unsupported
     * @throws MissingRequiredException  if required fields had no value
     */
    public <T> T bind(T target) throws EnvBindException {
        requireBindable(target);
        Class<?> type = target.getClass();
        List<FieldDeclaration> declarations = FieldDeclaration.of(type);

        List<String> violations = new ArrayList<>();
        int assigned = 0;

        for (FieldDeclaration declaration : declarations) {
            FieldKind kind = declaration.getKind().orElseThrow(() -> new UnsupportedFieldTypeException(
                    declaration.getName(),
                    declaration.getField().getGenericType(),
                    FieldKind.unsupportedReason(declaration.getField().getType())));

            String variable = declaration.getVariableName();
            String value = environment.lookup(variable);
            if (value == null) {
                value = "";
            }

            if (!value.isEmpty()) {
                LOG.debug("Field [{}] resolved from environment variable {}", declaration.getName(), variable);
            } else if (declaration.getTag().isRequired()) {
                violations.add(variable + " is required");
                continue;
            } else if (declaration.getTag().getDefaultValue().isPresent()) {
                value = declaration.getTag().getDefaultValue().get();
                LOG.debug("Field [{}] resolved from default", declaration.getName());
            } else {
                LOG.trace("Field [{}] has no value for {} - leaving unchanged", declaration.getName(), variable);
                continue;
            }

            if (!declaration.isSettable()) {
                LOG.debug("Field [{}] is final - skipping assignment", declaration.getName());
                continue;
            }

            assign(target, declaration, kind, value);
            assigned++;
        }

        if (!violations.isEmpty()) {
            LOG.warn("{} required variable(s) missing for {}: {}",
                    violations.size(), type.getSimpleName(), violations);
            throw new MissingRequiredException(violations);
        }

        LOG.debug("Bound {} of {} field(s) on {}", assigned, declarations.size(), type.getName());
        return target;
    }

    /**
     * Instantiate {@code type} through its no-arg constructor and bind it.
     *
     * @param type configuration class; must not be {@code null}
     * @param <T>  configuration type
     * @return the bound instance
     * @throws InvalidTargetException if {@code type} cannot be instantiated or
     *                                cannot hold fields
     * @throws EnvBindException       for any other binding failure
     */
    public <T> T bindNew(Class<T> type) throws EnvBindException {
        Objects.requireNonNull(type, "Configuration type must not be null");
        return bind(instantiate(type));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void assign(Object target, FieldDeclaration declaration, FieldKind kind, String value)
            throws EnvBindException {
        Object converted;
        try {
            converted = ValueCoercer.coerce(kind, declaration.getField().getType(), value);
        } catch (IllegalArgumentException e) {
            throw new CoercionException(declaration.getName(), value, e);
        }

        try {
            declaration.set(target, converted);
        } catch (IllegalAccessException | InaccessibleObjectException e) {
            throw new InvalidTargetException(
                    "field " + declaration.getName() + " of " + target.getClass().getName()
                            + " is not accessible", e);
        }
    }

    private static void requireBindable(Object target) throws InvalidTargetException {
        if (target == null) {
            throw new InvalidTargetException("configuration target must be a mutable object, got null");
        }
        Class<?> type = target.getClass();
        if (type.isArray() || type.isEnum() || type.isRecord() || isJdkType(type)) {
            throw new InvalidTargetException(
                    "configuration target must be a mutable object with @Env fields, got " + type.getName());
        }
    }

    private static boolean isJdkType(Class<?> type) {
        String name = type.getName();
        return name.startsWith("java.") || name.startsWith("javax.") || name.startsWith("jdk.");
    }

    private static <T> T instantiate(Class<T> type) throws InvalidTargetException {
        if (type.isInterface() || type.isArray() || type.isPrimitive()) {
            throw new InvalidTargetException("cannot instantiate configuration type " + type.getName());
        }
        try {
            Constructor<T> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new InvalidTargetException(
                    "configuration type " + type.getName() + " has no no-arg constructor", e);
        } catch (InstantiationException | IllegalAccessException | InaccessibleObjectException e) {
            throw new InvalidTargetException("cannot instantiate configuration type " + type.getName(), e);
        } catch (InvocationTargetException e) {
            throw new InvalidTargetException(
                    "constructor of " + type.getName() + " failed: " + e.getCause(), e.getCause());
        }
    }
}
