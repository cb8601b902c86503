package com.envbind.core.bind;

import com.envbind.core.annotation.Env;
import com.envbind.core.coerce.FieldKind;
import com.envbind.core.tag.EnvTag;
import com.envbind.core.tag.TagParser;

import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One {@link Env}-annotated field of a configuration class.
 *
 * <p>
 * Use {@link #of(Class)} to extract the declarations of a class. Fields of
 * superclasses come first, then each class's fields in declaration order.
 * Static, synthetic and untagged fields are not declarations.
 * </p>
 *
 * @since 1.0.0
 */
public final class FieldDeclaration {

    private final Field field;
    private final EnvTag tag;
    private final FieldKind kind;

    private FieldDeclaration(Field field, EnvTag tag, FieldKind kind) {
        this.field = field;
        this.tag = tag;
        this.kind = kind;
    }

    /**
     * Extract the declarations of {@code type}.
     *
     * @param type configuration class; must not be {@code null}
     * @return unmodifiable list of declarations
     */
    public static List<FieldDeclaration> of(Class<?> type) {
        Objects.requireNonNull(type, "Configuration type must not be null");

        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }

        List<FieldDeclaration> declarations = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                Env env = field.getAnnotation(Env.class);
                if (env == null || field.isSynthetic() || Modifier.isStatic(field.getModifiers())) {
                    continue;
                }
                FieldKind kind = FieldKind.of(field).orElse(null);
                declarations.add(new FieldDeclaration(field, TagParser.parse(env.value()), kind));
            }
        }
        return Collections.unmodifiableList(declarations);
    }

    /**
     * @return Java field name
     */
    public String getName() {
        return field.getName();
    }

    public String getVariableName() {
        return tag.getVariableName();
    }

    public EnvTag getTag() {
        return tag;
    }

    /**
     * @return the kind, or empty if the field's type is unsupported
     */
    public Optional<FieldKind> getKind() {
        return Optional.ofNullable(kind);
    }

    /**
     * Final fields are resolved and validated but never assigned.
     *
     * @return {@code true} if the binder may assign this field
     */
    public boolean isSettable() {
        return !Modifier.isFinal(field.getModifiers());
    }

    public Field getField() {
        return field;
    }

    /**
     * Read the field's current value from {@code target}.
     *
     * @param target instance of the declaring class
     * @return the value, boxed for primitives
     */
    public Object get(Object target) {
        try {
            field.setAccessible(true);
            return field.get(target);
        } catch (IllegalAccessException | InaccessibleObjectException e) {
            throw new IllegalStateException("Cannot read field " + getName(), e);
        }
    }

    void set(Object target, Object value) throws IllegalAccessException {
        field.setAccessible(true);
        field.set(target, value);
    }

    @Override
    public String toString() {
        return "FieldDeclaration{" +
                "name='" + getName() + '\'' +
                ", kind=" + kind +
                ", tag='" + tag + '\'' +
                '}';
    }
}
