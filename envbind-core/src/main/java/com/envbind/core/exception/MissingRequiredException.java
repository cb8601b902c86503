package com.envbind.core.exception;

import java.util.List;

/**
 * Thrown after a binding pass when one or more {@code required} fields had no
 * value. Carries every violation found, not just the first.
 *
 * @since 1.0.0
 */
public class MissingRequiredException extends EnvBindException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    /**
     * @param violations ordered {@code "<NAME> is required"} messages; must not
     *                   be empty
     */
    public MissingRequiredException(List<String> violations) {
        super("validation errors: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * @return unmodifiable list of violations in field order
     */
    public List<String> getViolations() {
        return violations;
    }
}
