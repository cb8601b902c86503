package com.envbind.core.display;

import com.envbind.core.bind.FieldDeclaration;
import com.envbind.core.coerce.DurationParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a bound configuration object for logs and diagnostics, with
 * sensitive values replaced by {@value #MASK}.
 *
 * <p>
 * Text output of {@link #render(Object)}:
 * </p>
 *
 * <pre>
 * Environment Configuration:
 * ==========================
 * SERVER_PORT         : 8080
 * DB_PASSWORD         : ***MASKED***
 * ALLOWED_HOSTS       : [localhost, 127.0.0.1]
 * </pre>
 *
 * <p>
 * One line per {@code @Env} field in declaration order, keyed by variable
 * name. A value is masked when either the Java field name or the variable
 * name is {@linkplain SensitiveFieldMatcher#isSensitive(String) sensitive}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MaskingPresenter {

    public static final String MASK = "***MASKED***";

    static final String HEADER = "Environment Configuration:";
    static final String DIVIDER = "==========================";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MaskingPresenter() {
        // utility class, not instantiable
    }

    /**
     * Render {@code config} as a text report.
     *
     * @param config the configuration object; must not be {@code null}
     * @return header, divider and one {@code %-20s: value} line per field,
     *         each terminated by a newline
     */
    public static String render(Object config) {
        Objects.requireNonNull(config, "Configuration must not be null");
        StringBuilder sb = new StringBuilder();
        sb.append(HEADER).append('\n');
        sb.append(DIVIDER).append('\n');
        for (FieldDeclaration declaration : FieldDeclaration.of(config.getClass())) {
            sb.append(String.format("%-20s: %s", declaration.getVariableName(), display(config, declaration)))
                    .append('\n');
        }
        return sb.toString();
    }

    /**
     * Masked view of {@code config}, keyed by variable name in declaration
     * order. Lists stay lists, durations become text, sensitive values become
     * {@value #MASK}. When several fields share a variable name the last one
     * declared wins; {@link #render(Object)} keeps all of them.
     *
     * @param config the configuration object; must not be {@code null}
     * @return ordered map of display values
     */
    public static Map<String, Object> toMap(Object config) {
        Objects.requireNonNull(config, "Configuration must not be null");
        Map<String, Object> view = new LinkedHashMap<>();
        for (FieldDeclaration declaration : FieldDeclaration.of(config.getClass())) {
            view.put(declaration.getVariableName(), display(config, declaration));
        }
        return view;
    }

    /**
     * Masked view of {@code config} as a single-line JSON object, suitable for
     * structured log lines.
     *
     * @param config the configuration object; must not be {@code null}
     * @return JSON text
     * @throws IllegalStateException if serialization fails
     */
    public static String toJson(Object config) {
        try {
            return MAPPER.writeValueAsString(toMap(config));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render configuration as JSON", e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Object display(Object config, FieldDeclaration declaration) {
        return isMasked(declaration) ? MASK : displayValue(declaration.get(config));
    }

    private static boolean isMasked(FieldDeclaration declaration) {
        return SensitiveFieldMatcher.isSensitive(declaration.getName())
                || SensitiveFieldMatcher.isSensitive(declaration.getVariableName());
    }

    private static Object displayValue(Object value) {
        if (value instanceof Duration duration) {
            return DurationParser.format(duration);
        }
        if (value == null) {
            return "";
        }
        return value;
    }
}
