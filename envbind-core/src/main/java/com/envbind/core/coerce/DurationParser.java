package com.envbind.core.coerce;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Unit-suffixed duration syntax, e.g. {@code 30s}, {@code 5m},
 * {@code 1h30m}, {@code 1.5h}, {@code 250ms}, {@code -2m}.
 *
 * <p>
 * A duration is an optional sign followed by one or more decimal numbers,
 * each with a unit: {@code ns}, {@code us} (or {@code µs}), {@code ms},
 * {@code s}, {@code m}, {@code h}. The bare string {@code 0} is accepted
 * without a unit. Fractions below one nanosecond are truncated.
 * </p>
 *
 * @since 1.0.0
 */
public final class DurationParser {

    private static final long NANOS_PER_MICRO = 1_000L;
    private static final long NANOS_PER_MILLI = 1_000_000L;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final long NANOS_PER_MINUTE = 60 * NANOS_PER_SECOND;
    private static final long NANOS_PER_HOUR = 60 * NANOS_PER_MINUTE;

    private static final Map<String, Long> UNITS = Map.of(
            "ns", 1L,
            "us", NANOS_PER_MICRO,
            "µs", NANOS_PER_MICRO,
            "μs", NANOS_PER_MICRO,
            "ms", NANOS_PER_MILLI,
            "s", NANOS_PER_SECOND,
            "m", NANOS_PER_MINUTE,
            "h", NANOS_PER_HOUR);

    private static final BigDecimal MAX_NANOS = BigDecimal.valueOf(Long.MAX_VALUE);

    private DurationParser() {
        // utility class, not instantiable
    }

    /**
     * Parse a duration.
     *
     * @param value the text to parse; must not be {@code null}
     * @return the parsed duration
     * @throws IllegalArgumentException if the syntax is invalid or the value
     *                                  does not fit in a signed 64-bit
     *                                  nanosecond count
     */
    public static Duration parse(String value) {
        Objects.requireNonNull(value, "Duration value must not be null");

        String s = value;
        boolean negative = false;
        if (!s.isEmpty() && (s.charAt(0) == '-' || s.charAt(0) == '+')) {
            negative = s.charAt(0) == '-';
            s = s.substring(1);
        }
        if (s.equals("0")) {
            return Duration.ZERO;
        }
        if (s.isEmpty()) {
            throw invalid(value, "empty duration");
        }

        BigDecimal total = BigDecimal.ZERO;
        int pos = 0;
        while (pos < s.length()) {
            int numberStart = pos;
            int digits = 0;
            while (pos < s.length() && isDigit(s.charAt(pos))) {
                pos++;
                digits++;
            }
            if (pos < s.length() && s.charAt(pos) == '.') {
                pos++;
                while (pos < s.length() && isDigit(s.charAt(pos))) {
                    pos++;
                    digits++;
                }
            }
            if (digits == 0) {
                throw invalid(value, "expected a number");
            }
            String number = s.substring(numberStart, pos);

            int unitStart = pos;
            while (pos < s.length() && s.charAt(pos) != '.' && !isDigit(s.charAt(pos))) {
                pos++;
            }
            String unit = s.substring(unitStart, pos);
            if (unit.isEmpty()) {
                throw invalid(value, "missing unit");
            }
            Long factor = UNITS.get(unit);
            if (factor == null) {
                throw invalid(value, "unknown unit '" + unit + "'");
            }

            total = total.add(new BigDecimal(number).multiply(BigDecimal.valueOf(factor)));
            if (total.compareTo(MAX_NANOS) > 0) {
                throw invalid(value, "out of range");
            }
        }

        long nanos = total.setScale(0, RoundingMode.DOWN).longValueExact();
        return Duration.ofNanos(negative ? -nanos : nanos);
    }

    /**
     * Render a duration in the syntax {@link #parse(String)} accepts, using
     * the largest units first: {@code 1h30m0s}, {@code 5m0s}, {@code 30s},
     * {@code 1.5s}, {@code 300ms}, {@code 0s}.
     *
     * @param duration the duration; must not be {@code null}
     * @return formatted text
     */
    public static String format(Duration duration) {
        Objects.requireNonNull(duration, "Duration must not be null");
        long nanos = duration.toNanos();
        if (nanos == 0) {
            return "0s";
        }

        StringBuilder sb = new StringBuilder();
        if (nanos < 0) {
            sb.append('-');
            nanos = -nanos;
        }

        if (nanos < NANOS_PER_SECOND) {
            if (nanos < NANOS_PER_MICRO) {
                sb.append(nanos).append("ns");
            } else if (nanos < NANOS_PER_MILLI) {
                appendFraction(sb, nanos, NANOS_PER_MICRO, 3).append("µs");
            } else {
                appendFraction(sb, nanos, NANOS_PER_MILLI, 6).append("ms");
            }
            return sb.toString();
        }

        long hours = nanos / NANOS_PER_HOUR;
        long minutes = (nanos % NANOS_PER_HOUR) / NANOS_PER_MINUTE;
        long secondNanos = nanos % NANOS_PER_MINUTE;
        if (hours > 0) {
            sb.append(hours).append('h').append(minutes).append('m');
        } else if (minutes > 0) {
            sb.append(minutes).append('m');
        }
        return appendFraction(sb, secondNanos, NANOS_PER_SECOND, 9).append('s').toString();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static StringBuilder appendFraction(StringBuilder sb, long value, long unit, int width) {
        sb.append(value / unit);
        long fraction = value % unit;
        if (fraction != 0) {
            String digits = String.format("%0" + width + "d", fraction);
            int end = digits.length();
            while (digits.charAt(end - 1) == '0') {
                end--;
            }
            sb.append('.').append(digits, 0, end);
        }
        return sb;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static IllegalArgumentException invalid(String value, String reason) {
        return new IllegalArgumentException("invalid duration value '" + value + "': " + reason);
    }
}
