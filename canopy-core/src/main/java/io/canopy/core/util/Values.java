package io.canopy.core.util;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/// Conversions applied to loosely typed values read from blackboards and definitions.
///
/// Definition files and blackboards hold plain objects, so numbers may arrive as
/// `Integer`, `Long` or `Double` and durations as numbers of seconds or ISO-8601 text.
public final class Values {

    private Values() {}

    /// Converts a value to a duration.
    ///
    /// Accepts a {@link Duration}, a number of seconds, or text holding either an ISO-8601
    /// duration (`PT1.5S`) or a number of seconds.
    ///
    /// @param value value to convert, not null
    /// @return the duration, never null
    /// @throws IllegalArgumentException if the value cannot be read as a duration
    public static Duration toDuration(Object value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value instanceof Duration duration) {
            return duration;
        }
        if (value instanceof Number number) {
            return secondsToDuration(toBigDecimal(number));
        }
        String text = value.toString().trim();
        if (text.startsWith("P") || text.startsWith("p")) {
            return Duration.parse(text);
        }
        try {
            return secondsToDuration(new BigDecimal(text));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a duration: '" + text + "'", e);
        }
    }

    /// Returns whether two values are equal, comparing numbers by numeric value.
    ///
    /// `1`, `1L` and `1.0` are all equal under this comparison.
    public static boolean looselyEquals(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return toBigDecimal(l).compareTo(toBigDecimal(r)) == 0;
        }
        return Objects.equals(left, right);
    }

    /// Orders two values.
    ///
    /// Numbers are compared numerically, other values only if both are comparable
    /// instances of the same class.
    ///
    /// @return negative, zero or positive as for {@link Comparable#compareTo}
    /// @throws IllegalArgumentException if the values have no common ordering
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return toBigDecimal(l).compareTo(toBigDecimal(r));
        }
        if (left instanceof Comparable comparable
                && right != null
                && left.getClass() == right.getClass()) {
            return comparable.compareTo(right);
        }
        throw new IllegalArgumentException(
                "Cannot order " + describe(left) + " and " + describe(right));
    }

    /// Converts a value to an int, accepting numbers and numeric text.
    public static int toInt(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        return Integer.parseInt(Objects.requireNonNull(value, "value must not be null").toString().trim());
    }

    /// Converts a value to a double, accepting numbers and numeric text.
    public static double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return Double.parseDouble(Objects.requireNonNull(value, "value must not be null").toString().trim());
    }

    private static Duration secondsToDuration(BigDecimal seconds) {
        if (seconds.signum() < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + seconds);
        }
        return Duration.ofNanos(seconds.movePointRight(9).longValue());
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
