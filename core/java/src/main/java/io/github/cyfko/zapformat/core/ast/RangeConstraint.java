package io.github.cyfko.zapformat.core.ast;

/**
 * Numeric bounds attached to a primitive (value range, string length) or an array (length).
 * <p>
 * Either bound may be {@code null}; both {@code null} is an open range, written {@code ..}.
 * An exact constraint such as {@code u8(5)} has {@code min == max}.
 * </p>
 *
 * @param min lower bound, or {@code null}
 * @param max upper bound, or {@code null}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record RangeConstraint(Double min, Double max) {

    public static RangeConstraint open() {
        return new RangeConstraint(null, null);
    }

    public static RangeConstraint exactly(double value) {
        return new RangeConstraint(value, value);
    }

    public static RangeConstraint atLeast(double min) {
        return new RangeConstraint(min, null);
    }

    public static RangeConstraint atMost(double max) {
        return new RangeConstraint(null, max);
    }

    public static RangeConstraint between(double min, double max) {
        return new RangeConstraint(min, max);
    }
}
