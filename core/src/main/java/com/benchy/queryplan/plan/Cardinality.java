package com.benchy.queryplan.plan;

/**
 * Row counts of a plan node.
 *
 * <p>{@code estimated} is the planner's a-priori estimate, {@code exact} the
 * row count measured during execution. Either may be null when the vendor does
 * not report it. Integral values are held as {@code Long}, fractional ones as
 * {@code Double}.
 */
public record Cardinality(Number estimated, Number exact) {

    /** Both counts zero. */
    public static final Cardinality ZERO = new Cardinality(0L, 0L);

    /** Neither count known. */
    public static final Cardinality UNKNOWN = new Cardinality(null, null);

    public Cardinality withEstimated(Number value) {
        return new Cardinality(value, exact);
    }

    public Cardinality withExact(Number value) {
        return new Cardinality(estimated, value);
    }

    /**
     * Returns true if either count is known and greater than zero.
     */
    public boolean isPositive() {
        return isPositive(estimated) || isPositive(exact);
    }

    private static boolean isPositive(Number value) {
        return value != null && value.doubleValue() > 0;
    }

    @Override
    public String toString() {
        return "est=" + estimated + ", exact=" + exact;
    }
}
