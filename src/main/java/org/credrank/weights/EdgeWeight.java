package org.credrank.weights;

/**
 * Forward and backward weight of a contribution edge.
 */
public record EdgeWeight(double forwards, double backwards) {
    public static final EdgeWeight ZERO = new EdgeWeight(0.0d, 0.0d);
    public static final EdgeWeight NEUTRAL = new EdgeWeight(1.0d, 1.0d);

    public EdgeWeight {
        requireWeight(forwards, "forwards");
        requireWeight(backwards, "backwards");
    }

    /**
     * Component-wise product, used to apply an override on a type default.
     */
    public EdgeWeight times(EdgeWeight other) {
        return new EdgeWeight(forwards * other.forwards, backwards * other.backwards);
    }

    public boolean isZero() {
        return forwards == 0.0d && backwards == 0.0d;
    }

    static double requireWeight(double value, String fieldName) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new IllegalArgumentException(fieldName + " must be finite and >= 0, got " + value);
        }
        return value;
    }
}
