package org.credrank.core.time;

/**
 * Half-open time window {@code [startMs, endMs)}.
 *
 * <p>{@link Long#MIN_VALUE} and {@link Long#MAX_VALUE} stand for negative and
 * positive infinity; such bounds mark the sentinel epochs of a sequence.</p>
 */
public record Interval(long startMs, long endMs) {
    public static final long NEGATIVE_INFINITY = Long.MIN_VALUE;
    public static final long POSITIVE_INFINITY = Long.MAX_VALUE;

    public Interval {
        if (endMs <= startMs) {
            throw new IllegalArgumentException(
                    "interval must have positive length, got [" + startMs + ", " + endMs + ")"
            );
        }
    }

    /**
     * Returns whether {@code start <= timestampMs < end}.
     */
    public boolean contains(long timestampMs) {
        return startMs <= timestampMs && timestampMs < endMs;
    }

    /**
     * Returns whether either bound is infinite.
     */
    public boolean isSentinel() {
        return startMs == NEGATIVE_INFINITY || endMs == POSITIVE_INFINITY;
    }

    @Override
    public String toString() {
        return "[" + format(startMs) + ", " + format(endMs) + ")";
    }

    private static String format(long bound) {
        if (bound == NEGATIVE_INFINITY) {
            return "-inf";
        }
        if (bound == POSITIVE_INFINITY) {
            return "+inf";
        }
        return Long.toString(bound);
    }
}
