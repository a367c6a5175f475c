package org.credrank.core.time;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.credrank.graph.ContributionGraph;
import org.credrank.graph.Edge;

import java.util.ArrayList;
import java.util.Objects;

/**
 * Derives epoch sequences from contribution timestamps.
 *
 * <p>Regular epochs are aligned on {@code originMs + k * widthMs} and bracketed
 * by two unbounded sentinel epochs. Weekly epochs start on Sundays, 00:00 UTC.</p>
 */
public final class IntervalPartitioner {
    public static final long DAY_MS = 24L * 60L * 60L * 1000L;
    public static final long WEEK_MS = 7L * DAY_MS;
    /** 1970-01-04T00:00Z, the first Sunday after the Unix epoch. */
    public static final long WEEK_ORIGIN_MS = 3L * DAY_MS;

    private IntervalPartitioner() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Partitions the time line around the given timestamps, aligned on multiples of the width.
     *
     * @see #partition(long[], long, long)
     */
    public static IntervalSequence partition(long[] timestampsMs, long widthMs) {
        return partition(timestampsMs, widthMs, 0L);
    }

    /**
     * Partitions the time line around the given timestamps.
     *
     * @param timestampsMs timestamps to cover, in any order.
     * @param widthMs regular epoch width, must be positive.
     * @param originMs any regular epoch boundary.
     * @return sentinel, regular epochs covering every timestamp, sentinel.
     * @throws IllegalArgumentException when the width is not positive, or a timestamp is so
     *                                  close to the ends of the {@code long} range that its
     *                                  epoch would not fit between the sentinels.
     */
    public static IntervalSequence partition(long[] timestampsMs, long widthMs, long originMs) {
        Objects.requireNonNull(timestampsMs, "timestampsMs");
        if (widthMs <= 0L) {
            throw new IllegalArgumentException("epoch width must be > 0, got " + widthMs);
        }
        ArrayList<Interval> intervals = new ArrayList<>();
        if (timestampsMs.length == 0) {
            intervals.add(new Interval(Interval.NEGATIVE_INFINITY, 0L));
            intervals.add(new Interval(0L, Interval.POSITIVE_INFINITY));
            return IntervalSequence.of(intervals);
        }

        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (long t : timestampsMs) {
            min = Math.min(min, t);
            max = Math.max(max, t);
        }
        long alignedStart;
        long alignedEnd;
        try {
            alignedStart = Math.addExact(originMs, Math.multiplyExact(Math.floorDiv(Math.subtractExact(min, originMs), widthMs), widthMs));
            long lastStart = Math.addExact(originMs, Math.multiplyExact(Math.floorDiv(Math.subtractExact(max, originMs), widthMs), widthMs));
            alignedEnd = Math.addExact(lastStart, widthMs);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    "timestamps [" + min + ", " + max + "] do not fit epochs of width " + widthMs, e
            );
        }
        if (alignedStart == Interval.NEGATIVE_INFINITY || alignedEnd == Interval.POSITIVE_INFINITY) {
            throw new IllegalArgumentException(
                    "timestamps [" + min + ", " + max + "] leave no room for the sentinel epochs"
            );
        }

        intervals.add(new Interval(Interval.NEGATIVE_INFINITY, alignedStart));
        for (long start = alignedStart; start < alignedEnd; start += widthMs) {
            intervals.add(new Interval(start, start + widthMs));
        }
        intervals.add(new Interval(alignedEnd, Interval.POSITIVE_INFINITY));
        return IntervalSequence.of(intervals);
    }

    /**
     * Partitions around the edge timestamps of a graph, aligned on multiples of the width.
     */
    public static IntervalSequence forGraph(ContributionGraph graph, long widthMs) {
        return forGraph(graph, widthMs, 0L);
    }

    public static IntervalSequence forGraph(ContributionGraph graph, long widthMs, long originMs) {
        Objects.requireNonNull(graph, "graph");
        LongArrayList timestamps = new LongArrayList(graph.edgeCount());
        for (Edge edge : graph.edges()) {
            timestamps.add(edge.timestampMs());
        }
        return partition(timestamps.toLongArray(), widthMs, originMs);
    }

    /**
     * Sunday-aligned weekly epochs around the edge timestamps of a graph.
     */
    public static IntervalSequence weekly(ContributionGraph graph) {
        return forGraph(graph, WEEK_MS, WEEK_ORIGIN_MS);
    }
}
