package org.credrank.core.time;

import java.util.AbstractList;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * Validated, contiguous sequence of half-open intervals.
 *
 * <p>Guarantees: at least one interval, and every interval except the first
 * starts exactly where the previous one ended.</p>
 */
public final class IntervalSequence extends AbstractList<Interval> implements RandomAccess {
    private final Interval[] intervals;
    private final long[] starts;

    private IntervalSequence(Interval[] intervals) {
        this.intervals = intervals;
        this.starts = new long[intervals.length];
        for (int i = 0; i < intervals.length; i++) {
            starts[i] = intervals[i].startMs();
        }
    }

    /**
     * Validates and copies the given intervals.
     *
     * @throws IllegalArgumentException when the list is empty or not contiguous.
     */
    public static IntervalSequence of(List<Interval> intervals) {
        Objects.requireNonNull(intervals, "intervals");
        if (intervals.isEmpty()) {
            throw new IllegalArgumentException("interval sequence needs at least one interval");
        }
        Interval[] copy = new Interval[intervals.size()];
        for (int i = 0; i < copy.length; i++) {
            Interval interval = Objects.requireNonNull(intervals.get(i), "intervals[" + i + "]");
            if (i > 0 && interval.startMs() != copy[i - 1].endMs()) {
                throw new IllegalArgumentException(
                        "interval " + i + " starts at " + interval.startMs()
                                + " but previous interval ends at " + copy[i - 1].endMs()
                );
            }
            copy[i] = interval;
        }
        return new IntervalSequence(copy);
    }

    @Override
    public Interval get(int index) {
        return intervals[index];
    }

    @Override
    public int size() {
        return intervals.length;
    }

    /**
     * Returns start of each interval in order.
     */
    public long[] starts() {
        return starts.clone();
    }

    /**
     * Returns the index of the interval containing {@code timestampMs}, or -1 when outside.
     */
    public int intervalIndexOf(long timestampMs) {
        if (timestampMs < starts[0] || timestampMs >= intervals[intervals.length - 1].endMs()) {
            return -1;
        }
        int lo = 0;
        int hi = starts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (starts[mid] <= timestampMs) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }
}
