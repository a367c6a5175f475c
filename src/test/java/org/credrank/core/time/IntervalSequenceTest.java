package org.credrank.core.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("IntervalSequence Tests")
class IntervalSequenceTest {

    @Test
    @DisplayName("Gaps and empty sequences are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> IntervalSequence.of(List.of()));
        assertThrows(
                IllegalArgumentException.class,
                () -> IntervalSequence.of(List.of(new Interval(0L, 1L), new Interval(2L, 3L)))
        );
        assertThrows(IllegalArgumentException.class, () -> new Interval(5L, 5L));
    }

    @Test
    @DisplayName("Membership is half-open")
    void testHalfOpenMembership() {
        Interval interval = new Interval(0L, 10L);
        assertTrue(interval.contains(0L));
        assertTrue(interval.contains(9L));
        assertFalse(interval.contains(10L));
        assertFalse(interval.contains(-1L));
    }

    @Test
    @DisplayName("Index lookup and starts copy")
    void testLookup() {
        IntervalSequence intervals = IntervalSequence.of(List.of(
                new Interval(0L, 10L),
                new Interval(10L, 20L),
                new Interval(20L, 30L)
        ));
        assertEquals(-1, intervals.intervalIndexOf(-1L));
        assertEquals(0, intervals.intervalIndexOf(0L));
        assertEquals(1, intervals.intervalIndexOf(15L));
        assertEquals(2, intervals.intervalIndexOf(29L));
        assertEquals(-1, intervals.intervalIndexOf(30L));

        long[] starts = intervals.starts();
        assertArrayEquals(new long[]{0L, 10L, 20L}, starts);
        starts[0] = 99L;
        assertArrayEquals(new long[]{0L, 10L, 20L}, intervals.starts());
        assertEquals("[-inf, 0)", new Interval(Interval.NEGATIVE_INFINITY, 0L).toString());
    }
}
