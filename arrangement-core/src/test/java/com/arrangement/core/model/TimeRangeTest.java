package com.arrangement.core.model;

import com.arrangement.core.exception.InvariantViolationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class TimeRangeTest {

    @Test
    void constructor_shouldRejectNegativeStart() {
        assertThatThrownBy(() -> TimeRange.of(-1, 10))
            .isInstanceOf(InvariantViolationException.class)
            .extracting(e -> ((InvariantViolationException) e).getViolation())
            .isEqualTo(InvariantViolationException.INVALID_RANGE);
    }

    @Test
    void constructor_shouldRejectNonPositiveLength() {
        assertThrows(InvariantViolationException.class, () -> TimeRange.of(0, 0));
        assertThrows(InvariantViolationException.class, () -> TimeRange.of(0, -5));
    }

    @Test
    void intersects_shouldTreatRangesAsHalfOpen() {
        TimeRange first = TimeRange.of(0, 1000);

        assertTrue(first.intersects(TimeRange.of(999, 10)));
        assertTrue(first.intersects(TimeRange.of(0, 1000)));
        assertFalse(first.intersects(TimeRange.of(1000, 10)));
        assertFalse(TimeRange.of(1000, 10).intersects(first));
    }

    @Test
    void contains_shouldIncludeStartAndExcludeEnd() {
        TimeRange range = TimeRange.of(100, 100);

        assertTrue(range.contains(100));
        assertFalse(range.contains(200));
        assertTrue(range.contains(TimeRange.of(100, 100)));
        assertFalse(range.contains(TimeRange.of(150, 100)));
    }

    @Test
    void shift_shouldKeepLength() {
        TimeRange shifted = TimeRange.of(100, 50).shift(25);

        assertThat(shifted).isEqualTo(TimeRange.of(125, 50));
        assertThat(shifted.end()).isEqualTo(175);
    }
}
