package com.arrangement.core.model;

import com.arrangement.core.exception.InvariantViolationException;

/**
 * Half-open time interval [start, start + length) in milliseconds.
 */
public record TimeRange(double start, double length) {

    public TimeRange {
        if (Double.isNaN(start) || Double.isInfinite(start) || start < 0) {
            throw new InvariantViolationException(InvariantViolationException.INVALID_RANGE,
                String.format("Range start must be non-negative, got %s", start));
        }
        if (Double.isNaN(length) || Double.isInfinite(length) || length <= 0) {
            throw new InvariantViolationException(InvariantViolationException.INVALID_RANGE,
                String.format("Range length must be positive, got %s", length));
        }
    }

    public static TimeRange of(double start, double length) {
        return new TimeRange(start, length);
    }

    public static TimeRange between(double start, double end) {
        return new TimeRange(start, end - start);
    }

    public double end() {
        return start + length;
    }

    public boolean intersects(TimeRange other) {
        return start < other.end() && end() > other.start;
    }

    public boolean contains(double time) {
        return time >= start && time < end();
    }

    public boolean contains(TimeRange other) {
        return other.start >= start && other.end() <= end();
    }

    public TimeRange shift(double offset) {
        return new TimeRange(start + offset, length);
    }

    public TimeRange withStart(double newStart) {
        return new TimeRange(newStart, length);
    }
}
