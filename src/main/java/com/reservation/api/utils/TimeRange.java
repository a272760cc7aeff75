package com.reservation.api.utils;

import java.time.LocalDateTime;

/**
 * Half-open interval {@code [start, end)}.
 */
public record TimeRange(LocalDateTime start, LocalDateTime end) {

    public TimeRange {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("Invalid time range: " + start + " - " + end);
        }
    }

    /** Touching ranges ({@code a.end == b.start}) do not overlap. */
    public boolean overlaps(TimeRange other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }
}
