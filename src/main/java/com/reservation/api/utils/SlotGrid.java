package com.reservation.api.utils;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Candidate start times on a fixed 15-minute grid anchored at the opening time.
 */
public final class SlotGrid {

    public static final int GRID_MINUTES = 15;

    private static final Duration STEP = Duration.ofMinutes(GRID_MINUTES);

    private SlotGrid() {
    }

    public static boolean isGridAligned(int durationMinutes) {
        return durationMinutes > 0 && durationMinutes % GRID_MINUTES == 0;
    }

    /**
     * Free start times for one day, ascending.
     *
     * @param day      calendar day being queried
     * @param opening  opening time of the company on that weekday
     * @param closing  closing time; a slot must end at or before it
     * @param duration length of the service
     * @param booked   non-terminal reservations of the employee on that day
     * @param now      current date-time; past days yield nothing and, on the current day,
     *                 starts before {@code now} are skipped
     */
    public static List<LocalDateTime> freeSlots(LocalDate day,
                                                LocalTime opening,
                                                LocalTime closing,
                                                Duration duration,
                                                Collection<TimeRange> booked,
                                                LocalDateTime now) {
        if (day.isBefore(now.toLocalDate())) {
            return List.of();
        }
        boolean today = day.equals(now.toLocalDate());
        LocalDateTime windowEnd = day.atTime(closing);
        List<LocalDateTime> slots = new ArrayList<>();

        for (LocalDateTime candidate = day.atTime(opening);
             !candidate.plus(duration).isAfter(windowEnd);
             candidate = candidate.plus(STEP)) {
            if (today && candidate.isBefore(now)) {
                continue;
            }
            TimeRange range = new TimeRange(candidate, candidate.plus(duration));
            if (booked.stream().noneMatch(range::overlaps)) {
                slots.add(candidate);
            }
        }
        return slots;
    }
}
