package com.reservation.api.utils;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SlotGridTest {

    // a Monday
    private static final LocalDate DAY = LocalDate.of(2030, 3, 4);
    private static final LocalDateTime EARLIER = LocalDateTime.of(2030, 3, 1, 12, 0);
    private static final LocalTime OPEN = LocalTime.of(8, 0);
    private static final LocalTime CLOSE = LocalTime.of(16, 30);

    private static TimeRange booking(int fromHour, int fromMinute, int toHour, int toMinute) {
        return new TimeRange(DAY.atTime(fromHour, fromMinute), DAY.atTime(toHour, toMinute));
    }

    private static List<LocalDateTime> slots(int durationMinutes, List<TimeRange> booked) {
        return SlotGrid.freeSlots(DAY, OPEN, CLOSE, Duration.ofMinutes(durationMinutes), booked, EARLIER);
    }

    @Nested
    class GridProperties {

        @Test
        void shouldProduceStrictlyIncreasingAlignedSlotsInsideOpeningHours() {
            for (int duration : new int[]{15, 30, 45, 60, 90, 120}) {
                List<LocalDateTime> result = slots(duration, List.of(booking(9, 0, 9, 45), booking(13, 15, 14, 0)));

                assertThat(result).isNotEmpty().isSorted().doesNotHaveDuplicates();
                for (LocalDateTime slot : result) {
                    long offset = Duration.between(DAY.atTime(OPEN), slot).toMinutes();
                    assertThat(offset % SlotGrid.GRID_MINUTES).isZero();
                    assertThat(offset).isNotNegative();
                    assertThat(slot.plusMinutes(duration)).isBeforeOrEqualTo(DAY.atTime(CLOSE));
                }
            }
        }

        @Test
        void shouldOfferEveryGridPointWhenNothingIsBooked() {
            List<LocalDateTime> result = slots(30, List.of());

            assertThat(result).hasSize(33);
            assertThat(result.get(0)).isEqualTo(DAY.atTime(8, 0));
            assertThat(result.get(result.size() - 1)).isEqualTo(DAY.atTime(16, 0));
        }

        @Test
        void shouldReturnSameResultOnRepeatedCalls() {
            List<TimeRange> booked = List.of(booking(10, 0, 10, 30));

            assertThat(slots(30, booked)).isEqualTo(slots(30, booked));
        }

        @Test
        void shouldReturnNothingWhenDurationExceedsWindow() {
            List<LocalDateTime> result = SlotGrid.freeSlots(DAY, LocalTime.of(9, 0), LocalTime.of(9, 30),
                    Duration.ofMinutes(45), List.of(), EARLIER);

            assertThat(result).isEmpty();
        }
    }

    @Nested
    class Bookings {

        @Test
        void shouldExcludeOverlappingStartsForThirtyMinuteService() {
            List<LocalDateTime> result = slots(30, List.of(booking(10, 0, 10, 30)));

            assertThat(result).contains(DAY.atTime(9, 30), DAY.atTime(10, 30));
            assertThat(result).doesNotContain(DAY.atTime(9, 45), DAY.atTime(10, 0), DAY.atTime(10, 15));
        }

        @Test
        void shouldOfferSlotEndingExactlyWhenBookingStarts() {
            List<LocalDateTime> result = slots(15, List.of(booking(10, 0, 10, 30)));

            assertThat(result).contains(DAY.atTime(9, 45), DAY.atTime(10, 30));
            assertThat(result).doesNotContain(DAY.atTime(10, 0), DAY.atTime(10, 15));
        }

        @Test
        void shouldNeverOfferStartOfExistingBooking() {
            for (int duration = 15; duration <= 120; duration += 15) {
                assertThat(slots(duration, List.of(booking(12, 0, 12, 15))))
                        .doesNotContain(DAY.atTime(12, 0));
            }
        }

        @Test
        void shouldOfferStartEqualToEndOfExistingBooking() {
            assertThat(slots(60, List.of(booking(12, 0, 12, 45)))).contains(DAY.atTime(12, 45));
        }
    }

    @Nested
    class Now {

        @Test
        void shouldReturnNothingForPastDay() {
            LocalDateTime later = DAY.plusDays(1).atTime(7, 0);

            assertThat(SlotGrid.freeSlots(DAY, OPEN, CLOSE, Duration.ofMinutes(30), List.of(), later)).isEmpty();
        }

        @Test
        void shouldSkipStartsBeforeNowOnCurrentDay() {
            LocalDateTime now = DAY.atTime(11, 5);

            List<LocalDateTime> result = SlotGrid.freeSlots(DAY, OPEN, CLOSE, Duration.ofMinutes(30), List.of(), now);

            assertThat(result.get(0)).isEqualTo(DAY.atTime(11, 15));
            assertThat(result).allMatch(slot -> !slot.isBefore(now));
        }

        @Test
        void shouldKeepSlotStartingExactlyNow() {
            LocalDateTime now = DAY.atTime(14, 0);

            List<LocalDateTime> result = SlotGrid.freeSlots(DAY, OPEN, CLOSE, Duration.ofMinutes(30), List.of(), now);

            assertThat(result.get(0)).isEqualTo(now);
        }
    }

    @Test
    void shouldAcceptOnlyPositiveMultiplesOfGrid() {
        assertThat(SlotGrid.isGridAligned(15)).isTrue();
        assertThat(SlotGrid.isGridAligned(90)).isTrue();
        assertThat(SlotGrid.isGridAligned(0)).isFalse();
        assertThat(SlotGrid.isGridAligned(20)).isFalse();
        assertThat(SlotGrid.isGridAligned(-15)).isFalse();
    }
}
