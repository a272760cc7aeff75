package com.reservation.api.utils;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeRangeTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2030, 1, 7, 0, 0);

    private static TimeRange range(int fromMinute, int toMinute) {
        return new TimeRange(BASE.plusMinutes(fromMinute), BASE.plusMinutes(toMinute));
    }

    /** Brute force: do the two ranges share at least one whole minute? */
    private static boolean shareMinute(int aFrom, int aTo, int bFrom, int bTo) {
        for (int m = aFrom; m < aTo; m++) {
            if (m >= bFrom && m < bTo) {
                return true;
            }
        }
        return false;
    }

    @Test
    void shouldMatchMinuteArithmeticForRandomPairs() {
        Random random = new Random(42);
        for (int i = 0; i < 5_000; i++) {
            int aFrom = random.nextInt(200);
            int aTo = aFrom + 1 + random.nextInt(90);
            int bFrom = random.nextInt(200);
            int bTo = bFrom + 1 + random.nextInt(90);

            boolean expected = shareMinute(aFrom, aTo, bFrom, bTo);

            assertThat(range(aFrom, aTo).overlaps(range(bFrom, bTo)))
                    .as("[%d,%d) vs [%d,%d)", aFrom, aTo, bFrom, bTo)
                    .isEqualTo(expected);
            assertThat(range(bFrom, bTo).overlaps(range(aFrom, aTo))).isEqualTo(expected);
        }
    }

    @Test
    void shouldTreatTouchingRangesAsDisjoint() {
        assertThat(range(0, 30).overlaps(range(30, 60))).isFalse();
        assertThat(range(30, 60).overlaps(range(0, 30))).isFalse();
    }

    @Test
    void shouldOverlapWhenContained() {
        assertThat(range(0, 120).overlaps(range(30, 45))).isTrue();
        assertThat(range(30, 45).overlaps(range(30, 45))).isTrue();
    }

    @Test
    void shouldRejectEmptyOrInvertedRange() {
        assertThatThrownBy(() -> range(10, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> range(20, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimeRange(null, BASE)).isInstanceOf(IllegalArgumentException.class);
    }
}
