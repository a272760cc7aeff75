package com.reservation.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkingDayResponse {

    /** Null for a weekday that was never configured. */
    private Long id;

    private DayOfWeek day;

    private LocalTime openingTime;

    private LocalTime closingTime;
}
