package com.reservation.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkingDayRequest {

    private DayOfWeek day;

    private LocalTime openingTime;

    private LocalTime closingTime;
}
