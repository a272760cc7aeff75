package com.reservation.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReservationRequest {

    private Long serviceId;

    private Long employeeId;

    /** Must equal one of the slots returned by the availability query. */
    private LocalDateTime startTime;

    private String note;
}
