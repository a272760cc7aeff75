package com.reservation.api.dto;

import com.reservation.api.entity.ReservationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReservationResponse {

    private Long id;

    private Long clientId;

    private Long companyId;

    private Long serviceId;

    private String serviceName;

    private Long employeeId;

    private String employeeName;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private ReservationStatus status;

    private String note;

    private LocalDateTime createdDate;

    private LocalDateTime updatedDate;
}
