package com.reservation.api.dto;

import com.reservation.api.entity.ReservationStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReservationStatusUpdateRequest {

    private ReservationStatus status;
}
