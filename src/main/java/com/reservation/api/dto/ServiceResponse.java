package com.reservation.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ServiceResponse {

    private Long id;

    private Long companyId;

    private Long subcategoryId;

    private String name;

    private String description;

    private BigDecimal price;

    private int durationMinutes;

    private boolean active;
}
