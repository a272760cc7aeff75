package com.reservation.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Create or partial update of a company service. On update, null fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServiceRequest {

    private Long subcategoryId;

    private String name;

    private String description;

    private BigDecimal price;

    private Integer durationMinutes;
}
