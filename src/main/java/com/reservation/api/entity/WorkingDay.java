package com.reservation.api.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * Opening hours of a company for one weekday. Both times null means closed.
 */
@Entity
@Table(name = "working_day", uniqueConstraints = {
    @UniqueConstraint(name = "uk_working_day_company_day", columnNames = {"company_id", "week_day"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkingDay {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "company_id", nullable = false)
    private Company company;

    @Enumerated(EnumType.STRING)
    @Column(name = "week_day", nullable = false, length = 10)
    private DayOfWeek day;

    @Column(name = "opening_time")
    private LocalTime openingTime;

    @Column(name = "closing_time")
    private LocalTime closingTime;

    public boolean isOpen() {
        return openingTime != null && closingTime != null;
    }
}
