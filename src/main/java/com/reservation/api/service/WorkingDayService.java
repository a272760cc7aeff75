package com.reservation.api.service;

import com.reservation.api.dto.WorkingDayResponse;
import com.reservation.api.entity.Company;
import com.reservation.api.entity.WorkingDay;
import com.reservation.api.exception.BookingException;
import com.reservation.api.exception.BookingException.Reason;
import com.reservation.api.repository.CompanyRepository;
import com.reservation.api.repository.WorkingDayRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Weekly opening hours per company.
 */
@Service
public class WorkingDayService {

    private static final Logger log = LoggerFactory.getLogger(WorkingDayService.class);

    private final WorkingDayRepository workingDayRepository;
    private final CompanyRepository companyRepository;

    public WorkingDayService(WorkingDayRepository workingDayRepository, CompanyRepository companyRepository) {
        this.workingDayRepository = workingDayRepository;
        this.companyRepository = companyRepository;
    }

    public record OpeningHours(LocalTime opening, LocalTime closing) {
    }

    /**
     * Opening window of the company on the given weekday; empty when the day is missing or closed.
     */
    @Transactional(readOnly = true)
    public Optional<OpeningHours> findOpeningHours(Long companyId, DayOfWeek day) {
        return workingDayRepository.findByCompanyIdAndDay(companyId, day)
                .filter(WorkingDay::isOpen)
                .map(wd -> new OpeningHours(wd.getOpeningTime(), wd.getClosingTime()));
    }

    /**
     * Creates the weekday or replaces its hours. Both times null marks the day closed.
     */
    @Transactional
    public WorkingDayResponse upsertDay(Long companyId, DayOfWeek day, LocalTime opening, LocalTime closing) {
        validate(day, opening, closing);
        Company company = companyRepository.findById(companyId)
                .orElseThrow(() -> BookingException.notFound(Reason.COMPANY_NOT_FOUND, "Company not found: " + companyId));

        WorkingDay workingDay = workingDayRepository.findByCompanyIdAndDay(companyId, day)
                .orElseGet(() -> WorkingDay.builder().company(company).day(day).build());
        workingDay.setOpeningTime(opening);
        workingDay.setClosingTime(closing);
        workingDay = workingDayRepository.save(workingDay);

        log.info("Working day {} for company {} set to {}", day, companyId,
                workingDay.isOpen() ? opening + "-" + closing : "closed");
        return toResponse(workingDay);
    }

    /**
     * All seven weekdays, Monday first. Days never configured are reported closed.
     */
    @Transactional(readOnly = true)
    public List<WorkingDayResponse> getWeek(Long companyId) {
        Map<DayOfWeek, WorkingDay> existing = new EnumMap<>(DayOfWeek.class);
        for (WorkingDay wd : workingDayRepository.findByCompanyId(companyId)) {
            existing.put(wd.getDay(), wd);
        }
        List<WorkingDayResponse> week = new ArrayList<>(7);
        for (DayOfWeek day : DayOfWeek.values()) {
            WorkingDay wd = existing.get(day);
            week.add(wd != null ? toResponse(wd) : WorkingDayResponse.builder().day(day).build());
        }
        return week;
    }

    private static void validate(DayOfWeek day, LocalTime opening, LocalTime closing) {
        if (day == null) {
            throw BookingException.validation("Day of week is required");
        }
        if ((opening == null) != (closing == null)) {
            throw BookingException.validation("Opening and closing must both be provided or both be null");
        }
        if (opening != null && opening.equals(closing)) {
            throw BookingException.validation("Opening and closing cannot be the same");
        }
        if (opening != null && opening.isAfter(closing)) {
            throw BookingException.validation("Opening must be before closing");
        }
    }

    private static WorkingDayResponse toResponse(WorkingDay wd) {
        return WorkingDayResponse.builder()
                .id(wd.getId())
                .day(wd.getDay())
                .openingTime(wd.getOpeningTime())
                .closingTime(wd.getClosingTime())
                .build();
    }
}
