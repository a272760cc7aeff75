package com.reservation.api.service;

import com.reservation.api.entity.CompanyService;
import com.reservation.api.service.WorkingDayService.OpeningHours;
import com.reservation.api.utils.SlotGrid;
import com.reservation.api.utils.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Computes bookable start times for an employee and service on one day.
 * Nothing is cached; every call reads the current bookings.
 */
@Service
public class SlotService {

    private static final Logger log = LoggerFactory.getLogger(SlotService.class);

    private final ServiceCatalogService catalogService;
    private final WorkingDayService workingDayService;
    private final BookingLedger bookingLedger;
    private final Clock clock;

    public SlotService(ServiceCatalogService catalogService,
                       WorkingDayService workingDayService,
                       BookingLedger bookingLedger,
                       Clock clock) {
        this.catalogService = catalogService;
        this.workingDayService = workingDayService;
        this.bookingLedger = bookingLedger;
        this.clock = clock;
    }

    /**
     * Free start times, ascending, on the 15-minute grid from the opening time.
     *
     * @return empty when the service does not exist or the employee is not assigned to it;
     *         otherwise the (possibly empty) list of slots
     */
    @Transactional(readOnly = true)
    public Optional<List<LocalDateTime>> getAvailableSlots(Long employeeId, Long serviceId, LocalDate day) {
        Optional<CompanyService> service = catalogService.findService(serviceId);
        if (service.isEmpty()) {
            log.debug("Slots requested for unknown service {}", serviceId);
            return Optional.empty();
        }
        if (!catalogService.isEmployeeAssignedToService(serviceId, employeeId)) {
            log.debug("Employee {} is not assigned to service {}", employeeId, serviceId);
            return Optional.empty();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (day.isBefore(now.toLocalDate())) {
            return Optional.of(List.of());
        }

        Long companyId = service.get().getCompany().getId();
        Optional<OpeningHours> hours = workingDayService.findOpeningHours(companyId, day.getDayOfWeek());
        if (hours.isEmpty()) {
            return Optional.of(List.of());
        }

        Duration duration = Duration.ofMinutes(service.get().getDurationMinutes());
        List<TimeRange> booked = bookingLedger.listBookedRanges(employeeId, day);
        List<LocalDateTime> slots = SlotGrid.freeSlots(day, hours.get().opening(), hours.get().closing(),
                duration, booked, now);

        log.debug("Employee {} service {} on {}: {} free slots, {} bookings", employeeId, serviceId, day,
                slots.size(), booked.size());
        return Optional.of(slots);
    }
}
