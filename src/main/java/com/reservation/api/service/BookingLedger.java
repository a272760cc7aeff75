package com.reservation.api.service;

import com.reservation.api.entity.Reservation;
import com.reservation.api.entity.ReservationStatus;
import com.reservation.api.repository.ReservationRepository;
import com.reservation.api.utils.TimeRange;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Storage of reservations. Every listing is ordered by status priority
 * (Pending, Confirmed, Completed, Cancelled) and then by start time.
 */
@Component
public class BookingLedger {

    static final Comparator<Reservation> LISTING_ORDER = Comparator
            .comparing(Reservation::getStatus, ReservationStatus.LISTING_ORDER)
            .thenComparing(Reservation::getStartTime);

    private final ReservationRepository reservationRepository;
    private final Clock clock;

    public BookingLedger(ReservationRepository reservationRepository, Clock clock) {
        this.reservationRepository = reservationRepository;
        this.clock = clock;
    }

    @Transactional
    public Reservation create(Reservation reservation) {
        if (reservation.getCreatedDate() == null) {
            reservation.setCreatedDate(LocalDateTime.now(clock));
        }
        return reservationRepository.saveAndFlush(reservation);
    }

    @Transactional(readOnly = true)
    public Optional<Reservation> getById(Long id) {
        return reservationRepository.findById(id);
    }

    /** Same as {@link #getById} but holds a row lock until the surrounding transaction ends. */
    @Transactional
    public Optional<Reservation> getByIdForUpdate(Long id) {
        return reservationRepository.findByIdForUpdate(id);
    }

    /**
     * Time blocked for the employee on {@code day}: reservations starting that day whose
     * status is not terminal.
     */
    @Transactional(readOnly = true)
    public List<TimeRange> listBookedRanges(Long employeeId, LocalDate day) {
        return listByEmployeeAndDate(employeeId, day).stream()
                .map(r -> new TimeRange(r.getStartTime(), r.getEndTime()))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Reservation> listByEmployeeAndDate(Long employeeId, LocalDate day) {
        return reservationRepository.findBookedForEmployeeBetween(employeeId,
                day.atStartOfDay(), day.plusDays(1).atStartOfDay(), ReservationStatus.TERMINAL);
    }

    @Transactional(readOnly = true)
    public boolean hasOverlap(Long employeeId, TimeRange range) {
        return reservationRepository.existsOverlapping(employeeId, range.start(), range.end(),
                ReservationStatus.TERMINAL);
    }

    @Transactional(readOnly = true)
    public List<Reservation> listByClient(Long clientId) {
        return sorted(reservationRepository.findByClientId(clientId));
    }

    @Transactional(readOnly = true)
    public List<Reservation> listByCompany(Long companyId) {
        return sorted(reservationRepository.findByCompanyId(companyId));
    }

    @Transactional(readOnly = true)
    public List<Reservation> listByEmployee(Long employeeId) {
        return sorted(reservationRepository.findByEmployeeId(employeeId));
    }

    @Transactional
    public Reservation updateStatus(Reservation reservation, ReservationStatus newStatus) {
        reservation.setStatus(newStatus);
        reservation.setUpdatedDate(LocalDateTime.now(clock));
        return reservationRepository.save(reservation);
    }

    private static List<Reservation> sorted(List<Reservation> reservations) {
        return reservations.stream().sorted(LISTING_ORDER).toList();
    }
}
