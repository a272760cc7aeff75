package com.reservation.api.service;

import com.reservation.api.entity.Reservation;
import com.reservation.api.entity.ReservationStatus;
import com.reservation.api.exception.BookingException;
import com.reservation.api.exception.BookingException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Status changes of existing reservations. Only the owning company may move a reservation:
 * Pending to Confirmed or Cancelled, Confirmed to Cancelled or Completed. Cancelled and
 * Completed are final.
 */
@Service
public class ReservationStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ReservationStateMachine.class);

    private final BookingLedger bookingLedger;

    public ReservationStateMachine(BookingLedger bookingLedger) {
        this.bookingLedger = bookingLedger;
    }

    /**
     * Applies {@code newStatus} after checking ownership, terminal state and the transition
     * table, all under a row lock. On rejection the reservation is left untouched.
     */
    @Transactional
    public Reservation updateStatus(Long reservationId, ReservationStatus newStatus, Long actingCompanyId) {
        if (newStatus == null) {
            throw BookingException.validation("Target status is required");
        }
        Reservation reservation = bookingLedger.getByIdForUpdate(reservationId)
                .orElseThrow(() -> BookingException.notFound(Reason.RESERVATION_NOT_FOUND,
                        "Reservation not found: " + reservationId));

        if (actingCompanyId == null || !actingCompanyId.equals(reservation.getCompany().getId())) {
            log.warn("Company {} tried to change reservation {} owned by company {}",
                    actingCompanyId, reservationId, reservation.getCompany().getId());
            throw new BookingException(Reason.NOT_OWNER, "Reservation belongs to another company");
        }

        ReservationStatus current = reservation.getStatus();
        if (current.isTerminal()) {
            throw new BookingException(Reason.RESERVATION_CLOSED,
                    "Reservation is " + current.getLabel() + " and can no longer be updated");
        }
        if (!current.canTransitionTo(newStatus)) {
            throw new BookingException(Reason.INVALID_TRANSITION,
                    "Cannot change status from " + current.getLabel() + " to " + newStatus.getLabel());
        }

        Reservation updated = bookingLedger.updateStatus(reservation, newStatus);
        log.info("Reservation {} status {} -> {}", reservationId, current, newStatus);
        return updated;
    }
}
