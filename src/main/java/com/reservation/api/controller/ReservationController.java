package com.reservation.api.controller;

import com.reservation.api.dto.ReservationRequest;
import com.reservation.api.dto.ReservationResponse;
import com.reservation.api.dto.ReservationStatusUpdateRequest;
import com.reservation.api.entity.AccountRole;
import com.reservation.api.service.ReservationService;
import com.reservation.api.service.SlotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/reservations")
public class ReservationController {

    private static final Logger log = LoggerFactory.getLogger(ReservationController.class);

    private final ReservationService reservationService;
    private final SlotService slotService;

    public ReservationController(ReservationService reservationService, SlotService slotService) {
        this.reservationService = reservationService;
        this.slotService = slotService;
    }

    @PostMapping
    public ResponseEntity<ReservationResponse> createReservation(
            @RequestHeader(AccountHeaders.ACCOUNT_ID) UUID accountId,
            @RequestHeader(AccountHeaders.ACCOUNT_ROLE) String role,
            @RequestBody ReservationRequest request) {
        ReservationResponse response = reservationService.createReservation(accountId, AccountRole.fromValue(role), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * 404 when the service does not exist or the employee is not assigned to it; an empty
     * list when nothing is free.
     */
    @GetMapping("/available")
    public ResponseEntity<List<LocalDateTime>> getAvailableSlots(
            @RequestParam("employeeId") Long employeeId,
            @RequestParam("serviceId") Long serviceId,
            @RequestParam("day") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day) {
        return slotService.getAvailableSlots(employeeId, serviceId, day)
                .map(ResponseEntity::ok)
                .orElseGet(() -> {
                    log.debug("No slot calendar for employee {} service {}", employeeId, serviceId);
                    return ResponseEntity.notFound().build();
                });
    }

    @GetMapping("/client")
    public List<ReservationResponse> getClientReservations(
            @RequestHeader(AccountHeaders.ACCOUNT_ID) UUID accountId,
            @RequestHeader(AccountHeaders.ACCOUNT_ROLE) String role) {
        return reservationService.getClientReservations(accountId, AccountRole.fromValue(role));
    }

    @GetMapping("/company")
    public List<ReservationResponse> getCompanyReservations(
            @RequestHeader(AccountHeaders.ACCOUNT_ID) UUID accountId,
            @RequestHeader(AccountHeaders.ACCOUNT_ROLE) String role) {
        return reservationService.getCompanyReservations(accountId, AccountRole.fromValue(role));
    }

    @GetMapping("/company/employees/{employeeId}")
    public List<ReservationResponse> getEmployeeReservations(
            @RequestHeader(AccountHeaders.ACCOUNT_ID) UUID accountId,
            @RequestHeader(AccountHeaders.ACCOUNT_ROLE) String role,
            @PathVariable Long employeeId) {
        return reservationService.getEmployeeReservations(accountId, AccountRole.fromValue(role), employeeId);
    }

    @GetMapping("/{reservationId}")
    public ReservationResponse getReservation(
            @RequestHeader(AccountHeaders.ACCOUNT_ID) UUID accountId,
            @RequestHeader(AccountHeaders.ACCOUNT_ROLE) String role,
            @PathVariable Long reservationId) {
        return reservationService.getReservation(accountId, AccountRole.fromValue(role), reservationId);
    }

    @PatchMapping("/{reservationId}")
    public ReservationResponse updateStatus(
            @RequestHeader(AccountHeaders.ACCOUNT_ID) UUID accountId,
            @RequestHeader(AccountHeaders.ACCOUNT_ROLE) String role,
            @PathVariable Long reservationId,
            @RequestBody ReservationStatusUpdateRequest request) {
        return reservationService.updateStatus(accountId, AccountRole.fromValue(role), reservationId,
                request.getStatus());
    }
}
