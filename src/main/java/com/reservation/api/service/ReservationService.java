package com.reservation.api.service;

import com.reservation.api.dto.ReservationRequest;
import com.reservation.api.dto.ReservationResponse;
import com.reservation.api.entity.AccountRole;
import com.reservation.api.entity.Client;
import com.reservation.api.entity.CompanyService;
import com.reservation.api.entity.Employee;
import com.reservation.api.entity.Reservation;
import com.reservation.api.entity.ReservationStatus;
import com.reservation.api.exception.BookingException;
import com.reservation.api.exception.BookingException.Reason;
import com.reservation.api.repository.EmployeeRepository;
import com.reservation.api.utils.TimeRange;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Booking entry point: validates a request against live availability and stores it.
 * <p>
 * The requested start must be one of the currently free slots. The insert itself runs under a
 * row lock on the employee followed by an overlap re-check, so of two requests that both saw
 * the slot free only the first is stored; the other gets a persistence conflict.
 */
@Service
public class ReservationService {

    private static final Logger log = LoggerFactory.getLogger(ReservationService.class);

    private final IdentityService identityService;
    private final ServiceCatalogService catalogService;
    private final SlotService slotService;
    private final BookingLedger bookingLedger;
    private final ReservationStateMachine stateMachine;
    private final EmployeeRepository employeeRepository;

    public ReservationService(IdentityService identityService,
                              ServiceCatalogService catalogService,
                              SlotService slotService,
                              BookingLedger bookingLedger,
                              ReservationStateMachine stateMachine,
                              EmployeeRepository employeeRepository) {
        this.identityService = identityService;
        this.catalogService = catalogService;
        this.slotService = slotService;
        this.bookingLedger = bookingLedger;
        this.stateMachine = stateMachine;
        this.employeeRepository = employeeRepository;
    }

    /**
     * Clients create Pending reservations; companies create Confirmed ones for their own
     * services with no client attached. Any failed check aborts without side effects.
     */
    @Transactional
    public ReservationResponse createReservation(UUID accountId, AccountRole role, ReservationRequest request) {
        Client client = null;
        Long actingCompanyId = null;
        ReservationStatus initialStatus;
        if (role == AccountRole.USER) {
            client = identityService.requireClient(accountId);
            initialStatus = ReservationStatus.PENDING;
        } else {
            actingCompanyId = identityService.requireCompanyId(accountId);
            initialStatus = ReservationStatus.CONFIRMED;
        }

        if (request == null || request.getServiceId() == null || request.getEmployeeId() == null
                || request.getStartTime() == null) {
            throw BookingException.validation("serviceId, employeeId and startTime are required");
        }
        Long serviceId = request.getServiceId();
        Long employeeId = request.getEmployeeId();
        LocalDateTime startTime = request.getStartTime();

        CompanyService service = catalogService.findService(serviceId)
                .orElseThrow(() -> BookingException.notFound(Reason.SERVICE_NOT_FOUND, "Service not found: " + serviceId));
        if (actingCompanyId != null && !actingCompanyId.equals(service.getCompany().getId())) {
            throw BookingException.notFound(Reason.SERVICE_NOT_FOUND, "Service not found: " + serviceId);
        }

        List<LocalDateTime> slots = slotService.getAvailableSlots(employeeId, serviceId, startTime.toLocalDate())
                .orElseThrow(() -> {
                    log.warn("Rejected booking: employee {} cannot perform service {}", employeeId, serviceId);
                    return BookingException.slotUnavailable("Employee is not available for this service");
                });
        if (!slots.contains(startTime)) {
            log.warn("Rejected booking: {} is not a free slot for employee {} service {}",
                    startTime, employeeId, serviceId);
            throw BookingException.slotUnavailable("Requested time is not available");
        }

        TimeRange requested = new TimeRange(startTime, startTime.plusMinutes(service.getDurationMinutes()));
        Employee employee = lockEmployee(employeeId);
        if (bookingLedger.hasOverlap(employeeId, requested)) {
            log.warn("Lost booking race: {} overlaps a reservation of employee {} stored meanwhile", requested, employeeId);
            throw new BookingException(Reason.PERSISTENCE_CONFLICT, "Reservation conflicts with another booking");
        }

        Reservation reservation = Reservation.builder()
                .client(client)
                .company(service.getCompany())
                .service(service)
                .employee(employee)
                .startTime(requested.start())
                .endTime(requested.end())
                .status(initialStatus)
                .note(StringUtils.trimToNull(request.getNote()))
                .build();

        try {
            reservation = bookingLedger.create(reservation);
        } catch (DataIntegrityViolationException e) {
            log.warn("Lost booking race for employee {} at {}", employeeId, startTime);
            throw new BookingException(Reason.PERSISTENCE_CONFLICT, "Reservation conflicts with another booking", e);
        }

        log.info("Reservation {} created: service={} employee={} {}-{} status={}", reservation.getId(),
                serviceId, employeeId, reservation.getStartTime(), reservation.getEndTime(), initialStatus);
        return toResponse(reservation);
    }

    /**
     * Visible to the owning company and to the client it was booked for; anyone else gets
     * not-found.
     */
    @Transactional(readOnly = true)
    public ReservationResponse getReservation(UUID accountId, AccountRole role, Long reservationId) {
        Reservation reservation = bookingLedger.getById(reservationId)
                .filter(r -> isVisibleTo(r, accountId, role))
                .orElseThrow(() -> BookingException.notFound(Reason.RESERVATION_NOT_FOUND,
                        "Reservation not found: " + reservationId));
        return toResponse(reservation);
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> getClientReservations(UUID accountId, AccountRole role) {
        identityService.requireRole(role, AccountRole.USER);
        Long clientId = identityService.requireClientId(accountId);
        return bookingLedger.listByClient(clientId).stream().map(ReservationService::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> getCompanyReservations(UUID accountId, AccountRole role) {
        identityService.requireRole(role, AccountRole.COMPANY);
        Long companyId = identityService.requireCompanyId(accountId);
        return bookingLedger.listByCompany(companyId).stream().map(ReservationService::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> getEmployeeReservations(UUID accountId, AccountRole role, Long employeeId) {
        identityService.requireRole(role, AccountRole.COMPANY);
        Long companyId = identityService.requireCompanyId(accountId);
        employeeRepository.findByIdAndCompanyId(employeeId, companyId)
                .orElseThrow(() -> BookingException.notFound(Reason.EMPLOYEE_NOT_FOUND, "Employee not found: " + employeeId));
        return bookingLedger.listByEmployee(employeeId).stream().map(ReservationService::toResponse).toList();
    }

    @Transactional
    public ReservationResponse updateStatus(UUID accountId, AccountRole role, Long reservationId,
                                            ReservationStatus newStatus) {
        identityService.requireRole(role, AccountRole.COMPANY);
        Long companyId = identityService.requireCompanyId(accountId);
        return toResponse(stateMachine.updateStatus(reservationId, newStatus, companyId));
    }

    private Employee lockEmployee(Long employeeId) {
        try {
            return employeeRepository.findByIdForUpdate(employeeId)
                    .orElseThrow(() -> BookingException.slotUnavailable("Employee not found: " + employeeId));
        } catch (PessimisticLockingFailureException e) {
            log.warn("Timed out waiting for booking lock on employee {}", employeeId);
            throw new BookingException(Reason.PERSISTENCE_CONFLICT, "Employee calendar is busy, try again", e);
        }
    }

    private boolean isVisibleTo(Reservation reservation, UUID accountId, AccountRole role) {
        if (role == AccountRole.COMPANY) {
            return identityService.findCompany(accountId)
                    .map(c -> c.getId().equals(reservation.getCompany().getId()))
                    .orElse(false);
        }
        return reservation.getClient() != null && identityService.findClient(accountId)
                .map(c -> c.getId().equals(reservation.getClient().getId()))
                .orElse(false);
    }

    static ReservationResponse toResponse(Reservation r) {
        Employee employee = r.getEmployee();
        return ReservationResponse.builder()
                .id(r.getId())
                .clientId(r.getClient() != null ? r.getClient().getId() : null)
                .companyId(r.getCompany().getId())
                .serviceId(r.getService().getId())
                .serviceName(r.getService().getName())
                .employeeId(employee.getId())
                .employeeName(StringUtils.trim(StringUtils.defaultString(employee.getFirstName())
                        + " " + StringUtils.defaultString(employee.getLastName())))
                .startTime(r.getStartTime())
                .endTime(r.getEndTime())
                .status(r.getStatus())
                .note(r.getNote())
                .createdDate(r.getCreatedDate())
                .updatedDate(r.getUpdatedDate())
                .build();
    }
}
