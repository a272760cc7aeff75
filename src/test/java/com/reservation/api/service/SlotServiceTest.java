package com.reservation.api.service;

import com.reservation.api.entity.Company;
import com.reservation.api.entity.CompanyService;
import com.reservation.api.service.WorkingDayService.OpeningHours;
import com.reservation.api.utils.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SlotServiceTest {

    @Mock
    private ServiceCatalogService catalogService;

    @Mock
    private WorkingDayService workingDayService;

    @Mock
    private BookingLedger bookingLedger;

    private SlotService slotService;

    private static final Long COMPANY_ID = 3L;
    private static final Long SERVICE_ID = 11L;
    private static final Long EMPLOYEE_ID = 21L;
    // Friday 2030-03-01 12:00
    private static final LocalDateTime NOW = LocalDateTime.of(2030, 3, 1, 12, 0);
    private static final LocalDate MONDAY = LocalDate.of(2030, 3, 4);
    private static final LocalDate SUNDAY = LocalDate.of(2030, 3, 3);

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        slotService = new SlotService(catalogService, workingDayService, bookingLedger, clock);
    }

    private CompanyService service(int durationMinutes) {
        return CompanyService.builder()
                .id(SERVICE_ID)
                .company(Company.builder().id(COMPANY_ID).name("Salon").build())
                .name("Haircut")
                .price(new BigDecimal("50.00"))
                .durationMinutes(durationMinutes)
                .active(true)
                .build();
    }

    private void stubAssignedService(int durationMinutes) {
        when(catalogService.findService(SERVICE_ID)).thenReturn(Optional.of(service(durationMinutes)));
        when(catalogService.isEmployeeAssignedToService(SERVICE_ID, EMPLOYEE_ID)).thenReturn(true);
    }

    @Nested
    class NotApplicable {

        @Test
        void shouldReturnEmptyOptionalForUnknownService() {
            when(catalogService.findService(SERVICE_ID)).thenReturn(Optional.empty());

            assertTrue(slotService.getAvailableSlots(EMPLOYEE_ID, SERVICE_ID, MONDAY).isEmpty());
            verifyNoInteractions(workingDayService, bookingLedger);
        }

        @Test
        void shouldReturnEmptyOptionalWhenEmployeeNotAssigned() {
            when(catalogService.findService(SERVICE_ID)).thenReturn(Optional.of(service(30)));
            when(catalogService.isEmployeeAssignedToService(SERVICE_ID, EMPLOYEE_ID)).thenReturn(false);

            assertTrue(slotService.getAvailableSlots(EMPLOYEE_ID, SERVICE_ID, MONDAY).isEmpty());
            verifyNoInteractions(workingDayService, bookingLedger);
        }
    }

    @Nested
    class NoOpenings {

        @Test
        void shouldReturnEmptyListForPastDay() {
            stubAssignedService(30);

            Optional<List<LocalDateTime>> result = slotService.getAvailableSlots(EMPLOYEE_ID, SERVICE_ID,
                    NOW.toLocalDate().minusDays(1));

            assertTrue(result.isPresent());
            assertTrue(result.get().isEmpty());
            verifyNoInteractions(workingDayService, bookingLedger);
        }

        @Test
        void shouldReturnEmptyListWhenCompanyClosed() {
            stubAssignedService(30);
            when(workingDayService.findOpeningHours(COMPANY_ID, DayOfWeek.SUNDAY)).thenReturn(Optional.empty());

            Optional<List<LocalDateTime>> result = slotService.getAvailableSlots(EMPLOYEE_ID, SERVICE_ID, SUNDAY);

            assertEquals(Optional.of(List.of()), result);
            verify(bookingLedger, never()).listBookedRanges(anyLong(), any());
        }
    }

    @Nested
    class Openings {

        @BeforeEach
        void openMonday() {
            when(workingDayService.findOpeningHours(COMPANY_ID, DayOfWeek.MONDAY))
                    .thenReturn(Optional.of(new OpeningHours(LocalTime.of(8, 0), LocalTime.of(16, 30))));
        }

        @Test
        void shouldExcludeTimesTakenByExistingBooking() {
            stubAssignedService(30);
            when(bookingLedger.listBookedRanges(EMPLOYEE_ID, MONDAY))
                    .thenReturn(List.of(new TimeRange(MONDAY.atTime(10, 0), MONDAY.atTime(10, 30))));

            List<LocalDateTime> slots = slotService.getAvailableSlots(EMPLOYEE_ID, SERVICE_ID, MONDAY).orElseThrow();

            assertEquals(MONDAY.atTime(8, 0), slots.get(0));
            assertEquals(MONDAY.atTime(16, 0), slots.get(slots.size() - 1));
            assertTrue(slots.contains(MONDAY.atTime(9, 30)));
            assertTrue(slots.contains(MONDAY.atTime(10, 30)));
            assertFalse(slots.contains(MONDAY.atTime(9, 45)));
            assertFalse(slots.contains(MONDAY.atTime(10, 0)));
            assertFalse(slots.contains(MONDAY.atTime(10, 15)));
        }

        @Test
        void shouldOfferQuarterHourServiceRightBeforeBooking() {
            stubAssignedService(15);
            when(bookingLedger.listBookedRanges(EMPLOYEE_ID, MONDAY))
                    .thenReturn(List.of(new TimeRange(MONDAY.atTime(10, 0), MONDAY.atTime(10, 30))));

            List<LocalDateTime> slots = slotService.getAvailableSlots(EMPLOYEE_ID, SERVICE_ID, MONDAY).orElseThrow();

            assertTrue(slots.contains(MONDAY.atTime(9, 45)));
            assertTrue(slots.contains(MONDAY.atTime(10, 30)));
            assertFalse(slots.contains(MONDAY.atTime(10, 0)));
            assertFalse(slots.contains(MONDAY.atTime(10, 15)));
        }

        @Test
        void shouldReturnIdenticalSlotsOnRepeatedQueries() {
            stubAssignedService(45);
            when(bookingLedger.listBookedRanges(EMPLOYEE_ID, MONDAY)).thenReturn(List.of());

            Optional<List<LocalDateTime>> first = slotService.getAvailableSlots(EMPLOYEE_ID, SERVICE_ID, MONDAY);
            Optional<List<LocalDateTime>> second = slotService.getAvailableSlots(EMPLOYEE_ID, SERVICE_ID, MONDAY);

            assertEquals(first, second);
            verify(bookingLedger, times(2)).listBookedRanges(EMPLOYEE_ID, MONDAY);
        }
    }
}
