package com.reservation.api.config;

import com.reservation.api.dto.ServiceRequest;
import com.reservation.api.dto.ServiceResponse;
import com.reservation.api.entity.Client;
import com.reservation.api.entity.Company;
import com.reservation.api.entity.Employee;
import com.reservation.api.repository.ClientRepository;
import com.reservation.api.repository.CompanyRepository;
import com.reservation.api.repository.EmployeeRepository;
import com.reservation.api.service.ServiceCatalogService;
import com.reservation.api.service.WorkingDayService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.UUID;

/**
 * Idempotent demo seeder: one company with an employee, a 30-minute service and weekday
 * opening hours, plus one client. Enabled with {@code reservation.seed.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "reservation.seed.enabled", havingValue = "true")
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    static final UUID DEMO_COMPANY_ACCOUNT = UUID.fromString("00000000-0000-0000-0000-0000000000c1");
    static final UUID DEMO_CLIENT_ACCOUNT = UUID.fromString("00000000-0000-0000-0000-0000000000a1");

    private final CompanyRepository companyRepository;
    private final EmployeeRepository employeeRepository;
    private final ClientRepository clientRepository;
    private final WorkingDayService workingDayService;
    private final ServiceCatalogService catalogService;

    public DataInitializer(CompanyRepository companyRepository,
                           EmployeeRepository employeeRepository,
                           ClientRepository clientRepository,
                           WorkingDayService workingDayService,
                           ServiceCatalogService catalogService) {
        this.companyRepository = companyRepository;
        this.employeeRepository = employeeRepository;
        this.clientRepository = clientRepository;
        this.workingDayService = workingDayService;
        this.catalogService = catalogService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seed() {
        if (companyRepository.findByAccountId(DEMO_COMPANY_ACCOUNT).isPresent()) {
            log.info("Demo data already present, skipping seed");
            return;
        }
        log.info("Seeding demo company...");
        Company company = companyRepository.save(Company.builder()
                .accountId(DEMO_COMPANY_ACCOUNT)
                .name("Studio Cut & Style")
                .city("Warsaw")
                .postalCode("00-001")
                .street("Marszalkowska 1")
                .description("Hair salon")
                .build());
        Employee employee = employeeRepository.save(Employee.builder()
                .company(company)
                .firstName("Anna")
                .lastName("Nowak")
                .email("anna.nowak@example.com")
                .build());

        for (DayOfWeek day : EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY)) {
            workingDayService.upsertDay(company.getId(), day, LocalTime.of(8, 0), LocalTime.of(16, 30));
        }

        ServiceRequest haircut = new ServiceRequest();
        haircut.setName("Haircut");
        haircut.setDescription("Wash, cut and blow-dry");
        haircut.setPrice(new BigDecimal("80.00"));
        haircut.setDurationMinutes(30);
        ServiceResponse service = catalogService.createService(company.getId(), haircut);
        catalogService.assignEmployee(company.getId(), service.getId(), employee.getId());

        if (clientRepository.findByAccountId(DEMO_CLIENT_ACCOUNT).isEmpty()) {
            clientRepository.save(Client.builder()
                    .accountId(DEMO_CLIENT_ACCOUNT)
                    .firstName("Jan")
                    .lastName("Kowalski")
                    .phoneNumber("+48500100200")
                    .build());
        }
        log.info("DataInitializer: company={}, employee={}, service={} ready", company.getId(),
                employee.getId(), service.getId());
    }
}
