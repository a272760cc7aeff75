package com.reservation.api.service;

import com.reservation.api.dto.EmployeeResponse;
import com.reservation.api.dto.ServiceRequest;
import com.reservation.api.dto.ServiceResponse;
import com.reservation.api.entity.Company;
import com.reservation.api.entity.CompanyService;
import com.reservation.api.entity.Employee;
import com.reservation.api.exception.BookingException;
import com.reservation.api.exception.BookingException.Reason;
import com.reservation.api.repository.CompanyRepository;
import com.reservation.api.repository.CompanyServiceRepository;
import com.reservation.api.repository.EmployeeRepository;
import com.reservation.api.utils.SlotGrid;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Services a company offers and the employees who perform them.
 */
@Service
public class ServiceCatalogService {

    private static final Logger log = LoggerFactory.getLogger(ServiceCatalogService.class);

    private final CompanyServiceRepository serviceRepository;
    private final CompanyRepository companyRepository;
    private final EmployeeRepository employeeRepository;

    public ServiceCatalogService(CompanyServiceRepository serviceRepository,
                                 CompanyRepository companyRepository,
                                 EmployeeRepository employeeRepository) {
        this.serviceRepository = serviceRepository;
        this.companyRepository = companyRepository;
        this.employeeRepository = employeeRepository;
    }

    @Transactional(readOnly = true)
    public Optional<CompanyService> findService(Long serviceId) {
        return serviceId == null ? Optional.empty() : serviceRepository.findById(serviceId);
    }

    @Transactional(readOnly = true)
    public boolean isEmployeeAssignedToService(Long serviceId, Long employeeId) {
        if (serviceId == null || employeeId == null) return false;
        return serviceRepository.isEmployeeAssigned(serviceId, employeeId);
    }

    @Transactional
    public ServiceResponse createService(Long companyId, ServiceRequest request) {
        if (StringUtils.isBlank(request.getName())) {
            throw BookingException.validation("Service name is required");
        }
        if (request.getPrice() == null || request.getPrice().compareTo(BigDecimal.ZERO) < 0) {
            throw BookingException.validation("Service price must be zero or more");
        }
        requireDuration(request.getDurationMinutes());
        Company company = companyRepository.findById(companyId)
                .orElseThrow(() -> BookingException.notFound(Reason.COMPANY_NOT_FOUND, "Company not found: " + companyId));

        CompanyService service = CompanyService.builder()
                .company(company)
                .subcategoryId(request.getSubcategoryId())
                .name(request.getName().trim())
                .description(StringUtils.trimToNull(request.getDescription()))
                .price(request.getPrice())
                .durationMinutes(request.getDurationMinutes())
                .active(false)
                .build();
        service = serviceRepository.save(service);
        log.info("Created service {} '{}' for company {}", service.getId(), service.getName(), companyId);
        return toResponse(service);
    }

    /**
     * Partial update. A new duration only affects reservations made afterwards.
     */
    @Transactional
    public ServiceResponse updateService(Long companyId, Long serviceId, ServiceRequest request) {
        CompanyService service = requireOwnedService(companyId, serviceId);

        if (request.getDurationMinutes() != null) {
            requireDuration(request.getDurationMinutes());
            service.setDurationMinutes(request.getDurationMinutes());
        }
        if (request.getPrice() != null) {
            if (request.getPrice().compareTo(BigDecimal.ZERO) < 0) {
                throw BookingException.validation("Service price must be zero or more");
            }
            service.setPrice(request.getPrice());
        }
        if (StringUtils.isNotBlank(request.getName())) {
            service.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            service.setDescription(StringUtils.trimToNull(request.getDescription()));
        }
        if (request.getSubcategoryId() != null) {
            service.setSubcategoryId(request.getSubcategoryId());
        }
        service = serviceRepository.save(service);
        log.info("Updated service {} for company {}", serviceId, companyId);
        return toResponse(service);
    }

    @Transactional
    public ServiceResponse assignEmployee(Long companyId, Long serviceId, Long employeeId) {
        CompanyService service = requireOwnedService(companyId, serviceId);
        Employee employee = requireOwnedEmployee(companyId, employeeId);
        service.getEmployees().add(employee);
        service.setActive(true);
        service = serviceRepository.save(service);
        log.info("Assigned employee {} to service {}", employeeId, serviceId);
        return toResponse(service);
    }

    @Transactional
    public ServiceResponse unassignEmployee(Long companyId, Long serviceId, Long employeeId) {
        CompanyService service = requireOwnedService(companyId, serviceId);
        Employee employee = requireOwnedEmployee(companyId, employeeId);
        service.getEmployees().removeIf(e -> e.getId().equals(employee.getId()));
        service.setActive(!service.getEmployees().isEmpty());
        service = serviceRepository.save(service);
        log.info("Unassigned employee {} from service {} (active={})", employeeId, serviceId, service.isActive());
        return toResponse(service);
    }

    @Transactional(readOnly = true)
    public List<EmployeeResponse> getAssignedEmployees(Long serviceId) {
        CompanyService service = serviceRepository.findById(serviceId)
                .orElseThrow(() -> BookingException.notFound(Reason.SERVICE_NOT_FOUND, "Service not found: " + serviceId));
        return service.getEmployees().stream()
                .sorted(Comparator.comparing(Employee::getId))
                .map(e -> EmployeeResponse.builder()
                        .id(e.getId())
                        .firstName(e.getFirstName())
                        .lastName(e.getLastName())
                        .build())
                .toList();
    }

    private CompanyService requireOwnedService(Long companyId, Long serviceId) {
        return serviceRepository.findByIdAndCompanyId(serviceId, companyId)
                .orElseThrow(() -> BookingException.notFound(Reason.SERVICE_NOT_FOUND, "Service not found: " + serviceId));
    }

    private Employee requireOwnedEmployee(Long companyId, Long employeeId) {
        return employeeRepository.findByIdAndCompanyId(employeeId, companyId)
                .orElseThrow(() -> BookingException.notFound(Reason.EMPLOYEE_NOT_FOUND, "Employee not found: " + employeeId));
    }

    private static void requireDuration(Integer durationMinutes) {
        if (durationMinutes == null || !SlotGrid.isGridAligned(durationMinutes)) {
            throw BookingException.validation("Duration must be a positive multiple of "
                    + SlotGrid.GRID_MINUTES + " minutes");
        }
    }

    static ServiceResponse toResponse(CompanyService service) {
        return ServiceResponse.builder()
                .id(service.getId())
                .companyId(service.getCompany().getId())
                .subcategoryId(service.getSubcategoryId())
                .name(service.getName())
                .description(service.getDescription())
                .price(service.getPrice())
                .durationMinutes(service.getDurationMinutes())
                .active(service.isActive())
                .build();
    }
}
