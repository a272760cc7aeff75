package com.reservation.api.controller;

import com.reservation.api.dto.EmployeeResponse;
import com.reservation.api.dto.ServiceRequest;
import com.reservation.api.dto.ServiceResponse;
import com.reservation.api.entity.AccountRole;
import com.reservation.api.service.IdentityService;
import com.reservation.api.service.ServiceCatalogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/services")
public class ServiceController {

    private final ServiceCatalogService catalogService;
    private final IdentityService identityService;

    public ServiceController(ServiceCatalogService catalogService, IdentityService identityService) {
        this.catalogService = catalogService;
        this.identityService = identityService;
    }

    @PostMapping
    public ResponseEntity<ServiceResponse> createService(
            @RequestHeader(AccountHeaders.ACCOUNT_ID) UUID accountId,
            @RequestHeader(AccountHeaders.ACCOUNT_ROLE) String role,
            @RequestBody ServiceRequest request) {
        ServiceResponse response = catalogService.createService(companyOf(accountId, role), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PatchMapping("/{serviceId}")
    public ServiceResponse updateService(
            @RequestHeader(AccountHeaders.ACCOUNT_ID) UUID accountId,
            @RequestHeader(AccountHeaders.ACCOUNT_ROLE) String role,
            @PathVariable Long serviceId,
            @RequestBody ServiceRequest request) {
        return catalogService.updateService(companyOf(accountId, role), serviceId, request);
    }

    @PutMapping("/{serviceId}/employees/{employeeId}")
    public ServiceResponse assignEmployee(
            @RequestHeader(AccountHeaders.ACCOUNT_ID) UUID accountId,
            @RequestHeader(AccountHeaders.ACCOUNT_ROLE) String role,
            @PathVariable Long serviceId,
            @PathVariable Long employeeId) {
        return catalogService.assignEmployee(companyOf(accountId, role), serviceId, employeeId);
    }

    @DeleteMapping("/{serviceId}/employees/{employeeId}")
    public ServiceResponse unassignEmployee(
            @RequestHeader(AccountHeaders.ACCOUNT_ID) UUID accountId,
            @RequestHeader(AccountHeaders.ACCOUNT_ROLE) String role,
            @PathVariable Long serviceId,
            @PathVariable Long employeeId) {
        return catalogService.unassignEmployee(companyOf(accountId, role), serviceId, employeeId);
    }

    @GetMapping("/{serviceId}/employees")
    public List<EmployeeResponse> getAssignedEmployees(@PathVariable Long serviceId) {
        return catalogService.getAssignedEmployees(serviceId);
    }

    private Long companyOf(UUID accountId, String role) {
        identityService.requireRole(AccountRole.fromValue(role), AccountRole.COMPANY);
        return identityService.requireCompanyId(accountId);
    }
}
