package com.reservation.api.controller;

import com.reservation.api.dto.WorkingDayRequest;
import com.reservation.api.dto.WorkingDayResponse;
import com.reservation.api.entity.AccountRole;
import com.reservation.api.service.IdentityService;
import com.reservation.api.service.WorkingDayService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/working-days")
public class WorkingDayController {

    private final WorkingDayService workingDayService;
    private final IdentityService identityService;

    public WorkingDayController(WorkingDayService workingDayService, IdentityService identityService) {
        this.workingDayService = workingDayService;
        this.identityService = identityService;
    }

    @PostMapping
    public ResponseEntity<WorkingDayResponse> upsertDay(
            @RequestHeader(AccountHeaders.ACCOUNT_ID) UUID accountId,
            @RequestHeader(AccountHeaders.ACCOUNT_ROLE) String role,
            @RequestBody WorkingDayRequest request) {
        identityService.requireRole(AccountRole.fromValue(role), AccountRole.COMPANY);
        Long companyId = identityService.requireCompanyId(accountId);
        WorkingDayResponse response = workingDayService.upsertDay(companyId, request.getDay(),
                request.getOpeningTime(), request.getClosingTime());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{companyId}")
    public List<WorkingDayResponse> getWeek(@PathVariable Long companyId) {
        return workingDayService.getWeek(companyId);
    }
}
