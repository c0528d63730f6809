package com.sniper.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sniper.backend.dto.ApiResponse;
import com.sniper.backend.dto.capacity.FinancialProfileRequest;
import com.sniper.backend.services.finance.FinanceEngine;
import com.sniper.backend.services.finance.model.CapacitySnapshot;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/capacity")
@RequiredArgsConstructor
@Slf4j
public class CapacityController {

    private final FinanceEngine financeEngine;

    @PostMapping
    public ResponseEntity<ApiResponse<CapacitySnapshot>> compute(@Valid @RequestBody FinancialProfileRequest request) {
        CapacitySnapshot snapshot = financeEngine.computeCapacity(request.toProfile());
        log.info("[Capacity] freeCashFlow={}, safeCapacity={}, overCommitted={}",
                snapshot.freeCashFlow(), snapshot.safeInstallmentCapacity(), snapshot.overCommitted());
        return ResponseEntity.ok(ApiResponse.success(snapshot, "Capacidade calculada"));
    }
}
