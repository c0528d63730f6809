package com.sniper.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sniper.backend.dto.ApiResponse;
import com.sniper.backend.dto.affordability.AffordabilityRequest;
import com.sniper.backend.services.finance.FinanceEngine;
import com.sniper.backend.services.finance.model.AffordabilityResult;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/affordability")
@RequiredArgsConstructor
@Slf4j
public class AffordabilityController {

    private final FinanceEngine financeEngine;

    @PostMapping
    public ResponseEntity<ApiResponse<AffordabilityResult>> classify(@Valid @RequestBody AffordabilityRequest request) {
        AffordabilityResult result = financeEngine.classifyAffordability(
                request.getProfile().toProfile(),
                request.getItemCashPrice(),
                request.getItemInstallmentPrice(),
                request.getInstallmentCount());
        log.info("[Affordability] recommendation={}, risk={}", result.recommendation(), result.riskLevel());
        return ResponseEntity.ok(ApiResponse.success(result, "Análise de orçamento concluída"));
    }
}
