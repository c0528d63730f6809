package com.sniper.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sniper.backend.dto.ApiResponse;
import com.sniper.backend.dto.imports.ImportAnalysisRequest;
import com.sniper.backend.services.finance.FinanceEngine;
import com.sniper.backend.services.finance.model.ImportAnalysis;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/imports")
@RequiredArgsConstructor
@Slf4j
public class ImportCostController {

    private final FinanceEngine financeEngine;

    @PostMapping("/analyze")
    public ResponseEntity<ApiResponse<ImportAnalysis>> analyze(@Valid @RequestBody ImportAnalysisRequest request) {
        log.info("[ImportCost] priceUsd={}, shippingUsd={}, remessaConforme={}, hasNationalPrice={}",
                request.getPriceUsd(), request.getShippingUsd(), request.isRemessaConformeOrDefault(),
                request.getNationalPriceBrl() != null);
        ImportAnalysis analysis = financeEngine.analyzeImport(
                request.getPriceUsd(),
                request.getShippingUsd(),
                request.getNationalPriceBrl(),
                request.isRemessaConformeOrDefault());
        return ResponseEntity.ok(ApiResponse.success(analysis, "Custo de importação calculado"));
    }
}
