package com.sniper.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sniper.backend.dto.ApiResponse;
import com.sniper.backend.dto.offers.PurchaseAnalysisRequest;
import com.sniper.backend.dto.offers.SmartChoiceRequest;
import com.sniper.backend.exceptions.BusinessException;
import com.sniper.backend.services.finance.FinanceEngine;
import com.sniper.backend.services.finance.model.PurchaseAnalysis;
import com.sniper.backend.services.finance.model.RankingResult;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/smart-choice")
@RequiredArgsConstructor
@Slf4j
public class SmartChoiceController {

    private final FinanceEngine financeEngine;

    @PostMapping("/rank")
    public ResponseEntity<ApiResponse<RankingResult>> rank(@Valid @RequestBody SmartChoiceRequest request) {
        log.info("[SmartChoice] offers={}, availableCash={}, monthlyCapacity={}",
                request.getOffers() != null ? request.getOffers().size() : 0,
                request.getAvailableCash(), request.getMonthlyCapacity());
        RankingResult result = financeEngine.rankOffers(
                request.getAvailableCash(), request.getMonthlyCapacity(), request.toOffers());
        requireOffers(result);
        return ResponseEntity.ok(ApiResponse.success(result, "Ofertas ranqueadas"));
    }

    @PostMapping("/purchase")
    public ResponseEntity<ApiResponse<PurchaseAnalysis>> purchase(@Valid @RequestBody PurchaseAnalysisRequest request) {
        log.info("[SmartChoice] purchase offers={}", request.getOffers() != null ? request.getOffers().size() : 0);
        PurchaseAnalysis analysis = financeEngine.analyzePurchase(request.getProfile().toProfile(), request.toOffers());
        requireOffers(analysis.ranking());
        return ResponseEntity.ok(ApiResponse.success(analysis, "Compra analisada"));
    }

    private static void requireOffers(RankingResult result) {
        if (!result.hasOffers()) {
            throw new BusinessException(result.error());
        }
    }
}
