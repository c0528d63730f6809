package com.sniper.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sniper.backend.dto.ApiResponse;
import com.sniper.backend.dto.payment.InstallmentPlanRequest;
import com.sniper.backend.dto.payment.InstallmentSuggestionRequest;
import com.sniper.backend.dto.payment.PaymentAnalysisRequest;
import com.sniper.backend.services.finance.FinanceEngine;
import com.sniper.backend.services.finance.model.InstallmentComparison;
import com.sniper.backend.services.finance.model.InstallmentPlan;
import com.sniper.backend.services.finance.model.InstallmentSuggestion;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentAnalysisController {

    private final FinanceEngine financeEngine;

    @PostMapping("/analyze")
    public ResponseEntity<ApiResponse<InstallmentComparison>> analyze(@Valid @RequestBody PaymentAnalysisRequest request) {
        InstallmentComparison comparison = financeEngine.analyzePayment(
                request.getCashPrice(),
                request.getInstallmentPrice(),
                request.getInstallmentCount(),
                request.isInterestFreeOrDefault());
        log.info("[Payments] count={}, interestFree={}, recommendation={}",
                comparison.numInstallments(), comparison.interestFree(), comparison.recommendation());
        return ResponseEntity.ok(ApiResponse.success(comparison, "Análise de pagamento concluída"));
    }

    @PostMapping("/plan")
    public ResponseEntity<ApiResponse<InstallmentPlan>> plan(@Valid @RequestBody InstallmentPlanRequest request) {
        log.info("[Payments] plan count={}, rate={}", request.getInstallmentCount(), request.getMonthlyInterestRate());
        InstallmentPlan plan = financeEngine.calculateInstallmentPlan(
                request.getTotalPrice(), request.getInstallmentCount(), request.getMonthlyInterestRate());
        return ResponseEntity.ok(ApiResponse.success(plan, "Parcelamento calculado"));
    }

    @PostMapping("/suggest")
    public ResponseEntity<ApiResponse<InstallmentSuggestion>> suggest(@Valid @RequestBody InstallmentSuggestionRequest request) {
        log.info("[Payments] suggest maxInstallments={}", request.getMaxInstallments());
        InstallmentSuggestion suggestion = financeEngine.suggestInstallments(
                request.getItemPrice(), request.getMonthlyBudget(), request.getMaxInstallments());
        return ResponseEntity.ok(ApiResponse.success(suggestion, "Sugestão de parcelas gerada"));
    }
}
