package com.sniper.backend.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Limiares do motor de decisão. Carrega de application.properties com prefixo "sniper.engine".
 *
 * Exemplo:
 * sniper.engine.safe-commitment-pct=30
 * sniper.engine.installment-net-benefit-threshold=50
 * sniper.engine.save-first-max-months=6
 */
@ConfigurationProperties(prefix = "sniper.engine")
public record FinanceEngineProperties(
        BigDecimal safeCommitmentPct,
        BigDecimal maxCommitmentPct,
        BigDecimal cashDiscountThresholdPct,
        BigDecimal installmentNetBenefitThreshold,
        BigDecimal annualInflationRate,
        Integer saveFirstMaxMonths,
        Integer longInstallmentCount,
        Integer mediumInstallmentCount,
        Integer maxSuggestedInstallments,
        Integer idealInstallmentCount,
        BigDecimal comfortablePaymentShare
) {
    public FinanceEngineProperties {
        if (safeCommitmentPct == null) {
            safeCommitmentPct = new BigDecimal("30");
        }
        if (maxCommitmentPct == null) {
            maxCommitmentPct = new BigDecimal("50");
        }
        if (cashDiscountThresholdPct == null) {
            cashDiscountThresholdPct = new BigDecimal("10");
        }
        if (installmentNetBenefitThreshold == null) {
            installmentNetBenefitThreshold = new BigDecimal("50");
        }
        if (annualInflationRate == null) {
            annualInflationRate = new BigDecimal("0.045");
        }
        if (saveFirstMaxMonths == null) {
            saveFirstMaxMonths = 6;
        }
        if (longInstallmentCount == null) {
            longInstallmentCount = 18;
        }
        if (mediumInstallmentCount == null) {
            mediumInstallmentCount = 12;
        }
        if (maxSuggestedInstallments == null) {
            maxSuggestedInstallments = 24;
        }
        if (idealInstallmentCount == null) {
            idealInstallmentCount = 12;
        }
        if (comfortablePaymentShare == null) {
            comfortablePaymentShare = new BigDecimal("0.30");
        }
    }

    public static FinanceEngineProperties defaults() {
        return new FinanceEngineProperties(null, null, null, null, null, null, null, null, null, null, null);
    }
}
