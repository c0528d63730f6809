package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;

import com.sniper.backend.enums.Currency;
import com.sniper.backend.enums.PaymentRecommendation;

import lombok.Builder;

@Builder
public record InstallmentComparison(
        BigDecimal cashPrice,
        BigDecimal installmentPrice,
        int numInstallments,
        BigDecimal monthlyInstallment,
        BigDecimal cashDiscount,
        BigDecimal cashDiscountPercentage,
        BigDecimal presentValueInstallments,
        BigDecimal inflationSavings,
        BigDecimal netBenefitInstallment,
        boolean interestFree,
        PaymentRecommendation recommendation,
        String recommendationText,
        BigDecimal financialBenefit,
        BigDecimal annualInflationRate,
        Currency currency
) {
}
