package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;

import com.sniper.backend.enums.Currency;
import com.sniper.backend.enums.ImportRecommendation;

import lombok.Builder;

@Builder
public record ImportComparison(
        ImportCostBreakdown importAnalysis,
        BigDecimal nationalPriceBrl,
        BigDecimal priceDifference,
        BigDecimal percentageDifference,
        ImportRecommendation recommendation,
        String recommendationText,
        BigDecimal savings,
        Currency currency
) {
}
