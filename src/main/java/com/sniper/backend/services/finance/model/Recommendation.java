package com.sniper.backend.services.finance.model;

import com.sniper.backend.enums.PaymentStrategy;
import com.sniper.backend.enums.RiskLevel;

public record Recommendation(
        PaymentStrategy strategy,
        String title,
        String message,
        RiskLevel riskLevel,
        String store
) {
}
